package com.example.apirecovery.controller;

import com.example.apirecovery.recovery.ErrorRecoveryOrchestrator;
import com.example.apirecovery.recovery.ErrorRecoveryStats;
import com.example.apirecovery.recovery.HealthStatus;
import com.example.apirecovery.recovery.RecoveryReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/recovery")
public class RecoveryController {
    @Autowired
    private ErrorRecoveryOrchestrator orchestrator;

    @GetMapping("/stats")
    public ErrorRecoveryStats stats() {
        return orchestrator.getStats();
    }

    @GetMapping("/health")
    public HealthStatus health() {
        return orchestrator.getHealthStatus();
    }

    @GetMapping("/report")
    public RecoveryReport report() {
        return orchestrator.generateReport();
    }

    @DeleteMapping("/stats")
    public Map<String, Object> resetStats() {
        orchestrator.resetStats();
        return response(200, "统计已重置");
    }

    @DeleteMapping("/circuit-breakers/{name}")
    public ResponseEntity<Map<String, Object>> resetCircuitBreaker(@PathVariable String name) {
        if (!orchestrator.getCircuitBreakerManager().reset(name)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response(404, "熔断器不存在: " + name));
        }
        return ResponseEntity.ok(response(200, "熔断器 " + name + " 已重置"));
    }

    private static Map<String, Object> response(int code, String message) {
        Map<String, Object> data = new HashMap<>();
        data.put("code", code);
        data.put("message", message);
        data.put("timestamp", System.currentTimeMillis());
        return data;
    }
}
