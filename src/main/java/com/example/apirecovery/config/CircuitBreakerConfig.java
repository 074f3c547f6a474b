package com.example.apirecovery.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerConfig {
    private int failureThreshold = 5;        // 统计窗口内触发熔断的失败次数
    private long recoveryTimeout = 60_000;   // 熔断持续时间（毫秒）
    private int successThreshold = 3;        // 半开状态恢复所需的成功次数
    private long monitoringPeriod = 120_000; // 失败计数的滚动窗口（毫秒）
    private int halfOpenMaxCalls = 3;        // 半开状态允许的并发试探请求数

    public CircuitBreakerConfig copy() {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, successThreshold, monitoringPeriod, halfOpenMaxCalls);
    }

    public void validate() {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
        if (halfOpenMaxCalls < 1) {
            throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1");
        }
        if (recoveryTimeout < 0 || monitoringPeriod <= 0) {
            throw new IllegalArgumentException("recoveryTimeout must be >= 0 and monitoringPeriod > 0");
        }
    }
}
