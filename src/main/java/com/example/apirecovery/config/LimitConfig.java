package com.example.apirecovery.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "limit")
@Data
public class LimitConfig {
    private boolean enabled = false;           // 是否在队列前挂载限流
    private String strategy = "TokenBucket";   // TokenBucket / SlidingWindow / FixedWindow
    private int maxRequests = 100;             // 全局窗口内最大请求数
    private long windowMs = 1000;              // 窗口时长（毫秒）
    private List<String> skipEndpoints = new ArrayList<>();
    private Map<String, EndpointLimit> endpointLimits = new HashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EndpointLimit {
        private int maxRequests;
        private long windowMs;
    }
}
