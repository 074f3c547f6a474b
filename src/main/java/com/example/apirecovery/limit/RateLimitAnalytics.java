package com.example.apirecovery.limit;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;

@Data
@AllArgsConstructor
public class RateLimitAnalytics {
    private long totalRequests;
    private long blockedRequests;
    private Map<String, EndpointStats> endpointStats;

    @Data
    @AllArgsConstructor
    public static class EndpointStats {
        private long requests;
        private long blocked;
    }
}
