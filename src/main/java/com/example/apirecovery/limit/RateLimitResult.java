package com.example.apirecovery.limit;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RateLimitResult {
    private boolean allowed;
    private long remaining;
    private long limit;
    private long resetTime;   // 窗口重置的时间戳（毫秒）
    private long retryAfter;  // 被拒绝时建议的等待时长（毫秒）
}
