package com.example.apirecovery.limit;

// 固定窗口计数器
public class FixedWindowCounter {
    private final long windowSizeMs;
    private long windowStart;
    private long requests;

    public FixedWindowCounter(long windowSizeMs) {
        if (windowSizeMs <= 0) {
            throw new IllegalArgumentException("windowSizeMs must be > 0");
        }
        this.windowSizeMs = windowSizeMs;
        this.windowStart = System.currentTimeMillis();
    }

    public synchronized boolean allowRequest(long maxRequests) {
        roll(System.currentTimeMillis());
        if (requests >= maxRequests) {
            return false;
        }
        requests++;
        return true;
    }

    public synchronized long count() {
        roll(System.currentTimeMillis());
        return requests;
    }

    public synchronized long getResetTime() {
        return windowStart + windowSizeMs;
    }

    private void roll(long now) {
        if (now - windowStart >= windowSizeMs) {
            requests = 0;
            windowStart = now;
        }
    }
}
