package com.example.apirecovery.limit;

import java.util.concurrent.locks.StampedLock;

public class TokenBucket {
    private final long capacity;
    private final double refillRatePerMs;
    private final StampedLock lock = new StampedLock();
    private double tokens;
    private long lastRefillTime;

    public TokenBucket(long capacity, long refillPerSecond) {
        this(capacity, refillPerSecond / 1000.0);
    }

    public TokenBucket(long capacity, double refillRatePerMs) {
        if (capacity < 1 || refillRatePerMs <= 0) {
            throw new IllegalArgumentException("capacity must be >= 1 and refill rate > 0");
        }
        this.capacity = capacity;
        this.refillRatePerMs = refillRatePerMs;
        this.tokens = capacity;
        this.lastRefillTime = System.currentTimeMillis();
    }

    public boolean tryAcquire(int token) {
        long stamp = lock.writeLock();
        try {
            refill(System.currentTimeMillis());
            if (tokens < token) {
                return false;
            }
            tokens -= token;
            return true;
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // 乐观读，不修改桶状态
    public double availableTokens() {
        long stamp = lock.tryOptimisticRead();
        double current = tokens;
        long lastTime = lastRefillTime;
        if (!lock.validate(stamp)) {
            stamp = lock.readLock();
            try {
                current = tokens;
                lastTime = lastRefillTime;
            } finally {
                lock.unlockRead(stamp);
            }
        }
        long timeDelta = Math.max(0, System.currentTimeMillis() - lastTime);
        return Math.min(capacity, current + timeDelta * refillRatePerMs);
    }

    // 距离下一个令牌可用还需等待的毫秒数
    public long millisUntilAvailable() {
        double missing = 1 - availableTokens();
        if (missing <= 0) {
            return 0;
        }
        return (long) Math.ceil(missing / refillRatePerMs);
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill(long now) {
        if (now <= lastRefillTime) {
            return;
        }
        long timeDelta = now - lastRefillTime;
        tokens = Math.min(capacity, tokens + timeDelta * refillRatePerMs);
        lastRefillTime = now;
    }
}
