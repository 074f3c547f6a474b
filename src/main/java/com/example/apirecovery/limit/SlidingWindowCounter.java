package com.example.apirecovery.limit;

import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

// 滑动窗口计数器（线程安全）
public class SlidingWindowCounter {
    // 窗口配置
    private final long windowSizeMs;    // 窗口总时长（毫秒）
    private final int sliceCount;       // 窗口分片数量
    private final long sliceIntervalMs; // 分片间隔（毫秒）

    // 时间槽数据结构
    private static class Slice {
        final LongAdder counter = new LongAdder(); // 当前分片的计数器
        volatile long timestamp = Long.MIN_VALUE;  // 分片的起始时间戳
    }

    // 环形缓冲区存储分片
    private final Slice[] slices;
    // 分片轮转和限流判定共用一把锁，计数本身走 LongAdder
    private final Lock rotateLock = new ReentrantLock();

    public SlidingWindowCounter(long windowSizeMs, int sliceCount) {
        if (windowSizeMs < sliceCount || sliceCount < 1) {
            throw new IllegalArgumentException("windowSizeMs must be >= sliceCount and sliceCount >= 1");
        }
        this.windowSizeMs = windowSizeMs;
        this.sliceCount = sliceCount;
        this.sliceIntervalMs = windowSizeMs / sliceCount;
        this.slices = new Slice[sliceCount];
        for (int i = 0; i < sliceCount; i++) {
            slices[i] = new Slice();
        }
    }

    // ----------------- 核心方法 -----------------

    public void record() {
        currentSlice(System.currentTimeMillis()).counter.increment();
    }

    public long count() {
        return countSince(System.currentTimeMillis());
    }

    /**
     * 窗口内计数未达到 maxRequests 时计数并放行
     */
    public boolean allowRequest(long maxRequests) {
        rotateLock.lock();
        try {
            long now = System.currentTimeMillis();
            if (countSince(now) >= maxRequests) {
                return false;
            }
            currentSlice(now).counter.increment();
            return true;
        } finally {
            rotateLock.unlock();
        }
    }

    // 最老的有效分片滑出窗口的时间
    public long nextReleaseTime() {
        long now = System.currentTimeMillis();
        long windowStart = now - windowSizeMs;
        long oldest = Long.MAX_VALUE;
        for (Slice slice : slices) {
            long ts = slice.timestamp;
            if (ts > windowStart && slice.counter.sum() > 0) {
                oldest = Math.min(oldest, ts);
            }
        }
        return oldest == Long.MAX_VALUE ? now : oldest + windowSizeMs;
    }

    public long getWindowSizeMs() {
        return windowSizeMs;
    }

    // ----------------- 私有方法 -----------------

    private Slice currentSlice(long now) {
        long sliceStart = now - (now % sliceIntervalMs);
        Slice slice = slices[(int) ((now / sliceIntervalMs) % sliceCount)];
        if (slice.timestamp == sliceStart) {
            return slice;
        }
        rotateLock.lock();
        try {
            // 双重检查，过期分片清零后复用
            if (slice.timestamp != sliceStart) {
                slice.counter.reset();
                slice.timestamp = sliceStart;
            }
            return slice;
        } finally {
            rotateLock.unlock();
        }
    }

    private long countSince(long now) {
        long windowStart = now - windowSizeMs;
        long sum = 0;
        for (Slice slice : slices) {
            if (slice.timestamp > windowStart) {
                sum += slice.counter.sum();
            }
        }
        return sum;
    }
}
