package com.fastpublish.core.backoff;

/**
 * 单个 producer 的退避状态, 不可变
 */
final class BackoffEntry {

    /** 当前退避时长, 单位与 BackoffStore 一致 */
    private final long delay;

    /** 最近一次成功/失败的时间（nanoTime） */
    private final long lastTouchedNanos;

    BackoffEntry(long delay, long lastTouchedNanos) {
        this.delay = delay;
        this.lastTouchedNanos = lastTouchedNanos;
    }

    long delay() {
        return delay;
    }

    long lastTouchedNanos() {
        return lastTouchedNanos;
    }

    /**
     * inactivityNanos <= 0 时永不过期
     */
    boolean isExpired(long nowNanos, long inactivityNanos) {
        return inactivityNanos > 0 && nowNanos - lastTouchedNanos >= inactivityNanos;
    }

    @Override
    public String toString() {
        return "BackoffEntry{delay=" + delay + ", lastTouchedNanos=" + lastTouchedNanos + '}';
    }
}
