package com.fastpublish.core.notify.ratelimit;

import com.fastpublish.core.spi.notify.NotifierFilter;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 告警去抖
 * 同一 (事件, broker, 级别) 各自维护固定窗口, 窗口内最多放行 threshold 次;
 * 一个 broker 持续故障不会挤掉其它 broker 的告警
 */
public class RateLimitFilter implements NotifierFilter {

    private final long windowMs;

    private final int threshold;

    /** 毫秒时钟 */
    private final LongSupplier clock;

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    /** 上次清理时间, 每个窗口周期最多清理一次 */
    private volatile long lastPurge;

    public RateLimitFilter(Duration window, int threshold) {
        this(window, threshold, System::currentTimeMillis);
    }

    public RateLimitFilter(Duration window, int threshold, LongSupplier clock) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0, got " + threshold);
        }
        this.windowMs = window.toMillis();
        this.threshold = threshold;
        this.clock = clock;
        this.lastPurge = clock.getAsLong();
    }

    @Override
    public boolean allow(NotifyContext ctx, Severity sev) {
        long now = clock.getAsLong();
        if (now - lastPurge > windowMs) {
            lastPurge = now;
            purge();
        }
        Window w = windows.compute(keyOf(ctx, sev), (k, old) ->
                old == null || now - old.start > windowMs ? new Window(now, 1) : new Window(old.start, old.count + 1));
        return w.count <= threshold;
    }

    /**
     * 清掉已过期的窗口, 返回剩余窗口数
     */
    public int purge() {
        long now = clock.getAsLong();
        windows.values().removeIf(w -> now - w.start > windowMs);
        return windows.size();
    }

    /**
     * 当前跟踪的窗口数
     */
    public int trackedWindows() {
        return windows.size();
    }

    private static String keyOf(NotifyContext ctx, Severity sev) {
        return ctx.getType() + "|" + ctx.getBrokerUrl() + "|" + sev;
    }

    private static final class Window {

        private final long start;

        private final int count;

        private Window(long start, int count) {
            this.start = start;
            this.count = count;
        }
    }
}
