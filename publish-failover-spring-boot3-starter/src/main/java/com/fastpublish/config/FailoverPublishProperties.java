package com.fastpublish.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 容错发送配置（绑定前缀：publish.failover）
 *
 * YAML 示例：
 * publish:
 *   failover:
 *     enabled: true
 *     max-attempts: 3
 *     retry-delay: 5
 *     inactivity-reset-delay: 60
 *     time-unit: SECONDS
 *     wheel:
 *       tick-duration: 10ms
 *       ticks-per-wheel: 512
 *       max-pending-timeouts: 100000
 *     shutdown:
 *       await: 30s
 */
@Validated
@ConfigurationProperties(prefix = "publish.failover")
public class FailoverPublishProperties {

    /** 是否创建 FailoverProducer */
    private boolean enabled = true;

    /** 单次发送最大尝试次数 */
    private int maxAttempts = 3;

    /** 退避上限（time-unit 为单位） */
    private long retryDelay = 5;

    /** producer 无活动多久后遗忘其退避状态（time-unit 为单位）, 0 表示永不遗忘 */
    private long inactivityResetDelay = 0;

    /** retry-delay / inactivity-reset-delay 的单位 */
    private TimeUnit timeUnit = TimeUnit.SECONDS;

    private Wheel wheel = new Wheel();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度, 决定退避挂起的精度 */
        private Duration tickDuration = Duration.ofMillis(10);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Shutdown {
        /** 停机时等待在途发送的时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public long getRetryDelay() { return retryDelay; }
    public void setRetryDelay(long retryDelay) { this.retryDelay = retryDelay; }

    public long getInactivityResetDelay() { return inactivityResetDelay; }
    public void setInactivityResetDelay(long inactivityResetDelay) { this.inactivityResetDelay = inactivityResetDelay; }

    public TimeUnit getTimeUnit() { return timeUnit; }
    public void setTimeUnit(TimeUnit timeUnit) { this.timeUnit = timeUnit; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 退避上限换算为 Duration, 用于启动日志 */
    public Duration retryDelayDuration() { return Duration.ofNanos(timeUnit.toNanos(retryDelay)); }

    public Duration inactivityResetDuration() { return Duration.ofNanos(timeUnit.toNanos(inactivityResetDelay)); }
}
