package com.fastpublish.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * publish:
 *   failover:
 *     guard:
 *       enabled: true
 *       circuit-breaker:
 *         failure-rate-threshold: 60
 *         sliding-window-size: 50
 *         wait-duration-in-open-state: 15s
 *       bulkhead:
 *         enabled: true
 *         max-concurrent-calls: 200
 *       rate-limiter:
 *         enabled: true
 *         limit-for-period: 300
 *         limit-refresh-period: 100ms
 *
 * 每个 producer 实例各自一套熔断/舱壁/限流; 被拒绝的调用按发布失败处理, 继续切换下一个 producer
 */
@Data
@ConfigurationProperties(prefix = "publish.failover.guard")
public class PublishGuardProperties {
    /** 总开关, 默认关闭 */
    private boolean enabled = false;

    private CbConfig circuitBreaker = new CbConfig();
    private BhConfig bulkhead = new BhConfig();
    private RlConfig rateLimiter = new RlConfig();

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private float slowCallRateThreshold = 100f;
        private Duration slowCallDurationThreshold = Duration.ofSeconds(2);
        private int slidingWindowSize = 100;
        private int minimumNumberOfCalls = 100;
        private Duration waitDurationInOpenState = Duration.ofSeconds(10);
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    @Data
    public static class BhConfig {
        private boolean enabled = false;
        private int maxConcurrentCalls = 100;
        // 0=非阻塞
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }

    @Data
    public static class RlConfig {
        private boolean enabled = false;
        // 每个窗口许可数
        private int limitForPeriod = 200;
        private Duration limitRefreshPeriod = Duration.ofMillis(100);
        // 获取许可最大等待
        private Duration timeoutDuration = Duration.ofMillis(20);
    }
}
