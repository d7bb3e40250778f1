package com.fastpublish.core.handler;

import com.fastpublish.config.PublishGuardProperties;
import com.fastpublish.core.spi.Producer;
import com.fastpublish.exception.guard.DownstreamBulkheadFullException;
import com.fastpublish.exception.guard.DownstreamOpenCircuitException;
import com.fastpublish.exception.guard.DownstreamRateLimitedException;
import com.fastpublish.model.ProducerKey;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * producer 调用统一入口
 * 按 producer 实例对 publish/request 增加 RL/BH/CB 装饰, 并把同步抛出的异常统一折叠为失败的 stage
 */
public class GuardedPublishExecutor {

    private final PublishGuardProperties props;

    private final ConcurrentHashMap<ProducerKey, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ProducerKey, Bulkhead>       bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ProducerKey, RateLimiter>    rlCache = new ConcurrentHashMap<>();

    public GuardedPublishExecutor(PublishGuardProperties props) {
        this.props = props;
    }

    /** 不做任何保护, 只负责异常折叠 */
    public static GuardedPublishExecutor unguarded() {
        return new GuardedPublishExecutor(new PublishGuardProperties());
    }

    /**
     * 执行一次 producer 调用
     * @return 永不为 null, 失败时异常已解包并转换
     */
    public <T> CompletableFuture<T> execute(Producer producer, Supplier<CompletionStage<T>> call) {
        Supplier<CompletionStage<T>> decorated = call;
        ProducerKey key = ProducerKey.of(producer);

        if (props.isEnabled()) {
            // RateLimiter 限流，抑制突发流量
            if (props.getRateLimiter().isEnabled()) {
                RateLimiter rl = rlCache.computeIfAbsent(key, k -> buildRl(producer));
                decorated = RateLimiter.decorateCompletionStage(rl, decorated);
            }
            // Bulkhead 限制单个 producer 的在途数量
            if (props.getBulkhead().isEnabled()) {
                Bulkhead bh = bhCache.computeIfAbsent(key, k -> buildBh(producer));
                decorated = Bulkhead.decorateCompletionStage(bh, decorated);
            }
            // CircuitBreaker 最外层, fail-fast
            if (props.getCircuitBreaker().isEnabled()) {
                CircuitBreaker cb = cbCache.computeIfAbsent(key, k -> buildCb(producer));
                decorated = CircuitBreaker.decorateCompletionStage(cb, decorated);
            }
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        CompletionStage<T> stage;
        try {
            stage = decorated.get();
        } catch (Exception e) {
            result.completeExceptionally(translate(e, producer.brokerUrl()));
            return result;
        }
        if (stage == null) {
            result.completeExceptionally(new IllegalStateException(producer.brokerUrl() + " returned no completion stage"));
            return result;
        }
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(translate(error, producer.brokerUrl()));
            }
        });
        return result;
    }

    /**
     * 熔断打开/并发满/限流 → 转为 Downstream* 异常, 其余解包后原样返回
     */
    static Throwable translate(Throwable error, String brokerUrl) {
        Throwable t = unwrap(error);
        if (t instanceof CallNotPermittedException) {
            return new DownstreamOpenCircuitException(brokerUrl, t);
        }
        if (t instanceof BulkheadFullException) {
            return new DownstreamBulkheadFullException(brokerUrl, t);
        }
        if (t instanceof RequestNotPermitted) {
            return new DownstreamRateLimitedException(brokerUrl, t);
        }
        return t;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /** 未启用熔断时返回 null */
    public CircuitBreaker getCircuitBreakerIfEnabled(Producer producer) {
        if (!props.isEnabled() || !props.getCircuitBreaker().isEnabled()) {
            return null;
        }
        return cbCache.computeIfAbsent(ProducerKey.of(producer), k -> buildCb(producer));
    }

    private RateLimiter buildRl(Producer producer) {
        PublishGuardProperties.RlConfig r = props.getRateLimiter();
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + producer.brokerUrl(), cfg);
    }

    private Bulkhead buildBh(Producer producer) {
        PublishGuardProperties.BhConfig b = props.getBulkhead();
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + producer.brokerUrl(), cfg);
    }

    private CircuitBreaker buildCb(Producer producer) {
        PublishGuardProperties.CbConfig c = props.getCircuitBreaker();
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        // 名称仅用于诊断, 实例按 producer 身份缓存
        return CircuitBreaker.of("cb:" + producer.brokerUrl(), cfg);
    }
}
