package com.fastpublish.core;

import com.fastpublish.core.backoff.BackoffStore;
import com.fastpublish.core.handler.GuardedPublishExecutor;
import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.notify.NotifyContexts;
import com.fastpublish.core.notify.NotifyingFacade;
import com.fastpublish.core.spi.Producer;
import com.fastpublish.core.spi.ProducerSelector;
import com.fastpublish.exception.FailoverException;
import com.fastpublish.exception.NoProducersAvailableException;
import com.fastpublish.exception.ProducerDisposedException;
import com.fastpublish.exception.PublishException;
import com.fastpublish.exception.PublishFailureException;
import com.fastpublish.model.DispatchAttempt;
import com.fastpublish.model.Message;
import com.fastpublish.model.MessageExchange;
import com.fastpublish.model.enums.Severity;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * 容错发送核心：
 * - 每次尝试由选择器给出 producer, 按该 producer 当前退避挂起后再发送
 * - 成功: 退避归零并立即返回; 失败: 退避放大, 记录错误, 换下一个 producer
 * - 尝试次数耗尽抛 FailoverException, 携带每一次的失败原因
 * - 退避挂起在时间轮上完成, 不占用调用线程, 也没有全局锁
 */
public class FailoverProducer {

    private static final Logger log = LoggerFactory.getLogger(FailoverProducer.class);

    /** producer 选择器 */
    private final ProducerSelector selector;

    /** 单次发送的最大尝试次数 */
    private final int maxAttempts;

    /** 退避上限 */
    private final long retryDelay;

    /** retryDelay / inactivityResetDelay 的单位 */
    private final TimeUnit unit;

    /** producer 退避状态, 独占 */
    private final BackoffStore backoff;

    /** 退避挂起用的时间轮 */
    private final Timer timer;

    /** producer 调用保护 */
    private final GuardedPublishExecutor guard;

    /** 指标 */
    private final PublishMetrics meter;

    /** 通知 */
    private final NotifyingFacade notifier;

    /** 释放标记, 只会从 false 变为 true 一次 */
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    /** 在途发送数 */
    private final AtomicInteger inflight = new AtomicInteger();

    /**
     * 延时单位为秒
     */
    public FailoverProducer(ProducerSelector selector, int maxAttempts, long retryDelay, long inactivityResetDelay) {
        this(selector, maxAttempts, retryDelay, inactivityResetDelay, TimeUnit.SECONDS);
    }

    public FailoverProducer(ProducerSelector selector, int maxAttempts, long retryDelay, long inactivityResetDelay,
                            TimeUnit unit) {
        this(selector, maxAttempts, retryDelay, inactivityResetDelay, unit,
                DefaultTimerHolder.TIMER,
                GuardedPublishExecutor.unguarded(),
                PublishMetrics.standalone(),
                NotifyingFacade.disabled(),
                System::nanoTime);
    }

    public FailoverProducer(ProducerSelector selector,
                            int maxAttempts,
                            long retryDelay,
                            long inactivityResetDelay,
                            TimeUnit unit,
                            Timer timer,
                            GuardedPublishExecutor guard,
                            PublishMetrics meter,
                            NotifyingFacade notifier,
                            LongSupplier nanoClock) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        if (retryDelay < 0) {
            throw new IllegalArgumentException("retryDelay must be >= 0, got " + retryDelay);
        }
        if (inactivityResetDelay < 0) {
            throw new IllegalArgumentException("inactivityResetDelay must be >= 0, got " + inactivityResetDelay);
        }
        this.selector = Objects.requireNonNull(selector, "selector");
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.meter = Objects.requireNonNull(meter, "meter");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.backoff = new BackoffStore(inactivityResetDelay, unit, nanoClock);
    }

    /**
     * 同步发送, 失败时抛出 FailoverException / NoProducersAvailableException / ProducerDisposedException
     */
    public void send(Message message) {
        await(sendAsync(message));
    }

    public CompletableFuture<Void> sendAsync(Message message) {
        return sendAsync(MessageExchange.publish(message)).thenApply(exchange -> null);
    }

    /**
     * 同步交换, 请求类交换返回时已回填应答
     */
    public MessageExchange send(MessageExchange exchange) {
        return await(sendAsync(exchange));
    }

    /**
     * 异步交换
     * 已释放时直接抛出 ProducerDisposedException, 不会触碰任何 producer
     */
    public CompletableFuture<MessageExchange> sendAsync(MessageExchange exchange) {
        ensureNotDisposed();
        Objects.requireNonNull(exchange, "exchange");

        CompletableFuture<MessageExchange> result = new CompletableFuture<>();
        inflight.incrementAndGet();
        result.whenComplete((r, e) -> inflight.decrementAndGet());
        new SendTask(exchange, result).next();
        return result;
    }

    /**
     * 当前退避状态的只读快照（producer 实例 → 退避时长）, 不产生副作用
     */
    public Map<Producer, Long> delays() {
        ensureNotDisposed();
        return backoff.snapshot();
    }

    /**
     * 释放, 幂等
     * 不取消在途发送, 也不关闭 producer
     */
    public void dispose() {
        if (disposed.compareAndSet(false, true)) {
            log.info("[Failover-Producer] disposed, inflight={}", inflight.get());
        }
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public int inflight() {
        return inflight.get();
    }

    /**
     * 等待在途发送结束
     * @return 超时前全部结束返回 true
     */
    public boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inflight.get() > 0) {
            if (System.nanoTime() - deadline >= 0) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    public int getMaxAttempts() { return maxAttempts; }

    public long getRetryDelay() { return retryDelay; }

    public TimeUnit getUnit() { return unit; }

    private void ensureNotDisposed() {
        if (disposed.get()) {
            throw new ProducerDisposedException("failover producer has been disposed");
        }
    }

    private static CompletionStage<Object> invoke(Producer producer, MessageExchange exchange) {
        if (exchange.isRequest()) {
            return producer.request(exchange.getMessage(), exchange.getResponseType()).thenApply(reply -> reply);
        }
        return producer.publish(exchange.getMessage()).thenApply(v -> null);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new PublishException("send failed", cause);
        }
    }

    /**
     * 单次发送的状态, 各次尝试严格串行
     * 自身即为退避到期后继续发送的时间轮任务
     */
    final class SendTask implements TimerTask {

        private final MessageExchange exchange;

        private final CompletableFuture<MessageExchange> result;

        private final List<DispatchAttempt> history = new ArrayList<>();

        private int attempt;

        private Producer producer;

        private long appliedDelay;

        private long suspendedAt;

        /** 待执行的尝试请求数, 由 0 变 1 的调用方负责驱动 */
        private final AtomicInteger wip = new AtomicInteger();

        SendTask(MessageExchange exchange, CompletableFuture<MessageExchange> result) {
            this.exchange = exchange;
            this.result = result;
        }

        /**
         * 请求下一次尝试
         * 同步完成的失败只登记请求并返回, 由栈底的驱动循环接着执行, 调用栈深度与尝试次数无关
         */
        void next() {
            if (wip.getAndIncrement() != 0) {
                return;
            }
            do {
                try {
                    attemptOnce();
                } catch (RuntimeException e) {
                    log.error("[Failover-Send] attempt {} aborted", attempt, e);
                    result.completeExceptionally(e);
                }
            } while (wip.decrementAndGet() != 0);
        }

        private void attemptOnce() {
            if (result.isDone()) {
                return;
            }
            attempt++;
            if (attempt > maxAttempts) {
                failover();
                return;
            }
            try {
                producer = selector.next();
                if (producer == null) {
                    throw new NoProducersAvailableException("selector returned no producer");
                }
            } catch (RuntimeException e) {
                // 选择失败不重试, 也不计入尝试次数
                log.warn("[Failover-Send] producer selection failed at attempt {}: {}", attempt, e.getMessage());
                result.completeExceptionally(e);
                return;
            }

            appliedDelay = backoff.delayFor(producer);
            if (appliedDelay <= 0) {
                publish();
                return;
            }
            suspendedAt = System.nanoTime();
            try {
                timer.newTimeout(this, appliedDelay, unit);
            } catch (RuntimeException e) {
                if (disposed.get()) {
                    // 停机后时间轮已停止, 按释放处理
                    log.debug("[Failover-Send] attempt {} via {} dropped, producer disposed", attempt, producer.brokerUrl());
                    result.completeExceptionally(
                            new ProducerDisposedException("failover producer stopped while waiting for backoff"));
                    return;
                }
                // 挂起任务过多
                log.error("[Failover-Send] failed to schedule attempt {} via {}", attempt, producer.brokerUrl(), e);
                notifier.fire(NotifyContexts.ctxForEngineError(producer.brokerUrl(), "schedule", e), Severity.ERROR);
                result.completeExceptionally(e);
            }
        }

        @Override
        public void run(Timeout timeout) {
            meter.recordBackoffNanos(System.nanoTime() - suspendedAt);
            publish();
        }

        /**
         * 时间轮停止时未到期的任务, 直接以 reason 结束
         */
        void abandon(Throwable reason) {
            result.completeExceptionally(reason);
        }

        private void publish() {
            if (result.isDone()) {
                return;
            }
            Producer current = producer;
            int n = attempt;
            long delay = appliedDelay;
            meter.incAttempt();
            guard.execute(current, () -> invoke(current, exchange)).whenComplete((reply, error) -> {
                try {
                    if (error == null) {
                        onSuccess(current, n, reply);
                    } else {
                        onFailure(current, n, delay, error);
                    }
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                }
            });
        }

        private void onSuccess(Producer current, int n, Object reply) {
            backoff.decay(current);
            meter.incSuccess();
            meter.recordAttempts(n);
            if (exchange.isRequest()) {
                exchange.setResponse(reply);
            }
            if (n > 1) {
                log.debug("[Failover-Send] delivered via {} at attempt {}/{}", current.brokerUrl(), n, maxAttempts);
            }
            result.complete(exchange);
        }

        private void onFailure(Producer current, int n, long delay, Throwable error) {
            Throwable cause = GuardedPublishExecutor.unwrap(error);
            boolean[] saturated = new boolean[1];
            long next = backoff.escalate(current, retryDelay, () -> saturated[0] = true);
            meter.incFailed();

            PublishFailureException failure = new PublishFailureException(current.brokerUrl(), n, cause);
            history.add(DispatchAttempt.builder()
                    .attempt(n)
                    .producer(current)
                    .brokerUrl(current.brokerUrl())
                    .appliedDelay(delay)
                    .unit(unit)
                    .error(failure)
                    .build());
            log.debug("[Failover-Send] attempt {}/{} via {} failed, next delay={} {}: {}",
                    n, maxAttempts, current.brokerUrl(), next, unit, cause.toString());

            // 只有把退避推到上限的那一次失败告警
            if (saturated[0]) {
                notifier.fire(NotifyContexts.ctxForBackoffSaturated(current.brokerUrl(), next, unit), Severity.WARNING);
            }
            next();
        }

        private void failover() {
            FailoverException e = new FailoverException(maxAttempts, history);
            meter.incFailover();
            meter.recordAttempts(maxAttempts);
            log.warn("[Failover-Send] label={} not delivered after {} attempt(s), brokers={}",
                    exchange.getMessage().getLabel(), maxAttempts,
                    history.stream().map(DispatchAttempt::getBrokerUrl).toList());
            notifier.fire(NotifyContexts.ctxForFailover(exchange.getMessage(), e), Severity.ERROR);
            result.completeExceptionally(e);
        }
    }

    /**
     * 未注入时间轮时共享的守护线程时间轮
     */
    private static final class DefaultTimerHolder {
        static final HashedWheelTimer TIMER = new HashedWheelTimer(
                new NamedThreadFactory("publish-failover-timer"), 10, TimeUnit.MILLISECONDS, 512);
    }
}
