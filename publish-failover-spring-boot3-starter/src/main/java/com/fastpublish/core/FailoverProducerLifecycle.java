package com.fastpublish.core;

import com.fastpublish.config.FailoverPublishProperties;
import com.fastpublish.config.PublishNotifierProperties;
import com.fastpublish.exception.ProducerDisposedException;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 容错发送生命周期
 * 启动时打印关键配置; 停止时释放 FailoverProducer, 等待在途发送, 再停止时间轮
 */
public class FailoverProducerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FailoverProducerLifecycle.class);

    private final FailoverProducer producer;

    private final Timer timer;

    private final FailoverPublishProperties props;

    private final PublishNotifierProperties notifyProps;

    private final int producerCount;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public FailoverProducerLifecycle(FailoverProducer producer, Timer timer, FailoverPublishProperties props,
                                     PublishNotifierProperties notifyProps, int producerCount) {
        this.producer = producer;
        this.timer = timer;
        this.props = props;
        this.notifyProps = notifyProps;
        this.producerCount = producerCount;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌──────────────────────────────────────────────");
            log.info("│ FailoverProducer starting...");
            log.info("├──────────────────────────────────────────────");
            log.info("│ producers              : {}", producerCount);
            log.info("│ max-attempts           : {}", props.getMaxAttempts());
            log.info("│ retry-delay            : {} {} ({})", props.getRetryDelay(), props.getTimeUnit(), props.retryDelayDuration());
            log.info("│ inactivity-reset-delay : {}", props.getInactivityResetDelay() > 0 ? props.inactivityResetDuration() : "never");
            log.info("│ wheel.tick             : {} ms", props.wheelTickMillis());
            log.info("│ notifier.enabled       : {}", notifyProps.isEnabled());
            log.info("└──────────────────────────────────────────────");
        } catch (Throwable t) {
            // 启动日志打印本身不应阻断启动
            log.warn("[Failover-Producer] failed to render startup banner: {}", t.toString());
        }
        if (producerCount == 0) {
            log.warn("[Failover-Producer] no Producer beans found, every send will fail with NoProducersAvailableException");
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Failover-Producer] stop skipped: already stopped");
            return;
        }
        log.info("[Failover-Producer] stopping... inflight={}", producer.inflight());
        // 停止接收新发送, 等待在途完成
        producer.dispose();
        try {
            if (!producer.awaitQuiescence(props.getShutdown().getAwait())) {
                log.warn("[Failover-Producer] {} send(s) still in flight after {}", producer.inflight(), props.getShutdown().getAwait());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        int abandoned = abandonPending(timer.stop());
        log.info("[Failover-Producer] stopped, abandonedSends={}", abandoned);
    }

    /**
     * 时间轮停止后仍未到期的发送直接失败, 避免调用方永久等待
     */
    private int abandonPending(Set<Timeout> unprocessed) {
        if (unprocessed == null || unprocessed.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (Timeout t : unprocessed) {
            if (t != null && t.task() instanceof FailoverProducer.SendTask task) {
                task.abandon(new ProducerDisposedException("failover producer stopped while waiting for backoff"));
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
