package com.fastpublish.core.notify;

import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.spi.notify.Notifier;
import com.fastpublish.core.spi.notify.NotifierFilter;
import com.fastpublish.core.spi.notify.NotifierRouter;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 异步派发
 * 通过路由、限流、异步执行通知, 不阻塞发送线程
 */
public class AsyncNotifyingService implements AutoCloseable {

    private static final int MAX_TRIES = 3;

    private final Logger log = LoggerFactory.getLogger(AsyncNotifyingService.class);

    private final ExecutorService exec;

    private final NotifierRouter router;

    private final NotifierFilter filter;

    private final PublishMetrics metrics;

    public AsyncNotifyingService(ExecutorService exec, NotifierRouter router, NotifierFilter filter, PublishMetrics metrics) {
        this.exec = exec;
        this.router = router;
        this.filter = filter;
        this.metrics = metrics;
    }

    public void fire(NotifyContext ctx, Severity sev) {
        if (filter != null && !filter.allow(ctx, sev)) {
            metrics.incNotifySuppressed();
            return;
        }
        try {
            exec.execute(() -> dispatch(ctx, sev));
        } catch (RejectedExecutionException e) {
            metrics.incNotifyFailed();
            log.warn("[Notify] executor rejected event={}, broker={}", ctx.getType(), ctx.getBrokerUrl());
        }
    }

    private void dispatch(NotifyContext ctx, Severity sev) {
        List<Notifier> notifiers = router.route(ctx, sev);
        for (Notifier n : notifiers) {
            try {
                // 重试
                int attempt = 0;
                long backoff = 200;
                while (true) {
                    try {
                        n.notify(ctx, sev);
                        break;
                    } catch (Exception e) {
                        if (++attempt >= MAX_TRIES) {
                            throw e;
                        }
                        Thread.sleep(backoff);
                        // 指数退避
                        backoff = Math.min(backoff * 2, 4000);
                    }
                }
                metrics.incNotifySent();
            } catch (InterruptedException ie) {
                metrics.incNotifyFailed();
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                metrics.incNotifyFailed();
                log.error("[Notify] channel={} event={} failed", n.name(), ctx.getType(), e);
            }
        }
    }

    @Override
    public void close() {
        exec.shutdown();
    }
}
