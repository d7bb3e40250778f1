package com.fastpublish.core.notify.notifier;

import com.fastpublish.core.spi.notify.Notifier;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 写日志的告警渠道, 始终注册
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    private static final int MAX_ERROR_LEN = 2000;

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void notify(NotifyContext ctx, Severity severity) {
        String line = describe(ctx);
        switch (severity) {
            case CRITICAL, ERROR -> log.error("[Notify-{}] {}, err={}", ctx.getType(), line, clip(ctx.getLastError()));
            case WARNING -> log.warn("[Notify-{}] {}", ctx.getType(), line);
            default -> log.info("[Notify-{}] {}", ctx.getType(), line);
        }
    }

    private static String describe(NotifyContext ctx) {
        if (ctx.getType() == null) {
            return "broker=" + ctx.getBrokerUrl();
        }
        return switch (ctx.getType()) {
            case FAILOVER -> "label=" + ctx.getLabel()
                    + ", attempts=" + ctx.getAttempts() + "/" + ctx.getMaxAttempts()
                    + ", lastBroker=" + ctx.getBrokerUrl()
                    + ", brokers=" + ctx.getAttributes().get("brokers");
            case BACKOFF_SATURATED -> "broker=" + ctx.getBrokerUrl()
                    + " backing off at cap " + ctx.getAttributes().get("delay") + " " + ctx.getAttributes().get("unit");
            case ENGINE_ERROR -> "broker=" + ctx.getBrokerUrl() + ", reason=" + ctx.getReasonCode();
        };
    }

    private static String clip(String s) {
        return s == null || s.length() <= MAX_ERROR_LEN ? s : s.substring(0, MAX_ERROR_LEN);
    }
}
