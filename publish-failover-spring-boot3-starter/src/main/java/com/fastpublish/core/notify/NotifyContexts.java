package com.fastpublish.core.notify;

import com.fastpublish.exception.FailoverException;
import com.fastpublish.model.DispatchAttempt;
import com.fastpublish.model.Message;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.NotifyEventType;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class NotifyContexts {

    private static final int MAX_ERROR_LEN = 4000;

    private NotifyContexts() {}

    /* ========== 对外入口（使用系统UTC时钟） ========== */

    public static NotifyContext ctxForFailover(Message message, FailoverException e) {
        return ctxForFailover(message, e, Clock.systemUTC());
    }

    public static NotifyContext ctxForBackoffSaturated(String brokerUrl, long delay, TimeUnit unit) {
        return ctxForBackoffSaturated(brokerUrl, delay, unit, Clock.systemUTC());
    }

    public static NotifyContext ctxForEngineError(String brokerUrl, String op, Throwable e) {
        return ctxForEngineError(brokerUrl, op, e, Clock.systemUTC());
    }

    /* ========== 带 Clock 的重载（方便测试） ========== */

    public static NotifyContext ctxForFailover(Message message, FailoverException e, Clock clock) {
        List<DispatchAttempt> log = e.getAttemptLog();
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("brokers", log.stream().map(DispatchAttempt::getBrokerUrl).toList());
        attrs.put("delays", log.stream().map(DispatchAttempt::getAppliedDelay).toList());
        String lastBroker = log.isEmpty() ? null : log.get(log.size() - 1).getBrokerUrl();
        return new NotifyContext(
                NotifyEventType.FAILOVER,
                lastBroker,
                message == null ? null : message.getLabel(),
                log.size(),
                e.getAttempts(),
                "MAX_ATTEMPTS",
                truncate(toError(e.getCause())),
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForBackoffSaturated(String brokerUrl, long delay, TimeUnit unit, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("delay", delay);
        attrs.put("unit", unit.name());
        return new NotifyContext(
                NotifyEventType.BACKOFF_SATURATED,
                brokerUrl,
                null,
                null,
                null,
                "BACKOFF_CAP",
                null,
                now(clock),
                attrs
        );
    }

    public static NotifyContext ctxForEngineError(String brokerUrl, String op, Throwable e, Clock clock) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("op", op);
        return new NotifyContext(
                NotifyEventType.ENGINE_ERROR,
                brokerUrl,
                null,
                null,
                null,
                "ENGINE_" + op.toUpperCase(Locale.ROOT),
                truncate(toError(e)),
                now(clock),
                attrs
        );
    }

    /* ========== 工具方法 ========== */

    private static Instant now(Clock clock) {
        return clock.instant();
    }

    private static String toError(Throwable e) {
        if (e == null) {
            return null;
        }
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String truncate(String s) {
        if (s == null) {
            return null;
        }
        return s.length() <= MAX_ERROR_LEN ? s : s.substring(0, MAX_ERROR_LEN);
    }
}
