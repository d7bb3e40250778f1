package com.fastpublish.core.spi.notify;

import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;

import java.util.Objects;

/**
 * 派发前的放行判断
 */
@FunctionalInterface
public interface NotifierFilter {

    boolean allow(NotifyContext ctx, Severity severity);

    /**
     * 两个过滤器都放行才放行, 前者拒绝时不再询问后者
     */
    default NotifierFilter and(NotifierFilter next) {
        Objects.requireNonNull(next, "next");
        return (ctx, sev) -> allow(ctx, sev) && next.allow(ctx, sev);
    }

    /**
     * 丢弃低于 min 的事件
     */
    static NotifierFilter atLeast(Severity min) {
        Objects.requireNonNull(min, "min");
        return (ctx, sev) -> sev.compareTo(min) >= 0;
    }
}
