package com.fastpublish.core.notify.route;

import com.fastpublish.core.spi.notify.Notifier;
import com.fastpublish.core.spi.notify.NotifierRouter;
import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;

import java.util.List;

/**
 * 按事件类型广播给订阅了它的全部渠道
 */
public class SimpleRouter implements NotifierRouter {

    private final List<Notifier> channels;

    public SimpleRouter(List<Notifier> channels) {
        this.channels = List.copyOf(channels);
    }

    @Override
    public List<Notifier> route(NotifyContext ctx, Severity severity) {
        if (ctx.getType() == null) {
            return channels;
        }
        return channels.stream()
                .filter(channel -> channel.supports(ctx.getType()))
                .toList();
    }
}
