package com.fastpublish.core.spi.notify;

import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.Severity;

import java.util.List;

/**
 * 为一条事件挑选投递渠道, 返回空列表表示不投递
 */
public interface NotifierRouter {

    List<Notifier> route(NotifyContext ctx, Severity severity);
}
