package com.fastpublish.core.spi.notify;

import com.fastpublish.model.ctx.NotifyContext;
import com.fastpublish.model.enums.NotifyEventType;
import com.fastpublish.model.enums.Severity;

/**
 * 发送链路告警渠道（整条消息发送失败、producer 退避打满、时间轮调度失败）
 * 实现注册为 Spring Bean 即参与路由
 */
public interface Notifier {

    /**
     * 渠道名, 出现在重试失败日志里
     */
    String name();

    /**
     * 是否订阅该类事件, 默认全部订阅
     */
    default boolean supports(NotifyEventType type) {
        return true;
    }

    /**
     * 同步投递; 由 AsyncNotifyingService 在通知线程池中调用, 抛异常会触发重试
     */
    void notify(NotifyContext ctx, Severity severity);
}
