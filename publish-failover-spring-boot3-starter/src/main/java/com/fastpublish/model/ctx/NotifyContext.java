package com.fastpublish.model.ctx;

import com.fastpublish.model.enums.NotifyEventType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * 事件上下文
 */
@Getter
@ToString
@AllArgsConstructor
public class NotifyContext {

    private final NotifyEventType type;

    /** 出问题的 producer 地址; FAILOVER 事件为最后一次尝试的地址 */
    private final String brokerUrl;

    /** 消息标签 */
    private final String label;

    private final Integer attempts;

    private final Integer maxAttempts;

    // 自定义分类码，如 MAX_ATTEMPTS/BACKOFF_CAP/TIMER_STOPPED
    private final String reasonCode;

    // 已截断
    private final String lastError;

    private final Instant when;

    // 额外字段：delay、unit、brokers 等
    private final Map<String, Object> attributes;
}
