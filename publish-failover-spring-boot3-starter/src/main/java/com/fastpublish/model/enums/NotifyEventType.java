package com.fastpublish.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 尝试次数耗尽, 发送失败 */
    FAILOVER,

    /** producer 退避达到上限 */
    BACKOFF_SATURATED,

    /** 引擎级异常（时间轮拒绝、停机丢弃等） */
    ENGINE_ERROR
}
