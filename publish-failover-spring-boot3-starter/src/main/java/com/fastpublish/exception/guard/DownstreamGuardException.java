package com.fastpublish.exception.guard;

import com.fastpublish.exception.PublishException;

/**
 * producer 保护组件拒绝了本次调用, producer 本身并未被调用
 * 与普通发布失败一样计入退避并切换到下一个 producer
 */
public abstract class DownstreamGuardException extends PublishException {

    private final String brokerUrl;

    protected DownstreamGuardException(String reason, String brokerUrl, Throwable cause) {
        super(reason + ": " + brokerUrl, cause);
        this.brokerUrl = brokerUrl;
    }

    public String getBrokerUrl() {
        return brokerUrl;
    }
}
