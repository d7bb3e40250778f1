package com.fastpublish.model;

import com.fastpublish.core.spi.Producer;
import com.fastpublish.exception.PublishFailureException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.TimeUnit;

/**
 * 一次失败尝试的记录, 仅用于构造 FailoverException
 */
@Getter
@Builder
@ToString(exclude = "producer")
public class DispatchAttempt {

    /** 第几次尝试, 从1开始 */
    private final int attempt;

    private final Producer producer;

    private final String brokerUrl;

    /** 本次尝试前实际挂起的时长 */
    private final long appliedDelay;

    private final TimeUnit unit;

    private final PublishFailureException error;
}
