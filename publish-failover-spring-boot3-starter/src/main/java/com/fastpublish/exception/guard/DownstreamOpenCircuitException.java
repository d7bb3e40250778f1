package com.fastpublish.exception.guard;

/**
 * 熔断打开
 */
public class DownstreamOpenCircuitException extends DownstreamGuardException {

    public DownstreamOpenCircuitException(String brokerUrl, Throwable cause) {
        super("circuit open", brokerUrl, cause);
    }
}
