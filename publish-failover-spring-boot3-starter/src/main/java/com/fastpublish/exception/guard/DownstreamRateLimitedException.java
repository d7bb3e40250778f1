package com.fastpublish.exception.guard;

public class DownstreamRateLimitedException extends DownstreamGuardException {
    public DownstreamRateLimitedException(String brokerUrl, Throwable cause) { super("publish rate exceeded", brokerUrl, cause); }
}
