package com.fastpublish.exception.guard;

public class DownstreamBulkheadFullException extends DownstreamGuardException {
    public DownstreamBulkheadFullException(String brokerUrl, Throwable cause) { super("too many in-flight publishes", brokerUrl, cause); }
}
