package com.fastpublish.exception;

/**
 * producer 已释放后仍被调用
 */
public class ProducerDisposedException extends PublishException {

    public ProducerDisposedException(String message) {
        super(message);
    }
}
