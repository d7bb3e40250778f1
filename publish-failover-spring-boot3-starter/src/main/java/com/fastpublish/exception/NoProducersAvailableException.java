package com.fastpublish.exception;

/**
 * 选择器无法给出 producer, 不重试
 */
public class NoProducersAvailableException extends PublishException {

    public NoProducersAvailableException(String message) {
        super(message);
    }
}
