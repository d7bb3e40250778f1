package com.fastpublish.model;

import lombok.Getter;

import java.util.Objects;

/**
 * 一次消息交换
 * responseType 为空时为单向发布, 否则为请求/应答, 应答由 producer 回填
 */
@Getter
public class MessageExchange {

    private final Message message;

    private final Class<?> responseType;

    private volatile Object response;

    private MessageExchange(Message message, Class<?> responseType) {
        this.message = Objects.requireNonNull(message, "message");
        this.responseType = responseType;
    }

    public static MessageExchange publish(Message message) {
        return new MessageExchange(message, null);
    }

    public static MessageExchange request(Message message, Class<?> responseType) {
        return new MessageExchange(message, Objects.requireNonNull(responseType, "responseType"));
    }

    public boolean isRequest() {
        return responseType != null;
    }

    public void setResponse(Object response) {
        this.response = response;
    }

    /** 按类型取应答 */
    public <R> R getResponse(Class<R> type) {
        return type.cast(response);
    }
}
