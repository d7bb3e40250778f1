package com.fastpublish.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 待发送的消息
 * 负载的编码由具体 producer 负责, 这里只做透传
 */
@Getter
@ToString
public class Message {

    /** 消息标签, 如 "order.created" */
    private final String label;

    private final Object payload;

    private final Map<String, Object> headers;

    public Message(String label, Object payload) {
        this(label, payload, Map.of());
    }

    public Message(String label, Object payload, Map<String, Object> headers) {
        this.label = Objects.requireNonNull(label, "label");
        this.payload = payload;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(headers, "headers")));
    }
}
