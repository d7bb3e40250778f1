package com.fastpublish.model;

import com.fastpublish.core.spi.Producer;

import java.util.Objects;

/**
 * producer 身份键
 * 按实例引用判等, 不依赖 brokerUrl 或实现类的 equals/hashCode
 */
public final class ProducerKey {

    private final Producer producer;

    private ProducerKey(Producer producer) {
        this.producer = producer;
    }

    public static ProducerKey of(Producer producer) {
        return new ProducerKey(Objects.requireNonNull(producer, "producer"));
    }

    public Producer producer() {
        return producer;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProducerKey other && other.producer == producer;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(producer);
    }

    @Override
    public String toString() {
        return "ProducerKey@" + Integer.toHexString(hashCode());
    }
}
