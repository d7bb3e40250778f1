package com.fastpublish.core.spi;

/**
 * producer 选择策略
 * 可被多个线程并发调用
 */
public interface ProducerSelector {

    /**
     * 返回下一个要尝试的 producer
     * @throws com.fastpublish.exception.NoProducersAvailableException 没有可用 producer
     */
    Producer next();
}
