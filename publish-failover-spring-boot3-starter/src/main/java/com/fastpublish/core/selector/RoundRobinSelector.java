package com.fastpublish.core.selector;

import com.fastpublish.core.spi.Producer;
import com.fastpublish.core.spi.ProducerSelector;
import com.fastpublish.exception.NoProducersAvailableException;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 轮询选择
 * 构造时固定 producer 集合, 游标原子递增
 */
public class RoundRobinSelector implements ProducerSelector {

    private final List<Producer> producers;

    private final AtomicInteger cursor = new AtomicInteger();

    public RoundRobinSelector(Collection<? extends Producer> producers) {
        // List.copyOf 拒绝 null 元素
        this.producers = List.copyOf(producers);
    }

    @Override
    public Producer next() {
        if (producers.isEmpty()) {
            throw new NoProducersAvailableException("no producers configured for round-robin selection");
        }
        // floorMod: 游标溢出为负数后仍落在 [0, size)
        return producers.get(Math.floorMod(cursor.getAndIncrement(), producers.size()));
    }

    public List<Producer> producers() {
        return producers;
    }
}
