package com.fastpublish.core.selector;

import com.fastpublish.core.spi.Producer;
import com.fastpublish.exception.NoProducersAvailableException;
import org.junit.jupiter.api.Test;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class RoundRobinSelectorTest {

    @Test
    void cyclesThroughProducersInOrder() {
        Producer a = mock(Producer.class);
        Producer b = mock(Producer.class);
        Producer c = mock(Producer.class);
        RoundRobinSelector selector = new RoundRobinSelector(List.of(a, b, c));

        assertThat(List.of(selector.next(), selector.next(), selector.next(), selector.next(), selector.next()))
                .containsExactly(a, b, c, a, b);
    }

    @Test
    void singleProducerIsAlwaysReturned() {
        Producer only = mock(Producer.class);
        RoundRobinSelector selector = new RoundRobinSelector(List.of(only));

        for (int i = 0; i < 10; i++) {
            assertThat(selector.next()).isSameAs(only);
        }
    }

    @Test
    void emptySelectorThrows() {
        RoundRobinSelector selector = new RoundRobinSelector(List.of());

        assertThatThrownBy(selector::next).isInstanceOf(NoProducersAvailableException.class);
    }

    @Test
    void concurrentCallersSeeAnEvenSplit() throws Exception {
        Producer a = mock(Producer.class);
        Producer b = mock(Producer.class);
        Producer c = mock(Producer.class);
        Producer d = mock(Producer.class);
        RoundRobinSelector selector = new RoundRobinSelector(List.of(a, b, c, d));

        int threads = 8;
        int perThread = 1000;
        Map<Producer, Integer> counts = new IdentityHashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            Producer p = selector.next();
                            synchronized (counts) {
                                counts.merge(p, 1, Integer::sum);
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(counts).hasSize(4);
        assertThat(counts.values()).containsOnly(threads * perThread / 4);
    }
}
