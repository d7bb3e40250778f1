package com.fastpublish.core;

import com.fastpublish.config.FailoverPublishProperties;
import com.fastpublish.config.PublishNotifierProperties;
import com.fastpublish.core.handler.GuardedPublishExecutor;
import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.notify.AsyncNotifyingService;
import com.fastpublish.core.notify.NotifyingFacade;
import com.fastpublish.core.notify.route.SimpleRouter;
import com.fastpublish.core.selector.RoundRobinSelector;
import com.fastpublish.core.spi.Producer;
import com.fastpublish.core.spi.notify.Notifier;
import com.fastpublish.exception.ProducerDisposedException;
import com.fastpublish.model.Message;
import com.fastpublish.model.enums.NotifyEventType;
import io.netty.util.HashedWheelTimer;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FailoverProducerLifecycleTest {

    private static FailoverPublishProperties props(Duration await) {
        FailoverPublishProperties props = new FailoverPublishProperties();
        props.getShutdown().setAwait(await);
        return props;
    }

    @Test
    void stopDisposesAndAbandonsSendsWaitingOnBackoff() {
        Producer broken = mock(Producer.class);
        when(broken.brokerUrl()).thenReturn("amqp://broken");
        when(broken.publish(any())).thenThrow(new RuntimeException("Publish error"));
        HashedWheelTimer timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        FailoverProducer producer = new FailoverProducer(new RoundRobinSelector(List.of(broken)), 2, 10, 0,
                TimeUnit.SECONDS, timer, GuardedPublishExecutor.unguarded(), PublishMetrics.standalone(),
                NotifyingFacade.disabled(), System::nanoTime);
        FailoverProducerLifecycle lifecycle = new FailoverProducerLifecycle(producer, timer,
                props(Duration.ofMillis(100)), new PublishNotifierProperties(), 1);
        lifecycle.start();

        CompletableFuture<Void> pending = producer.sendAsync(new Message("order.created", "{}"));
        assertThat(pending).isNotDone();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(producer.isDisposed()).isTrue();
        assertThat(pending).isCompletedExceptionally();
        assertThatThrownBy(pending::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ProducerDisposedException.class);
    }

    @Test
    void publishFailingAfterStopEndsAsDisposed() {
        CompletableFuture<Void> outcome = new CompletableFuture<>();
        Producer slow = mock(Producer.class);
        when(slow.brokerUrl()).thenReturn("amqp://slow");
        when(slow.publish(any())).thenReturn(outcome);
        Notifier notifier = mock(Notifier.class);
        when(notifier.name()).thenReturn("mock");
        when(notifier.supports(any())).thenReturn(true);
        ExecutorService exec = Executors.newSingleThreadExecutor();
        AsyncNotifyingService service = new AsyncNotifyingService(exec, new SimpleRouter(List.of(notifier)), null,
                PublishMetrics.standalone());
        HashedWheelTimer timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        FailoverProducer producer = new FailoverProducer(new RoundRobinSelector(List.of(slow)), 2, 10, 0,
                TimeUnit.SECONDS, timer, GuardedPublishExecutor.unguarded(), PublishMetrics.standalone(),
                NotifyingFacade.of(service), System::nanoTime);
        FailoverProducerLifecycle lifecycle = new FailoverProducerLifecycle(producer, timer,
                props(Duration.ofMillis(50)), new PublishNotifierProperties(), 1);
        try {
            lifecycle.start();
            CompletableFuture<Void> pending = producer.sendAsync(new Message("order.created", "{}"));

            lifecycle.stop();
            assertThat(pending).isNotDone();
            outcome.completeExceptionally(new IllegalStateException("connection reset"));

            assertThatThrownBy(pending::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(ProducerDisposedException.class);
            verify(notifier, after(300).never()).notify(
                    argThat(ctx -> ctx.getType() == NotifyEventType.ENGINE_ERROR), any());
        } finally {
            service.close();
        }
    }

    @Test
    void stopWithNothingInFlightReturnsPromptly() {
        HashedWheelTimer timer = new HashedWheelTimer(10, TimeUnit.MILLISECONDS);
        FailoverProducer producer = new FailoverProducer(new RoundRobinSelector(List.of()), 3, 5, 0,
                TimeUnit.SECONDS, timer, GuardedPublishExecutor.unguarded(), PublishMetrics.standalone(),
                NotifyingFacade.disabled(), System::nanoTime);
        FailoverProducerLifecycle lifecycle = new FailoverProducerLifecycle(producer, timer,
                props(Duration.ofSeconds(30)), new PublishNotifierProperties(), 0);
        lifecycle.start();

        long started = System.nanoTime();
        lifecycle.stop();
        lifecycle.stop();

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)).isLessThan(5000);
        assertThat(producer.isDisposed()).isTrue();
    }
}
