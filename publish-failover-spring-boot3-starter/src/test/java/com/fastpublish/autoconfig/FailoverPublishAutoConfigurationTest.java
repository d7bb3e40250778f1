package com.fastpublish.autoconfig;

import com.fastpublish.config.FailoverPublishProperties;
import com.fastpublish.config.PublishGuardProperties;
import com.fastpublish.core.FailoverProducer;
import com.fastpublish.core.FailoverProducerLifecycle;
import com.fastpublish.core.handler.GuardedPublishExecutor;
import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.notify.AsyncNotifyingService;
import com.fastpublish.core.selector.RoundRobinSelector;
import com.fastpublish.core.spi.Producer;
import com.fastpublish.core.spi.ProducerSelector;
import com.fastpublish.model.Message;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FailoverPublishAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    PublishMetricsAutoConfiguration.class,
                    PublishGuardAutoConfiguration.class,
                    PublishNotifierAutoConfiguration.class,
                    FailoverPublishAutoConfiguration.class));

    @Test
    void wiresTheFailoverProducerOverAllProducerBeans() {
        runner.withUserConfiguration(TwoProducers.class).run(ctx -> {
            assertThat(ctx).hasSingleBean(FailoverProducer.class);
            assertThat(ctx).hasSingleBean(FailoverProducerLifecycle.class);
            assertThat(ctx).hasSingleBean(GuardedPublishExecutor.class);
            assertThat(ctx).hasSingleBean(PublishMetrics.class);
            assertThat(ctx).doesNotHaveBean(AsyncNotifyingService.class);
            assertThat(ctx.getBean(ProducerSelector.class)).isInstanceOf(RoundRobinSelector.class);
            assertThat(((RoundRobinSelector) ctx.getBean(ProducerSelector.class)).producers()).hasSize(2);

            FailoverProducer producer = ctx.getBean(FailoverProducer.class);
            producer.send(new Message("order.created", "{}"));
            assertThat(producer.delays()).hasSize(1);
        });
    }

    @Test
    void bindsFailoverProperties() {
        runner.withUserConfiguration(TwoProducers.class)
                .withPropertyValues(
                        "publish.failover.max-attempts=7",
                        "publish.failover.retry-delay=250",
                        "publish.failover.inactivity-reset-delay=60000",
                        "publish.failover.time-unit=MILLISECONDS",
                        "publish.failover.shutdown.await=5s")
                .run(ctx -> {
                    FailoverPublishProperties props = ctx.getBean(FailoverPublishProperties.class);
                    assertThat(props.getMaxAttempts()).isEqualTo(7);
                    assertThat(props.getShutdown().getAwait()).isEqualTo(Duration.ofSeconds(5));
                    assertThat(props.inactivityResetDuration()).isEqualTo(Duration.ofMinutes(1));

                    FailoverProducer producer = ctx.getBean(FailoverProducer.class);
                    assertThat(producer.getMaxAttempts()).isEqualTo(7);
                    assertThat(producer.getRetryDelay()).isEqualTo(250);
                    assertThat(producer.getUnit()).isEqualTo(TimeUnit.MILLISECONDS);
                });
    }

    @Test
    void disabledPropertyBacksOff() {
        runner.withUserConfiguration(TwoProducers.class)
                .withPropertyValues("publish.failover.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(FailoverProducer.class);
                    assertThat(ctx).doesNotHaveBean(FailoverProducerLifecycle.class);
                });
    }

    @Test
    void customSelectorReplacesRoundRobin() {
        runner.withUserConfiguration(TwoProducers.class, FirstOnlySelector.class).run(ctx -> {
            assertThat(ctx).hasSingleBean(ProducerSelector.class);
            assertThat(ctx.getBean(ProducerSelector.class)).isNotInstanceOf(RoundRobinSelector.class);
        });
    }

    @Test
    void notifierServiceIsCreatedWhenEnabled() {
        runner.withUserConfiguration(TwoProducers.class)
                .withPropertyValues("publish.failover.notify.enabled=true")
                .run(ctx -> assertThat(ctx).hasSingleBean(AsyncNotifyingService.class));
    }

    @Test
    void bindsGuardProperties() {
        runner.withPropertyValues(
                        "publish.failover.guard.enabled=true",
                        "publish.failover.guard.circuit-breaker.sliding-window-size=20",
                        "publish.failover.guard.bulkhead.enabled=true")
                .run(ctx -> {
                    PublishGuardProperties props = ctx.getBean(PublishGuardProperties.class);
                    assertThat(props.isEnabled()).isTrue();
                    assertThat(props.getCircuitBreaker().getSlidingWindowSize()).isEqualTo(20);
                    assertThat(props.getBulkhead().isEnabled()).isTrue();
                });
    }

    @Test
    void metricsUseTheApplicationRegistry() {
        runner.withUserConfiguration(TwoProducers.class, Registry.class).run(ctx -> {
            ctx.getBean(FailoverProducer.class).send(new Message("order.created", "{}"));

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.get("publish.success").counter().count()).isEqualTo(1.0);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class TwoProducers {

        @Bean
        Producer primaryProducer() {
            return new StubProducer("amqp://primary");
        }

        @Bean
        Producer secondaryProducer() {
            return new StubProducer("amqp://secondary");
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class FirstOnlySelector {

        @Bean
        ProducerSelector firstOnly(List<Producer> producers) {
            return () -> producers.get(0);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class Registry {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    static final class StubProducer implements Producer {

        private final String url;

        StubProducer(String url) {
            this.url = url;
        }

        @Override
        public CompletionStage<Void> publish(Message message) {
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public String brokerUrl() {
            return url;
        }
    }
}
