package com.fastpublish.autoconfig;

import com.fastpublish.config.FailoverPublishProperties;
import com.fastpublish.config.PublishNotifierProperties;
import com.fastpublish.core.FailoverProducer;
import com.fastpublish.core.FailoverProducerLifecycle;
import com.fastpublish.core.handler.GuardedPublishExecutor;
import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.notify.NotifyingFacade;
import com.fastpublish.core.selector.RoundRobinSelector;
import com.fastpublish.core.spi.Producer;
import com.fastpublish.core.spi.ProducerSelector;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 时间轮、选择器及容错发送组件
 */
@AutoConfiguration(after = {
        PublishMetricsAutoConfiguration.class,
        PublishGuardAutoConfiguration.class,
        PublishNotifierAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "publish.failover", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(FailoverPublishProperties.class)
public class FailoverPublishAutoConfiguration {

    /**
     * 退避挂起用的时间轮, 由 FailoverProducerLifecycle 负责停止
     */
    @Bean("failoverWheelTimer")
    public HashedWheelTimer failoverWheelTimer(FailoverPublishProperties props) {
        return new HashedWheelTimer(
                new NamedThreadFactory("publish-failover-timer"),
                props.getWheel().getTickDuration().toMillis(),
                TimeUnit.MILLISECONDS,
                props.getWheel().getTicksPerWheel(),
                false,
                props.getWheel().getMaxPendingTimeouts()
        );
    }

    /**
     * 默认轮询容器内全部 Producer
     */
    @Bean
    @ConditionalOnMissingBean
    public ProducerSelector producerSelector(ObjectProvider<Producer> producers) {
        return new RoundRobinSelector(producers.orderedStream().toList());
    }

    /**
     * 容错发送
     */
    @Bean
    @ConditionalOnMissingBean
    public FailoverProducer failoverProducer(ProducerSelector selector,
                                             @Qualifier("failoverWheelTimer") HashedWheelTimer timer,
                                             GuardedPublishExecutor guard,
                                             PublishMetrics meter,
                                             NotifyingFacade notifier,
                                             FailoverPublishProperties props) {
        return new FailoverProducer(selector,
                props.getMaxAttempts(),
                props.getRetryDelay(),
                props.getInactivityResetDelay(),
                props.getTimeUnit(),
                timer,
                guard,
                meter,
                notifier,
                System::nanoTime);
    }

    /**
     * 启动/停止
     */
    @Bean
    public FailoverProducerLifecycle failoverProducerLifecycle(FailoverProducer producer,
                                                               @Qualifier("failoverWheelTimer") HashedWheelTimer timer,
                                                               FailoverPublishProperties props,
                                                               ObjectProvider<PublishNotifierProperties> notifyProps,
                                                               ObjectProvider<Producer> producers) {
        List<Producer> pool = producers.orderedStream().toList();
        return new FailoverProducerLifecycle(producer, timer, props,
                notifyProps.getIfAvailable(PublishNotifierProperties::new), pool.size());
    }
}
