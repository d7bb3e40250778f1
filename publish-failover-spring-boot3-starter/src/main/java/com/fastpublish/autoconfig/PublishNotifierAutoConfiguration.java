package com.fastpublish.autoconfig;

import com.fastpublish.config.PublishNotifierProperties;
import com.fastpublish.core.metric.PublishMetrics;
import com.fastpublish.core.notify.AsyncNotifyingService;
import com.fastpublish.core.notify.NotifyingFacade;
import com.fastpublish.core.notify.notifier.LoggingNotifier;
import com.fastpublish.core.notify.ratelimit.RateLimitFilter;
import com.fastpublish.core.notify.route.SimpleRouter;
import com.fastpublish.core.spi.notify.Notifier;
import com.fastpublish.core.spi.notify.NotifierFilter;
import com.fastpublish.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = PublishMetricsAutoConfiguration.class)
@EnableConfigurationProperties(PublishNotifierProperties.class)
public class PublishNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    /**
     * 容器内所有 Notifier 都参与路由
     */
    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers) {
        return new SimpleRouter(notifiers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnProperty(prefix = "publish.failover.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       PublishMetrics metrics,
                                                       PublishNotifierProperties props) {
        PublishNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "publish-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.DiscardOldestPolicy());
        NotifierFilter filter = NotifierFilter.atLeast(props.getMinSeverity())
                .and(new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold()));
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
