package com.fastpublish.autoconfig;

import com.fastpublish.core.metric.PublishMeterRegistryProvider;
import com.fastpublish.core.metric.PublishMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class PublishMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PublishMeterRegistryProvider publishMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new PublishMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public PublishMetrics publishMetrics(PublishMeterRegistryProvider provider) {
        return PublishMetrics.create(provider.getRegistry());
    }
}
