package com.fastpublish.autoconfig;

import com.fastpublish.config.PublishGuardProperties;
import com.fastpublish.core.handler.GuardedPublishExecutor;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        PublishGuardProperties.class
})
public class PublishGuardAutoConfiguration {

    /**
     * producer 调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedPublishExecutor guardedPublishExecutor(PublishGuardProperties props) {
        return new GuardedPublishExecutor(props);
    }
}
