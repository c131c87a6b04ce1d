package com.insights.precompute.infrastructure.config;

import com.insights.precompute.application.AggregationMetadataFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AggregationBeansConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AggregationMetadataFactory aggregationMetadataFactory() {
        return AggregationMetadataFactory.none();
    }
}
