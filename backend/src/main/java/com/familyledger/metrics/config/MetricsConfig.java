package com.familyledger.metrics.config;

import com.familyledger.metrics.MetricsAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MetricsProperties.class)
public class MetricsConfig {

    @Bean
    public MetricsAggregator metricsAggregator(MetricsProperties properties) {
        return new MetricsAggregator(properties.getGoldPricePerGram());
    }
}
