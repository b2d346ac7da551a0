package com.marker.adapter.spring;

import com.marker.config.ConfigLoader;
import com.marker.config.MarkerConfig;
import com.marker.evaluator.MarkerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for marker evaluation.
 */
@Configuration
@ConditionalOnProperty(prefix = "marker", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MarkerProperties.class)
public class MarkerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MarkerAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MarkerConfig markerConfig(MarkerProperties properties) {
        log.info("Loading marker configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public MarkerEvaluator markerEvaluator(MarkerConfig config) {
        log.info("Creating MarkerEvaluator (environment: {}, extras: {})",
                config.hasEnvironment() ? "configured" : "none", config.extras());
        return new MarkerEvaluator(config);
    }
}
