package com.mirrorgroups.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration Properties Enablement
 *
 * <p>Binds {@link GroupInsightsProperties} (insights.*) with validation and exposes
 * the shared {@link Clock} used for cache ages, retry scheduling and job timestamps.
 *
 * @author MirrorGroups Insights Team
 * @since 1.0.0
 * @version 1.0
 */
@Configuration
@EnableConfigurationProperties(GroupInsightsProperties.class)
@Slf4j
public class ConfigurationPropertiesConfig {

    public ConfigurationPropertiesConfig() {
        log.info("Initializing Group Insights Service Configuration Properties");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
