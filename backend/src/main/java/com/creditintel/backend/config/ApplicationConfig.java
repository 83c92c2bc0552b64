package com.creditintel.backend.config;

import com.creditintel.backend.pipeline.FeatureCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans shared by the pipeline.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureCatalog featureCatalog(FeatureCatalogProperties properties) {
        return new FeatureCatalog(properties.toDefinitions());
    }
}
