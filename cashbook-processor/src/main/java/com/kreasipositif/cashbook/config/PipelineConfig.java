package com.kreasipositif.cashbook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the ingestion pipeline.
 */
@Configuration
public class PipelineConfig {

    /** Source of "today" for the opening entry and the current-year date fallback. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
