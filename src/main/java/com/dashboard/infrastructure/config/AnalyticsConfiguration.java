package com.dashboard.infrastructure.config;

import com.dashboard.domain.source.DataSource;
import com.dashboard.infrastructure.cache.DatasetCache;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class AnalyticsConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * One cache per application context. Slots are emptied when the context closes.
     */
    @Bean(destroyMethod = "invalidateAll")
    public DatasetCache datasetCache(DataSource dataSource,
                                     Clock clock,
                                     MeterRegistry meterRegistry,
                                     @Value("${app.cache.ttl-seconds:600}") long ttlSeconds) {
        log.info("Dataset cache TTL: {}s, source: {}", ttlSeconds, dataSource.getClass().getSimpleName());
        return new DatasetCache(dataSource, clock, Duration.ofSeconds(ttlSeconds), meterRegistry);
    }
}
