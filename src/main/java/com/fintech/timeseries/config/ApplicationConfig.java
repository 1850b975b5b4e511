package com.fintech.timeseries.config;

import com.fintech.timeseries.cache.ResultCache;
import com.fintech.timeseries.ingestion.CollectorStatusRegistry;
import com.fintech.timeseries.ingestion.SourceCollectorFactory;
import com.fintech.timeseries.scheduling.CollectionScheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ForkJoinPool;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public ResultCache resultCache(TimeSeriesProperties properties, Ticker cacheTicker, MeterRegistry meterRegistry) {
        TimeSeriesProperties.Cache cache = properties.getCache();
        return new ResultCache(cache.getTtl(), cache.getMaximumSize(), cacheTicker,
            ForkJoinPool.commonPool(), meterRegistry);
    }

    @Bean
    public CollectionScheduler collectionScheduler(
            SourceCollectorFactory collectorFactory,
            TimeSeriesProperties properties,
            CollectorStatusRegistry statusRegistry,
            Clock clock,
            MeterRegistry meterRegistry) {
        return new CollectionScheduler(collectorFactory.createAll(), properties.getScheduler(),
            statusRegistry, clock, meterRegistry);
    }
}
