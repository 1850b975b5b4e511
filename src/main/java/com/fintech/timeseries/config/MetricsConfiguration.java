package com.fintech.timeseries.config;

import com.fintech.timeseries.storage.SegmentFileTimeSeriesStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Common tags, timer percentiles and store gauges.
 *
 * Collector runs take seconds and queries milliseconds, so the SLO buckets
 * span 1 ms to 2 min.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> {
            registry.config().commonTags(
                "application", "timeseries-ingestion-service",
                "environment", getEnvironment()
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith("timeseries.")) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        .serviceLevelObjectives(
                            Duration.ofMillis(1).toNanos(),
                            Duration.ofMillis(10).toNanos(),
                            Duration.ofMillis(100).toNanos(),
                            Duration.ofSeconds(1).toNanos(),
                            Duration.ofSeconds(10).toNanos(),
                            Duration.ofMinutes(2).toNanos()
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofMinutes(5))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }

    @Bean
    public MeterBinder storeMetrics(SegmentFileTimeSeriesStore store) {
        return registry -> {
            Gauge.builder("timeseries.store.segments.written", store, SegmentFileTimeSeriesStore::getSegmentsWritten)
                .description("Segments appended since startup")
                .register(registry);
            Gauge.builder("timeseries.store.records.written", store, SegmentFileTimeSeriesStore::getRecordsWritten)
                .description("Records appended since startup")
                .register(registry);
            Gauge.builder("timeseries.store.scans", store, SegmentFileTimeSeriesStore::getScans)
                .description("Range scans served since startup")
                .register(registry);
            Gauge.builder("timeseries.store.records", store, SegmentFileTimeSeriesStore::getStoredRecords)
                .description("Records held across all partitions")
                .register(registry);
        };
    }

    private String getEnvironment() {
        String env = System.getenv("SPRING_PROFILES_ACTIVE");
        return env != null ? env : "local";
    }
}
