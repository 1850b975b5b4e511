package com.fintech.timeseries;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Time-series Ingestion Service
 *
 * Collects incremental market-data batches from upstream publishers into
 * durable, resolution-partitioned storage and serves cached,
 * resolution-aware aggregate queries.
 *
 * Key Features:
 * - Concurrent collectors with per-source watermarks and idempotent merge
 * - Append-only segment store with atomic publish
 * - Fine/coarse resolution selection with quantity-consistent aggregation
 * - Caffeine result cache with fixed TTL and single flight
 * - Prometheus metrics via Actuator
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class TimeSeriesApplication {

    public static void main(String[] args) {
        SpringApplication.run(TimeSeriesApplication.class, args);
    }
}
