package com.fintech.timeseries.config;

import com.fintech.timeseries.domain.Resolution;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the ingestion and query service.
 * Maps to 'timeseries.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "timeseries")
public class TimeSeriesProperties {

    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();
    private Retry retry = new Retry();
    private Query query = new Query();
    private Cache cache = new Cache();
    private List<SourceDefinition> sources = new ArrayList<>();

    @Data
    public static class Storage {
        private String baseDir = "data/timeseries";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofSeconds(10);
        private Duration taskTimeout = Duration.ofMinutes(2);
        private int workerThreads = 4;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Query {
        /** Ranges up to this length are served from the fine dataset. */
        private Duration fineRangeThreshold = Duration.ofDays(7);
        private Duration maxRange = Duration.ofDays(3650);
        /** Zone whose midnight starts a DAILY bucket. */
        private String bucketZone = "UTC";
        /** Dataset name to dimension file (classpath: or file: resource). */
        private Map<String, String> dimensionFiles = new LinkedHashMap<>();
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(300);
        private long maximumSize = 1_000L;
    }

    public enum SourceType {
        HTTP_DIRECTORY,
        LOCAL_DIRECTORY,
        ROLLUP
    }

    @Data
    public static class SourceDefinition {
        private String id;
        private String dataset;
        private Resolution resolution = Resolution.FINE;
        private SourceType type = SourceType.HTTP_DIRECTORY;

        /** Listing URL or directory path; unused for ROLLUP. */
        private String location;
        /** Batch file name regex; group 1 is the embedded sequence timestamp. */
        private String filePattern;

        // Row format
        private String recordType;
        private String timestampField = "SETTLEMENTDATE";
        private String entityField;
        private String valueField;
        private List<String> attributeFields = new ArrayList<>();
        private String timestampFormat = "yyyy/MM/dd HH:mm:ss";
        private String zone = "+10:00";

        // Rollup
        private String rollupOf;
        private Duration rollupLookback = Duration.ofDays(1);

        // HTTP
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);

        // Per-source overrides (null = use global)
        private Duration taskTimeout;
        private Retry retry;
    }
}
