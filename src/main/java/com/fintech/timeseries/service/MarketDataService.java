package com.fintech.timeseries.service;

import com.fintech.timeseries.cache.CacheStatistics;
import com.fintech.timeseries.cache.QueryFingerprint;
import com.fintech.timeseries.cache.ResultCache;
import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.config.TimeSeriesProperties.SourceDefinition;
import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.ingestion.CollectorStatus;
import com.fintech.timeseries.ingestion.CollectorStatusRegistry;
import com.fintech.timeseries.query.AggregateQuery;
import com.fintech.timeseries.query.AggregateTable;
import com.fintech.timeseries.query.QueryEngine;
import com.fintech.timeseries.storage.TimeSeriesStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The three entry points offered to the presentation layer: QueryAggregate,
 * GetDateRange and GetStatus, plus explicit cache invalidation.
 *
 * Query results go through the {@link ResultCache}; the store scan behind a
 * cache miss runs under the "store" circuit breaker. Bad parameters surface
 * as {@link ValidationException}, infrastructure failures as
 * {@link ServiceException}. A failed query never populates the cache.
 */
@Service
public class MarketDataService {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final QueryEngine queryEngine;
    private final ResultCache resultCache;
    private final TimeSeriesStore store;
    private final CollectorStatusRegistry statusRegistry;
    private final TimeSeriesProperties properties;
    private final CircuitBreaker circuitBreaker;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);

    public MarketDataService(
            QueryEngine queryEngine,
            ResultCache resultCache,
            TimeSeriesStore store,
            CollectorStatusRegistry statusRegistry,
            TimeSeriesProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.queryEngine = queryEngine;
        this.resultCache = resultCache;
        this.store = store;
        this.statusRegistry = statusRegistry;
        this.properties = properties;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker("store");

        meterRegistry.gauge("timeseries.service.validation.errors", validationErrors);
        meterRegistry.gauge("timeseries.service.errors", serviceErrors);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * QueryAggregate with caching and single flight.
     *
     * @throws ValidationException if the query is invalid
     * @throws ServiceException if the store cannot be read
     */
    public AggregateTable queryAggregate(AggregateQuery query) {
        Resolution resolution;
        try {
            resolution = queryEngine.selectResolution(query);
        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());
        }

        QueryFingerprint fingerprint = QueryFingerprint.of(query, resolution);
        try {
            return resultCache.get(fingerprint,
                () -> circuitBreaker.executeSupplier(() -> queryEngine.aggregate(query, resolution)));

        } catch (CallNotPermittedException e) {
            log.error("Circuit breaker OPEN - rejecting query on {}", query.source());
            throw new ServiceException("Store circuit breaker is open. System is recovering from errors.", e);

        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());

        } catch (RuntimeException e) {
            serviceErrors.incrementAndGet();
            log.error("Query failed: source={}, range=({}, {}], resolution={}",
                query.source(), query.start(), query.end(), resolution, e);
            throw new ServiceException("Failed to aggregate " + query.source(), e);
        }
    }

    /**
     * GetDateRange: span of stored data over all resolutions of a dataset.
     *
     * @throws ValidationException if the dataset name is invalid
     */
    public Optional<DateRange> getDateRange(String source) {
        if (source == null || source.isBlank()) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Source cannot be null or blank");
        }
        try {
            return queryEngine.getDateRange(source.trim());
        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());
        }
    }

    /**
     * GetStatus: every configured source, including those that have not
     * run yet. Watermarks are read from the store.
     */
    public ServiceStatus getStatus() {
        List<SourceStatus> sources = new ArrayList<>();
        for (SourceDefinition definition : properties.getSources()) {
            String id = definition.getId();
            OptionalLong watermark = store.getWatermark(id);
            Optional<CollectorStatus> status = statusRegistry.get(id);
            sources.add(new SourceStatus(
                id,
                definition.getDataset(),
                definition.getResolution().pathName(),
                watermark.isPresent() ? watermark.getAsLong() : null,
                status.map(CollectorStatus::lastAttempt).orElse(null),
                status.map(CollectorStatus::lastSuccess).orElse(null),
                status.map(CollectorStatus::lastOutcome).orElse(null),
                status.map(CollectorStatus::lastMessage).orElse(null),
                status.map(CollectorStatus::errorCount).orElse(0L),
                status.map(CollectorStatus::consecutiveFailures).orElse(0),
                status.map(CollectorStatus::totalAppended).orElse(0L)));
        }
        return new ServiceStatus(store.isHealthy(), getCircuitBreakerState(), sources, resultCache.statistics());
    }

    /**
     * Drops cached results of one dataset, or all when source is null.
     *
     * @return Number of entries removed, -1 when everything was cleared
     */
    public int invalidateCache(String source) {
        if (source == null || source.isBlank()) {
            resultCache.invalidateAll();
            return -1;
        }
        return resultCache.invalidateSource(source.trim().toLowerCase(Locale.ROOT));
    }

    public CacheStatistics getCacheStatistics() {
        return resultCache.statistics();
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Invalid query parameters.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps store and infrastructure errors).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
