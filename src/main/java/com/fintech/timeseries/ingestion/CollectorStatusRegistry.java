package com.fintech.timeseries.ingestion;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest {@link CollectorStatus} of every source.
 */
@Component
public class CollectorStatusRegistry {

    private final Map<String, CollectorStatus> statuses = new ConcurrentHashMap<>();
    private final Clock clock;

    public CollectorStatusRegistry(Clock clock) {
        this.clock = clock;
    }

    public void record(CollectionResult result) {
        statuses.compute(result.sourceId(), (id, current) ->
            (current == null ? CollectorStatus.initial(id) : current).after(result, clock.instant()));
    }

    public Optional<CollectorStatus> get(String sourceId) {
        return Optional.ofNullable(statuses.get(sourceId));
    }

    /** Returns all statuses sorted by source id. */
    public Map<String, CollectorStatus> snapshot() {
        return new TreeMap<>(statuses);
    }
}
