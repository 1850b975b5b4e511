package com.fintech.timeseries.scheduling;

import com.fintech.timeseries.ingestion.CollectionResult;
import com.fintech.timeseries.ingestion.CollectionStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-source outcomes of one collection cycle.
 *
 * @param cycle Cycle number, starting at 1
 * @param startedAt When the cycle started
 * @param elapsed Wall time of the cycle
 * @param results Outcome per source id
 */
public record CycleSummary(
    long cycle,
    Instant startedAt,
    Duration elapsed,
    Map<String, CollectionResult> results
) {

    public CycleSummary {
        results = Map.copyOf(results);
    }

    public CollectionStatus statusOf(String sourceId) {
        CollectionResult result = results.get(sourceId);
        return result == null ? null : result.status();
    }

    public long failureCount() {
        return results.values().stream().filter(CollectionResult::isFailure).count();
    }

    public int totalAppended() {
        return results.values().stream().mapToInt(CollectionResult::appended).sum();
    }

    /** Single line form for the cycle log: {@code source=STATUS(+rows)}. */
    public String describe() {
        return results.values().stream()
            .sorted((a, b) -> a.sourceId().compareTo(b.sourceId()))
            .map(r -> r.sourceId() + "=" + r.status() + (r.appended() > 0 ? "(+" + r.appended() + ")" : ""))
            .collect(Collectors.joining(" "));
    }
}
