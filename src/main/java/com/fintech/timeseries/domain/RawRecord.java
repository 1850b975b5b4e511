package com.fintech.timeseries.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable sample of an instantaneous rate for one entity.
 * Once appended to a dataset a record is never mutated or removed.
 *
 * @param timestamp Interval-ending time (Unix epoch millis)
 * @param entityId Upstream identifier of the measured entity (unit, region, link)
 * @param value Instantaneous rate; may be negative for bidirectional quantities
 * @param attributes Source-specific fields carried alongside the sample
 */
public record RawRecord(
    long timestamp,
    String entityId,
    double value,
    Map<String, String> attributes
) {

    public RawRecord {
        Objects.requireNonNull(entityId, "Entity id cannot be null");
        if (entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Value must be finite for " + entityId + " at " + timestamp);
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static RawRecord of(long timestamp, String entityId, double value) {
        return new RawRecord(timestamp, entityId, value, Map.of());
    }

    /** Returns the attribute value or null. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /** Identity used for de-duplication: one sample per entity per interval. */
    public SampleKey sampleKey() {
        return new SampleKey(timestamp, entityId);
    }

    public record SampleKey(long timestamp, String entityId) {
    }
}
