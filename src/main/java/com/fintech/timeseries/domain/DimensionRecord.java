package com.fintech.timeseries.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Reference data for one entity, e.g. a generating unit and its fuel type.
 *
 * @param entityId Upstream entity identifier
 * @param category Categorical label used for grouping (fuel, technology)
 * @param attributes Other static attributes (region, owner, capacity)
 */
public record DimensionRecord(
    String entityId,
    String category,
    Map<String, String> attributes
) {

    public DimensionRecord {
        Objects.requireNonNull(entityId, "Entity id cannot be null");
        category = category == null || category.isBlank() ? null : category.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
