package com.fintech.timeseries.query;

import com.fintech.timeseries.domain.DimensionRecord;
import com.fintech.timeseries.domain.RawRecord;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * In-memory {@code entity_id -> DimensionRecord} lookup. Rows are enriched
 * one at a time during aggregation; nothing is pre-joined.
 */
public class DimensionTable {

    public static final String UNKNOWN = "Unknown";
    public static final String ENTITY = "entity";
    public static final String CATEGORY = "category";

    private static final DimensionTable EMPTY = new DimensionTable(Map.of());

    private final Map<String, DimensionRecord> byEntity;

    private DimensionTable(Map<String, DimensionRecord> byEntity) {
        this.byEntity = byEntity;
    }

    public static DimensionTable empty() {
        return EMPTY;
    }

    public static DimensionTable of(Collection<DimensionRecord> records) {
        Map<String, DimensionRecord> byEntity = new HashMap<>();
        for (DimensionRecord record : records) {
            byEntity.put(record.entityId(), record);
        }
        return new DimensionTable(Map.copyOf(byEntity));
    }

    public int size() {
        return byEntity.size();
    }

    /**
     * Resolves a dimension for one row: {@code entity}, {@code category},
     * then a record attribute, then a dimension attribute. Anything missing
     * falls into {@link #UNKNOWN}.
     *
     * @param dimension Lower case dimension name
     */
    public String resolve(RawRecord record, String dimension) {
        if (ENTITY.equals(dimension)) {
            return record.entityId();
        }
        DimensionRecord reference = byEntity.get(record.entityId());
        if (CATEGORY.equals(dimension)) {
            return reference != null && reference.category() != null ? reference.category() : UNKNOWN;
        }
        String value = attribute(record.attributes(), dimension);
        if (value == null && reference != null) {
            value = attribute(reference.attributes(), dimension);
        }
        return value != null ? value : UNKNOWN;
    }

    private static String attribute(Map<String, String> attributes, String dimension) {
        if (attributes.isEmpty()) {
            return null;
        }
        String value = attributes.get(dimension);
        return value != null ? value : attributes.get(dimension.toUpperCase(Locale.ROOT));
    }
}
