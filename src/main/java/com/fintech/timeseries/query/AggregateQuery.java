package com.fintech.timeseries.query;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parameters of QueryAggregate over {@code (start, end]} of one dataset.
 * Dimension names are trimmed and lower-cased; filter values are trimmed
 * and kept sorted so that logically identical queries compare equal.
 *
 * @param source Dataset name
 * @param start Exclusive range start (epoch millis)
 * @param end Inclusive range end (epoch millis)
 * @param groupBy Dimensions to group by, in output column order
 * @param filters Dimension to the set of accepted values
 * @param bucket Time bucketing
 * @param resolution Requested resolution
 */
public record AggregateQuery(
    String source,
    long start,
    long end,
    List<String> groupBy,
    SortedMap<String, SortedSet<String>> filters,
    BucketSize bucket,
    ResolutionChoice resolution
) {

    public AggregateQuery {
        Objects.requireNonNull(source, "Source cannot be null");
        source = source.trim().toLowerCase(Locale.ROOT);
        if (source.isEmpty()) {
            throw new IllegalArgumentException("Source cannot be blank");
        }
        if (end < start) {
            throw new IllegalArgumentException("Range end must not be before start");
        }
        groupBy = normalizeGroupBy(groupBy);
        filters = normalizeFilters(filters);
        bucket = bucket == null ? BucketSize.NONE : bucket;
        resolution = resolution == null ? ResolutionChoice.AUTO : resolution;
    }

    public static AggregateQuery of(String source, long start, long end, List<String> groupBy) {
        return new AggregateQuery(source, start, end, groupBy, null, BucketSize.NONE, ResolutionChoice.AUTO);
    }

    public AggregateQuery withBucket(BucketSize bucket) {
        return new AggregateQuery(source, start, end, groupBy, filters, bucket, resolution);
    }

    public AggregateQuery withResolution(ResolutionChoice resolution) {
        return new AggregateQuery(source, start, end, groupBy, filters, bucket, resolution);
    }

    public AggregateQuery withFilter(String dimension, Set<String> values) {
        SortedMap<String, SortedSet<String>> copy = new TreeMap<>(filters);
        copy.put(dimension, new TreeSet<>(values));
        return new AggregateQuery(source, start, end, groupBy, copy, bucket, resolution);
    }

    public long rangeMillis() {
        return end - start;
    }

    public boolean isEmptyRange() {
        return end == start;
    }

    private static List<String> normalizeGroupBy(List<String> groupBy) {
        if (groupBy == null) {
            return List.of();
        }
        Set<String> dimensions = new LinkedHashSet<>();
        for (String dimension : groupBy) {
            if (dimension != null && !dimension.isBlank()) {
                dimensions.add(dimension.trim().toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(dimensions);
    }

    private static SortedMap<String, SortedSet<String>> normalizeFilters(Map<String, ? extends Set<String>> filters) {
        SortedMap<String, SortedSet<String>> normalized = new TreeMap<>();
        if (filters != null) {
            filters.forEach((dimension, values) -> {
                if (dimension == null || dimension.isBlank()) {
                    throw new IllegalArgumentException("Filter dimension cannot be blank");
                }
                SortedSet<String> accepted = new TreeSet<>();
                if (values != null) {
                    values.stream().filter(Objects::nonNull).map(String::trim).forEach(accepted::add);
                }
                if (accepted.isEmpty()) {
                    throw new IllegalArgumentException("Filter on '" + dimension + "' has no values");
                }
                normalized.merge(dimension.trim().toLowerCase(Locale.ROOT), accepted, (a, b) -> {
                    SortedSet<String> merged = new TreeSet<>(a);
                    merged.addAll(b);
                    return merged;
                });
            });
        }
        SortedMap<String, SortedSet<String>> frozen = new TreeMap<>();
        normalized.forEach((dimension, values) -> frozen.put(dimension, Collections.unmodifiableSortedSet(values)));
        return Collections.unmodifiableSortedMap(frozen);
    }
}
