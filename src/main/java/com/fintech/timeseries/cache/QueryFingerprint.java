package com.fintech.timeseries.cache;

import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.query.AggregateQuery;
import com.fintech.timeseries.query.BucketSize;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Cache key of an aggregate query. Built from the normalized query and the
 * resolution actually read, so AUTO and an explicit choice of the same
 * resolution share one entry.
 */
public record QueryFingerprint(
    String source,
    long start,
    long end,
    Resolution resolution,
    BucketSize bucket,
    List<String> groupBy,
    SortedMap<String, SortedSet<String>> filters
) {

    public static QueryFingerprint of(AggregateQuery query, Resolution resolution) {
        return new QueryFingerprint(query.source(), query.start(), query.end(), resolution,
            query.bucket(), query.groupBy(), query.filters());
    }
}
