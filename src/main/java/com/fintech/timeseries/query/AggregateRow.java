package com.fintech.timeseries.query;

import java.util.Map;

/**
 * One group (and bucket) of an aggregate result. Quantities are
 * {@code rate * interval_hours} summed over the group's samples.
 *
 * @param groups Group-by dimension to value, in group-by order
 * @param bucketStart Bucket start (epoch millis), null when not bucketed
 * @param netQuantity Sum of all quantities
 * @param positiveQuantity Sum of positive quantities only
 * @param negativeQuantity Sum of negative quantities only
 * @param meanRate Interval-weighted mean rate
 * @param sampleCount Number of samples aggregated
 * @param partial True if the samples do not cover the whole bucket
 */
public record AggregateRow(
    Map<String, String> groups,
    Long bucketStart,
    double netQuantity,
    double positiveQuantity,
    double negativeQuantity,
    double meanRate,
    long sampleCount,
    boolean partial
) {

    public String group(String dimension) {
        return groups.get(dimension);
    }
}
