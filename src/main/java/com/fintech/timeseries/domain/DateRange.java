package com.fintech.timeseries.domain;

/**
 * Inclusive span of stored timestamps.
 *
 * @param start Earliest stored timestamp (epoch millis)
 * @param end Latest stored timestamp (epoch millis)
 */
public record DateRange(long start, long end) {

    public DateRange {
        if (end < start) {
            throw new IllegalArgumentException("End (" + end + ") cannot precede start (" + start + ")");
        }
    }

    /** Returns the smallest range covering both. */
    public DateRange span(DateRange other) {
        return new DateRange(Math.min(start, other.start), Math.max(end, other.end));
    }
}
