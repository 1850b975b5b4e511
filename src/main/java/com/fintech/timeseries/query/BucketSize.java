package com.fintech.timeseries.query;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Server-side time bucketing of aggregate results. A record belongs to the
 * bucket containing the start of the interval it describes.
 */
public enum BucketSize {

    NONE(null),
    HOURLY(ChronoUnit.HOURS),
    DAILY(ChronoUnit.DAYS);

    private final ChronoUnit unit;

    BucketSize(ChronoUnit unit) {
        this.unit = unit;
    }

    /** Start of the bucket containing {@code timestamp}, in epoch millis. */
    public long bucketStart(long timestamp, ZoneId zone) {
        if (unit == null) {
            throw new IllegalStateException("NONE has no buckets");
        }
        return Instant.ofEpochMilli(timestamp).atZone(zone).truncatedTo(unit).toInstant().toEpochMilli();
    }

    /** Exclusive end of the bucket starting at {@code bucketStart}. */
    public long bucketEnd(long bucketStart, ZoneId zone) {
        if (unit == null) {
            throw new IllegalStateException("NONE has no buckets");
        }
        ZonedDateTime start = Instant.ofEpochMilli(bucketStart).atZone(zone);
        return start.plus(1, unit).toInstant().toEpochMilli();
    }

    public static BucketSize parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unsupported bucket '" + value + "'. Allowed: none, hourly, daily", e);
        }
    }
}
