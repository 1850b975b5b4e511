package com.fintech.timeseries.domain;

import java.util.Locale;

/**
 * Sampling interval of a dataset. Both resolutions carry the same physical
 * quantity, an instantaneous rate, sampled at different intervals.
 *
 * Timestamps follow the interval-ending convention: a record stamped {@code t}
 * describes the interval {@code (t - interval, t]}.
 */
public enum Resolution {

    FINE(300_000L),
    COARSE(1_800_000L);

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final long milliseconds;

    Resolution(long milliseconds) {
        this.milliseconds = milliseconds;
    }

    /** Returns interval duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /** Returns interval duration in hours (1/12 for FINE, 0.5 for COARSE). */
    public double intervalHours() {
        return milliseconds / MILLIS_PER_HOUR;
    }

    /**
     * Converts an instantaneous rate sampled at this resolution into the
     * quantity delivered over one interval: {@code rate * intervalHours}.
     */
    public double toQuantity(double rate) {
        return rate * intervalHours();
    }

    /** Returns the exclusive start of the interval ending at {@code timestamp}. */
    public long intervalStart(long timestamp) {
        return timestamp - milliseconds;
    }

    /** Returns true if {@code timestamp} lies on an interval boundary. */
    public boolean isAligned(long timestamp) {
        return timestamp % milliseconds == 0;
    }

    /** Rounds {@code timestamp} down to an interval boundary. */
    public long alignDown(long timestamp) {
        return Math.floorDiv(timestamp, milliseconds) * milliseconds;
    }

    /** Number of intervals of this resolution inside one interval of {@code coarser}. */
    public int intervalsPer(Resolution coarser) {
        if (coarser.milliseconds % milliseconds != 0) {
            throw new IllegalArgumentException(coarser + " is not a multiple of " + this);
        }
        return (int) (coarser.milliseconds / milliseconds);
    }

    /** Directory-safe lower case name. */
    public String pathName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Resolution parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resolution cannot be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fine", "5m", "5min" -> FINE;
            case "coarse", "30m", "30min" -> COARSE;
            default -> throw new IllegalArgumentException(
                "Unsupported resolution '" + value + "'. Allowed: fine (5m), coarse (30m)");
        };
    }
}
