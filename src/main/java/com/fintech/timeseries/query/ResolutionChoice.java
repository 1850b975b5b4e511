package com.fintech.timeseries.query;

import java.util.Locale;

/**
 * Requested resolution of a query: chosen by range length, or an explicit
 * override.
 */
public enum ResolutionChoice {
    AUTO,
    FINE,
    COARSE;

    public static ResolutionChoice parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "fine", "5m", "5min" -> FINE;
            case "coarse", "30m", "30min" -> COARSE;
            default -> throw new IllegalArgumentException(
                "Unsupported resolution '" + value + "'. Allowed: auto, fine, coarse");
        };
    }
}
