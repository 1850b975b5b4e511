package com.fintech.timeseries.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifies one dataset partition: a (dataset, resolution) pair.
 * Natural ordering is dataset, then resolution.
 */
public record SeriesKey(
    String dataset,
    Resolution resolution
) implements Comparable<SeriesKey> {

    private static final Pattern VALID_DATASET = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,63}$");

    public SeriesKey {
        Objects.requireNonNull(dataset, "Dataset cannot be null");
        Objects.requireNonNull(resolution, "Resolution cannot be null");
        if (!VALID_DATASET.matcher(dataset).matches()) {
            throw new IllegalArgumentException(
                "Dataset must be lower case alphanumeric, '-' or '_' (max 64 chars): " + dataset);
        }
    }

    public static SeriesKey of(String dataset, Resolution resolution) {
        return new SeriesKey(dataset, resolution);
    }

    @Override
    public int compareTo(SeriesKey other) {
        int datasetCompare = this.dataset.compareTo(other.dataset);
        if (datasetCompare != 0) {
            return datasetCompare;
        }
        return this.resolution.compareTo(other.resolution);
    }

    @Override
    public String toString() {
        return dataset + "/" + resolution.pathName();
    }
}
