package com.fintech.timeseries.ingestion;

import java.util.Comparator;
import java.util.Objects;

/**
 * Reference to one batch offered by an upstream source.
 *
 * @param name Batch name as published upstream (e.g. file name)
 * @param sequence Sequence embedded in the name, usually a timestamp; higher is newer
 * @param location Where to fetch the batch from (URL, path)
 */
public record BatchRef(
    String name,
    long sequence,
    String location
) {

    /** Orders by sequence, then name. */
    public static final Comparator<BatchRef> NEWEST_LAST =
        Comparator.comparingLong(BatchRef::sequence).thenComparing(BatchRef::name);

    public BatchRef {
        Objects.requireNonNull(name, "Batch name cannot be null");
        Objects.requireNonNull(location, "Batch location cannot be null");
    }
}
