package com.fintech.timeseries.storage;

import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.SeriesKey;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Durable, append-only, resolution-partitioned time-series storage with
 * per-source watermark tracking.
 * Abstracts the underlying storage mechanism so collectors and the query
 * engine do not depend on the on-disk layout.
 */
public interface TimeSeriesStore {

    /**
     * Appends a batch to a dataset partition as one new immutable segment.
     * Atomic from a reader's perspective: a concurrent scan observes either
     * none or all of the batch.
     *
     * @param key The dataset partition
     * @param records Records to append, in ingestion order
     * @throws StoreWriteException if the segment could not be made durable
     */
    void append(SeriesKey key, List<RawRecord> records);

    /**
     * Scans records with {@code start < timestamp <= end} (interval-ending
     * convention) in ingestion order.
     *
     * @param key The dataset partition
     * @param start Exclusive lower bound (epoch millis)
     * @param end Inclusive upper bound (epoch millis)
     * @param filter Additional row predicate
     * @return Iterator over a consistent snapshot of the partition
     */
    Iterator<RawRecord> scanRange(SeriesKey key, long start, long end, Predicate<RawRecord> filter);

    /**
     * Returns the latest timestamp durably merged for a source, empty if the
     * source has never merged anything.
     */
    OptionalLong getWatermark(String sourceId);

    /**
     * Durably advances the watermark of a source. Never lowers it.
     *
     * @return The watermark in effect after the call
     * @throws StoreWriteException if the new value could not be persisted
     */
    long advanceWatermark(String sourceId, long timestamp);

    /** Returns the span of stored timestamps in a partition. */
    Optional<DateRange> getDateRange(SeriesKey key);

    /** Returns all partitions holding at least one segment. */
    Set<SeriesKey> partitions();

    /** Returns the number of records stored in a partition. */
    long count(SeriesKey key);

    /** Checks if the store is ready to serve requests. */
    boolean isHealthy();

    /** Convenience for {@code getDateRange(key).map(DateRange::end)}. */
    default OptionalLong latestTimestamp(SeriesKey key) {
        return getDateRange(key)
            .map(range -> OptionalLong.of(range.end()))
            .orElse(OptionalLong.empty());
    }
}
