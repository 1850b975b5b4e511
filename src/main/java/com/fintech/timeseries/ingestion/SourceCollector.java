package com.fintech.timeseries.ingestion;

import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.storage.StoreWriteException;
import com.fintech.timeseries.storage.TimeSeriesStore;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Incremental collector for one upstream source writing to one dataset
 * partition.
 *
 * <p>A run fetches the newest upstream batch, compares it with the source
 * watermark and merges only rows strictly newer than it. Rows are appended
 * before the watermark advances, so a failure at any point leaves the
 * watermark at or below what is durably stored and the next run re-merges
 * without duplicating rows.
 */
public class SourceCollector {

    private static final Logger log = LoggerFactory.getLogger(SourceCollector.class);

    private final String sourceId;
    private final SeriesKey target;
    private final UpstreamSource source;
    private final TimeSeriesStore store;
    private final Retry retry;
    private final Duration taskTimeout;
    private final MeterRegistry meterRegistry;

    private final AtomicLong rowsAppended = new AtomicLong(0);
    private final AtomicLong parseFailures = new AtomicLong(0);
    private final AtomicLong batchesRejected = new AtomicLong(0);

    public SourceCollector(
            String sourceId,
            SeriesKey target,
            UpstreamSource source,
            TimeSeriesStore store,
            RetryPolicy retryPolicy,
            Duration taskTimeout,
            MeterRegistry meterRegistry) {
        this.sourceId = sourceId;
        this.target = target;
        this.source = source;
        this.store = store;
        this.retry = retryPolicy.newRetry(sourceId);
        this.taskTimeout = taskTimeout;
        this.meterRegistry = meterRegistry;

        Tags tags = Tags.of("source", sourceId);
        meterRegistry.gauge("timeseries.collector.rows.appended", tags, rowsAppended);
        meterRegistry.gauge("timeseries.collector.rows.unparseable", tags, parseFailures);
        meterRegistry.gauge("timeseries.collector.batches.rejected", tags, batchesRejected);
    }

    public String getSourceId() {
        return sourceId;
    }

    public SeriesKey getTarget() {
        return target;
    }

    /** Per-task deadline; null means the scheduler default applies. */
    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    public String describe() {
        return source.describe();
    }

    /**
     * Runs one incremental collection. Never throws for upstream, batch or
     * store failures; they are reported in the result.
     */
    public CollectionResult run() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            Optional<ParsedBatch> latest = fetchLatest();
            if (latest.isEmpty()) {
                log.info("Source {} offers no batches", sourceId);
                return CollectionResult.noNewData(sourceId, 0, currentWatermark());
            }

            ParsedBatch batch = latest.get();
            parseFailures.addAndGet(batch.parseFailures());
            if (!isNew(batch)) {
                log.debug("Source {} up to date at batch {}", sourceId, batch.ref().name());
                return CollectionResult.noNewData(sourceId, batch.parseFailures(), currentWatermark());
            }

            if (Thread.currentThread().isInterrupted()) {
                return CollectionResult.failure(sourceId, CollectionStatus.TIMED_OUT, "Cancelled before merge");
            }

            MergeResult merged = merge(batch);
            log.info("Source {} merged {} rows from {} (watermark={}, skipped rows={})",
                sourceId, merged.appended(), batch.ref().name(), merged.watermark(), batch.parseFailures());
            return merged.appended() == 0
                ? CollectionResult.noNewData(sourceId, batch.parseFailures(), merged.watermark())
                : CollectionResult.success(sourceId, merged.appended(), batch.parseFailures(), merged.watermark());

        } catch (BatchValidationException e) {
            batchesRejected.incrementAndGet();
            log.error("Source {} batch rejected: {}", sourceId, e.getMessage());
            return CollectionResult.failure(sourceId, CollectionStatus.REJECTED, e.getMessage());
        } catch (TransientFetchException e) {
            log.error("Source {} fetch failed after {} attempts: {}",
                sourceId, retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, e.getMessage());
        } catch (IngestionException e) {
            log.error("Source {} fetch failed: {}", sourceId, e.getMessage());
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, e.getMessage());
        } catch (StoreWriteException e) {
            log.error("Source {} merge failed, watermark unchanged: {}", sourceId, e.getMessage(), e);
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Source {} failed unexpectedly", sourceId, e);
            return CollectionResult.failure(sourceId, CollectionStatus.FAILED, e.toString());
        } finally {
            sample.stop(meterRegistry.timer("timeseries.collector.run.time", "source", sourceId));
        }
    }

    /**
     * Lists upstream and fetches the batch with the highest sequence,
     * retrying transient failures with backoff.
     *
     * @return The newest batch, empty if upstream offers none
     */
    public Optional<ParsedBatch> fetchLatest() {
        return Retry.decorateSupplier(retry, () -> source.latest().map(source::fetch)).get();
    }

    /** True if the batch holds at least one row newer than the watermark. */
    public boolean isNew(ParsedBatch batch) {
        OptionalLong newest = batch.maxTimestamp();
        if (newest.isEmpty()) {
            return false;
        }
        OptionalLong floor = storedFloor();
        return floor.isEmpty() || newest.getAsLong() > floor.getAsLong();
    }

    /**
     * Appends the rows of the batch strictly newer than the watermark, then
     * advances the watermark to the newest appended row. Duplicates of
     * {@code (timestamp, entity)} within the batch keep the last occurrence.
     *
     * @throws StoreWriteException if the append fails; the watermark is unchanged
     */
    public MergeResult merge(ParsedBatch batch) {
        OptionalLong floor = reconcileWatermark();

        Map<RawRecord.SampleKey, RawRecord> accepted = new LinkedHashMap<>();
        for (RawRecord record : batch.records()) {
            if (floor.isPresent() && record.timestamp() <= floor.getAsLong()) {
                continue;
            }
            accepted.remove(record.sampleKey());
            accepted.put(record.sampleKey(), record);
        }
        if (accepted.isEmpty()) {
            return new MergeResult(0, floor.isPresent() ? floor.getAsLong() : null);
        }

        List<RawRecord> rows = new ArrayList<>(accepted.values());
        long newest = rows.stream().mapToLong(RawRecord::timestamp).max().getAsLong();

        store.append(target, rows);
        long watermark = store.advanceWatermark(sourceId, newest);

        rowsAppended.addAndGet(rows.size());
        return new MergeResult(rows.size(), watermark);
    }

    /**
     * Brings a watermark that lags the partition up to the newest stored row.
     * Happens when a previous run appended but crashed before advancing.
     */
    private OptionalLong reconcileWatermark() {
        OptionalLong watermark = store.getWatermark(sourceId);
        OptionalLong stored = store.latestTimestamp(target);
        if (stored.isPresent() && (watermark.isEmpty() || stored.getAsLong() > watermark.getAsLong())) {
            log.warn("Source {} watermark {} lags stored data in {} at {}; reconciling",
                sourceId, watermark.isPresent() ? watermark.getAsLong() : "none", target, stored.getAsLong());
            return OptionalLong.of(store.advanceWatermark(sourceId, stored.getAsLong()));
        }
        return watermark;
    }

    private OptionalLong storedFloor() {
        OptionalLong watermark = store.getWatermark(sourceId);
        OptionalLong stored = store.latestTimestamp(target);
        if (watermark.isEmpty()) {
            return stored;
        }
        if (stored.isEmpty()) {
            return watermark;
        }
        return OptionalLong.of(Math.max(watermark.getAsLong(), stored.getAsLong()));
    }

    private Long currentWatermark() {
        OptionalLong watermark = store.getWatermark(sourceId);
        return watermark.isPresent() ? watermark.getAsLong() : null;
    }
}
