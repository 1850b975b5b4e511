package com.fintech.timeseries.ingestion.source;

import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.ingestion.BatchRef;
import com.fintech.timeseries.ingestion.ParsedBatch;
import com.fintech.timeseries.ingestion.UpstreamSource;
import com.fintech.timeseries.storage.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives a coarse dataset from the fine dataset of the same quantity.
 *
 * <p>Offers at most one batch: every coarse window newer than the rollup's
 * own progress that is complete with respect to the newest fine sample. A
 * window is emitted per entity only when all of its fine intervals are
 * present; the coarse rate is the interval-weighted mean of the fine rates.
 */
public class RollupSource implements UpstreamSource {

    private static final Logger log = LoggerFactory.getLogger(RollupSource.class);

    private final TimeSeriesStore store;
    private final String sourceId;
    private final SeriesKey fine;
    private final SeriesKey target;
    private final long lookbackMillis;
    private final int intervalsPerWindow;

    private final AtomicLong incompleteWindows = new AtomicLong(0);

    public RollupSource(TimeSeriesStore store, String sourceId, SeriesKey fine, SeriesKey target, Duration lookback) {
        if (fine.resolution().toMillis() >= target.resolution().toMillis()) {
            throw new IllegalArgumentException("Rollup " + sourceId + " must go from a finer to a coarser resolution");
        }
        this.store = store;
        this.sourceId = sourceId;
        this.fine = fine;
        this.target = target;
        this.lookbackMillis = lookback.toMillis();
        this.intervalsPerWindow = fine.resolution().intervalsPer(target.resolution());
    }

    @Override
    public List<BatchRef> listAvailable() {
        OptionalLong fineLatest = store.latestTimestamp(fine);
        if (fineLatest.isEmpty()) {
            return List.of();
        }
        long completeEnd = target.resolution().alignDown(fineLatest.getAsLong());
        if (completeEnd <= progress(completeEnd)) {
            return List.of();
        }
        return List.of(new BatchRef("rollup-" + completeEnd, completeEnd, fine.toString()));
    }

    @Override
    public ParsedBatch fetch(BatchRef ref) {
        Resolution coarse = target.resolution();
        long end = ref.sequence();
        long start = progress(end);

        // window end -> entity -> fine samples keyed by timestamp (last one wins)
        Map<Long, Map<String, Map<Long, RawRecord>>> windows = new TreeMap<>();
        Iterator<RawRecord> scan = store.scanRange(fine, start, end, null);
        while (scan.hasNext()) {
            RawRecord record = scan.next();
            long windowEnd = coarse.alignDown(record.timestamp() - 1) + coarse.toMillis();
            windows.computeIfAbsent(windowEnd, k -> new TreeMap<>())
                .computeIfAbsent(record.entityId(), k -> new LinkedHashMap<>())
                .put(record.timestamp(), record);
        }

        List<RawRecord> records = new ArrayList<>();
        int candidates = 0;
        int incomplete = 0;
        double fineHours = fine.resolution().intervalHours();
        for (Map.Entry<Long, Map<String, Map<Long, RawRecord>>> window : windows.entrySet()) {
            for (Map.Entry<String, Map<Long, RawRecord>> entity : window.getValue().entrySet()) {
                candidates++;
                Map<Long, RawRecord> samples = entity.getValue();
                if (samples.size() < intervalsPerWindow) {
                    incomplete++;
                    continue;
                }
                double rateHours = 0.0;
                double hours = 0.0;
                RawRecord latest = null;
                for (RawRecord sample : samples.values()) {
                    rateHours += sample.value() * fineHours;
                    hours += fineHours;
                    if (latest == null || sample.timestamp() > latest.timestamp()) {
                        latest = sample;
                    }
                }
                records.add(new RawRecord(window.getKey(), entity.getKey(), rateHours / hours, latest.attributes()));
            }
        }

        if (incomplete > 0) {
            incompleteWindows.addAndGet(incomplete);
            log.warn("Rollup {} skipped {} incomplete windows in ({}, {}]", sourceId, incomplete, start, end);
        }
        log.debug("Rollup {} produced {} {} records from {}", sourceId, records.size(), target, fine);
        return new ParsedBatch(ref, records, candidates, 0);
    }

    @Override
    public String describe() {
        return fine + " -> " + target;
    }

    public long getIncompleteWindows() {
        return incompleteWindows.get();
    }

    /**
     * Exclusive start of the windows still to roll up: the rollup's own
     * progress, or the lookback horizon on first run.
     */
    private long progress(long completeEnd) {
        OptionalLong watermark = store.getWatermark(sourceId);
        OptionalLong stored = store.latestTimestamp(target);
        if (watermark.isEmpty() && stored.isEmpty()) {
            return target.resolution().alignDown(completeEnd - lookbackMillis);
        }
        return Math.max(watermark.orElse(Long.MIN_VALUE), stored.orElse(Long.MIN_VALUE));
    }
}
