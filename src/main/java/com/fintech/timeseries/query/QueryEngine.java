package com.fintech.timeseries.query;

import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.storage.TimeSeriesStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * Resolution-aware grouped aggregation over one dataset.
 *
 * <p>Rows are scanned once, de-duplicated by {@code (timestamp, entity)}
 * keeping the last ingested, enriched through the dataset's dimension
 * table and folded into per-group accumulators. Each sample contributes
 * {@code rate * interval_hours} of quantity at its own resolution, so fine
 * and coarse data of the same rate produce the same totals.
 *
 * <p>Stateless apart from read-only scans; safe for concurrent callers.
 */
@Component
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private static final Comparator<GroupKey> ROW_ORDER = Comparator
        .comparing(GroupKey::bucket, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
        .thenComparing(GroupKey::values, QueryEngine::compareValues);

    private final TimeSeriesStore store;
    private final DimensionCatalog dimensions;
    private final ResolutionSelector selector;
    private final ZoneId bucketZone;
    private final long maxRangeMillis;
    private final MeterRegistry meterRegistry;

    public QueryEngine(
            TimeSeriesStore store,
            DimensionCatalog dimensions,
            TimeSeriesProperties properties,
            MeterRegistry meterRegistry) {
        TimeSeriesProperties.Query config = properties.getQuery();
        this.store = store;
        this.dimensions = dimensions;
        this.selector = new ResolutionSelector(store, config.getFineRangeThreshold());
        this.bucketZone = ZoneId.of(config.getBucketZone());
        this.maxRangeMillis = config.getMaxRange().toMillis();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Validates the range and resolves the resolution the query will read.
     *
     * @throws IllegalArgumentException for an oversized range, an unknown
     *         dataset name or a FINE override beyond the threshold
     */
    public Resolution selectResolution(AggregateQuery query) {
        if (query.rangeMillis() > maxRangeMillis) {
            throw new IllegalArgumentException("Range exceeds " + Duration.ofMillis(maxRangeMillis).toDays() + " days");
        }
        return selector.select(query);
    }

    public AggregateTable aggregate(AggregateQuery query) {
        return aggregate(query, selectResolution(query));
    }

    /**
     * Runs QueryAggregate at an already selected resolution. An empty range
     * or a range without data yields an empty table with the full schema.
     */
    public AggregateTable aggregate(AggregateQuery query, Resolution resolution) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            SeriesKey key = SeriesKey.of(query.source(), resolution);
            if (query.isEmptyRange()) {
                return AggregateTable.empty(resolution, query.groupBy(), query.bucket());
            }

            DimensionTable dimensionTable = dimensions.forDataset(query.source());

            // Keep-last de-duplication runs before filtering so a superseded row
            // can never pass a filter its replacement fails
            Map<RawRecord.SampleKey, RawRecord> latest = new LinkedHashMap<>();
            int scanned = 0;
            Iterator<RawRecord> rows = store.scanRange(key, query.start(), query.end(), null);
            while (rows.hasNext()) {
                RawRecord record = rows.next();
                latest.put(record.sampleKey(), record);
                scanned++;
            }
            if (scanned != latest.size()) {
                log.warn("Query on {} resolved {} duplicate samples (keep last)", key, scanned - latest.size());
            }

            Map<GroupKey, Accumulator> groups = new HashMap<>();
            for (RawRecord record : latest.values()) {
                if (!matches(record, query, dimensionTable)) {
                    continue;
                }
                Long bucket = query.bucket() == BucketSize.NONE
                    ? null
                    : query.bucket().bucketStart(resolution.intervalStart(record.timestamp()), bucketZone);
                List<String> values = new ArrayList<>(query.groupBy().size());
                for (String dimension : query.groupBy()) {
                    values.add(dimensionTable.resolve(record, dimension));
                }
                groups.computeIfAbsent(new GroupKey(bucket, values), k -> new Accumulator()).add(record, resolution);
            }

            List<AggregateRow> result = new ArrayList<>(groups.size());
            groups.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(ROW_ORDER))
                .forEach(entry -> result.add(toRow(query, resolution, entry.getKey(), entry.getValue())));

            log.debug("Aggregated {} samples of {} into {} rows", latest.size(), key, result.size());
            return new AggregateTable(resolution, AggregateTable.columnsFor(query.groupBy(), query.bucket()), result);
        } finally {
            sample.stop(meterRegistry.timer("timeseries.query.time", "resolution", resolution.pathName()));
        }
    }

    /** Span of stored data over all resolutions of a dataset. */
    public Optional<DateRange> getDateRange(String dataset) {
        Optional<DateRange> span = Optional.empty();
        for (Resolution resolution : Resolution.values()) {
            Optional<DateRange> range = store.getDateRange(SeriesKey.of(dataset, resolution));
            if (range.isPresent()) {
                span = Optional.of(span.map(existing -> existing.span(range.get())).orElse(range.get()));
            }
        }
        return span;
    }

    private AggregateRow toRow(AggregateQuery query, Resolution resolution, GroupKey key, Accumulator acc) {
        long spanStart;
        long spanEnd;
        boolean clipped = false;
        if (key.bucket() == null) {
            spanStart = query.start();
            spanEnd = query.end();
        } else {
            spanStart = key.bucket();
            spanEnd = query.bucket().bucketEnd(spanStart, bucketZone);
            clipped = spanStart < query.start() || spanEnd > query.end();
        }
        long covered = (long) acc.intervals.size() * resolution.toMillis();
        boolean partial = clipped || covered < spanEnd - spanStart;

        Map<String, String> groups = new LinkedHashMap<>();
        for (int i = 0; i < query.groupBy().size(); i++) {
            groups.put(query.groupBy().get(i), key.values().get(i));
        }
        return new AggregateRow(groups, key.bucket(), acc.net, acc.positive, acc.negative,
            acc.meanRate(), acc.count, partial);
    }

    private static boolean matches(RawRecord record, AggregateQuery query, DimensionTable dimensionTable) {
        for (Map.Entry<String, SortedSet<String>> filter : query.filters().entrySet()) {
            if (!filter.getValue().contains(dimensionTable.resolve(record, filter.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static int compareValues(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private record GroupKey(Long bucket, List<String> values) {
    }

    /** Running sums of one group. */
    private static final class Accumulator {
        private double net;
        private double positive;
        private double negative;
        private double rateHours;
        private double hours;
        private long count;
        private final Set<Long> intervals = new HashSet<>();

        void add(RawRecord record, Resolution resolution) {
            double quantity = resolution.toQuantity(record.value());
            net += quantity;
            if (quantity > 0) {
                positive += quantity;
            } else if (quantity < 0) {
                negative += quantity;
            }
            rateHours += record.value() * resolution.intervalHours();
            hours += resolution.intervalHours();
            count++;
            intervals.add(record.timestamp());
        }

        double meanRate() {
            return hours == 0 ? 0.0 : rateHours / hours;
        }
    }
}
