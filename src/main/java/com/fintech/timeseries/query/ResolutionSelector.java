package com.fintech.timeseries.query;

import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.storage.TimeSeriesStore;

import java.time.Duration;

/**
 * Picks the dataset resolution of a query. Fine data is read only for
 * ranges up to the threshold; longer ranges always read the coarse dataset.
 * A long range over a dataset that only has fine data is rejected rather
 * than answered with an empty table.
 */
public class ResolutionSelector {

    private final TimeSeriesStore store;
    private final long fineRangeThresholdMillis;

    public ResolutionSelector(TimeSeriesStore store, Duration fineRangeThreshold) {
        this.store = store;
        this.fineRangeThresholdMillis = fineRangeThreshold.toMillis();
    }

    /**
     * @throws IllegalArgumentException if FINE is requested beyond the threshold,
     *         or an automatic long-range query finds fine data but no coarse data
     */
    public Resolution select(AggregateQuery query) {
        boolean shortRange = query.rangeMillis() <= fineRangeThresholdMillis;
        switch (query.resolution()) {
            case FINE:
                if (!shortRange) {
                    throw new IllegalArgumentException("Fine resolution is limited to ranges of "
                        + thresholdDays() + " days; use coarse or a bucket");
                }
                return Resolution.FINE;
            case COARSE:
                return Resolution.COARSE;
            default:
                boolean hasFine = hasData(query.source(), Resolution.FINE);
                if (shortRange && hasFine) {
                    return Resolution.FINE;
                }
                if (hasFine && !hasData(query.source(), Resolution.COARSE)) {
                    throw new IllegalArgumentException("No coarse data for '" + query.source()
                        + "'; ranges over " + thresholdDays() + " days need a coarse rollup of the fine data");
                }
                return Resolution.COARSE;
        }
    }

    private long thresholdDays() {
        return Duration.ofMillis(fineRangeThresholdMillis).toDays();
    }

    private boolean hasData(String dataset, Resolution resolution) {
        return store.getDateRange(SeriesKey.of(dataset, resolution)).isPresent();
    }
}
