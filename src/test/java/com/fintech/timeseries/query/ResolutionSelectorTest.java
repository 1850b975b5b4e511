package com.fintech.timeseries.query;

import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.storage.TimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ResolutionSelector Tests")
class ResolutionSelectorTest {

    private static final long DAY = 86_400_000L;

    private TimeSeriesStore store;
    private ResolutionSelector selector;

    @BeforeEach
    void setUp() {
        store = mock(TimeSeriesStore.class);
        when(store.getDateRange(SeriesKey.of("generation", Resolution.FINE)))
            .thenReturn(Optional.of(new DateRange(0, 30 * DAY)));
        when(store.getDateRange(SeriesKey.of("generation", Resolution.COARSE)))
            .thenReturn(Optional.of(new DateRange(0, 30 * DAY)));
        selector = new ResolutionSelector(store, Duration.ofDays(7));
    }

    @Test
    @DisplayName("Short ranges read fine data when it exists")
    void testAutoShortRange() {
        assertThat(selector.select(AggregateQuery.of("generation", 0, DAY, List.of())))
            .isEqualTo(Resolution.FINE);
        assertThat(selector.select(AggregateQuery.of("generation", 0, 7 * DAY, List.of())))
            .isEqualTo(Resolution.FINE);
    }

    @Test
    @DisplayName("Long ranges always read coarse data")
    void testAutoLongRange() {
        assertThat(selector.select(AggregateQuery.of("generation", 0, 7 * DAY + 1, List.of())))
            .isEqualTo(Resolution.COARSE);
    }

    @Test
    @DisplayName("Long ranges over a dataset with only fine data are rejected")
    void testAutoLongRangeWithoutCoarseData() {
        when(store.getDateRange(SeriesKey.of("transmission", Resolution.FINE)))
            .thenReturn(Optional.of(new DateRange(0, 8 * DAY)));

        assertThat(selector.select(AggregateQuery.of("transmission", 0, DAY, List.of())))
            .isEqualTo(Resolution.FINE);
        assertThatThrownBy(() -> selector.select(AggregateQuery.of("transmission", 0, 8 * DAY, List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No coarse data for 'transmission'");
    }

    @Test
    @DisplayName("Long ranges read coarse data once a rollup has written it")
    void testAutoLongRangeWithCoarseData() {
        when(store.getDateRange(SeriesKey.of("transmission", Resolution.FINE)))
            .thenReturn(Optional.of(new DateRange(0, 8 * DAY)));
        when(store.getDateRange(SeriesKey.of("transmission", Resolution.COARSE)))
            .thenReturn(Optional.of(new DateRange(0, 8 * DAY)));

        assertThat(selector.select(AggregateQuery.of("transmission", 0, 8 * DAY, List.of())))
            .isEqualTo(Resolution.COARSE);
    }

    @Test
    @DisplayName("Short ranges fall back to coarse when the dataset has no fine data")
    void testAutoWithoutFineData() {
        assertThat(selector.select(AggregateQuery.of("rooftop", 0, DAY, List.of())))
            .isEqualTo(Resolution.COARSE);
    }

    @Test
    @DisplayName("Explicit overrides are honoured within limits")
    void testOverrides() {
        AggregateQuery shortRange = AggregateQuery.of("generation", 0, DAY, List.of());
        AggregateQuery longRange = AggregateQuery.of("generation", 0, 30 * DAY, List.of());

        assertThat(selector.select(shortRange.withResolution(ResolutionChoice.COARSE))).isEqualTo(Resolution.COARSE);
        assertThat(selector.select(shortRange.withResolution(ResolutionChoice.FINE))).isEqualTo(Resolution.FINE);
        assertThatThrownBy(() -> selector.select(longRange.withResolution(ResolutionChoice.FINE)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("7 days");
    }
}
