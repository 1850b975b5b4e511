package com.fintech.timeseries.api;

import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.storage.TimeSeriesStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
    "timeseries.scheduler.enabled=false",
    "spring.jmx.enabled=false",
    "timeseries.storage.base-dir=target/test-store-${random.uuid}"
})
@DisplayName("MarketDataController Integration Tests")
class MarketDataControllerTest {

    private static final long BASE = 1_733_752_800_000L;
    private static final long FIVE_MIN = Resolution.FINE.toMillis();
    private static final long HOUR = 3_600_000L;
    private static final long DAY = 86_400_000L;
    private static final SeriesKey GENERATION = SeriesKey.of("generation", Resolution.FINE);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TimeSeriesStore store;

    // The store persists across tests in this class, so each test writes its own time window

    @Test
    @DisplayName("Should aggregate by category with signed quantities")
    void testAggregateByCategory() throws Exception {
        long window = BASE;
        store.append(GENERATION, List.of(
            RawRecord.of(window + FIVE_MIN, "BAYSW1", 120.0),
            RawRecord.of(window + FIVE_MIN, "HPRG1", -60.0)));

        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", String.valueOf(window / 1000))
                .param("to", String.valueOf((window + FIVE_MIN) / 1000))
                .param("groupBy", "category"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.resolution").value("fine"))
            .andExpect(jsonPath("$.columns[0]").value("category"))
            .andExpect(jsonPath("$.rows", hasSize(2)))
            .andExpect(jsonPath("$.rows[0].category").value("Battery"))
            .andExpect(jsonPath("$.rows[0].net_quantity").value(-5.0))
            .andExpect(jsonPath("$.rows[0].negative_quantity").value(-5.0))
            .andExpect(jsonPath("$.rows[1].category").value("Coal"))
            .andExpect(jsonPath("$.rows[1].positive_quantity").value(10.0))
            .andExpect(jsonPath("$.rows[1].partial").value(false));
    }

    @Test
    @DisplayName("Should return hourly buckets in Unix seconds")
    void testHourlyBuckets() throws Exception {
        long window = BASE + 10 * DAY;
        store.append(GENERATION, List.of(
            RawRecord.of(window + FIVE_MIN, "BAYSW1", 120.0),
            RawRecord.of(window + HOUR + FIVE_MIN, "BAYSW1", 240.0)));

        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", String.valueOf(window / 1000))
                .param("to", String.valueOf((window + 2 * HOUR) / 1000))
                .param("groupBy", "category")
                .param("bucket", "hourly"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.columns", hasItem("bucket_start")))
            .andExpect(jsonPath("$.rows", hasSize(2)))
            .andExpect(jsonPath("$.rows[0].bucket_start").value(window / 1000))
            .andExpect(jsonPath("$.rows[1].bucket_start").value((window + HOUR) / 1000))
            .andExpect(jsonPath("$.rows[1].net_quantity").value(20.0))
            .andExpect(jsonPath("$.rows[1].partial").value(true));
    }

    @Test
    @DisplayName("Should apply dimension filters")
    void testFilter() throws Exception {
        long window = BASE + 20 * DAY;
        store.append(GENERATION, List.of(
            RawRecord.of(window + FIVE_MIN, "BAYSW1", 120.0),
            RawRecord.of(window + FIVE_MIN, "HPRG1", -60.0)));

        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", String.valueOf(window / 1000))
                .param("to", String.valueOf((window + FIVE_MIN) / 1000))
                .param("filter", "region:SA1|TAS1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows", hasSize(1)))
            .andExpect(jsonPath("$.rows[0].net_quantity").value(-5.0))
            .andExpect(jsonPath("$.rows[0].sample_count").value(1));
    }

    @Test
    @DisplayName("Should return the full schema for an empty range")
    void testEmptyRange() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", String.valueOf(BASE / 1000))
                .param("to", String.valueOf(BASE / 1000))
                .param("groupBy", "category"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rows", hasSize(0)))
            .andExpect(jsonPath("$.columns", hasSize(7)));
    }

    @Test
    @DisplayName("Should return 400 when from is after to")
    void testInvertedRange() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", "2000")
                .param("to", "1000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Should return 400 for a missing source")
    void testMissingSource() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("from", "1000")
                .param("to", "2000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_PARAMETER"));
    }

    @Test
    @DisplayName("Should return 400 for a non-numeric timestamp")
    void testTypeMismatch() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", "yesterday")
                .param("to", "2000"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("TYPE_MISMATCH"));
    }

    @Test
    @DisplayName("Should return 400 for an unsupported bucket")
    void testBadBucket() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", "1000")
                .param("to", "2000")
                .param("bucket", "weekly"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unsupported bucket 'weekly'. Allowed: none, hourly, daily"));
    }

    @Test
    @DisplayName("Should refuse fine resolution over a long range")
    void testFineOverLongRange() throws Exception {
        mockMvc.perform(get("/api/v1/aggregate")
                .param("source", "generation")
                .param("from", String.valueOf(BASE / 1000))
                .param("to", String.valueOf((BASE + 30 * DAY) / 1000))
                .param("resolution", "fine"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("QUERY_VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should report the stored date range of a dataset")
    void testDateRange() throws Exception {
        store.append(GENERATION, List.of(RawRecord.of(BASE + 30 * DAY, "BAYSW1", 1.0)));

        mockMvc.perform(get("/api/v1/sources/generation/date-range"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hasData").value(true))
            .andExpect(jsonPath("$.start").exists());

        mockMvc.perform(get("/api/v1/sources/transmission/date-range"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hasData").value(false))
            .andExpect(jsonPath("$.start").doesNotExist());
    }

    @Test
    @DisplayName("Should list every configured source in the status")
    void testStatus() throws Exception {
        mockMvc.perform(get("/api/v1/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.storeHealthy").value(true))
            .andExpect(jsonPath("$.circuitBreakerState").value("CLOSED"))
            .andExpect(jsonPath("$.sources", hasSize(7)))
            .andExpect(jsonPath("$.sources[0].sourceId").value("generation-scada"))
            .andExpect(jsonPath("$.sources[*].sourceId", hasItems("prices-rollup", "transmission-rollup")))
            .andExpect(jsonPath("$.cache.ttlSeconds").value(300));
    }

    @Test
    @DisplayName("Should invalidate the cache")
    void testInvalidateCache() throws Exception {
        mockMvc.perform(post("/api/v1/cache/invalidate").param("source", "generation"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("generation"))
            .andExpect(jsonPath("$.removed").exists());

        mockMvc.perform(post("/api/v1/cache/invalidate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("all"));
    }
}
