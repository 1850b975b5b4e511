package com.fintech.timeseries.storage;

import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SegmentFileTimeSeriesStore Tests")
class SegmentFileTimeSeriesStoreTest {

    private static final long BASE = 1_700_000_000_000L;
    private static final long FIVE_MIN = Resolution.FINE.toMillis();
    private static final SeriesKey GENERATION_FINE = SeriesKey.of("generation", Resolution.FINE);

    @TempDir
    Path tempDir;

    private TimeSeriesProperties properties;
    private SegmentFileTimeSeriesStore store;

    @BeforeEach
    void setUp() {
        properties = new TimeSeriesProperties();
        properties.getStorage().setBaseDir(tempDir.toString());
        store = new SegmentFileTimeSeriesStore(properties);
        store.initialize();
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    @DisplayName("Should append and scan records with exclusive start and inclusive end")
    void testAppendAndScan() {
        store.append(GENERATION_FINE, List.of(
            RawRecord.of(BASE, "UNIT1", 10.0),
            RawRecord.of(BASE + FIVE_MIN, "UNIT1", 20.0),
            RawRecord.of(BASE + 2 * FIVE_MIN, "UNIT1", 30.0)
        ));

        List<RawRecord> result = drain(store.scanRange(GENERATION_FINE, BASE, BASE + 2 * FIVE_MIN, null));

        assertThat(result).extracting(RawRecord::value).containsExactly(20.0, 30.0);
    }

    @Test
    @DisplayName("Should apply row filter during scan")
    void testScanFilter() {
        store.append(GENERATION_FINE, List.of(
            RawRecord.of(BASE + FIVE_MIN, "UNIT1", 10.0),
            RawRecord.of(BASE + FIVE_MIN, "UNIT2", 20.0)
        ));

        List<RawRecord> result = drain(store.scanRange(GENERATION_FINE, BASE, BASE + FIVE_MIN,
            record -> record.entityId().equals("UNIT2")));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).value()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should return empty iterator for unknown partition or empty range")
    void testEmptyScans() {
        assertThat(store.scanRange(SeriesKey.of("prices", Resolution.FINE), BASE, BASE + FIVE_MIN, null)).isExhausted();

        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + FIVE_MIN, "UNIT1", 10.0)));
        assertThat(store.scanRange(GENERATION_FINE, BASE + FIVE_MIN, BASE + FIVE_MIN, null)).isExhausted();
    }

    @Test
    @DisplayName("Should write each append as a new immutable segment file")
    void testSegmentsOnDisk() throws IOException {
        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + FIVE_MIN, "UNIT1", 1.0)));
        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + 2 * FIVE_MIN, "UNIT1", 2.0)));

        Path partitionDir = tempDir.resolve("generation").resolve("fine");
        try (Stream<Path> files = Files.list(partitionDir)) {
            List<String> names = files.map(path -> path.getFileName().toString()).sorted().toList();
            assertThat(names).hasSize(2);
            assertThat(names).allMatch(name -> name.startsWith("seg-") && name.endsWith(".jsonl"));
        }
        assertThat(store.count(GENERATION_FINE)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should recover segments and watermarks after reopening")
    void testReopen() {
        store.append(GENERATION_FINE, List.of(
            new RawRecord(BASE + FIVE_MIN, "UNIT1", -5.5, Map.of("region", "SA1")),
            RawRecord.of(BASE + 2 * FIVE_MIN, "UNIT2", 7.0)
        ));
        store.advanceWatermark("generation-scada", BASE + 2 * FIVE_MIN);
        store.shutdown();

        SegmentFileTimeSeriesStore reopened = new SegmentFileTimeSeriesStore(properties);
        reopened.initialize();

        List<RawRecord> records = drain(reopened.scanRange(GENERATION_FINE, BASE, BASE + 10 * FIVE_MIN, null));
        assertThat(records).hasSize(2);
        assertThat(records.get(0).attribute("region")).isEqualTo("SA1");
        assertThat(records.get(0).value()).isEqualTo(-5.5);
        assertThat(reopened.getWatermark("generation-scada")).hasValue(BASE + 2 * FIVE_MIN);

        // Sequence continues after the recovered segments
        reopened.append(GENERATION_FINE, List.of(RawRecord.of(BASE + 3 * FIVE_MIN, "UNIT1", 1.0)));
        assertThat(reopened.count(GENERATION_FINE)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reopen from segment file names without reading record data")
    void testReopenReadsMetadataOnly() throws IOException {
        store.append(GENERATION_FINE, List.of(
            RawRecord.of(BASE + FIVE_MIN, "UNIT1", 1.0),
            RawRecord.of(BASE + 2 * FIVE_MIN, "UNIT1", 2.0),
            RawRecord.of(BASE + 3 * FIVE_MIN, "UNIT1", 3.0)));
        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + 20 * FIVE_MIN, "UNIT1", 4.0)));
        Path partitionDir = tempDir.resolve("generation").resolve("fine");
        Path first;
        try (Stream<Path> files = Files.list(partitionDir)) {
            first = files.sorted().findFirst().orElseThrow();
        }
        assertThat(first.getFileName().toString()).endsWith("_3.jsonl");
        Files.writeString(first, "not json\n");

        SegmentFileTimeSeriesStore reopened = new SegmentFileTimeSeriesStore(properties);
        reopened.initialize();

        assertThat(reopened.count(GENERATION_FINE)).isEqualTo(4);
        assertThat(reopened.getStoredRecords()).isEqualTo(4);
        assertThat(reopened.getDateRange(GENERATION_FINE)).contains(new DateRange(BASE + FIVE_MIN, BASE + 20 * FIVE_MIN));

        // Ranges that skip the damaged segment never open it
        assertThat(drain(reopened.scanRange(GENERATION_FINE, BASE + 10 * FIVE_MIN, BASE + 20 * FIVE_MIN, null)))
            .extracting(RawRecord::value).containsExactly(4.0);
        assertThatThrownBy(() -> drain(reopened.scanRange(GENERATION_FINE, BASE, BASE + 20 * FIVE_MIN, null)))
            .isInstanceOf(StoreReadException.class)
            .hasMessageContaining(first.getFileName().toString());
    }

    @Test
    @DisplayName("Should discard unpublished temp files on startup")
    void testTempFilesDiscarded() throws IOException {
        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + FIVE_MIN, "UNIT1", 1.0)));
        Path partitionDir = tempDir.resolve("generation").resolve("fine");
        Path orphan = partitionDir.resolve(".tmp-orphan");
        Files.writeString(orphan, "{\"t\":1,\"e\":\"HALF");

        SegmentFileTimeSeriesStore reopened = new SegmentFileTimeSeriesStore(properties);
        reopened.initialize();

        assertThat(orphan).doesNotExist();
        assertThat(reopened.count(GENERATION_FINE)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never lower a watermark")
    void testWatermarkMonotonic() {
        assertThat(store.getWatermark("prices")).isEmpty();

        assertThat(store.advanceWatermark("prices", BASE + 2 * FIVE_MIN)).isEqualTo(BASE + 2 * FIVE_MIN);
        assertThat(store.advanceWatermark("prices", BASE + FIVE_MIN)).isEqualTo(BASE + 2 * FIVE_MIN);

        assertThat(store.getWatermark("prices")).hasValue(BASE + 2 * FIVE_MIN);
    }

    @Test
    @DisplayName("Should report date range from segment metadata")
    void testDateRange() {
        assertThat(store.getDateRange(GENERATION_FINE)).isEmpty();

        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + 3 * FIVE_MIN, "UNIT1", 1.0)));
        store.append(GENERATION_FINE, List.of(RawRecord.of(BASE + FIVE_MIN, "UNIT1", 1.0)));

        assertThat(store.getDateRange(GENERATION_FINE)).contains(new DateRange(BASE + FIVE_MIN, BASE + 3 * FIVE_MIN));
        assertThat(store.latestTimestamp(GENERATION_FINE)).hasValue(BASE + 3 * FIVE_MIN);
        assertThat(store.partitions()).containsExactly(GENERATION_FINE);
    }

    @Test
    @DisplayName("Should reject empty batches and invalid source ids")
    void testRejectsInvalidInput() {
        assertThatThrownBy(() -> store.append(GENERATION_FINE, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.advanceWatermark("../escape", BASE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail with StoreWriteException when the partition directory is not writable")
    void testWriteFailure() throws IOException {
        // A regular file where the dataset directory should be
        Files.writeString(tempDir.resolve("blocked"), "not a directory");

        assertThatThrownBy(() -> store.append(SeriesKey.of("blocked", Resolution.FINE),
                List.of(RawRecord.of(BASE, "UNIT1", 1.0))))
            .isInstanceOf(StoreWriteException.class);
    }

    @Test
    @DisplayName("Concurrent readers should only ever observe whole batches")
    void testReadersNeverSeePartialBatch() throws Exception {
        int batchSize = 50;
        int batches = 40;
        AtomicBoolean writing = new AtomicBoolean(true);
        ConcurrentLinkedQueue<Integer> observedCounts = new ConcurrentLinkedQueue<>();
        CountDownLatch readersStarted = new CountDownLatch(2);
        ExecutorService readers = Executors.newFixedThreadPool(2);

        for (int r = 0; r < 2; r++) {
            readers.submit(() -> {
                readersStarted.countDown();
                while (writing.get()) {
                    observedCounts.add(drain(store.scanRange(GENERATION_FINE, Long.MIN_VALUE, Long.MAX_VALUE, null)).size());
                }
            });
        }
        readersStarted.await();

        for (int b = 0; b < batches; b++) {
            List<RawRecord> batch = new ArrayList<>();
            for (int i = 0; i < batchSize; i++) {
                batch.add(RawRecord.of(BASE + (long) (b * batchSize + i + 1) * FIVE_MIN, "UNIT" + i, i));
            }
            store.append(GENERATION_FINE, batch);
        }
        writing.set(false);
        readers.shutdown();
        assertThat(readers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(observedCounts).isNotEmpty();
        assertThat(observedCounts).allMatch(count -> count % batchSize == 0);
        assertThat(store.count(GENERATION_FINE)).isEqualTo((long) batchSize * batches);
    }

    private static List<RawRecord> drain(Iterator<RawRecord> iterator) {
        List<RawRecord> records = new ArrayList<>();
        iterator.forEachRemaining(records::add);
        return records;
    }
}
