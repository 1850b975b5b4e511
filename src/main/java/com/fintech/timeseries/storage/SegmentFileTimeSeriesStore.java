package com.fintech.timeseries.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.domain.DateRange;
import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.domain.Resolution;
import com.fintech.timeseries.domain.SeriesKey;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * File-backed implementation of {@link TimeSeriesStore}.
 *
 * Layout under the base directory:
 * <pre>
 *   &lt;dataset&gt;/&lt;resolution&gt;/seg-&lt;seq&gt;_&lt;minTs&gt;_&lt;maxTs&gt;_&lt;count&gt;.jsonl
 *   _watermarks/&lt;sourceId&gt;.json
 * </pre>
 *
 * Every append writes a new segment to a temp file, forces it to disk and
 * renames it into place before publishing it to readers through a
 * copy-on-write segment list. Segments are never rewritten.
 *
 * Only segment metadata is held in memory, and it is recovered from file
 * names at startup. Scans read one overlapping segment at a time from disk,
 * so heap use follows the largest segment rather than the stored history.
 *
 * Thread-safe: one writer per partition at a time, any number of readers.
 */
@Repository
public class SegmentFileTimeSeriesStore implements TimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(SegmentFileTimeSeriesStore.class);

    private static final String WATERMARK_DIR = "_watermarks";
    private static final Pattern VALID_SOURCE_ID = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,63}$");

    private final TimeSeriesProperties properties;
    private final ObjectMapper mapper;
    private final SegmentCodec codec;

    private final Map<SeriesKey, Partition> partitions = new ConcurrentHashMap<>();
    private final Map<String, Long> watermarks = new ConcurrentHashMap<>();
    private final Map<String, Object> watermarkLocks = new ConcurrentHashMap<>();

    private final AtomicLong segmentsWritten = new AtomicLong(0);
    private final AtomicLong recordsWritten = new AtomicLong(0);
    private final AtomicLong scans = new AtomicLong(0);

    private Path baseDir;

    public SegmentFileTimeSeriesStore(TimeSeriesProperties properties) {
        this.properties = properties;
        this.mapper = new ObjectMapper();
        this.codec = new SegmentCodec(mapper);
    }

    @PostConstruct
    public void initialize() {
        baseDir = Paths.get(properties.getStorage().getBaseDir()).toAbsolutePath();
        try {
            Files.createDirectories(baseDir.resolve(WATERMARK_DIR));
            loadWatermarks();
            loadPartitions();
        } catch (IOException e) {
            log.error("Failed to open time-series store at {}", baseDir, e);
            throw new IllegalStateException("Time-series store initialization failed", e);
        }

        log.info("Time-series store opened: path={}, partitions={}, watermarks={}",
                baseDir, partitions.size(), watermarks.size());
    }

    @Override
    public void append(SeriesKey key, List<RawRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch to " + key);
        }

        Partition partition = partitions.computeIfAbsent(key, this::newPartition);
        partition.writeLock.lock();
        try {
            long sequence = partition.nextSequence.get();
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            for (RawRecord record : records) {
                min = Math.min(min, record.timestamp());
                max = Math.max(max, record.timestamp());
            }

            Path target = partition.directory.resolve(Segment.fileName(sequence, min, max, records.size()));
            writeDurably(partition.directory, target, writer -> codec.write(records, writer));

            partition.publish(new Segment(sequence, target, min, max, records.size()));
            partition.nextSequence.incrementAndGet();
            segmentsWritten.incrementAndGet();
            recordsWritten.addAndGet(records.size());

            if (log.isDebugEnabled()) {
                log.debug("Appended segment: partition={}, seq={}, records={}, range=[{}, {}]",
                        key, sequence, records.size(), min, max);
            }
        } catch (IOException e) {
            throw new StoreWriteException("Failed to append " + records.size() + " records to " + key, e);
        } finally {
            partition.writeLock.unlock();
        }
    }

    @Override
    public Iterator<RawRecord> scanRange(SeriesKey key, long start, long end, Predicate<RawRecord> filter) {
        scans.incrementAndGet();
        Partition partition = partitions.get(key);
        if (partition == null || end <= start) {
            return Collections.emptyIterator();
        }

        // Snapshot: segments published after this point are not visible to this scan
        List<Segment> snapshot = partition.segments;
        Predicate<RawRecord> rowFilter = filter == null ? record -> true : filter;

        List<Segment> overlapping = snapshot.stream()
            .filter(segment -> segment.overlaps(start, end))
            .toList();
        return new SegmentScan(overlapping.iterator(),
            record -> record.timestamp() > start && record.timestamp() <= end && rowFilter.test(record));
    }

    @Override
    public OptionalLong getWatermark(String sourceId) {
        Long watermark = watermarks.get(sourceId);
        return watermark == null ? OptionalLong.empty() : OptionalLong.of(watermark);
    }

    @Override
    public long advanceWatermark(String sourceId, long timestamp) {
        requireValidSourceId(sourceId);
        Object lock = watermarkLocks.computeIfAbsent(sourceId, id -> new Object());
        synchronized (lock) {
            Long current = watermarks.get(sourceId);
            if (current != null && timestamp <= current) {
                if (timestamp < current) {
                    log.warn("Ignoring watermark regression: source={}, current={}, requested={}",
                            sourceId, current, timestamp);
                }
                return current;
            }

            Path target = watermarkFile(sourceId);
            WatermarkFile content = new WatermarkFile(sourceId, timestamp, Instant.now().toString());
            try {
                writeDurably(target.getParent(), target,
                        writer -> writer.write(mapper.writeValueAsString(content)));
            } catch (IOException e) {
                throw new StoreWriteException("Failed to persist watermark for " + sourceId, e);
            }
            watermarks.put(sourceId, timestamp);
            log.debug("Watermark advanced: source={}, from={}, to={}", sourceId, current, timestamp);
            return timestamp;
        }
    }

    @Override
    public Optional<DateRange> getDateRange(SeriesKey key) {
        Partition partition = partitions.get(key);
        if (partition == null) {
            return Optional.empty();
        }
        return partition.segments.stream()
            .map(segment -> new DateRange(segment.minTimestamp(), segment.maxTimestamp()))
            .reduce(DateRange::span);
    }

    @Override
    public Set<SeriesKey> partitions() {
        Set<SeriesKey> keys = new TreeSet<>();
        partitions.forEach((key, partition) -> {
            if (!partition.segments.isEmpty()) {
                keys.add(key);
            }
        });
        return keys;
    }

    @Override
    public long count(SeriesKey key) {
        Partition partition = partitions.get(key);
        if (partition == null) {
            return 0;
        }
        return partition.segments.stream().mapToLong(Segment::recordCount).sum();
    }

    @Override
    public boolean isHealthy() {
        return baseDir != null && Files.isDirectory(baseDir) && Files.isWritable(baseDir);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing time-series store: segments_written={}, records_written={}, scans={}",
                segmentsWritten.get(), recordsWritten.get(), scans.get());
    }

    // ------------------------------------------------------------------
    // Durable write: temp file -> fsync -> atomic rename -> directory fsync

    @FunctionalInterface
    private interface ContentWriter {
        void write(BufferedWriter writer) throws IOException;
    }

    private void writeDurably(Path directory, Path target, ContentWriter content) throws IOException {
        Path temp = directory.resolve(Segment.TEMP_PREFIX + UUID.randomUUID());
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                 BufferedWriter writer = new BufferedWriter(
                         new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8))) {
                content.write(writer);
                writer.flush();
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            syncDirectory(directory);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            // Some platforms cannot open directories; the rename is still atomic there
            log.trace("Directory sync not supported for {}: {}", directory, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Recovery

    private void loadWatermarks() throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(baseDir.resolve(WATERMARK_DIR))) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.startsWith(Segment.TEMP_PREFIX)) {
                    Files.deleteIfExists(file);
                    continue;
                }
                if (!name.endsWith(".json")) {
                    continue;
                }
                WatermarkFile watermark = mapper.readValue(file.toFile(), WatermarkFile.class);
                watermarks.put(watermark.sourceId(), watermark.watermark());
            }
        }
    }

    private void loadPartitions() throws IOException {
        try (DirectoryStream<Path> datasets = Files.newDirectoryStream(baseDir, Files::isDirectory)) {
            for (Path datasetDir : datasets) {
                String dataset = datasetDir.getFileName().toString();
                if (dataset.equals(WATERMARK_DIR)) {
                    continue;
                }
                if (!VALID_SOURCE_ID.matcher(dataset).matches()) {
                    log.warn("Ignoring directory that is not a dataset: {}", datasetDir);
                    continue;
                }
                for (Resolution resolution : Resolution.values()) {
                    Path partitionDir = datasetDir.resolve(resolution.pathName());
                    if (Files.isDirectory(partitionDir)) {
                        SeriesKey key = SeriesKey.of(dataset, resolution);
                        partitions.put(key, loadPartition(key, partitionDir));
                    }
                }
            }
        }
    }

    private Partition loadPartition(SeriesKey key, Path directory) throws IOException {
        List<Segment> segments = new ArrayList<>();
        int removedTemps = 0;

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.startsWith(Segment.TEMP_PREFIX)) {
                    // Interrupted append: never published, safe to discard
                    Files.deleteIfExists(file);
                    removedTemps++;
                    continue;
                }
                Segment segment = Segment.parse(file);
                if (segment == null) {
                    log.warn("Ignoring unexpected file in partition {}: {}", key, name);
                    continue;
                }
                segments.add(segment);
            }
        }

        segments.sort(Comparator.comparingLong(Segment::sequence));
        Partition partition = new Partition(directory);
        partition.segments = List.copyOf(segments);
        partition.nextSequence.set(segments.isEmpty() ? 1 : segments.get(segments.size() - 1).sequence() + 1);

        log.info("Loaded partition {}: segments={}, discarded_temp_files={}", key, segments.size(), removedTemps);
        return partition;
    }

    private Partition newPartition(SeriesKey key) {
        Path directory = baseDir.resolve(key.dataset()).resolve(key.resolution().pathName());
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreWriteException("Cannot create partition directory " + directory, e);
        }
        log.info("Created partition {} at {}", key, directory);
        return new Partition(directory);
    }

    private Path watermarkFile(String sourceId) {
        return baseDir.resolve(WATERMARK_DIR).resolve(sourceId + ".json");
    }

    private static void requireValidSourceId(String sourceId) {
        if (sourceId == null || !VALID_SOURCE_ID.matcher(sourceId).matches()) {
            throw new IllegalArgumentException("Invalid source id: " + sourceId);
        }
    }

    private List<RawRecord> readSegment(Segment segment) {
        try (BufferedReader reader = Files.newBufferedReader(segment.file(), StandardCharsets.UTF_8)) {
            return codec.read(reader);
        } catch (IOException e) {
            throw new StoreReadException("Failed to read segment " + segment.file(), e);
        }
    }

    // Metrics accessors for monitoring
    public long getSegmentsWritten() {
        return segmentsWritten.get();
    }

    public long getRecordsWritten() {
        return recordsWritten.get();
    }

    public long getScans() {
        return scans.get();
    }

    /** Records held across all partitions, from segment metadata. */
    public long getStoredRecords() {
        long total = 0;
        for (Partition partition : partitions.values()) {
            for (Segment segment : partition.segments) {
                total += segment.recordCount();
            }
        }
        return total;
    }

    /**
     * Published segments of one partition. Readers take the volatile list as a
     * snapshot; the single writer replaces it with a longer copy.
     */
    private static final class Partition {
        final Path directory;
        final ReentrantLock writeLock = new ReentrantLock();
        final AtomicLong nextSequence = new AtomicLong(1);
        volatile List<Segment> segments = List.of();

        Partition(Path directory) {
            this.directory = directory;
        }

        void publish(Segment segment) {
            List<Segment> next = new ArrayList<>(segments.size() + 1);
            next.addAll(segments);
            next.add(segment);
            segments = List.copyOf(next);
        }
    }

    /**
     * Lazily reads the segments of a scan snapshot in sequence order, one
     * file at a time. Each file is closed before its records are handed out.
     *
     * @throws StoreReadException from {@code hasNext} if a segment cannot be read
     */
    private final class SegmentScan implements Iterator<RawRecord> {
        private final Iterator<Segment> segments;
        private final Predicate<RawRecord> accept;
        private Iterator<RawRecord> current = Collections.emptyIterator();

        SegmentScan(Iterator<Segment> segments, Predicate<RawRecord> accept) {
            this.segments = segments;
            this.accept = accept;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext() && segments.hasNext()) {
                List<RawRecord> matching = new ArrayList<>();
                for (RawRecord record : readSegment(segments.next())) {
                    if (accept.test(record)) {
                        matching.add(record);
                    }
                }
                current = matching.iterator();
            }
            return current.hasNext();
        }

        @Override
        public RawRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }

    record WatermarkFile(String sourceId, long watermark, String updatedAt) {
    }
}
