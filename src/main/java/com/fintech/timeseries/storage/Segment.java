package com.fintech.timeseries.storage;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Metadata of one immutable, fully written segment file. Records stay on
 * disk and are read on demand; everything needed for pruning and counting
 * is encoded in the file name.
 * Segments are published to readers only after the file has been renamed
 * into place, so a published segment is always complete.
 */
record Segment(
    long sequence,
    Path file,
    long minTimestamp,
    long maxTimestamp,
    long recordCount
) {

    static final String PREFIX = "seg-";
    static final String SUFFIX = ".jsonl";
    static final String TEMP_PREFIX = ".tmp-";

    private static final Pattern FILE_NAME = Pattern.compile("^seg-(\\d{20})_(-?\\d+)_(-?\\d+)_(\\d+)\\.jsonl$");

    /** True if any record may fall in {@code (start, end]}. */
    boolean overlaps(long start, long end) {
        return maxTimestamp > start && minTimestamp <= end;
    }

    static String fileName(long sequence, long minTimestamp, long maxTimestamp, long recordCount) {
        return String.format("%s%020d_%d_%d_%d%s", PREFIX, sequence, minTimestamp, maxTimestamp, recordCount, SUFFIX);
    }

    /** Parses a segment file name back into its metadata; null if not a segment. */
    static Segment parse(Path file) {
        Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            return null;
        }
        return new Segment(
            Long.parseLong(matcher.group(1)),
            file,
            Long.parseLong(matcher.group(2)),
            Long.parseLong(matcher.group(3)),
            Long.parseLong(matcher.group(4)));
    }
}
