package com.fintech.timeseries.ingestion;

/**
 * @param appended Rows appended by the merge
 * @param watermark Watermark in effect after the merge, null if none yet
 */
public record MergeResult(int appended, Long watermark) {
}
