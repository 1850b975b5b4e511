package com.fintech.timeseries.ingestion;

import com.fintech.timeseries.domain.RawRecord;

import java.util.List;
import java.util.OptionalLong;

/**
 * Rows parsed from one upstream batch.
 *
 * @param ref The batch the rows came from
 * @param records Successfully parsed rows, in upstream order
 * @param candidateRows Rows of the expected record type seen in the payload
 * @param parseFailures Candidate rows that were skipped as unparseable
 */
public record ParsedBatch(
    BatchRef ref,
    List<RawRecord> records,
    int candidateRows,
    int parseFailures
) {

    public ParsedBatch {
        records = List.copyOf(records);
    }

    /** Returns the newest timestamp in the batch, empty for an empty batch. */
    public OptionalLong maxTimestamp() {
        return records.stream().mapToLong(RawRecord::timestamp).max();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
