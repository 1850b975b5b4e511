package com.fintech.timeseries.ingestion;

import java.util.List;
import java.util.Optional;

/**
 * Contract of an external batch publisher: list what is available, fetch
 * one batch by reference. Implementations decompress and parse the payload.
 */
public interface UpstreamSource {

    /**
     * Lists the batches currently offered upstream.
     *
     * @throws TransientFetchException on timeouts, rate limiting, unavailable upstream
     * @throws SourceFetchException on non-recoverable request failures
     */
    List<BatchRef> listAvailable();

    /**
     * Fetches and parses one batch. Unparseable rows are skipped and counted.
     *
     * @throws TransientFetchException on timeouts, rate limiting, unavailable upstream
     * @throws SourceFetchException on non-recoverable request failures
     * @throws BatchValidationException if the payload as a whole is unusable
     */
    ParsedBatch fetch(BatchRef ref);

    /** Human readable location for logs and status. */
    String describe();

    /** Returns the newest available batch reference. */
    default Optional<BatchRef> latest() {
        return listAvailable().stream().max(BatchRef.NEWEST_LAST);
    }
}
