package com.fintech.timeseries.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.timeseries.domain.DateRange;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Optional;

/**
 * Span of stored data of a dataset, in Unix seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Stored date range of a dataset")
public record DateRangeResponse(
    @Schema(description = "Dataset", example = "generation")
    String source,

    @Schema(description = "True if any data is stored")
    boolean hasData,

    @Schema(description = "Earliest stored timestamp (Unix seconds)", example = "1733529600")
    Long start,

    @Schema(description = "Latest stored timestamp (Unix seconds)", example = "1733616000")
    Long end
) {

    public static DateRangeResponse of(String source, Optional<DateRange> range) {
        return range
            .map(r -> new DateRangeResponse(source, true, r.start() / 1000, r.end() / 1000))
            .orElseGet(() -> new DateRangeResponse(source, false, null, null));
    }
}
