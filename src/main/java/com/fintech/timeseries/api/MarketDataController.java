package com.fintech.timeseries.api;

import com.fintech.timeseries.query.AggregateQuery;
import com.fintech.timeseries.query.AggregateTable;
import com.fintech.timeseries.query.BucketSize;
import com.fintech.timeseries.query.ResolutionChoice;
import com.fintech.timeseries.service.MarketDataService;
import com.fintech.timeseries.service.ServiceStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * REST API for the presentation layer: aggregate queries, stored date
 * ranges, ingestion status and cache invalidation.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Market Data", description = "Aggregates over ingested time-series datasets")
public class MarketDataController {

    private static final Logger log = LoggerFactory.getLogger(MarketDataController.class);
    private static final long MAX_TIMESTAMP = 9999999999L; // Year 2286

    private final MarketDataService marketDataService;
    private final MeterRegistry meterRegistry;

    public MarketDataController(MarketDataService marketDataService, MeterRegistry meterRegistry) {
        this.marketDataService = marketDataService;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/aggregate
     *
     * @param source Dataset name
     * @param from Exclusive range start in Unix seconds
     * @param to Inclusive range end in Unix seconds
     */
    @Operation(
        summary = "Aggregate a dataset over a time range",
        description = """
            Groups samples in (from, to] by the requested dimensions and returns net,
            positive-only and negative-only quantities (rate x interval hours) per group.

            **Dimensions:** entity, category, or any record/dimension attribute (e.g. region)

            **Filters:** `filter=dimension:value1|value2`, repeatable

            **Resolution:** auto picks fine data for ranges up to the fine threshold and
            coarse data otherwise

            **Example Request:**
            ```
            GET /api/v1/aggregate?source=generation&from=1733529600&to=1733616000&groupBy=category&bucket=hourly
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Aggregate table (empty rows when no data is stored in range)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = AggregateResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "status": "ok",
                          "source": "generation",
                          "resolution": "fine",
                          "columns": ["category", "net_quantity", "positive_quantity",
                                      "negative_quantity", "mean_rate", "sample_count", "partial"],
                          "rows": [
                            {"category": "Battery", "net_quantity": 12.5, "positive_quantity": 40.0,
                             "negative_quantity": -27.5, "mean_rate": 0.52, "sample_count": 288,
                             "partial": false}
                          ]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid query (bad range, unsupported bucket or resolution)",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "500",
            description = "Store unavailable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/aggregate")
    public ResponseEntity<AggregateResponse> aggregate(
            @Parameter(description = "Dataset name", example = "generation", required = true)
            @RequestParam
            @NotBlank(message = "Source is required and cannot be blank")
            String source,

            @Parameter(description = "Range start, exclusive (Unix seconds)", example = "1733529600", required = true)
            @RequestParam
            @NotNull(message = "From timestamp is required")
            @PositiveOrZero(message = "From timestamp cannot be negative")
            Long from,

            @Parameter(description = "Range end, inclusive (Unix seconds)", example = "1733616000", required = true)
            @RequestParam
            @NotNull(message = "To timestamp is required")
            @PositiveOrZero(message = "To timestamp cannot be negative")
            Long to,

            @Parameter(description = "Dimensions to group by", example = "category")
            @RequestParam(required = false)
            List<String> groupBy,

            @Parameter(description = "Filters as dimension:value1|value2", example = "region:NSW1|QLD1")
            @RequestParam(required = false)
            List<String> filter,

            @Parameter(description = "Time bucket: none, hourly, daily", example = "hourly")
            @RequestParam(required = false)
            String bucket,

            @Parameter(description = "Resolution: auto, fine, coarse", example = "auto")
            @RequestParam(required = false)
            String resolution) {

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            if (from > MAX_TIMESTAMP || to > MAX_TIMESTAMP) {
                throw new IllegalArgumentException("Timestamps must be Unix seconds up to " + MAX_TIMESTAMP);
            }
            if (from > to) {
                throw new IllegalArgumentException(
                    String.format("Invalid time range: 'from' (%d) must not be after 'to' (%d)", from, to));
            }

            AggregateQuery query = new AggregateQuery(
                source,
                from * 1000,
                to * 1000,
                groupBy,
                parseFilters(filter),
                BucketSize.parse(bucket),
                ResolutionChoice.parse(resolution));

            AggregateTable table = marketDataService.queryAggregate(query);
            log.debug("Aggregate query: source={}, range=({}, {}], groupBy={}, rows={}",
                query.source(), from, to, query.groupBy(), table.rows().size());
            return ResponseEntity.ok(AggregateResponse.fromTable(query.source(), table));
        } finally {
            sample.stop(meterRegistry.timer("api.aggregate.request.time", "source", source));
        }
    }

    @Operation(summary = "Get the stored date range of a dataset")
    @GetMapping("/sources/{source}/date-range")
    public ResponseEntity<DateRangeResponse> getDateRange(
            @Parameter(description = "Dataset name", example = "generation")
            @PathVariable String source) {
        return ResponseEntity.ok(DateRangeResponse.of(source, marketDataService.getDateRange(source)));
    }

    @Operation(summary = "Get per-source ingestion health, store and cache state")
    @GetMapping("/status")
    public ResponseEntity<ServiceStatus> getStatus() {
        return ResponseEntity.ok(marketDataService.getStatus());
    }

    @Operation(summary = "Invalidate cached results of one dataset, or all when source is omitted")
    @PostMapping("/cache/invalidate")
    public ResponseEntity<InvalidationResponse> invalidateCache(
            @Parameter(description = "Dataset name; omit to clear everything", example = "generation")
            @RequestParam(required = false) String source) {
        int removed = marketDataService.invalidateCache(source);
        return ResponseEntity.ok(removed < 0
            ? new InvalidationResponse("all", null)
            : new InvalidationResponse(source.trim(), removed));
    }

    /**
     * Parses {@code dimension:value1|value2} filter expressions.
     */
    static SortedMap<String, SortedSet<String>> parseFilters(List<String> filters) {
        SortedMap<String, SortedSet<String>> parsed = new TreeMap<>();
        if (filters == null) {
            return parsed;
        }
        for (String expression : filters) {
            int colon = expression.indexOf(':');
            if (colon <= 0 || colon == expression.length() - 1) {
                throw new IllegalArgumentException(
                    "Filter '" + expression + "' must look like dimension:value1|value2");
            }
            String dimension = expression.substring(0, colon).trim();
            parsed.computeIfAbsent(dimension, k -> new TreeSet<>())
                .addAll(Arrays.asList(expression.substring(colon + 1).split("\\|")));
        }
        return parsed;
    }

    @Schema(description = "Result of a cache invalidation")
    public record InvalidationResponse(
        @Schema(description = "Dataset invalidated, or 'all'", example = "generation")
        String scope,

        @Schema(description = "Entries removed (absent when everything was cleared)", example = "12")
        Integer removed
    ) {}
}
