package com.fintech.timeseries.query;

import com.fintech.timeseries.domain.Resolution;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of QueryAggregate: the declared column schema and its rows. An
 * empty range still carries the full schema.
 *
 * @param resolution Dataset resolution the rows were computed from
 * @param columns Column names: group-by dimensions, optional bucket, measures
 * @param rows Rows sorted by bucket, then group values
 */
public record AggregateTable(
    Resolution resolution,
    List<String> columns,
    List<AggregateRow> rows
) {

    public static final String BUCKET_START = "bucket_start";
    public static final List<String> MEASURES = List.of(
        "net_quantity", "positive_quantity", "negative_quantity", "mean_rate", "sample_count", "partial");

    public AggregateTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static List<String> columnsFor(List<String> groupBy, BucketSize bucket) {
        List<String> columns = new ArrayList<>(groupBy);
        if (bucket != BucketSize.NONE) {
            columns.add(BUCKET_START);
        }
        columns.addAll(MEASURES);
        return columns;
    }

    public static AggregateTable empty(Resolution resolution, List<String> groupBy, BucketSize bucket) {
        return new AggregateTable(resolution, columnsFor(groupBy, bucket), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public double totalNetQuantity() {
        return rows.stream().mapToDouble(AggregateRow::netQuantity).sum();
    }
}
