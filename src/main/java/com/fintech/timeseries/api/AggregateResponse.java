package com.fintech.timeseries.api;

import com.fintech.timeseries.query.AggregateRow;
import com.fintech.timeseries.query.AggregateTable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular aggregate result: the declared columns and one object per row
 * keyed by column name. Bucket starts are Unix seconds.
 */
@Schema(description = "Aggregate result table")
public record AggregateResponse(
    @Schema(description = "Response status", example = "ok")
    String status,

    @Schema(description = "Dataset queried", example = "generation")
    String source,

    @Schema(description = "Resolution the rows were computed from", example = "fine")
    String resolution,

    @Schema(description = "Column names, group-by dimensions first")
    List<String> columns,

    @Schema(description = "Rows keyed by column name")
    List<Map<String, Object>> rows
) {

    public static AggregateResponse fromTable(String source, AggregateTable table) {
        List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
        for (AggregateRow row : table.rows()) {
            Map<String, Object> values = new LinkedHashMap<>(row.groups());
            if (table.columns().contains(AggregateTable.BUCKET_START)) {
                values.put(AggregateTable.BUCKET_START, row.bucketStart() / 1000);
            }
            values.put("net_quantity", row.netQuantity());
            values.put("positive_quantity", row.positiveQuantity());
            values.put("negative_quantity", row.negativeQuantity());
            values.put("mean_rate", row.meanRate());
            values.put("sample_count", row.sampleCount());
            values.put("partial", row.partial());
            rows.add(values);
        }
        return new AggregateResponse("ok", source, table.resolution().pathName(), table.columns(), rows);
    }
}
