package com.fintech.timeseries.ingestion.source;

import com.fintech.timeseries.config.TimeSeriesProperties.SourceDefinition;
import com.fintech.timeseries.domain.RawRecord;
import com.fintech.timeseries.ingestion.BatchRef;
import com.fintech.timeseries.ingestion.BatchValidationException;
import com.fintech.timeseries.ingestion.ParsedBatch;
import com.fintech.timeseries.ingestion.RowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parser for marker-prefixed multi-record CSV reports.
 *
 * <p>Each line starts with a marker: {@code C} for comments, {@code I} for a
 * header declaring the column names of a record type, {@code D} for a data
 * row of that record type. Columns 2..n of {@code I}/{@code D} rows name the
 * report and sub-report, e.g. {@code D,DISPATCH,UNIT_SCADA,1,...}. Only rows
 * whose record type matches the configured one are parsed.
 */
public class MarkerCsvBatchParser {

    private static final Logger log = LoggerFactory.getLogger(MarkerCsvBatchParser.class);

    private static final String HEADER_MARKER = "I";
    private static final String DATA_MARKER = "D";

    private final List<String> recordType;
    private final String timestampField;
    private final String entityField;
    private final String valueField;
    private final List<String> attributeFields;
    private final DateTimeFormatter timestampFormat;
    private final ZoneId zone;

    public MarkerCsvBatchParser(
            String recordType,
            String timestampField,
            String entityField,
            String valueField,
            List<String> attributeFields,
            String timestampFormat,
            ZoneId zone) {
        Objects.requireNonNull(recordType, "Record type cannot be null");
        this.recordType = List.of(recordType.toUpperCase(Locale.ROOT).split(","));
        this.timestampField = normalize(Objects.requireNonNull(timestampField, "Timestamp field cannot be null"));
        this.entityField = normalize(Objects.requireNonNull(entityField, "Entity field cannot be null"));
        this.valueField = normalize(Objects.requireNonNull(valueField, "Value field cannot be null"));
        this.attributeFields = attributeFields == null ? List.of() : attributeFields.stream().map(MarkerCsvBatchParser::normalize).toList();
        this.timestampFormat = DateTimeFormatter.ofPattern(timestampFormat);
        this.zone = zone;
    }

    public static MarkerCsvBatchParser forSource(SourceDefinition definition) {
        return new MarkerCsvBatchParser(
            definition.getRecordType(),
            definition.getTimestampField(),
            definition.getEntityField(),
            definition.getValueField(),
            definition.getAttributeFields(),
            definition.getTimestampFormat(),
            ZoneId.of(definition.getZone()));
    }

    /**
     * Parses the payload of one batch.
     *
     * @throws BatchValidationException if a header lacks a required column or
     *         no candidate row could be parsed
     */
    public ParsedBatch parse(BatchRef ref, String content) {
        Map<String, Integer> columns = null;
        List<RawRecord> records = new ArrayList<>();
        int candidates = 0;
        int failures = 0;
        int lineNumber = 0;

        for (String line : content.split("\\r?\\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = splitLine(line);
            if (!matchesRecordType(fields)) {
                continue;
            }
            String marker = fields.get(0).trim();
            if (HEADER_MARKER.equals(marker)) {
                columns = readHeader(ref, fields);
            } else if (DATA_MARKER.equals(marker)) {
                candidates++;
                if (columns == null) {
                    throw new BatchValidationException(
                        "Data row before header for " + String.join(",", recordType) + " in " + ref.name());
                }
                try {
                    records.add(parseRow(fields, columns));
                } catch (RowParseException e) {
                    failures++;
                    log.debug("Skipping row {} of {}: {}", lineNumber, ref.name(), e.getMessage());
                }
            }
        }

        if (candidates == 0) {
            throw new BatchValidationException(
                "No " + String.join(",", recordType) + " rows in " + ref.name());
        }
        if (records.isEmpty()) {
            throw new BatchValidationException(
                "All " + candidates + " rows of " + ref.name() + " failed to parse");
        }
        if (failures > 0) {
            log.warn("Skipped {} of {} unparseable rows in {}", failures, candidates, ref.name());
        }
        return new ParsedBatch(ref, records, candidates, failures);
    }

    private boolean matchesRecordType(List<String> fields) {
        if (fields.size() <= recordType.size()) {
            return false;
        }
        for (int i = 0; i < recordType.size(); i++) {
            if (!recordType.get(i).equals(fields.get(i + 1).trim().toUpperCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Integer> readHeader(BatchRef ref, List<String> fields) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            columns.putIfAbsent(normalize(fields.get(i)), i);
        }
        List<String> missing = new ArrayList<>();
        for (String required : List.of(timestampField, entityField, valueField)) {
            if (!columns.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new BatchValidationException("Missing required columns " + missing + " in " + ref.name());
        }
        return columns;
    }

    private RawRecord parseRow(List<String> fields, Map<String, Integer> columns) {
        String rawTimestamp = field(fields, columns, timestampField);
        String entity = field(fields, columns, entityField);
        String rawValue = field(fields, columns, valueField);
        if (rawTimestamp.isEmpty() || entity.isEmpty() || rawValue.isEmpty()) {
            throw new RowParseException("Blank required field");
        }

        long timestamp;
        try {
            timestamp = LocalDateTime.parse(rawTimestamp, timestampFormat).atZone(zone).toInstant().toEpochMilli();
        } catch (DateTimeException e) {
            throw new RowParseException("Bad timestamp '" + rawTimestamp + "'", e);
        }

        double value;
        try {
            value = Double.parseDouble(rawValue);
        } catch (NumberFormatException e) {
            throw new RowParseException("Bad value '" + rawValue + "'", e);
        }
        if (!Double.isFinite(value)) {
            throw new RowParseException("Non-finite value '" + rawValue + "'");
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        for (String attribute : attributeFields) {
            String attributeValue = field(fields, columns, attribute);
            if (!attributeValue.isEmpty()) {
                attributes.put(attribute, attributeValue);
            }
        }
        return new RawRecord(timestamp, entity, value, attributes);
    }

    private static String field(List<String> fields, Map<String, Integer> columns, String name) {
        Integer index = columns.get(name);
        if (index == null || index >= fields.size()) {
            return "";
        }
        return fields.get(index).trim();
    }

    private static String normalize(String column) {
        return column.trim().toUpperCase(Locale.ROOT);
    }

    /** Splits one CSV line honouring double-quoted fields. */
    static List<String> splitLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }
}
