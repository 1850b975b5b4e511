package com.fintech.timeseries.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.timeseries.domain.RawRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Line-oriented JSON encoding of segment files: one record per line.
 */
class SegmentCodec {

    private final ObjectMapper mapper;

    SegmentCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    void write(List<RawRecord> records, Writer writer) throws IOException {
        for (RawRecord record : records) {
            StoredRecord stored = new StoredRecord(
                record.timestamp(), record.entityId(), record.value(), record.attributes());
            writer.write(mapper.writeValueAsString(stored));
            writer.write('\n');
        }
    }

    List<RawRecord> read(BufferedReader reader) throws IOException {
        List<RawRecord> records = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                StoredRecord stored = mapper.readValue(line, StoredRecord.class);
                records.add(new RawRecord(stored.t(), stored.e(), stored.v(), stored.a()));
            } catch (JsonProcessingException e) {
                throw new IOException("Corrupt segment line " + lineNumber + ": " + e.getOriginalMessage(), e);
            }
        }
        return records;
    }

    /** Compact on-disk form. */
    record StoredRecord(long t, String e, double v, @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> a) {
    }
}
