package com.fintech.timeseries.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.domain.DimensionRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dimension tables per dataset, loaded once at startup from JSON resources
 * configured under {@code timeseries.query.dimension-files}.
 */
@Component
public class DimensionCatalog {

    private static final Logger log = LoggerFactory.getLogger(DimensionCatalog.class);

    private final TimeSeriesProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final Map<String, DimensionTable> tables = new ConcurrentHashMap<>();

    public DimensionCatalog(TimeSeriesProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void load() {
        properties.getQuery().getDimensionFiles().forEach((dataset, location) -> {
            Resource resource = resourceLoader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                List<DimensionRecord> records = objectMapper.readValue(in, new TypeReference<List<DimensionRecord>>() { });
                tables.put(dataset, DimensionTable.of(records));
                log.info("Loaded {} dimension records for {} from {}", records.size(), dataset, location);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot load dimension file " + location + " for " + dataset, e);
            }
        });
    }

    /** Returns the table of a dataset; empty if none is configured. */
    public DimensionTable forDataset(String dataset) {
        return tables.getOrDefault(dataset, DimensionTable.empty());
    }

    /** Replaces the table of a dataset. */
    public void register(String dataset, DimensionTable table) {
        tables.put(dataset, table);
    }
}
