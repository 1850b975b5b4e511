package com.fintech.timeseries.ingestion;

import com.fintech.timeseries.config.TimeSeriesProperties;
import com.fintech.timeseries.config.TimeSeriesProperties.SourceDefinition;
import com.fintech.timeseries.config.TimeSeriesProperties.SourceType;
import com.fintech.timeseries.domain.SeriesKey;
import com.fintech.timeseries.ingestion.source.HttpDirectorySource;
import com.fintech.timeseries.ingestion.source.LocalDirectorySource;
import com.fintech.timeseries.ingestion.source.MarkerCsvBatchParser;
import com.fintech.timeseries.ingestion.source.RollupSource;
import com.fintech.timeseries.storage.TimeSeriesStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds one {@link SourceCollector} per configured source after checking
 * the configuration as a whole: unique source ids, exactly one writer per
 * dataset partition, rollups referring to a finer source of the same
 * dataset.
 */
@Component
public class SourceCollectorFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceCollectorFactory.class);

    private static final String USER_AGENT = "timeseries-ingestion-service/1.0";

    private final TimeSeriesProperties properties;
    private final TimeSeriesStore store;
    private final MeterRegistry meterRegistry;

    public SourceCollectorFactory(TimeSeriesProperties properties, TimeSeriesStore store, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @throws IllegalStateException if the source configuration is inconsistent
     */
    public List<SourceCollector> createAll() {
        Map<String, SourceDefinition> byId = validate(properties.getSources());
        List<SourceCollector> collectors = new ArrayList<>();
        for (SourceDefinition definition : properties.getSources()) {
            collectors.add(create(definition, byId));
            log.info("Registered source {} ({}) -> {}/{}", definition.getId(), definition.getType(),
                definition.getDataset(), definition.getResolution().pathName());
        }
        return collectors;
    }

    private SourceCollector create(SourceDefinition definition, Map<String, SourceDefinition> byId) {
        SeriesKey target = SeriesKey.of(definition.getDataset(), definition.getResolution());
        UpstreamSource upstream = switch (definition.getType()) {
            case HTTP_DIRECTORY -> new HttpDirectorySource(
                definition.getLocation(),
                compile(definition),
                MarkerCsvBatchParser.forSource(definition),
                restClient(definition));
            case LOCAL_DIRECTORY -> new LocalDirectorySource(
                Path.of(definition.getLocation()),
                compile(definition),
                MarkerCsvBatchParser.forSource(definition));
            case ROLLUP -> {
                SourceDefinition fine = byId.get(definition.getRollupOf());
                yield new RollupSource(store, definition.getId(),
                    SeriesKey.of(fine.getDataset(), fine.getResolution()), target, definition.getRollupLookback());
            }
        };
        TimeSeriesProperties.Retry retry = definition.getRetry() != null ? definition.getRetry() : properties.getRetry();
        return new SourceCollector(definition.getId(), target, upstream, store,
            RetryPolicy.from(retry), definition.getTaskTimeout(), meterRegistry);
    }

    private RestClient restClient(SourceDefinition definition) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) definition.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) definition.getReadTimeout().toMillis());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .defaultHeader("User-Agent", USER_AGENT)
            .build();
    }

    private static Pattern compile(SourceDefinition definition) {
        if (definition.getFilePattern() == null) {
            throw new IllegalStateException("Source " + definition.getId() + " needs file-pattern");
        }
        try {
            Pattern pattern = Pattern.compile(definition.getFilePattern());
            if (pattern.matcher("").groupCount() < 1) {
                throw new IllegalStateException("file-pattern of " + definition.getId()
                    + " must capture the batch sequence in group 1");
            }
            return pattern;
        } catch (PatternSyntaxException e) {
            throw new IllegalStateException("Invalid file-pattern for " + definition.getId() + ": " + e.getMessage(), e);
        }
    }

    static Map<String, SourceDefinition> validate(List<SourceDefinition> sources) {
        Map<String, SourceDefinition> byId = new HashMap<>();
        Map<SeriesKey, String> writers = new HashMap<>();
        for (SourceDefinition definition : sources) {
            String id = definition.getId();
            if (id == null || !id.matches("^[a-z0-9][a-z0-9_-]{0,63}$")) {
                throw new IllegalStateException("Invalid source id '" + id + "'");
            }
            if (byId.putIfAbsent(id, definition) != null) {
                throw new IllegalStateException("Duplicate source id '" + id + "'");
            }
            if (definition.getDataset() == null || definition.getResolution() == null || definition.getType() == null) {
                throw new IllegalStateException("Source " + id + " needs dataset, resolution and type");
            }
            SeriesKey target;
            try {
                target = SeriesKey.of(definition.getDataset(), definition.getResolution());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Source " + id + ": " + e.getMessage(), e);
            }
            String previous = writers.putIfAbsent(target, id);
            if (previous != null) {
                throw new IllegalStateException("Sources '" + previous + "' and '" + id + "' both write " + target);
            }
            if (definition.getType() != SourceType.ROLLUP) {
                if (definition.getLocation() == null || definition.getRecordType() == null
                        || definition.getEntityField() == null || definition.getValueField() == null) {
                    throw new IllegalStateException(
                        "Source " + id + " needs location, record-type, entity-field and value-field");
                }
            }
        }
        for (SourceDefinition definition : sources) {
            if (definition.getType() != SourceType.ROLLUP) {
                continue;
            }
            SourceDefinition fine = byId.get(definition.getRollupOf());
            if (fine == null) {
                throw new IllegalStateException("Rollup " + definition.getId() + " refers to unknown source '"
                    + definition.getRollupOf() + "'");
            }
            if (!fine.getDataset().equals(definition.getDataset())
                    || fine.getResolution().toMillis() >= definition.getResolution().toMillis()) {
                throw new IllegalStateException("Rollup " + definition.getId()
                    + " must derive a coarser resolution of the same dataset");
            }
        }
        return byId;
    }
}
