package com.fintech.timeseries.ingestion.source;

import com.fintech.timeseries.ingestion.BatchRef;
import com.fintech.timeseries.ingestion.ParsedBatch;
import com.fintech.timeseries.ingestion.SourceFetchException;
import com.fintech.timeseries.ingestion.TransientFetchException;
import com.fintech.timeseries.ingestion.UpstreamSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Upstream whose batches are dropped as files into a local directory.
 */
public class LocalDirectorySource implements UpstreamSource {

    private final Path directory;
    private final Pattern filePattern;
    private final MarkerCsvBatchParser parser;

    public LocalDirectorySource(Path directory, Pattern filePattern, MarkerCsvBatchParser parser) {
        this.directory = directory;
        this.filePattern = filePattern;
        this.parser = parser;
    }

    @Override
    public List<BatchRef> listAvailable() {
        if (!Files.isDirectory(directory)) {
            throw new SourceFetchException("Not a directory: " + directory);
        }
        List<BatchRef> refs = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                String fileName = file.getFileName().toString();
                Matcher name = filePattern.matcher(fileName);
                if (name.matches() && name.groupCount() >= 1) {
                    refs.add(new BatchRef(fileName, Long.parseLong(name.group(1)), file.toString()));
                }
            });
        } catch (IOException e) {
            throw new TransientFetchException("Cannot list " + directory + ": " + e.getMessage(), e);
        }
        return refs;
    }

    @Override
    public ParsedBatch fetch(BatchRef ref) {
        byte[] payload;
        try {
            payload = Files.readAllBytes(Path.of(ref.location()));
        } catch (NoSuchFileException e) {
            throw new SourceFetchException("Batch disappeared: " + ref.location(), e);
        } catch (IOException e) {
            throw new TransientFetchException("Cannot read " + ref.location() + ": " + e.getMessage(), e);
        }
        return parser.parse(ref, BatchPayloads.decode(ref.name(), payload));
    }

    @Override
    public String describe() {
        return directory.toString();
    }
}
