package com.fintech.timeseries.ingestion.source;

import com.fintech.timeseries.ingestion.BatchRef;
import com.fintech.timeseries.ingestion.ParsedBatch;
import com.fintech.timeseries.ingestion.SourceFetchException;
import com.fintech.timeseries.ingestion.TransientFetchException;
import com.fintech.timeseries.ingestion.UpstreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Upstream publishing batches as files in an HTTP directory listing.
 * Batch names must match the configured pattern whose first group is the
 * embedded sequence timestamp.
 */
public class HttpDirectorySource implements UpstreamSource {

    private static final Logger log = LoggerFactory.getLogger(HttpDirectorySource.class);

    private static final Pattern HREF = Pattern.compile("href\\s*=\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    private final URI listingUri;
    private final Pattern filePattern;
    private final MarkerCsvBatchParser parser;
    private final RestClient restClient;

    public HttpDirectorySource(String listingUrl, Pattern filePattern, MarkerCsvBatchParser parser, RestClient restClient) {
        this.listingUri = URI.create(listingUrl.endsWith("/") ? listingUrl : listingUrl + "/");
        this.filePattern = filePattern;
        this.parser = parser;
        this.restClient = restClient;
    }

    @Override
    public List<BatchRef> listAvailable() {
        String html = execute(listingUri, () -> restClient.get().uri(listingUri).retrieve().body(String.class));
        if (html == null) {
            return List.of();
        }

        Map<String, BatchRef> refs = new LinkedHashMap<>();
        Matcher href = HREF.matcher(html);
        while (href.find()) {
            String link = href.group(1);
            String fileName = link.substring(link.lastIndexOf('/') + 1);
            Matcher name = filePattern.matcher(fileName);
            if (!name.matches()) {
                continue;
            }
            try {
                long sequence = Long.parseLong(name.group(1));
                refs.putIfAbsent(fileName, new BatchRef(fileName, sequence, listingUri.resolve(link).toString()));
            } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
                log.debug("Ignoring listing entry {}: {}", link, e.getMessage());
            }
        }
        log.debug("Listing {} offers {} batches", listingUri, refs.size());
        return new ArrayList<>(refs.values());
    }

    @Override
    public ParsedBatch fetch(BatchRef ref) {
        URI uri = URI.create(ref.location());
        byte[] payload = execute(uri, () -> restClient.get().uri(uri).retrieve().body(byte[].class));
        return parser.parse(ref, BatchPayloads.decode(ref.name(), payload));
    }

    @Override
    public String describe() {
        return listingUri.toString();
    }

    private <T> T execute(URI uri, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            if (isTransient(status)) {
                throw new TransientFetchException("GET " + uri + " returned " + status.value(), e);
            }
            throw new SourceFetchException("GET " + uri + " returned " + status.value(), e);
        } catch (ResourceAccessException e) {
            throw new TransientFetchException("GET " + uri + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SourceFetchException("GET " + uri + " failed: " + e.getMessage(), e);
        }
    }

    /** Rate limiting and upstream unavailability are worth another attempt. */
    static boolean isTransient(HttpStatusCode status) {
        int code = status.value();
        return status.is5xxServerError() || code == 403 || code == 408 || code == 429;
    }
}
