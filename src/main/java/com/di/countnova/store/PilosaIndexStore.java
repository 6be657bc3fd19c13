package com.di.countnova.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link IndexStore} backed by a Pilosa node's HTTP query endpoint.
 * <p>
 * Each call POSTs one PQL statement to {@code /index/{index}/query} and decodes the
 * {@code {"results": [...]}} envelope. The query deadline is the read timeout of the
 * {@link RestClient}'s request factory (see {@link com.di.countnova.config.IndexStoreConfig}).
 */
@Slf4j
public class PilosaIndexStore implements IndexStore {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String queryPath;

    public PilosaIndexStore(RestClient restClient, ObjectMapper objectMapper, IndexStoreAddress address, String index) {
        if (index == null || index.isBlank()) {
            throw new IllegalArgumentException("Index name cannot be null or empty");
        }
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.queryPath = address.path("/index/" + index + "/query");
    }

    @Override
    public long count(Predicate predicate) {
        JsonNode result = query(PqlWriter.count(predicate));
        if (!result.canConvertToLong()) {
            throw new IndexStoreException("Count returned a non-numeric result: " + result);
        }
        return result.asLong();
    }

    @Override
    public List<CountItem> topN(String dimension, int n, Predicate filter) {
        JsonNode result = query(PqlWriter.topN(dimension, n, filter));
        if (result.isNull()) {
            return List.of();
        }
        if (!result.isArray()) {
            throw new IndexStoreException("TopN returned a non-array result: " + result);
        }
        List<CountItem> items = new ArrayList<>(result.size());
        for (JsonNode node : result) {
            items.add(new CountItem(node.path("id").asLong(), node.path("count").asLong()));
        }
        return items;
    }

    private JsonNode query(String pql) {
        String body;
        try {
            body = restClient.post()
                    .uri(queryPath)
                    .contentType(MediaType.TEXT_PLAIN)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(pql)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new IndexStoreException(String.format("Query %s failed with HTTP %d: %s",
                    pql, e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new QueryTimeoutException("Query " + pql + " timed out", e);
            }
            throw new IndexStoreException("Query " + pql + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new IndexStoreException("Query " + pql + " failed: " + e.getMessage(), e);
        }
        log.debug("[INDEX-STORE] {} -> {}", pql, body);
        return firstResult(pql, body);
    }

    private JsonNode firstResult(String pql, String body) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new IndexStoreException("Query " + pql + " returned an undecodable response", e);
        }
        if (envelope == null || envelope.isMissingNode()) {
            throw new IndexStoreException("Query " + pql + " returned an empty response");
        }
        if (envelope.hasNonNull("error")) {
            throw new IndexStoreException("Query " + pql + " failed: " + envelope.get("error").asText());
        }
        JsonNode results = envelope.path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw new IndexStoreException("Query " + pql + " returned no results");
        }
        return results.get(0);
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
