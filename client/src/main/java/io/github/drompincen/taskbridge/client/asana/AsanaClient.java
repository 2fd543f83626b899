package io.github.drompincen.taskbridge.client.asana;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.taskbridge.client.http.JsonTransport;
import io.github.drompincen.taskbridge.runtime.retry.RetryExecutor;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thin GET client for the source REST API. Collections are paged with {@code limit} and
 * {@code next_page.offset}; each page is a separate call through the executor.
 */
public class AsanaClient {

    static final int PAGE_LIMIT = 100;
    private static final int MAX_PAGES = 500;

    private final JsonTransport transport;
    private final AsanaSettings settings;

    public AsanaClient(JsonTransport transport, AsanaSettings settings) {
        this.transport = transport;
        this.settings = settings;
    }

    public JsonNode get(String operation, String path, Map<String, String> query) {
        JsonNode response = transport.get(operation, uri(path, query),
                Map.of("Authorization", "Bearer " + settings.accessToken()));
        return response.path("data");
    }

    public JsonNode get(RetryExecutor executor, String operation, String path, Map<String, String> query) {
        return executor.execute(operation, () -> get(operation, path, query));
    }

    public List<JsonNode> list(RetryExecutor executor, String operation, String path, Map<String, String> query) {
        List<JsonNode> all = new ArrayList<>();
        String offset = null;
        for (int page = 0; page < MAX_PAGES; page++) {
            Map<String, String> pageQuery = new LinkedHashMap<>(query);
            pageQuery.put("limit", String.valueOf(PAGE_LIMIT));
            if (offset != null) {
                pageQuery.put("offset", offset);
            }
            JsonNode response = executor.execute(operation, () -> transport.get(operation, uri(path, pageQuery),
                    Map.of("Authorization", "Bearer " + settings.accessToken())));
            response.path("data").forEach(all::add);
            JsonNode next = response.path("next_page").path("offset");
            if (next.isMissingNode() || next.isNull() || next.asText().isBlank()) {
                break;
            }
            offset = next.asText();
        }
        return all;
    }

    public AsanaSettings settings() {
        return settings;
    }

    URI uri(String path, Map<String, String> query) {
        String base = settings.baseUrl() + path;
        if (query.isEmpty()) {
            return URI.create(base);
        }
        String params = query.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(base + "?" + params);
    }
}
