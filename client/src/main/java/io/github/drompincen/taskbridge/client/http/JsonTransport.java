package io.github.drompincen.taskbridge.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * JSON over {@link HttpClient}. Maps HTTP status codes and I/O failures onto
 * {@link RemoteApiException} so the retry executor can tell transient from permanent failures.
 */
public class JsonTransport {

    private static final Logger log = LoggerFactory.getLogger(JsonTransport.class);
    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    public JsonTransport(HttpClient http, ObjectMapper mapper, Duration requestTimeout) {
        this.http = http;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    public static HttpClient defaultClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public JsonNode post(String operation, URI uri, JsonNode body, Map<String, String> headers) {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException(operation, 0, false, "could not serialize request", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        headers.forEach(builder::header);
        return send(operation, builder.build());
    }

    public JsonNode get(String operation, URI uri, Map<String, String> headers) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET();
        headers.forEach(builder::header);
        return send(operation, builder.build());
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private JsonNode send(String operation, HttpRequest request) {
        HttpResponse<String> response;
        try {
            log.debug("{} {} {}", operation, request.method(), request.uri());
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw RemoteApiException.network(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException(operation, 0, false, "interrupted", e);
        }
        String body = response.body() == null ? "" : response.body();
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw RemoteApiException.httpStatus(operation, response.statusCode(), abbreviate(body));
        }
        if (body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException(operation, response.statusCode(), false,
                    "response is not JSON: " + abbreviate(body), e);
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
