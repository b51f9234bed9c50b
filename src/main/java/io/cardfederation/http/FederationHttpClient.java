package io.cardfederation.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * JSON-over-HTTP client shared by the platform adapters and the local catalog.
 * Failures surface as {@link AdapterCallException} classified by {@link FailureKind}.
 */
@Slf4j
public class FederationHttpClient {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String ACCEPT = "Accept";
    private static final String APPLICATION_JSON = "application/json";

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public FederationHttpClient(Duration connectTimeout, Duration requestTimeout, ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    /**
     * Send a request and return whatever status the remote answered with.
     * Only transport failures throw.
     *
     * @param platform platform the call is made on behalf of, used for error classification
     * @param method HTTP method (GET, POST, PUT)
     * @param url full target URL
     * @param body request body, null for none
     * @param headers extra request headers, may be null
     */
    public HttpResult send(PlatformId platform, String method, String url, String body, Map<String, String> headers) {
        HttpRequest.Builder requestBuilder;
        try {
            requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .header(ACCEPT, APPLICATION_JSON);
        } catch (IllegalArgumentException e) {
            throw new AdapterCallException(platform, FailureKind.CLIENT_ERROR, "Invalid URL " + url, e);
        }

        if (headers != null) {
            headers.forEach(requestBuilder::header);
        }
        if (body != null) {
            requestBuilder.header(CONTENT_TYPE, APPLICATION_JSON);
            requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        long startTime = System.currentTimeMillis();
        try {
            HttpResponse<String> response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("[Platform: {}] {} {} -> {} in {}ms",
                    platform, method, url, response.statusCode(), System.currentTimeMillis() - startTime);
            return new HttpResult(response.statusCode(), response.body());
        } catch (HttpConnectTimeoutException e) {
            throw new AdapterCallException(platform, FailureKind.CONNECTIVITY,
                    "Connection to " + url + " timed out", e);
        } catch (HttpTimeoutException e) {
            throw new AdapterCallException(platform, FailureKind.TIMEOUT,
                    method + " " + url + " timed out after " + requestTimeout.toSeconds() + "s", e);
        } catch (ConnectException | UnknownHostException e) {
            throw new AdapterCallException(platform, FailureKind.CONNECTIVITY,
                    "Cannot reach " + url + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AdapterCallException(platform, FailureKind.CONNECTIVITY,
                    method + " " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterCallException(platform, FailureKind.CANCELLED,
                    method + " " + url + " interrupted", e);
        }
    }

    /**
     * GET a JSON document. Non-2xx answers throw.
     */
    public JsonNode getJson(PlatformId platform, String url, Map<String, String> headers) {
        HttpResult result = send(platform, "GET", url, null, headers);
        return parseSuccess(platform, "GET", url, result);
    }

    /**
     * Send a JSON body and parse the JSON answer. Non-2xx answers throw.
     * An empty success body yields a missing node.
     */
    public JsonNode sendJson(PlatformId platform, String method, String url, Object body, Map<String, String> headers) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new AdapterCallException(platform, FailureKind.UNEXPECTED,
                    "Failed to serialize request body for " + url, e);
        }
        HttpResult result = send(platform, method, url, payload, headers);
        return parseSuccess(platform, method, url, result);
    }

    /**
     * True when {@code url} answers with a 2xx status. Transport failures propagate.
     */
    public boolean probe(PlatformId platform, String url, Map<String, String> headers) {
        return send(platform, "GET", url, null, headers).isSuccess();
    }

    private JsonNode parseSuccess(PlatformId platform, String method, String url, HttpResult result) {
        if (!result.isSuccess()) {
            throw new AdapterCallException(platform, FailureKind.fromHttpStatus(result.statusCode()),
                    result.statusCode(), method + " " + url + " returned HTTP " + result.statusCode(), null);
        }
        if (result.body() == null || result.body().isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new AdapterCallException(platform, FailureKind.INVALID_RESPONSE,
                    "Response of " + method + " " + url + " is not valid JSON", e);
        }
    }
}
