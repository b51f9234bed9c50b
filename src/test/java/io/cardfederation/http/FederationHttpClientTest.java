package io.cardfederation.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.util.JsonUtils;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FederationHttpClientTest {

    private MockWebServer server;
    private FederationHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new FederationHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2), JsonUtils.createObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    @Test
    void testGetJson_ParsesBodyAndSendsHeaders() throws Exception {
        // Given
        server.enqueue(new MockResponse().setBody("{\"cards\":[]}"));

        // When
        JsonNode body = client.getJson(PlatformId.HUB, url("/api/federation/outbox"),
                Map.of("Authorization", "Bearer secret"));

        // Then
        assertThat(body.path("cards").isArray()).isTrue();
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void testSendJson_SerializesBody() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\":\"r-1\"}"));

        JsonNode body = client.sendJson(PlatformId.ARCHIVE, "POST", url("/inbox"), Map.of("name", "Aria"), null);

        assertThat(body.path("id").asText()).isEqualTo("r-1");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"name\":\"Aria\"}");
    }

    @Test
    void testSendJson_EmptySuccessBodyIsMissingNode() {
        server.enqueue(new MockResponse().setResponseCode(204));

        JsonNode body = client.sendJson(PlatformId.ARCHIVE, "PUT", url("/inbox/1"), Map.of(), null);

        assertThat(body.isMissingNode()).isTrue();
    }

    @Test
    void testNonSuccessStatusIsClassified() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.getJson(PlatformId.HUB, url("/missing"), null))
                .isInstanceOfSatisfying(AdapterCallException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FailureKind.CLIENT_ERROR);
                    assertThat(e.getStatusCode()).isEqualTo(404);
                    assertThat(e.getPlatform()).isEqualTo(PlatformId.HUB);
                });
        assertThatThrownBy(() -> client.getJson(PlatformId.HUB, url("/broken"), null))
                .isInstanceOfSatisfying(AdapterCallException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FailureKind.SERVER_ERROR);
                    assertThat(e.isRetryable()).isTrue();
                });
    }

    @Test
    void testInvalidJsonIsInvalidResponse() {
        server.enqueue(new MockResponse().setBody("<html>nope</html>"));

        assertThatThrownBy(() -> client.getJson(PlatformId.HUB, url("/outbox"), null))
                .isInstanceOfSatisfying(AdapterCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.INVALID_RESPONSE));
    }

    @Test
    void testSlowResponseIsTimeout() {
        server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(5, TimeUnit.SECONDS));

        assertThatThrownBy(() -> client.getJson(PlatformId.HUB, url("/slow"), null))
                .isInstanceOfSatisfying(AdapterCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.TIMEOUT));
    }

    @Test
    void testUnreachableHostIsConnectivity() {
        assertThatThrownBy(() -> client.probe(PlatformId.SILLYTAVERN, "http://127.0.0.1:1/actor", null))
                .isInstanceOfSatisfying(AdapterCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.CONNECTIVITY));
    }

    @Test
    void testProbe_ReflectsStatus() {
        server.enqueue(new MockResponse().setBody("{}"));
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThat(client.probe(PlatformId.HUB, url("/actor"), null)).isTrue();
        assertThat(client.probe(PlatformId.HUB, url("/actor"), null)).isFalse();
    }

    @Test
    void testInvalidUrlIsClientError() {
        assertThatThrownBy(() -> client.send(PlatformId.CUSTOM, "GET", "not a url", null, null))
                .isInstanceOfSatisfying(AdapterCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.CLIENT_ERROR));
    }
}
