package io.cardfederation.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.http.FederationHttpClient;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.RemoteCardEntry;
import io.cardfederation.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static io.cardfederation.config.Constants.HEADER_API_KEY;
import static io.cardfederation.config.Constants.HEADER_AUTHORIZATION;

/**
 * Adapter for platforms speaking the federation inbox/outbox protocol over HTTP.
 *
 * <ul>
 *   <li>push: {@code POST {create}} for new cards, {@code PUT {update}/{id}} for known ones; answer {@code {"id": ...}}</li>
 *   <li>pull: {@code GET {get}/{id}} returns the card document</li>
 *   <li>list: {@code GET {list}}</li>
 *   <li>probe: {@code GET {health}} answering 2xx</li>
 * </ul>
 */
@Slf4j
public class HttpPlatformAdapter implements PlatformAdapter {

    private final PlatformId platform;
    private final String displayName;
    private final String baseUrl;
    private final PlatformEndpoints endpoints;
    private final Map<String, String> authHeaders;
    private final FederationHttpClient httpClient;

    public HttpPlatformAdapter(PlatformId platform, String displayName, String baseUrl, String apiKey,
                               PlatformEndpoints endpoints, FederationHttpClient httpClient) {
        this.platform = platform;
        this.displayName = displayName;
        this.baseUrl = baseUrl;
        this.endpoints = endpoints;
        this.authHeaders = buildAuthHeaders(endpoints.getAuthMode(), apiKey);
        this.httpClient = httpClient;
    }

    @Override
    public PlatformId getPlatform() {
        return platform;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public boolean isAvailable() {
        boolean available = httpClient.probe(platform, baseUrl + endpoints.getHealth(), authHeaders);
        log.debug("[Platform: {}] probe of {} -> {}", platform, baseUrl + endpoints.getHealth(), available);
        return available;
    }

    @Override
    public String pushCard(AdapterCard card, String existingRemoteId) {
        JsonNode response;
        if (existingRemoteId != null) {
            response = httpClient.sendJson(platform, "PUT",
                    baseUrl + endpoints.getUpdate() + "/" + encode(existingRemoteId), card.getCard(), authHeaders);
        } else {
            response = httpClient.sendJson(platform, "POST",
                    baseUrl + endpoints.getCreate(), card.getCard(), authHeaders);
        }

        String remoteId = JsonUtils.textOrNull(response, "id");
        if (remoteId == null) {
            if (existingRemoteId == null) {
                throw new AdapterCallException(platform, FailureKind.INVALID_RESPONSE,
                        "Inbox answered without a card id");
            }
            remoteId = existingRemoteId;
        }
        log.info("[Platform: {}] pushed card '{}' as {}", platform, card.getName(), remoteId);
        return remoteId;
    }

    @Override
    public AdapterCard pullCard(String remoteId) {
        JsonNode card = httpClient.getJson(platform, baseUrl + endpoints.getGet() + "/" + encode(remoteId), authHeaders);
        if (!card.isObject()) {
            throw new AdapterCallException(platform, FailureKind.INVALID_RESPONSE,
                    "Card " + remoteId + " is not a JSON object");
        }
        return AdapterCard.of(remoteId, card);
    }

    @Override
    public List<RemoteCardEntry> listCards() {
        JsonNode response = httpClient.getJson(platform, baseUrl + endpoints.getList(), authHeaders);
        List<RemoteCardEntry> entries = OutboxParser.parse(platform, response);
        log.debug("[Platform: {}] outbox lists {} cards", platform, entries.size());
        return entries;
    }

    private static Map<String, String> buildAuthHeaders(PlatformEndpoints.AuthMode authMode, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Collections.emptyMap();
        }
        switch (authMode) {
            case BEARER:
                return Map.of(HEADER_AUTHORIZATION, "Bearer " + apiKey);
            case API_KEY:
                return Map.of(HEADER_API_KEY, apiKey);
            default:
                return Collections.emptyMap();
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
