package io.cardfederation.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.http.FederationHttpClient;
import io.cardfederation.http.HttpResult;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.LocalCard;
import io.cardfederation.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.cardfederation.config.Constants.CATALOG_CARDS_PATH;

/**
 * Catalog backed by the editor's REST API.
 *
 * <p>Records have the shape {@code {"meta": {"id", "name", "updatedAt"}, "data": <card>}}.
 */
@Slf4j
public class HttpLocalCardCatalog implements LocalCardCatalog {

    private static final PlatformId PLATFORM = PlatformId.EDITOR;

    private final String baseUrl;
    private final FederationHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpLocalCardCatalog(String baseUrl, FederationHttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<LocalCard> listCards() {
        JsonNode response = httpClient.getJson(PLATFORM, baseUrl + CATALOG_CARDS_PATH, null);
        JsonNode items = response.isArray() ? response : response.path("cards");
        if (!items.isArray()) {
            throw new AdapterCallException(PLATFORM, FailureKind.INVALID_RESPONSE,
                    "Card listing is neither an array nor {cards: [...]}");
        }

        List<LocalCard> cards = new ArrayList<>();
        for (JsonNode item : items) {
            String id = recordId(item);
            if (id == null) {
                log.debug("Skipping local card record without id");
                continue;
            }
            cards.add(new LocalCard(id, recordName(item)));
        }
        log.debug("Local catalog lists {} cards", cards.size());
        return cards;
    }

    @Override
    public Optional<AdapterCard> getCard(String localId) {
        String url = cardUrl(localId);
        HttpResult result = httpClient.send(PLATFORM, "GET", url, null, null);
        if (result.isNotFound()) {
            return Optional.empty();
        }
        if (!result.isSuccess()) {
            throw new AdapterCallException(PLATFORM, FailureKind.fromHttpStatus(result.statusCode()),
                    result.statusCode(), "GET " + url + " returned HTTP " + result.statusCode(), null);
        }

        JsonNode record;
        try {
            record = objectMapper.readTree(result.body());
        } catch (Exception e) {
            throw new AdapterCallException(PLATFORM, FailureKind.INVALID_RESPONSE,
                    "Card " + localId + " is not valid JSON", e);
        }
        JsonNode card = record.has("data") ? record.get("data") : record;
        String name = recordName(record);
        return Optional.of(AdapterCard.builder()
                .id(localId)
                .name(name != null ? name : JsonUtils.cardName(card))
                .card(card)
                .updatedAt(JsonUtils.textOrNull(record.path("meta"), "updatedAt"))
                .build());
    }

    @Override
    public String saveCard(JsonNode card, String localId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("data", card);

        if (localId == null) {
            JsonNode created = httpClient.sendJson(PLATFORM, "POST", baseUrl + CATALOG_CARDS_PATH, body, null);
            String id = recordId(created);
            if (id == null) {
                throw new AdapterCallException(PLATFORM, FailureKind.INVALID_RESPONSE,
                        "Card creation response carries no id");
            }
            log.info("Created local card {}", id);
            return id;
        }

        httpClient.sendJson(PLATFORM, "PUT", cardUrl(localId), body, null);
        log.info("Updated local card {}", localId);
        return localId;
    }

    private String cardUrl(String localId) {
        return baseUrl + CATALOG_CARDS_PATH + "/" + URLEncoder.encode(localId, StandardCharsets.UTF_8);
    }

    private static String recordId(JsonNode record) {
        String id = JsonUtils.textOrNull(record.path("meta"), "id");
        return id != null ? id : JsonUtils.textOrNull(record, "id");
    }

    private static String recordName(JsonNode record) {
        String name = JsonUtils.textOrNull(record.path("meta"), "name");
        return name != null ? name : JsonUtils.cardName(record.path("data"));
    }
}
