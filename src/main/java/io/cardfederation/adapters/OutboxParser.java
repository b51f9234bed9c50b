package io.cardfederation.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.models.RemoteCardEntry;
import io.cardfederation.util.JsonUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes outbox listings. Platforms answer with a bare array, {@code {"cards": [...]}}
 * or {@code {"items": [...]}}; entries without an id are dropped.
 */
public final class OutboxParser {

    private OutboxParser() {
        // Utility class
    }

    public static List<RemoteCardEntry> parse(PlatformId platform, JsonNode response) {
        JsonNode items = locateItems(response);
        if (items == null) {
            throw new AdapterCallException(platform, FailureKind.INVALID_RESPONSE,
                    "Outbox response is not an array, {cards} or {items} document");
        }

        List<RemoteCardEntry> entries = new ArrayList<>();
        for (JsonNode item : items) {
            String id = JsonUtils.textOrNull(item, "id");
            if (id == null) {
                continue;
            }
            String name = JsonUtils.textOrNull(item, "name");
            if (name == null) {
                name = JsonUtils.cardName(item.get("card"));
            }
            entries.add(new RemoteCardEntry(id, name));
        }
        return entries;
    }

    private static JsonNode locateItems(JsonNode response) {
        if (response == null) {
            return null;
        }
        if (response.isArray()) {
            return response;
        }
        if (response.path("cards").isArray()) {
            return response.get("cards");
        }
        if (response.path("items").isArray()) {
            return response.get("items");
        }
        return null;
    }
}
