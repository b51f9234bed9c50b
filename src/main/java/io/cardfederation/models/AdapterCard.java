package io.cardfederation.models;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardfederation.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Platform-neutral card representation exchanged between adapters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdapterCard {
    // id of the card on the platform it was read from
    private String id;
    private String name;
    private JsonNode card;
    private String updatedAt;

    public static AdapterCard of(String id, JsonNode card) {
        return AdapterCard.builder()
                .id(id)
                .name(JsonUtils.cardName(card))
                .card(card)
                .build();
    }
}
