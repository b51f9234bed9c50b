package io.cardfederation.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import io.cardfederation.models.AdapterCard;
import io.cardfederation.models.LocalCard;

import java.util.List;
import java.util.Optional;

/**
 * The editor's own card collection. Federation reads and writes local cards only through this seam.
 */
public interface LocalCardCatalog {

    List<LocalCard> listCards();

    Optional<AdapterCard> getCard(String localId);

    /**
     * Create or replace a local card.
     *
     * @param card card document
     * @param localId id to write to, or null to create a new card
     * @return id of the stored card
     */
    String saveCard(JsonNode card, String localId);
}
