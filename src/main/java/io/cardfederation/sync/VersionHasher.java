package io.cardfederation.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;

import java.nio.charset.StandardCharsets;

/**
 * Content hash of a card document over its canonical JSON form (object keys sorted).
 * SHA-256 when secure hashing is configured, Murmur3-128 otherwise.
 */
public class VersionHasher {

    private final ObjectMapper canonicalMapper;
    private final HashFunction hashFunction;

    public VersionHasher(ObjectMapper objectMapper, boolean secureHashing) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.hashFunction = secureHashing ? Hashing.sha256() : Hashing.murmur3_128();
    }

    /**
     * @param source platform the card was read from, blamed when the document cannot be serialized
     * @throws AdapterCallException with {@link FailureKind#INVALID_RESPONSE} for documents that have no JSON form
     */
    public String hash(PlatformId source, JsonNode card) {
        try {
            // trees keep insertion order, maps can be sorted
            Object plain = canonicalMapper.treeToValue(card, Object.class);
            String canonical = canonicalMapper.writeValueAsString(plain);
            return hashFunction.hashString(canonical, StandardCharsets.UTF_8).toString();
        } catch (Exception e) {
            throw new AdapterCallException(source, FailureKind.INVALID_RESPONSE,
                    "Card document cannot be serialized: " + e.getMessage(), e);
        }
    }
}
