package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.cardfederation.enums.PlatformId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Connection settings of one platform.
 * {@code enabled} asks for an adapter to be registered; {@code connected} caches the last probe result.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlatformConfig {

    @JsonProperty("id")
    private PlatformId id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("baseUrl")
    private String baseUrl;

    @JsonProperty("apiKey")
    private String apiKey;

    @JsonProperty("enabled")
    private boolean enabled;

    @JsonProperty("connected")
    private boolean connected;

    @JsonProperty("lastChecked")
    private Instant lastChecked;

    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * Copy without the API key.
     */
    public PlatformConfig redacted() {
        return toBuilder().apiKey(null).build();
    }

    public static PlatformConfig disabled(PlatformId id, String baseUrl) {
        return PlatformConfig.builder()
                .id(id)
                .name(id.getDisplayName())
                .baseUrl(baseUrl)
                .enabled(false)
                .connected(false)
                .build();
    }
}
