package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.cardfederation.config.FederationConfig;
import io.cardfederation.enums.PlatformId;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a {@link PlatformConfig}. Only non-null fields overwrite the target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlatformConfigPatch {

    @JsonProperty("name")
    private String name;

    @JsonProperty("baseUrl")
    private String baseUrl;

    @JsonProperty("apiKey")
    private String apiKey;

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("connected")
    private Boolean connected;

    @JsonProperty("lastChecked")
    private Instant lastChecked;

    public static PlatformConfigPatch enabled(boolean enabled) {
        return PlatformConfigPatch.builder().enabled(enabled).build();
    }

    public static PlatformConfigPatch connectionResult(boolean connected, Instant checkedAt) {
        return PlatformConfigPatch.builder().connected(connected).lastChecked(checkedAt).build();
    }

    public static PlatformConfigPatch disconnected() {
        return PlatformConfigPatch.builder().enabled(false).connected(false).build();
    }

    /**
     * Merge this patch over {@code base}, returning a new config. A null base starts from a
     * disabled config for the platform. Base URLs are normalized.
     */
    public PlatformConfig applyTo(PlatformId platform, PlatformConfig base) {
        PlatformConfig.PlatformConfigBuilder merged = base != null
                ? base.toBuilder()
                : PlatformConfig.disabled(platform, "").toBuilder();
        merged.id(platform);
        if (name != null) {
            merged.name(name);
        }
        if (baseUrl != null) {
            merged.baseUrl(FederationConfig.normalizeUrl(baseUrl));
        }
        if (apiKey != null) {
            merged.apiKey(apiKey.isBlank() ? null : apiKey);
        }
        if (enabled != null) {
            merged.enabled(enabled);
        }
        if (connected != null) {
            merged.connected(connected);
        }
        if (lastChecked != null) {
            merged.lastChecked(lastChecked);
        }
        return merged.build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return name == null && baseUrl == null && apiKey == null
                && enabled == null && connected == null && lastChecked == null;
    }
}
