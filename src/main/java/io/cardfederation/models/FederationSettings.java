package io.cardfederation.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.cardfederation.enums.PlatformId;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.cardfederation.config.Constants.DEFAULT_SYNC_INTERVAL_MINUTES;

/**
 * Federation settings snapshot, persisted whole under a single key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FederationSettings {

    @JsonProperty("platforms")
    private Map<PlatformId, PlatformConfig> platforms = new LinkedHashMap<>();

    @JsonProperty("autoSync")
    private boolean autoSync;

    @JsonProperty("syncIntervalMinutes")
    private int syncIntervalMinutes = DEFAULT_SYNC_INTERVAL_MINUTES;

    /**
     * Built-in defaults. The editor slot points at this instance and is always enabled.
     */
    public static FederationSettings defaults(String originUrl) {
        Map<PlatformId, PlatformConfig> platforms = new EnumMap<>(PlatformId.class);
        platforms.put(PlatformId.SILLYTAVERN, PlatformConfig.disabled(PlatformId.SILLYTAVERN, "http://localhost:8000"));
        platforms.put(PlatformId.HUB, PlatformConfig.disabled(PlatformId.HUB, "https://cardshub.example.com"));
        platforms.put(PlatformId.ARCHIVE, PlatformConfig.disabled(PlatformId.ARCHIVE, "https://archive.example.com"));
        platforms.put(PlatformId.EDITOR, PlatformConfig.builder()
                .id(PlatformId.EDITOR)
                .name(PlatformId.EDITOR.getDisplayName())
                .baseUrl(originUrl)
                .enabled(true)
                .connected(true)
                .build());
        platforms.put(PlatformId.RISU, PlatformConfig.disabled(PlatformId.RISU, ""));
        platforms.put(PlatformId.CHUB, PlatformConfig.disabled(PlatformId.CHUB, ""));
        platforms.put(PlatformId.CUSTOM, PlatformConfig.disabled(PlatformId.CUSTOM, ""));
        return new FederationSettings(new LinkedHashMap<>(platforms), false, DEFAULT_SYNC_INTERVAL_MINUTES);
    }

    public PlatformConfig platform(PlatformId platform) {
        return platforms.get(platform);
    }

    /**
     * Overlay a persisted snapshot on these settings. Persisted platform entries are
     * merged field by field, so slots and fields missing from the snapshot keep their defaults.
     */
    public FederationSettings mergedWith(Persisted persisted) {
        FederationSettings merged = copy();
        if (persisted == null) {
            return merged;
        }
        if (persisted.getPlatforms() != null) {
            persisted.getPlatforms().forEach((platform, patch) -> {
                if (platform != null && patch != null) {
                    merged.platforms.put(platform, patch.applyTo(platform, merged.platforms.get(platform)));
                }
            });
        }
        if (persisted.getAutoSync() != null) {
            merged.autoSync = persisted.getAutoSync();
        }
        if (persisted.getSyncIntervalMinutes() != null && persisted.getSyncIntervalMinutes() > 0) {
            merged.syncIntervalMinutes = persisted.getSyncIntervalMinutes();
        }
        return merged;
    }

    /**
     * Copy with one platform replaced by the result of applying {@code patch}. Other entries are untouched.
     */
    public FederationSettings withPlatformPatch(PlatformId platform, PlatformConfigPatch patch) {
        FederationSettings updated = copy();
        updated.platforms.put(platform, patch.applyTo(platform, platforms.get(platform)));
        return updated;
    }

    public FederationSettings copy() {
        Map<PlatformId, PlatformConfig> platformsCopy = new LinkedHashMap<>();
        platforms.forEach((platform, config) -> platformsCopy.put(platform, config.toBuilder().build()));
        return new FederationSettings(platformsCopy, autoSync, syncIntervalMinutes);
    }

    /**
     * Copy safe to hand out over the API: platform credentials are dropped.
     */
    public FederationSettings redacted() {
        Map<PlatformId, PlatformConfig> platformsCopy = new LinkedHashMap<>();
        platforms.forEach((platform, config) -> platformsCopy.put(platform, config.redacted()));
        return new FederationSettings(platformsCopy, autoSync, syncIntervalMinutes);
    }

    /**
     * Shape of a stored snapshot: every field optional.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Persisted {
        @JsonProperty("platforms")
        private Map<PlatformId, PlatformConfigPatch> platforms;

        @JsonProperty("autoSync")
        private Boolean autoSync;

        @JsonProperty("syncIntervalMinutes")
        private Integer syncIntervalMinutes;
    }
}
