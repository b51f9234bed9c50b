package io.cardfederation.adapters;

import io.cardfederation.catalog.LocalCardCatalog;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.ConfigurationException;
import io.cardfederation.http.FederationHttpClient;
import io.cardfederation.models.PlatformConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds adapters from platform configuration. This is the only place that knows which
 * protocol profile each platform speaks.
 */
@Slf4j
public class PlatformAdapterFactory {

    private final LocalCardCatalog catalog;
    private final FederationHttpClient httpClient;
    private final Map<PlatformId, PlatformEndpoints> profiles = new EnumMap<>(PlatformId.class);

    public PlatformAdapterFactory(LocalCardCatalog catalog, FederationHttpClient httpClient) {
        this.catalog = catalog;
        this.httpClient = httpClient;
        profiles.put(PlatformId.SILLYTAVERN, PlatformEndpoints.sillyTavern());
        profiles.put(PlatformId.HUB, PlatformEndpoints.standard(PlatformEndpoints.AuthMode.BEARER));
        profiles.put(PlatformId.ARCHIVE, PlatformEndpoints.standard(PlatformEndpoints.AuthMode.API_KEY));
        profiles.put(PlatformId.RISU, PlatformEndpoints.standard(PlatformEndpoints.AuthMode.API_KEY));
        profiles.put(PlatformId.CHUB, PlatformEndpoints.standard(PlatformEndpoints.AuthMode.API_KEY));
        profiles.put(PlatformId.CUSTOM, PlatformEndpoints.standard(PlatformEndpoints.AuthMode.API_KEY));
    }

    public PlatformAdapter localEditor() {
        return new LocalEditorAdapter(catalog);
    }

    /**
     * Adapter for {@code platform} configured by {@code config}.
     *
     * @throws ConfigurationException when the platform has no base URL
     */
    public PlatformAdapter create(PlatformId platform, PlatformConfig config) {
        if (platform.isLocal()) {
            return localEditor();
        }
        if (config == null || !config.hasBaseUrl()) {
            throw new ConfigurationException("Platform " + platform + " has no base URL configured");
        }
        PlatformEndpoints endpoints = profiles.get(platform);
        if (endpoints == null) {
            throw new ConfigurationException("No adapter profile for platform " + platform);
        }

        String displayName = config.getName() != null && !config.getName().isBlank()
                ? config.getName() : platform.getDisplayName();
        log.debug("[Platform: {}] creating adapter for {}", platform, config.getBaseUrl());
        return new HttpPlatformAdapter(platform, displayName, config.getBaseUrl(), config.getApiKey(),
                endpoints, httpClient);
    }
}
