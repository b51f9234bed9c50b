package io.cardfederation.adapters;

import lombok.Builder;
import lombok.Value;

import static io.cardfederation.config.Constants.ENDPOINT_ACTOR;
import static io.cardfederation.config.Constants.ENDPOINT_INBOX;
import static io.cardfederation.config.Constants.ENDPOINT_OUTBOX;
import static io.cardfederation.config.Constants.FEDERATION_BASE;
import static io.cardfederation.config.Constants.SILLYTAVERN_FEDERATION_BASE;

/**
 * Path layout and authentication scheme of a federation HTTP API.
 */
@Value
@Builder
public class PlatformEndpoints {

    String list;
    String get;
    String create;
    String update;
    String health;
    AuthMode authMode;

    public enum AuthMode {
        NONE,
        BEARER,
        API_KEY
    }

    /**
     * SillyTavern exposes federation through the CForge plugin and has no authentication.
     */
    public static PlatformEndpoints sillyTavern() {
        return forBase(SILLYTAVERN_FEDERATION_BASE, AuthMode.NONE);
    }

    public static PlatformEndpoints standard(AuthMode authMode) {
        return forBase(FEDERATION_BASE, authMode);
    }

    private static PlatformEndpoints forBase(String base, AuthMode authMode) {
        return PlatformEndpoints.builder()
                .list(base + ENDPOINT_OUTBOX)
                .get(base + ENDPOINT_OUTBOX)
                .create(base + ENDPOINT_INBOX)
                .update(base + ENDPOINT_INBOX)
                .health(base + ENDPOINT_ACTOR)
                .authMode(authMode)
                .build();
    }
}
