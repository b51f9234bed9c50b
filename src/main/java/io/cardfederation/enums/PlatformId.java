package io.cardfederation.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Platforms that can take part in card federation.
 *
 * <ul>
 *   <li><strong>EDITOR</strong> - this instance, always registered</li>
 *   <li><strong>SILLYTAVERN</strong> - chat client reached through the CForge federation plugin</li>
 *   <li><strong>HUB</strong> - public card hub</li>
 *   <li><strong>ARCHIVE</strong> - personal archive service</li>
 *   <li><strong>RISU</strong>, <strong>CHUB</strong>, <strong>CUSTOM</strong> - third-party slots</li>
 * </ul>
 */
public enum PlatformId {
    EDITOR("editor", "Character Architect"),
    SILLYTAVERN("sillytavern", "SillyTavern"),
    HUB("hub", "CardsHub"),
    ARCHIVE("archive", "Character Archive"),
    RISU("risu", "RisuAI"),
    CHUB("chub", "Chub.ai"),
    CUSTOM("custom", "Custom Platform");

    private final String id;
    private final String displayName;

    PlatformId(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * True for the platform that represents this instance.
     */
    public boolean isLocal() {
        return this == EDITOR;
    }

    @JsonCreator
    public static PlatformId fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Platform id cannot be null");
        }
        String normalized = value.trim();
        for (PlatformId platform : values()) {
            if (platform.id.equalsIgnoreCase(normalized) || platform.name().equalsIgnoreCase(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
