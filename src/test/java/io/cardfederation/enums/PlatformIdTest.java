package io.cardfederation.enums;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfederation.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformIdTest {

    private final ObjectMapper objectMapper = JsonUtils.createObjectMapper();

    @Test
    void testFromId_AcceptsWireIdAndEnumNameIgnoringCase() {
        assertThat(PlatformId.fromId("sillytavern")).isEqualTo(PlatformId.SILLYTAVERN);
        assertThat(PlatformId.fromId(" HUB ")).isEqualTo(PlatformId.HUB);
        assertThat(PlatformId.fromId("Archive")).isEqualTo(PlatformId.ARCHIVE);
    }

    @Test
    void testFromId_UnknownPlatformRejected() {
        assertThatThrownBy(() -> PlatformId.fromId("myspace"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown platform");
        assertThatThrownBy(() -> PlatformId.fromId(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testOnlyEditorIsLocal() {
        for (PlatformId platform : PlatformId.values()) {
            assertThat(platform.isLocal()).isEqualTo(platform == PlatformId.EDITOR);
        }
    }

    @Test
    void testSerialization_LowercaseValuesAndMapKeys() throws Exception {
        Map<PlatformId, String> ids = new EnumMap<>(PlatformId.class);
        ids.put(PlatformId.SILLYTAVERN, "42");

        String json = objectMapper.writeValueAsString(Map.of("platform", PlatformId.HUB, "ids", ids));

        assertThat(json).contains("\"platform\":\"hub\"");
        assertThat(json).contains("\"sillytavern\":\"42\"");
        assertThat(objectMapper.readValue("\"chub\"", PlatformId.class)).isEqualTo(PlatformId.CHUB);
    }
}
