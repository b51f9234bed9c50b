package io.cardfederation.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardfederation.enums.FailureKind;
import io.cardfederation.enums.PlatformId;
import io.cardfederation.exceptions.AdapterCallException;
import io.cardfederation.models.RemoteCardEntry;
import io.cardfederation.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboxParserTest {

    private final ObjectMapper objectMapper = JsonUtils.createObjectMapper();

    @Test
    void testParse_BareArray() throws Exception {
        List<RemoteCardEntry> entries = OutboxParser.parse(PlatformId.HUB,
                objectMapper.readTree("[{\"id\":\"1\",\"name\":\"Aria\"},{\"id\":2,\"name\":\"Echo\"}]"));

        assertThat(entries).containsExactly(new RemoteCardEntry("1", "Aria"), new RemoteCardEntry("2", "Echo"));
    }

    @Test
    void testParse_CardsAndItemsWrappers() throws Exception {
        assertThat(OutboxParser.parse(PlatformId.HUB,
                objectMapper.readTree("{\"cards\":[{\"id\":\"1\",\"name\":\"Aria\"}]}")))
                .containsExactly(new RemoteCardEntry("1", "Aria"));
        assertThat(OutboxParser.parse(PlatformId.HUB,
                objectMapper.readTree("{\"items\":[{\"id\":\"9\",\"name\":\"Nova\"}],\"total\":1}")))
                .containsExactly(new RemoteCardEntry("9", "Nova"));
    }

    @Test
    void testParse_NameFallsBackToEmbeddedCard() throws Exception {
        List<RemoteCardEntry> entries = OutboxParser.parse(PlatformId.SILLYTAVERN, objectMapper.readTree(
                "[{\"id\":\"42\",\"card\":{\"spec\":\"chara_card_v3\",\"data\":{\"name\":\"Aria\"}}}]"));

        assertThat(entries).containsExactly(new RemoteCardEntry("42", "Aria"));
    }

    @Test
    void testParse_DropsEntriesWithoutId() throws Exception {
        List<RemoteCardEntry> entries = OutboxParser.parse(PlatformId.HUB,
                objectMapper.readTree("[{\"name\":\"Ghost\"},{\"id\":\"\",\"name\":\"Blank\"},{\"id\":\"3\"}]"));

        assertThat(entries).containsExactly(new RemoteCardEntry("3", null));
    }

    @Test
    void testParse_UnknownShapeIsInvalidResponse() throws Exception {
        assertThatThrownBy(() -> OutboxParser.parse(PlatformId.HUB, objectMapper.readTree("{\"error\":\"nope\"}")))
                .isInstanceOfSatisfying(AdapterCallException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.INVALID_RESPONSE));
    }
}
