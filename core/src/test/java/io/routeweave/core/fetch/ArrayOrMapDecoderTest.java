package io.routeweave.core.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ArrayOrMapDecoder")
class ArrayOrMapDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("array shape → items in order")
    void decodesArray() throws Exception {
        JsonNode payload = MAPPER.readTree("[{\"name\":\"a@docker\",\"rule\":\"Host(`a`)\"},{\"name\":\"b@file\"}]");

        List<ObjectNode> items = ArrayOrMapDecoder.decode(payload);

        assertThat(items).extracting(i -> i.path("name").asText()).containsExactly("a@docker", "b@file");
    }

    @Test
    @DisplayName("map shape → key injected as name when absent")
    void decodesMapAndInjectsName() throws Exception {
        JsonNode payload = MAPPER.readTree("{\"web@docker\":{\"rule\":\"Host(`w`)\"},\"api\":{\"name\":\"api@file\"}}");

        List<ObjectNode> items = ArrayOrMapDecoder.decode(payload);

        assertThat(items).extracting(i -> i.path("name").asText()).containsExactly("web@docker", "api@file");
    }

    @Test
    @DisplayName("decoded items are copies of the payload")
    void itemsAreCopies() throws Exception {
        JsonNode payload = MAPPER.readTree("{\"web\":{\"rule\":\"x\"}}");

        ArrayOrMapDecoder.decode(payload).get(0).put("rule", "changed");

        assertThat(payload.path("web").path("rule").asText()).isEqualTo("x");
        assertThat(payload.path("web").has("name")).isFalse();
    }

    @Test
    @DisplayName("null payload → empty list")
    void nullPayloadIsEmpty() throws Exception {
        assertThat(ArrayOrMapDecoder.decode(null)).isEmpty();
        assertThat(ArrayOrMapDecoder.decode(MAPPER.readTree("null"))).isEmpty();
    }

    @Test
    @DisplayName("scalar payload → UpstreamDecodeException")
    void scalarPayloadRejected() throws Exception {
        JsonNode payload = MAPPER.readTree("\"oops\"");

        assertThatThrownBy(() -> ArrayOrMapDecoder.decode(payload))
                .isInstanceOf(UpstreamDecodeException.class)
                .hasMessageContaining("Failed to parse as array or map");
    }

    @Test
    @DisplayName("array of scalars → UpstreamDecodeException")
    void arrayOfScalarsRejected() throws Exception {
        JsonNode payload = MAPPER.readTree("[1,2]");

        assertThatThrownBy(() -> ArrayOrMapDecoder.decode(payload)).isInstanceOf(UpstreamDecodeException.class);
    }
}
