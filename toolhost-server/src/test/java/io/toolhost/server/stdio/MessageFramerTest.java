package io.toolhost.server.stdio;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MessageFramerTest {

    private MessageFramer framer;
    private List<JsonNode> received;

    @BeforeEach
    void setUp() {
        framer = new MessageFramer("test", new JsonRpc(new ObjectMapper()));
        received = new ArrayList<>();
        framer.addListener(received::add);
    }

    @Test
    void shouldEmitOneValuePerLine() {
        framer.feed("{\"id\":1}\n{\"id\":2}\n");

        assertThat(received).extracting(node -> node.get("id").asInt()).containsExactly(1, 2);
        assertThat(framer.bufferedLength()).isZero();
    }

    @Test
    void shouldBufferPartialLineAcrossChunks() {
        framer.feed("{\"id\":");
        assertThat(received).isEmpty();
        assertThat(framer.bufferedLength()).isEqualTo(6);

        framer.feed("5}\n{\"id\"");
        assertThat(received).hasSize(1);

        framer.feed(":6}\n");
        assertThat(received).extracting(node -> node.get("id").asInt()).containsExactly(5, 6);
    }

    @Test
    void shouldHandleOneCharacterAtATime() {
        String stream = "{\"method\":\"a\"}\n{\"method\":\"b\"}\n";
        for (char c : stream.toCharArray()) {
            framer.feed(String.valueOf(c));
        }

        assertThat(received)
                .extracting(node -> node.get("method").asText())
                .containsExactly("a", "b");
    }

    @Test
    void shouldStripCarriageReturn() {
        framer.feed("{\"id\":1}\r\n");

        assertThat(received).hasSize(1);
    }

    @Test
    void shouldSkipBlankAndNonJsonLinesWithoutStopping() {
        framer.feed("\n   \nServer listening on stdio\n{broken\n{\"id\":3}\n");

        assertThat(received).extracting(node -> node.get("id").asInt()).containsExactly(3);
    }

    @Test
    void shouldKeepDeliveringWhenListenerThrows() {
        framer.addListener(
                node -> {
                    throw new IllegalStateException("boom");
                });

        framer.feed("{\"id\":1}\n{\"id\":2}\n");

        assertThat(received).hasSize(2);
    }
}
