package io.toolhost.core.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class HostEventTest {

    @Test
    void shouldExposeStableTypeNames() {
        assertThat(HostEvent.ServerAdded.now("echo", "Echo").type()).isEqualTo("server.added");
        assertThat(HostEvent.ServerStarting.now("echo").type()).isEqualTo("server.starting");
        assertThat(HostEvent.ServerStarted.now("echo", 12L, 1).type())
                .isEqualTo("server.started");
        assertThat(HostEvent.ServerStopped.now("echo").type()).isEqualTo("server.stopped");
        assertThat(HostEvent.ServerFailed.now("echo", "boom").type()).isEqualTo("server.error");
        assertThat(HostEvent.ServerRemoved.now("echo").type()).isEqualTo("server.removed");
        assertThat(HostEvent.ToolsDiscovered.now("echo", List.of()).type())
                .isEqualTo("tools.discovered");
    }

    @Test
    void shouldCopyToolNames() {
        List<String> names = new ArrayList<>(List.of("ping"));
        HostEvent.ToolsDiscovered event = HostEvent.ToolsDiscovered.now("echo", names);

        names.add("echo");

        assertThat(event.toolNames()).containsExactly("ping");
        assertThat(event.serverId()).isEqualTo("echo");
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void shouldDeliverToLambdaListener() {
        List<HostEvent> received = new ArrayList<>();
        HostEventListener listener = received::add;

        listener.onEvent(HostEvent.ServerStopped.now("echo"));

        assertThat(received).singleElement().isInstanceOf(HostEvent.ServerStopped.class);
    }
}
