package io.toolhost.server.host;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolhost.core.HostConfig;
import io.toolhost.core.event.HostEvent;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.core.server.ServerSnapshot;
import io.toolhost.core.server.ServerStatus;
import io.toolhost.core.tool.ToolDescriptor;
import io.toolhost.server.stdio.InMemoryLauncher;
import io.toolhost.server.stdio.InMemoryProcess;
import io.toolhost.server.stdio.JsonRpc;
import io.toolhost.server.stdio.ScriptedToolProvider;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ServerSupervisorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ScheduledExecutorService scheduler;
    private InMemoryLauncher launcher;
    private RecordingListener events;
    private HostConfig hostConfig;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        launcher = new InMemoryLauncher();
        events = new RecordingListener();
        hostConfig =
                HostConfig.builder()
                        .handshakeTimeout(Duration.ofMillis(500))
                        .toolCallTimeout(Duration.ofMillis(500))
                        .startupTimeout(Duration.ofSeconds(2))
                        .stopGracePeriod(Duration.ofMillis(200))
                        .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ServerSupervisor supervisor(String command) {
        return new ServerSupervisor(
                ServerConfig.of("srv", command),
                launcher,
                new JsonRpc(new ObjectMapper()),
                hostConfig,
                scheduler,
                events);
    }

    @Nested
    class Start {

        @Test
        void shouldReachRunningWithDiscoveredTools() {
            launcher.script("echo-server", ScriptedToolProvider.withTools("echo", "ping"));
            ServerSupervisor supervisor = supervisor("echo-server");

            ServerSnapshot snapshot = supervisor.start().await().atMost(WAIT);

            assertThat(snapshot.status()).isEqualTo(ServerStatus.RUNNING);
            assertThat(snapshot.toolCount()).isEqualTo(2);
            assertThat(snapshot.pid()).isEqualTo(4242L);
            assertThat(snapshot.startedAt()).isNotNull();
            assertThat(snapshot.serverInfo()).containsEntry("name", "scripted");
            assertThat(supervisor.tools()).extracting(ToolDescriptor::name).contains("echo");
            assertThat(events.types())
                    .containsExactly("server.starting", "tools.discovered", "server.started");
        }

        @Test
        void shouldBeNoOpWhenAlreadyRunning() {
            launcher.script("echo-server", ScriptedToolProvider.withTools("echo"));
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            supervisor.start().await().atMost(WAIT);

            assertThat(launcher.launched()).hasSize(1);
        }

        @Test
        void shouldEnterErrorWhenCommandCannotBeSpawned() {
            ServerSupervisor supervisor = supervisor("/nonexistent/binary");

            assertThatThrownBy(() -> supervisor.start().await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SPAWN_FAILURE));

            ServerSnapshot snapshot = supervisor.snapshot();
            assertThat(snapshot.status()).isEqualTo(ServerStatus.ERROR);
            assertThat(snapshot.lastError()).contains("Cannot run program");
            assertThat(supervisor.tools()).isEmpty();
            assertThat(events.types()).containsExactly("server.starting", "server.error");
        }

        @Test
        void shouldTerminateProcessWhenHandshakeTimesOut() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools().silentInitialize();
            launcher.script("mute", provider);
            ServerSupervisor supervisor = supervisor("mute");

            assertThatThrownBy(() -> supervisor.start().await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));

            assertThat(supervisor.status()).isEqualTo(ServerStatus.ERROR);
            assertThat(supervisor.snapshot().lastError()).contains("timed out");
            assertThat(provider.lastProcess().onExit()).succeedsWithin(WAIT);
        }

        @Test
        void shouldApplyOverallStartupTimeout() {
            hostConfig.setHandshakeTimeout(Duration.ofSeconds(10));
            hostConfig.setStartupTimeout(Duration.ofMillis(300));
            launcher.script("mute", ScriptedToolProvider.withTools().silentInitialize());
            ServerSupervisor supervisor = supervisor("mute");

            assertThatThrownBy(() -> supervisor.start().await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> {
                                assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT);
                                assertThat(e.getMessage()).contains("did not become ready");
                            });
            assertThat(supervisor.status()).isEqualTo(ServerStatus.ERROR);
        }

        @Test
        void shouldClearLastErrorOnRestart() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            ServerSupervisor supervisor = supervisor("late-binary");
            assertThatThrownBy(() -> supervisor.start().await().atMost(WAIT))
                    .isInstanceOf(ToolHostException.class);

            launcher.script("late-binary", provider);
            ServerSnapshot snapshot = supervisor.start().await().atMost(WAIT);

            assertThat(snapshot.status()).isEqualTo(ServerStatus.RUNNING);
            assertThat(snapshot.lastError()).isNull();
        }
    }

    @Nested
    class Stop {

        @Test
        void shouldStopGracefully() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("echo-server", provider);
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            ServerSnapshot snapshot = supervisor.stop().await().atMost(WAIT);

            InMemoryProcess process = provider.lastProcess();
            assertThat(snapshot.status()).isEqualTo(ServerStatus.STOPPED);
            assertThat(snapshot.toolCount()).isZero();
            assertThat(snapshot.pid()).isNull();
            assertThat(process.isAlive()).isFalse();
            assertThat(process.stdinClosed()).isTrue();
            assertThat(process.forcedDestroyCalls()).isZero();
            assertThat(events.types()).endsWith("server.stopped");
        }

        @Test
        void shouldKillProcessThatIgnoresTermination() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("stubborn", provider);
            ServerSupervisor supervisor = supervisor("stubborn");
            supervisor.start().await().atMost(WAIT);
            provider.lastProcess().ignoreTerminate();

            ServerSnapshot snapshot = supervisor.stop().await().atMost(WAIT);

            assertThat(snapshot.status()).isEqualTo(ServerStatus.STOPPED);
            assertThat(provider.lastProcess().destroyCalls()).isEqualTo(1);
            assertThat(provider.lastProcess().forcedDestroyCalls()).isEqualTo(1);
            assertThat(provider.lastProcess().isAlive()).isFalse();
        }

        @Test
        void shouldReportStoppedWhileProcessShutsDown() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("stubborn", provider);
            ServerSupervisor supervisor = supervisor("stubborn");
            supervisor.start().await().atMost(WAIT);
            InMemoryProcess first = provider.lastProcess();
            first.ignoreTerminate();

            CompletableFuture<ServerSnapshot> stopping =
                    supervisor.stop().subscribe().asCompletionStage();

            assertThat(first.isAlive()).isTrue();
            assertThat(supervisor.snapshot().status()).isEqualTo(ServerStatus.STOPPED);
            assertThat(supervisor.snapshot().toolCount()).isZero();

            ServerSnapshot restarted = supervisor.start().await().atMost(WAIT);
            assertThat(restarted.status()).isEqualTo(ServerStatus.RUNNING);
            assertThat(provider.processes()).hasSize(2);

            assertThat(stopping).succeedsWithin(WAIT);
            assertThat(first.isAlive()).isFalse();
            assertThat(provider.lastProcess().isAlive()).isTrue();
            assertThat(supervisor.status()).isEqualTo(ServerStatus.RUNNING);
        }

        @Test
        void shouldBeNoOpWhenAlreadyStopped() {
            ServerSupervisor supervisor = supervisor("anything");

            ServerSnapshot snapshot = supervisor.stop().await().atMost(WAIT);

            assertThat(snapshot.status()).isEqualTo(ServerStatus.STOPPED);
            assertThat(events.events()).isEmpty();
        }

        @Test
        void shouldKeepLastErrorAfterStop() {
            ServerSupervisor supervisor = supervisor("missing");
            assertThatThrownBy(() -> supervisor.start().await().atMost(WAIT))
                    .isInstanceOf(ToolHostException.class);

            ServerSnapshot snapshot = supervisor.stop().await().atMost(WAIT);

            assertThat(snapshot.status()).isEqualTo(ServerStatus.STOPPED);
            assertThat(snapshot.lastError()).isNotBlank();
        }
    }

    @Nested
    class Execute {

        @Test
        void shouldReturnFullToolResult() {
            launcher.script("echo-server", ScriptedToolProvider.withTools("echo"));
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            JsonNode result =
                    supervisor.execute("echo", Map.of("text", "hello")).await().atMost(WAIT);

            assertThat(result.get("content").get(0).get("text").asText())
                    .isEqualTo("{\"text\":\"hello\"}");
        }

        @Test
        void shouldRejectUnknownToolWithoutSending() {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("echo-server", provider);
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            assertThatThrownBy(() -> supervisor.execute("nope", Map.of()).await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TOOL_NOT_FOUND));
            assertThat(provider.receivedMethods()).doesNotContain("tools/call");
        }

        @Test
        void shouldRejectWhenNotRunning() {
            ServerSupervisor supervisor = supervisor("echo-server");

            assertThatThrownBy(() -> supervisor.execute("echo", Map.of()).await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.NOT_RUNNING));
        }

        @Test
        void shouldTimeOutSlowToolAndStayRunning() {
            launcher.script(
                    "echo-server", ScriptedToolProvider.withTools("echo", "slow").silentTool("slow"));
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            assertThatThrownBy(() -> supervisor.execute("slow", Map.of()).await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));

            assertThat(supervisor.status()).isEqualTo(ServerStatus.RUNNING);
            assertThat(supervisor.execute("echo", Map.of()).await().atMost(WAIT)).isNotNull();
        }
    }

    @Nested
    class RuntimeFailures {

        @Test
        void shouldEnterErrorWhenProcessExitsUnexpectedly() throws Exception {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("echo-server", provider);
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);

            provider.lastProcess().exit(3);

            HostEvent.ServerFailed failed = events.await(HostEvent.ServerFailed.class, WAIT);
            assertThat(failed.serverId()).isEqualTo("srv");
            ServerSnapshot snapshot = supervisor.snapshot();
            assertThat(snapshot.status()).isEqualTo(ServerStatus.ERROR);
            assertThat(snapshot.lastError()).isNotBlank();
            assertThat(snapshot.toolCount()).isZero();
            assertThat(events.count(HostEvent.ServerFailed.class)).isEqualTo(1);
        }

        @Test
        void shouldRediscoverToolsOnListChanged() throws Exception {
            ScriptedToolProvider provider = ScriptedToolProvider.withTools("echo");
            launcher.script("echo-server", provider);
            ServerSupervisor supervisor = supervisor("echo-server");
            supervisor.start().await().atMost(WAIT);
            events.clear();

            provider.replaceTools("echo", "reverse");
            provider.lastProcess()
                    .writeLine(
                            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}");

            HostEvent.ToolsDiscovered discovered =
                    events.await(HostEvent.ToolsDiscovered.class, WAIT);
            assertThat(discovered.toolNames()).containsExactly("echo", "reverse");
            assertThat(supervisor.tools())
                    .extracting(ToolDescriptor::name)
                    .containsExactly("echo", "reverse");
            assertThat(provider.lastProcess().writerThreads())
                    .doesNotContain("toolhost-srv-stdout");
        }
    }
}
