package io.toolhost.server.stdio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class StdioConnectionTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private ScheduledExecutorService scheduler;
    private InMemoryProcess process;
    private StdioConnection connection;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        process = new InMemoryProcess();
        connection = new StdioConnection("srv", process, new JsonRpc(mapper), scheduler);
        connection.open();
    }

    @AfterEach
    void tearDown() {
        connection.close();
        process.exit(0);
        scheduler.shutdownNow();
    }

    private JsonNode nextHostMessage() throws Exception {
        String line = process.pollHostLine(WAIT);
        assertThat(line).as("host message").isNotNull();
        return mapper.readTree(line);
    }

    private void respond(long id, String resultJson) {
        process.writeLine("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"result\":" + resultJson + "}");
    }

    @Nested
    class Requests {

        @Test
        void shouldNumberRequestsFromOne() throws Exception {
            connection.request("a", null, WAIT);
            connection.request("b", null, WAIT);

            assertThat(nextHostMessage().get("id").asLong()).isEqualTo(1);
            assertThat(nextHostMessage().get("id").asLong()).isEqualTo(2);
        }

        @Test
        void shouldCorrelateOutOfOrderResponses() throws Exception {
            Uni<JsonNode> first = connection.request("first", null, WAIT);
            Uni<JsonNode> second = connection.request("second", null, WAIT);
            long firstId = nextHostMessage().get("id").asLong();
            long secondId = nextHostMessage().get("id").asLong();

            respond(secondId, "{\"n\":2}");
            respond(firstId, "{\"n\":1}");

            assertThat(first.await().atMost(WAIT).get("n").asInt()).isEqualTo(1);
            assertThat(second.await().atMost(WAIT).get("n").asInt()).isEqualTo(2);
            assertThat(connection.pendingRequestCount()).isZero();
        }

        @Test
        void shouldMapErrorResponseToRemoteError() throws Exception {
            Uni<JsonNode> result = connection.request("tools/call", Map.of("name", "x"), WAIT);
            long id = nextHostMessage().get("id").asLong();

            process.writeLine(
                    "{\"jsonrpc\":\"2.0\",\"id\":"
                            + id
                            + ",\"error\":{\"code\":-32602,\"message\":\"bad args\",\"data\":{\"field\":\"text\"}}}");

            assertThatThrownBy(() -> result.await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> {
                                assertThat(e.getKind()).isEqualTo(ErrorKind.REMOTE_ERROR);
                                assertThat(e.getRemoteCode()).isEqualTo(-32602);
                                assertThat(e.getMessage()).contains("bad args");
                                assertThat(e.getRemoteData()).isEqualTo(Map.of("field", "text"));
                            });
        }

        @Test
        void shouldTimeOutAndDiscardLateResponse() throws Exception {
            Uni<JsonNode> result = connection.request("slow", null, Duration.ofMillis(100));
            long id = nextHostMessage().get("id").asLong();

            assertThatThrownBy(() -> result.await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));
            assertThat(connection.pendingRequestCount()).isZero();

            respond(id, "{}");
            Uni<JsonNode> next = connection.request("next", null, WAIT);
            long nextId = nextHostMessage().get("id").asLong();
            respond(nextId, "{\"ok\":true}");

            assertThat(next.await().atMost(WAIT).get("ok").asBoolean()).isTrue();
            assertThat(connection.isOpen()).isTrue();
        }

        @Test
        void shouldEmitResultsOffTheReaderThread() throws Exception {
            Uni<String> thread =
                    connection
                            .request("where", null, WAIT)
                            .map(result -> Thread.currentThread().getName());
            long id = nextHostMessage().get("id").asLong();

            respond(id, "{}");

            assertThat(thread.await().atMost(WAIT)).isNotEqualTo("toolhost-srv-stdout");
        }

        @Test
        void shouldIgnoreResponsesForUnknownIds() throws Exception {
            Uni<JsonNode> result = connection.request("real", null, WAIT);
            long id = nextHostMessage().get("id").asLong();

            respond(999, "{}");
            respond(id, "{\"real\":true}");

            assertThat(result.await().atMost(WAIT).get("real").asBoolean()).isTrue();
        }

        @Test
        void shouldSurviveNoiseOnStdout() throws Exception {
            Uni<JsonNode> result = connection.request("real", null, WAIT);
            long id = nextHostMessage().get("id").asLong();

            process.writeLine("debug: warming up");
            process.writeRaw("{\"jsonrpc\":\"2.0\",\"id\":" + id);
            process.writeRaw(",\"result\":{\"v\":1}}\n");

            assertThat(result.await().atMost(WAIT).get("v").asInt()).isEqualTo(1);
        }
    }

    @Nested
    class ConnectionLoss {

        @Test
        void shouldFailAllPendingRequestsWhenProcessExits() {
            UniAssertSubscriber<JsonNode> first =
                    connection
                            .request("a", null, WAIT)
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());
            UniAssertSubscriber<JsonNode> second =
                    connection
                            .request("b", null, WAIT)
                            .subscribe()
                            .withSubscriber(UniAssertSubscriber.create());

            process.exit(1);

            first.awaitFailure(WAIT);
            second.awaitFailure(WAIT);
            assertThat(first.getFailure())
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_LOST));
            assertThat(connection.isOpen()).isFalse();
            assertThat(connection.pendingRequestCount()).isZero();
        }

        @Test
        void shouldNotifyListenerOnceOnClose() throws Exception {
            List<ToolHostException> reasons = new CopyOnWriteArrayList<>();
            CountDownLatch closed = new CountDownLatch(1);
            connection.setListener(
                    new StdioConnection.Listener() {
                        @Override
                        public void onClosed(ToolHostException reason) {
                            reasons.add(reason);
                            closed.countDown();
                        }
                    });

            process.exit(0);
            assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
            connection.close();

            assertThat(reasons).hasSize(1);
            assertThat(process.stdinClosed()).isTrue();
        }

        @Test
        void shouldRejectRequestsAfterClose() {
            connection.close();

            assertThatThrownBy(() -> connection.request("late", null, WAIT).await().atMost(WAIT))
                    .isInstanceOfSatisfying(
                            ToolHostException.class,
                            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_LOST));
        }
    }

    @Nested
    class ProviderTraffic {

        @Test
        void shouldForwardNotificationsToListener() throws Exception {
            AtomicReference<JsonRpcMessage.Notification> received = new AtomicReference<>();
            CountDownLatch delivered = new CountDownLatch(1);
            connection.setListener(
                    new StdioConnection.Listener() {
                        @Override
                        public void onNotification(JsonRpcMessage.Notification notification) {
                            received.set(notification);
                            delivered.countDown();
                        }
                    });

            process.writeLine(
                    "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}");

            assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(received.get().method()).isEqualTo("notifications/tools/list_changed");
        }

        @Test
        void shouldAnswerPingWithEmptyResult() throws Exception {
            process.writeLine("{\"jsonrpc\":\"2.0\",\"id\":\"p-1\",\"method\":\"ping\"}");

            JsonNode reply = nextHostMessage();
            assertThat(reply.get("id").asText()).isEqualTo("p-1");
            assertThat(process.writerThreads()).doesNotContain("toolhost-srv-stdout");
            assertThat(reply.get("result").isObject()).isTrue();
            assertThat(reply.get("result").size()).isZero();
        }

        @Test
        void shouldRejectOtherProviderRequests() throws Exception {
            process.writeLine(
                    "{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"sampling/createMessage\"}");

            JsonNode reply = nextHostMessage();
            assertThat(reply.get("id").asInt()).isEqualTo(9);
            assertThat(reply.get("error").get("code").asInt()).isEqualTo(-32601);
        }

        @Test
        void shouldDrainStderrWithoutAffectingProtocol() throws Exception {
            for (int i = 0; i < 1000; i++) {
                process.writeStderr("log line " + i);
            }
            Uni<JsonNode> result = connection.request("after-noise", null, WAIT);
            long id = nextHostMessage().get("id").asLong();
            respond(id, "{}");

            assertThat(result.await().atMost(WAIT).isObject()).isTrue();
        }
    }
}
