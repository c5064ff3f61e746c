package io.toolhost.server.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import io.toolhost.core.HostConfig;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.tool.ToolDescriptor;
import io.toolhost.server.validation.LogSanitizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/// Initialization and tool discovery sequence for one connection.
///
/// ### State Machine
/// ```
/// NOT_STARTED -> INITIALIZING -> INITIALIZED -> DISCOVERING -> READY
///        \____________\______________\______________\______-> FAILED
/// ```
///
/// 1. `initialize` request with protocol version, client capabilities and
///    client info; the result must be a JSON object
/// 2. `notifications/initialized` notification, no reply
/// 3. `tools/list` requests, following `nextCursor` until the provider stops
///    returning one
/// 4. READY with the discovered tools
///
/// Zero tools is a valid outcome. Re-discovery ({@link #discover()}) repeats
/// steps 3 and 4 only; if it fails the protocol returns to READY and the
/// caller keeps its previous tools.
///
/// Failures keep their kind when it is TIMEOUT or CONNECTION_LOST; any other
/// failure during the handshake is reported as HANDSHAKE_FAILURE.
public class HandshakeProtocol {

    private static final Logger LOG = Logger.getLogger(HandshakeProtocol.class);

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "notifications/initialized";
    public static final String TOOLS_LIST = "tools/list";
    public static final String TOOLS_CALL = "tools/call";
    public static final String TOOLS_LIST_CHANGED = "notifications/tools/list_changed";

    /// Upper bound on `tools/list` pages, guards against a provider that cycles cursors.
    static final int MAX_PAGES = 100;

    public enum State {
        NOT_STARTED,
        INITIALIZING,
        INITIALIZED,
        DISCOVERING,
        READY,
        FAILED
    }

    /// Outcome of a completed handshake.
    ///
    /// @param capabilities capabilities declared by the provider, never null
    /// @param serverInfo provider's self-description, never null
    /// @param protocolVersion protocol version the provider answered with, never null
    /// @param tools discovered tools, never null
    public record HandshakeResult(
            Map<String, Object> capabilities,
            Map<String, Object> serverInfo,
            String protocolVersion,
            List<ToolDescriptor> tools) {

        public HandshakeResult {
            capabilities = capabilities != null ? capabilities : Map.of();
            serverInfo = serverInfo != null ? serverInfo : Map.of();
            tools = tools != null ? List.copyOf(tools) : List.of();
        }
    }

    private final StdioConnection connection;
    private final JsonRpc jsonRpc;
    private final HostConfig config;
    private volatile State state = State.NOT_STARTED;

    public HandshakeProtocol(StdioConnection connection, JsonRpc jsonRpc, HostConfig config) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Runs the full sequence. Nothing is sent until the returned Uni is subscribed.
    ///
    /// @return the handshake outcome
    /// @throws IllegalStateException (through the Uni) if the handshake was already attempted
    public Uni<HandshakeResult> perform() {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            synchronized (this) {
                                if (state != State.NOT_STARTED) {
                                    return Uni.createFrom()
                                            .failure(
                                                    new IllegalStateException(
                                                            "Handshake already attempted, state: "
                                                                    + state));
                                }
                                state = State.INITIALIZING;
                            }
                            LOG.debugv("[{0}] Sending initialize", connection.serverId());
                            return connection
                                    .request(
                                            INITIALIZE,
                                            initializeParams(),
                                            config.getHandshakeTimeout())
                                    .map(this::acceptInitializeResult)
                                    .flatMap(this::completeInitialization);
                        })
                .onFailure()
                .transform(this::asHandshakeFailure)
                .onFailure(ToolHostException.class)
                .invoke(error -> state = State.FAILED);
    }

    /// Re-runs tool discovery on a READY connection.
    ///
    /// @return the newly discovered tools
    public Uni<List<ToolDescriptor>> discover() {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            synchronized (this) {
                                if (state != State.READY) {
                                    return Uni.createFrom()
                                            .failure(
                                                    ToolHostException.notRunning(
                                                            connection.serverId()));
                                }
                                state = State.DISCOVERING;
                            }
                            return listTools(null, new ArrayList<>(), 0)
                                    .onItem()
                                    .invoke(tools -> state = State.READY)
                                    .onFailure()
                                    .invoke(error -> state = State.READY);
                        });
    }

    /// Returns the current state.
    ///
    /// @return state, never null
    public State state() {
        return state;
    }

    private Map<String, Object> initializeParams() {
        Map<String, Object> clientInfo = new LinkedHashMap<>();
        clientInfo.put("name", config.getClientName());
        clientInfo.put("version", config.getClientVersion());

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", config.getProtocolVersion());
        params.put("capabilities", Map.of("tools", Map.of()));
        params.put("clientInfo", clientInfo);
        return params;
    }

    private HandshakeResult acceptInitializeResult(JsonNode result) {
        if (result == null || !result.isObject()) {
            throw ToolHostException.handshakeFailure(
                    connection.serverId(), "initialize result is not a JSON object");
        }
        JsonNode version = result.get("protocolVersion");
        return new HandshakeResult(
                jsonRpc.toMap(result.get("capabilities")),
                jsonRpc.toMap(result.get("serverInfo")),
                version != null && version.isTextual()
                        ? version.asText()
                        : config.getProtocolVersion(),
                List.of());
    }

    private Uni<HandshakeResult> completeInitialization(HandshakeResult initialized) {
        state = State.INITIALIZED;
        connection.sendNotification(INITIALIZED, null);
        state = State.DISCOVERING;
        return listTools(null, new ArrayList<>(), 0)
                .map(
                        tools -> {
                            state = State.READY;
                            LOG.debugv(
                                    "[{0}] Handshake complete, {1} tools, protocol {2}",
                                    connection.serverId(),
                                    tools.size(),
                                    LogSanitizer.sanitize(initialized.protocolVersion()));
                            return new HandshakeResult(
                                    initialized.capabilities(),
                                    initialized.serverInfo(),
                                    initialized.protocolVersion(),
                                    tools);
                        });
    }

    private Uni<List<ToolDescriptor>> listTools(
            String cursor, List<ToolDescriptor> collected, int page) {
        Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : null;
        return connection
                .request(TOOLS_LIST, params, config.getHandshakeTimeout())
                .flatMap(
                        result -> {
                            collected.addAll(parseTools(result));
                            JsonNode next = result.get("nextCursor");
                            if (next == null || !next.isTextual() || next.asText().isEmpty()) {
                                return Uni.createFrom().item(List.copyOf(collected));
                            }
                            if (page + 1 >= MAX_PAGES) {
                                LOG.warnv(
                                        "[{0}] Stopping tool discovery after {1} pages",
                                        connection.serverId(), MAX_PAGES);
                                return Uni.createFrom().item(List.copyOf(collected));
                            }
                            return listTools(next.asText(), collected, page + 1);
                        });
    }

    private List<ToolDescriptor> parseTools(JsonNode result) {
        if (result == null || !result.isObject()) {
            throw ToolHostException.handshakeFailure(
                    connection.serverId(), "tools/list result is not a JSON object");
        }
        JsonNode tools = result.get("tools");
        if (tools == null || tools.isNull()) {
            return List.of();
        }
        if (!tools.isArray()) {
            throw ToolHostException.handshakeFailure(
                    connection.serverId(), "tools/list result has no tools array");
        }

        List<ToolDescriptor> parsed = new ArrayList<>();
        for (JsonNode tool : tools) {
            JsonNode name = tool.get("name");
            if (name == null || !name.isTextual() || name.asText().isBlank()) {
                LOG.debugv("[{0}] Skipping tool without a name", connection.serverId());
                continue;
            }
            JsonNode description = tool.get("description");
            parsed.add(
                    new ToolDescriptor(
                            name.asText(),
                            description != null && description.isTextual()
                                    ? description.asText()
                                    : "",
                            jsonRpc.toMap(tool.get("inputSchema")),
                            connection.serverId()));
        }
        return parsed;
    }

    private Throwable asHandshakeFailure(Throwable error) {
        if (error instanceof ToolHostException hostError) {
            ErrorKind kind = hostError.getKind();
            if (kind == ErrorKind.TIMEOUT
                    || kind == ErrorKind.CONNECTION_LOST
                    || kind == ErrorKind.HANDSHAKE_FAILURE) {
                return hostError;
            }
        }
        if (error instanceof IllegalStateException) {
            return error;
        }
        return ToolHostException.handshakeFailure(connection.serverId(), error);
    }
}
