package io.toolhost.server.host;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.toolhost.core.HostConfig;
import io.toolhost.core.event.HostEvent;
import io.toolhost.core.event.HostEventListener;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.core.server.ServerSnapshot;
import io.toolhost.core.server.ServerStatus;
import io.toolhost.core.tool.DefaultToolRegistry;
import io.toolhost.core.tool.ToolDescriptor;
import io.toolhost.core.tool.ToolRegistry;
import io.toolhost.server.stdio.HandshakeProtocol;
import io.toolhost.server.stdio.JsonRpc;
import io.toolhost.server.stdio.JsonRpcMessage;
import io.toolhost.server.stdio.ProcessLauncher;
import io.toolhost.server.stdio.StdioConnection;
import io.toolhost.server.validation.LogSanitizer;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import org.jboss.logging.Logger;

/// Owns the full lifecycle of one tool-provider server.
///
/// ### Status Transitions
/// ```
/// STOPPED --start--> STARTING --handshake ok--> RUNNING --stop--> STOPPED
///                        |                         |
///                        +--spawn/handshake fail---+--unexpected exit--> ERROR
/// ```
///
/// A supervisor is the unit of failure isolation: everything that goes wrong
/// with its process ends up as `status = ERROR` plus `lastError` on this
/// supervisor and is never thrown at the registry. Each start attempt gets a
/// fresh process, connection and handshake; callbacks from an older attempt
/// are recognized by connection identity and ignored.
///
/// ### Thread Safety
/// State is guarded by the supervisor's monitor. Reader threads, timeout
/// timers and callers all go through synchronized transitions; events and
/// future completions happen outside the lock.
public class ServerSupervisor {

    private static final Logger LOG = Logger.getLogger(ServerSupervisor.class);

    private final ServerConfig config;
    private final ProcessLauncher launcher;
    private final JsonRpc jsonRpc;
    private final HostConfig hostConfig;
    private final ScheduledExecutorService scheduler;
    private final HostEventListener events;
    private final ToolRegistry tools;

    private ServerStatus status = ServerStatus.STOPPED;
    private String lastError;
    private Process process;
    private StdioConnection connection;
    private HandshakeProtocol handshake;
    private Instant startedAt;
    private Map<String, Object> capabilities = Map.of();
    private Map<String, Object> serverInfo = Map.of();
    private CompletableFuture<ServerSnapshot> startAttempt;

    public ServerSupervisor(
            ServerConfig config,
            ProcessLauncher launcher,
            JsonRpc jsonRpc,
            HostConfig hostConfig,
            ScheduledExecutorService scheduler,
            HostEventListener events) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.hostConfig = Objects.requireNonNull(hostConfig, "hostConfig must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.events = Objects.requireNonNull(events, "events must not be null");
        this.tools = new DefaultToolRegistry(config.id());
    }

    /// Spawns the process and runs the handshake.
    ///
    /// No-op if already RUNNING. A start requested while another one is in
    /// flight joins that attempt. The whole attempt is bounded by the startup
    /// timeout; on failure the server is left in ERROR with `lastError` set and
    /// the process terminated.
    ///
    /// @return snapshot after the server reached RUNNING
    public Uni<ServerSnapshot> start() {
        return Uni.createFrom().deferred(() -> Uni.createFrom().completionStage(beginStart()));
    }

    /// Terminates the process and clears the tools.
    ///
    /// The status is STOPPED as soon as the process is detached. The process
    /// then gets a graceful termination signal, and is killed forcibly once
    /// the stop grace period runs out. No-op if already STOPPED. `lastError`
    /// is kept.
    ///
    /// @return snapshot after the server stopped
    public Uni<ServerSnapshot> stop() {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            StdioConnection detachedConnection;
                            Process detachedProcess;
                            synchronized (this) {
                                if (status == ServerStatus.STOPPED && process == null) {
                                    return Uni.createFrom().item(snapshot());
                                }
                                detachedConnection = connection;
                                detachedProcess = process;
                                detach();
                                startAttempt = null;
                                // a start issued during the grace period spawns a fresh process
                                status = ServerStatus.STOPPED;
                            }

                            LOG.infov("[{0}] Stopping server", config.id());
                            if (detachedConnection != null) {
                                detachedConnection.close();
                            }
                            Uni<Void> termination =
                                    detachedProcess != null
                                            ? terminate(detachedProcess)
                                            : Uni.createFrom().voidItem();
                            return termination.map(ignored -> finishStop());
                        });
    }

    /// Calls a tool on the running server.
    ///
    /// Fails with NOT_RUNNING unless RUNNING, and with TOOL_NOT_FOUND, without
    /// sending anything, when the tool was not discovered.
    ///
    /// @param toolName tool to call, not null
    /// @param arguments tool arguments, may be null
    /// @return the provider's full `result` value
    public Uni<JsonNode> execute(String toolName, Map<String, Object> arguments) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            StdioConnection current;
                            synchronized (this) {
                                if (status != ServerStatus.RUNNING || connection == null) {
                                    return Uni.createFrom()
                                            .failure(ToolHostException.notRunning(config.id()));
                                }
                                if (!tools.contains(toolName)) {
                                    return Uni.createFrom()
                                            .failure(
                                                    ToolHostException.toolNotFound(
                                                            toolName, config.id()));
                                }
                                current = connection;
                            }

                            Map<String, Object> params = new LinkedHashMap<>();
                            params.put("name", toolName);
                            params.put("arguments", arguments != null ? arguments : Map.of());
                            LOG.debugv(
                                    "[{0}] Calling tool {1}",
                                    config.id(), LogSanitizer.sanitize(toolName));
                            return current.request(
                                    HandshakeProtocol.TOOLS_CALL,
                                    params,
                                    hostConfig.getToolCallTimeout());
                        });
    }

    /// Re-runs tool discovery on the running server.
    ///
    /// On success the tool registry is replaced; on failure the previous tools
    /// are kept.
    ///
    /// @return the tools after the refresh
    public Uni<List<ToolDescriptor>> refreshTools() {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            HandshakeProtocol protocol;
                            synchronized (this) {
                                if (status != ServerStatus.RUNNING || handshake == null) {
                                    return Uni.createFrom()
                                            .failure(ToolHostException.notRunning(config.id()));
                                }
                                protocol = handshake;
                            }
                            return protocol.discover()
                                    .map(found -> applyDiscovery(protocol, found));
                        });
    }

    /// Returns a copy of the current state.
    ///
    /// @return snapshot, never null
    public synchronized ServerSnapshot snapshot() {
        return new ServerSnapshot(
                config.id(),
                config.name(),
                config.description(),
                status,
                tools.size(),
                lastError,
                pidOf(process),
                startedAt,
                capabilities,
                serverInfo);
    }

    public synchronized ServerStatus status() {
        return status;
    }

    /// Returns the currently discovered tools.
    ///
    /// @return immutable copy, empty unless RUNNING
    public List<ToolDescriptor> tools() {
        return tools.all();
    }

    public ServerConfig config() {
        return config;
    }

    /// Begins a start attempt, or joins the one in flight.
    ///
    /// The status is STARTING when this returns unless the server was already RUNNING.
    CompletableFuture<ServerSnapshot> beginStart() {
        CompletableFuture<ServerSnapshot> attempt;
        synchronized (this) {
            if (status == ServerStatus.RUNNING) {
                return CompletableFuture.completedFuture(snapshot());
            }
            if (startAttempt != null) {
                return startAttempt;
            }
            attempt = new CompletableFuture<>();
            startAttempt = attempt;
            status = ServerStatus.STARTING;
            lastError = null;
        }

        LOG.infov("[{0}] Starting server: {1}", config.id(), config.command());
        events.onEvent(HostEvent.ServerStarting.now(config.id()));
        launchAndHandshake(attempt);
        return attempt;
    }

    private void launchAndHandshake(CompletableFuture<ServerSnapshot> attempt) {
        Process spawned;
        try {
            spawned = launcher.launch(config);
        } catch (ToolHostException e) {
            abortStart(attempt, null, e);
            return;
        }

        StdioConnection opened = new StdioConnection(config.id(), spawned, jsonRpc, scheduler);
        HandshakeProtocol protocol = new HandshakeProtocol(opened, jsonRpc, hostConfig);
        synchronized (this) {
            if (startAttempt != attempt) {
                // stopped while spawning
                spawned.destroyForcibly();
                attempt.completeExceptionally(startCancelled());
                return;
            }
            process = spawned;
            connection = opened;
            handshake = protocol;
            startedAt = Instant.now();
        }

        opened.setListener(
                new StdioConnection.Listener() {
                    @Override
                    public void onNotification(JsonRpcMessage.Notification notification) {
                        handleNotification(opened, notification);
                    }

                    @Override
                    public void onClosed(ToolHostException reason) {
                        handleConnectionLost(opened, reason);
                    }
                });
        spawned.onExit()
                .thenAccept(
                        exited ->
                                handleConnectionLost(
                                        opened,
                                        ToolHostException.connectionLost(
                                                config.id(),
                                                "process exited with code "
                                                        + exited.exitValue())));
        opened.open();

        Duration startupTimeout = hostConfig.getStartupTimeout();
        protocol.perform()
                .ifNoItem()
                .after(startupTimeout)
                .failWith(
                        () ->
                                new ToolHostException(
                                        ErrorKind.TIMEOUT,
                                        "Server '"
                                                + config.id()
                                                + "' did not become ready within "
                                                + startupTimeout.toMillis()
                                                + "ms"))
                .subscribe()
                .with(
                        result -> markRunning(attempt, opened, result),
                        error -> abortStart(attempt, opened, error));
    }

    private void markRunning(
            CompletableFuture<ServerSnapshot> attempt,
            StdioConnection opened,
            HandshakeProtocol.HandshakeResult result) {
        ServerSnapshot running;
        synchronized (this) {
            if (startAttempt != attempt || connection != opened) {
                running = null;
            } else if (!opened.isOpen()) {
                running = null;
            } else {
                tools.replaceAll(result.tools());
                capabilities = result.capabilities();
                serverInfo = result.serverInfo();
                status = ServerStatus.RUNNING;
                startAttempt = null;
                running = snapshot();
            }
        }

        if (running == null) {
            abortStart(
                    attempt,
                    opened,
                    opened.isOpen()
                            ? startCancelled()
                            : ToolHostException.connectionLost(
                                    config.id(), "connection closed during handshake"));
            return;
        }

        LOG.infov(
                "[{0}] Server running (pid {1}, {2} tools)",
                config.id(), running.pid(), running.toolCount());
        events.onEvent(HostEvent.ToolsDiscovered.now(config.id(), toolNames()));
        events.onEvent(
                HostEvent.ServerStarted.now(config.id(), running.pid(), running.toolCount()));
        attempt.complete(running);
    }

    private void abortStart(
            CompletableFuture<ServerSnapshot> attempt, StdioConnection opened, Throwable error) {
        ToolHostException failure = asHostException(error);
        boolean current;
        Process toTerminate = null;
        synchronized (this) {
            current = startAttempt == attempt && connection == opened;
            if (current) {
                toTerminate = process;
                detach();
                status = ServerStatus.ERROR;
                lastError = failure.getMessage();
                startAttempt = null;
            }
        }

        if (opened != null) {
            opened.close();
        }
        if (toTerminate != null) {
            terminate(toTerminate)
                    .subscribe()
                    .with(
                            ignored -> LOG.debugv("[{0}] Failed start cleaned up", config.id()),
                            e -> LOG.warnv(e, "[{0}] Cleanup after failed start", config.id()));
        }
        if (current) {
            LOG.warnv("[{0}] Start failed: {1}", config.id(), failure.getMessage());
            events.onEvent(HostEvent.ServerFailed.now(config.id(), failure.getMessage()));
        }
        attempt.completeExceptionally(failure);
    }

    private void handleConnectionLost(StdioConnection lost, ToolHostException reason) {
        Process toTerminate;
        synchronized (this) {
            if (connection != lost) {
                return;
            }
            if (status == ServerStatus.STARTING) {
                toTerminate = null;
            } else {
                toTerminate = process;
                detach();
                status = ServerStatus.ERROR;
                lastError = reason.getMessage();
            }
        }

        // closing fails the pending handshake requests, abortStart takes it from there
        lost.close();
        if (toTerminate == null) {
            return;
        }
        if (toTerminate.isAlive()) {
            toTerminate.destroyForcibly();
        }
        LOG.warnv("[{0}] Server exited unexpectedly: {1}", config.id(), reason.getMessage());
        events.onEvent(HostEvent.ServerFailed.now(config.id(), reason.getMessage()));
    }

    private void handleNotification(
            StdioConnection source, JsonRpcMessage.Notification notification) {
        if (!HandshakeProtocol.TOOLS_LIST_CHANGED.equals(notification.method())) {
            return;
        }
        synchronized (this) {
            if (connection != source || status != ServerStatus.RUNNING) {
                return;
            }
        }
        LOG.infov("[{0}] Tool list changed, rediscovering", config.id());
        // off the stdout reader thread, discovery writes to the child
        refreshTools()
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .subscribe()
                .with(
                        found ->
                                LOG.debugv(
                                        "[{0}] Rediscovered {1} tools",
                                        config.id(), found.size()),
                        error ->
                                LOG.warnv(
                                        "[{0}] Rediscovery failed, keeping previous tools: {1}",
                                        config.id(), error.getMessage()));
    }

    private List<ToolDescriptor> applyDiscovery(
            HandshakeProtocol protocol, List<ToolDescriptor> found) {
        boolean current;
        synchronized (this) {
            current = handshake == protocol && status == ServerStatus.RUNNING;
            if (current) {
                tools.replaceAll(found);
            }
        }
        if (!current) {
            return found;
        }
        events.onEvent(HostEvent.ToolsDiscovered.now(config.id(), toolNames()));
        return tools.all();
    }

    private ServerSnapshot finishStop() {
        boolean stopped;
        synchronized (this) {
            stopped = status == ServerStatus.STOPPED && startAttempt == null;
        }
        if (stopped) {
            LOG.infov("[{0}] Server stopped", config.id());
            events.onEvent(HostEvent.ServerStopped.now(config.id()));
        }
        return snapshot();
    }

    /// Clears the per-process state. Caller holds the monitor.
    private void detach() {
        process = null;
        connection = null;
        handshake = null;
        startedAt = null;
        capabilities = Map.of();
        serverInfo = Map.of();
        tools.clear();
    }

    private Uni<Void> terminate(Process target) {
        if (!target.isAlive()) {
            return Uni.createFrom().voidItem();
        }
        try {
            target.descendants().forEach(ProcessHandle::destroy);
        } catch (UnsupportedOperationException e) {
            LOG.debugv("[{0}] Process descendants not available", config.id());
        }
        target.destroy();

        Duration grace = hostConfig.getStopGracePeriod();
        // the timeout cancels the stage it waits on, never the process's own exit future
        return Uni.createFrom()
                .completionStage(target.onExit().thenApply(exited -> exited))
                .replaceWithVoid()
                .ifNoItem()
                .after(grace)
                .recoverWithUni(
                        () -> {
                            LOG.warnv(
                                    "[{0}] Process ignored termination for {1}ms, killing it",
                                    config.id(), grace.toMillis());
                            target.destroyForcibly();
                            return Uni.createFrom()
                                    .completionStage(target.onExit().thenApply(exited -> exited))
                                    .replaceWithVoid()
                                    .ifNoItem()
                                    .after(grace)
                                    .recoverWithUni(() -> Uni.createFrom().voidItem());
                        });
    }

    private List<String> toolNames() {
        return tools.all().stream().map(ToolDescriptor::name).toList();
    }

    private ToolHostException startCancelled() {
        return ToolHostException.connectionLost(config.id(), "start cancelled by stop");
    }

    private ToolHostException asHostException(Throwable error) {
        if (error instanceof ToolHostException hostError) {
            return hostError;
        }
        return ToolHostException.handshakeFailure(config.id(), error);
    }

    private static Long pidOf(Process target) {
        if (target == null) {
            return null;
        }
        try {
            return target.pid();
        } catch (UnsupportedOperationException e) {
            // in-memory processes have no pid
            return null;
        }
    }
}
