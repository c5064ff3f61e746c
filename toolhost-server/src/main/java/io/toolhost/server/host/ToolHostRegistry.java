package io.toolhost.server.host;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;
import io.toolhost.core.HostConfig;
import io.toolhost.core.event.HostEvent;
import io.toolhost.core.event.HostEventListener;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.result.HostResult;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.core.server.ServerSnapshot;
import io.toolhost.core.server.ServerStatus;
import io.toolhost.core.tool.ToolCall;
import io.toolhost.core.tool.ToolDescriptor;
import io.toolhost.server.stdio.JsonRpc;
import io.toolhost.server.stdio.ProcessLauncher;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.jboss.logging.Logger;

/// Public entry point of the tool host.
///
/// Holds one {@link ServerSupervisor} per added server and routes every
/// operation to it. Expected failures (unknown id, duplicate id, server not
/// running, tool not found, timeouts, provider errors) come back as failed
/// {@link HostResult}s; only programming errors such as a null id throw.
/// A failing server only ever changes its own supervisor's state.
///
/// ### Operations
/// | Operation | Result |
/// |---|---|
/// | {@link #addServer} | snapshot of the new server, ALREADY_EXISTS on duplicate id |
/// | {@link #startServer} | snapshot once RUNNING, LIMIT_REACHED above the running cap |
/// | {@link #stopServer} | snapshot once STOPPED |
/// | {@link #removeServer} | forgets the server, then stops its process |
/// | {@link #refreshTools} | re-discovered tools |
/// | {@link #executeTool} | the provider's full `result` value |
/// | {@link #listServers} / {@link #getServer} | snapshots, never live state |
/// | {@link #listTools} / {@link #findTool} | tool descriptors across all or one server |
///
/// Lifecycle changes are published as {@link HostEvent}s to registered
/// {@link HostEventListener}s.
///
/// ### Thread Safety
/// The server map is guarded by its own monitor and only held for lookups
/// and insertions; all process work happens inside the supervisors.
@ApplicationScoped
public class ToolHostRegistry {

    private static final Logger LOG = Logger.getLogger(ToolHostRegistry.class);

    private final HostConfig hostConfig;
    private final ProcessLauncher launcher;
    private final JsonRpc jsonRpc;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ServerSupervisor> servers = new LinkedHashMap<>();
    private final List<HostEventListener> listeners = new CopyOnWriteArrayList<>();

    @Inject
    public ToolHostRegistry(HostConfig hostConfig, ProcessLauncher launcher, JsonRpc jsonRpc) {
        this.hostConfig = Objects.requireNonNull(hostConfig, "hostConfig must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "toolhost-timeouts");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    /// Registers a listener for lifecycle events.
    ///
    /// @param listener the listener, not null
    public void addListener(HostEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Adds a server in STOPPED status, starting it when `autoStart` is set.
    ///
    /// A failed auto-start does not fail the add; the returned snapshot then
    /// shows ERROR and the failure message.
    ///
    /// @param config server configuration, not null
    /// @return snapshot of the added server, or ALREADY_EXISTS
    public Uni<HostResult<ServerSnapshot>> addServer(ServerConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        ServerSupervisor supervisor;
        synchronized (servers) {
            if (servers.containsKey(config.id())) {
                return Uni.createFrom()
                        .item(HostResult.failure(ToolHostException.alreadyExists(config.id())));
            }
            supervisor =
                    new ServerSupervisor(
                            config, launcher, jsonRpc, hostConfig, scheduler, this::publish);
            servers.put(config.id(), supervisor);
        }

        LOG.infov("Server added: {0}", LogSanitizer.sanitize(config.id()));
        publish(HostEvent.ServerAdded.now(config.id(), config.name()));

        if (!config.autoStart()) {
            return Uni.createFrom().item(HostResult.success(supervisor.snapshot()));
        }
        return startServer(config.id()).map(ignored -> HostResult.success(supervisor.snapshot()));
    }

    /// Starts a server and waits until it is RUNNING or has failed.
    ///
    /// @param serverId server id, not null
    /// @return snapshot of the running server, or the failure that left it in ERROR
    public Uni<HostResult<ServerSnapshot>> startServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            CompletableFuture<ServerSnapshot> attempt;
                            synchronized (servers) {
                                ServerSupervisor supervisor = servers.get(serverId);
                                if (supervisor == null) {
                                    return Uni.createFrom().item(notFound(serverId));
                                }
                                if (supervisor.status() != ServerStatus.RUNNING
                                        && activeCountExcluding(supervisor)
                                                >= hostConfig.getMaxRunningServers()) {
                                    int cap = hostConfig.getMaxRunningServers();
                                    return Uni.createFrom()
                                            .item(
                                                    HostResult.failure(
                                                            ToolHostException.limitReached(cap)));
                                }
                                // the new STARTING status is visible to the next cap check
                                attempt = supervisor.beginStart();
                            }
                            return toResult(Uni.createFrom().completionStage(attempt));
                        });
    }

    /// Stops a server.
    ///
    /// @param serverId server id, not null
    /// @return snapshot of the stopped server, or NOT_FOUND
    public Uni<HostResult<ServerSnapshot>> stopServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            ServerSupervisor supervisor = lookup(serverId);
                            if (supervisor == null) {
                                return Uni.createFrom().item(notFound(serverId));
                            }
                            return toResult(supervisor.stop());
                        });
    }

    /// Removes the server and stops its process.
    ///
    /// The id is unknown to every other operation from the moment the removal
    /// begins, so nothing can start the server while its process shuts down.
    /// The result completes once the process is gone.
    ///
    /// @param serverId server id, not null
    /// @return success, or NOT_FOUND
    public Uni<HostResult<Void>> removeServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            ServerSupervisor supervisor;
                            synchronized (servers) {
                                supervisor = servers.remove(serverId);
                            }
                            if (supervisor == null) {
                                return Uni.createFrom()
                                        .item(
                                                HostResult.<Void>failure(
                                                        ToolHostException.notFound(serverId)));
                            }
                            return supervisor
                                    .stop()
                                    .map(
                                            stopped -> {
                                                LOG.infov(
                                                        "Server removed: {0}",
                                                        LogSanitizer.sanitize(serverId));
                                                publish(HostEvent.ServerRemoved.now(serverId));
                                                return HostResult.ok();
                                            });
                        });
    }

    /// Re-runs tool discovery on a running server.
    ///
    /// @param serverId server id, not null
    /// @return the refreshed tools, NOT_FOUND or NOT_RUNNING
    public Uni<HostResult<List<ToolDescriptor>>> refreshTools(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            ServerSupervisor supervisor = lookup(serverId);
                            if (supervisor == null) {
                                return Uni.createFrom().item(notFound(serverId));
                            }
                            return toResult(supervisor.refreshTools());
                        });
    }

    /// Runs a tool on the server named in the call.
    ///
    /// @param call tool, arguments and target server, not null
    /// @return the provider's result, or NOT_FOUND, NOT_RUNNING, TOOL_NOT_FOUND,
    ///     TIMEOUT, REMOTE_ERROR or CONNECTION_LOST
    public Uni<HostResult<JsonNode>> executeTool(ToolCall call) {
        Objects.requireNonNull(call, "call must not be null");
        return Uni.createFrom()
                .deferred(
                        () -> {
                            ServerSupervisor supervisor = lookup(call.server());
                            if (supervisor == null) {
                                return Uni.createFrom().item(notFound(call.server()));
                            }
                            return toResult(supervisor.execute(call.tool(), call.parameters()));
                        });
    }

    /// Returns snapshots of all servers in insertion order.
    ///
    /// @return list of copies, never null
    public List<ServerSnapshot> listServers() {
        return supervisors().stream().map(ServerSupervisor::snapshot).toList();
    }

    /// Returns the snapshot of one server.
    ///
    /// @param serverId server id, not null
    /// @return snapshot, or NOT_FOUND
    public HostResult<ServerSnapshot> getServer(String serverId) {
        Objects.requireNonNull(serverId, "serverId must not be null");
        ServerSupervisor supervisor = lookup(serverId);
        return supervisor != null ? HostResult.success(supervisor.snapshot()) : notFound(serverId);
    }

    /// Lists discovered tools.
    ///
    /// @param serverId restrict to one server, or null for all servers
    /// @return tools in server then discovery order, empty for an unknown id
    public List<ToolDescriptor> listTools(String serverId) {
        if (serverId != null) {
            ServerSupervisor supervisor = lookup(serverId);
            return supervisor != null ? supervisor.tools() : List.of();
        }
        List<ToolDescriptor> all = new ArrayList<>();
        for (ServerSupervisor supervisor : supervisors()) {
            all.addAll(supervisor.tools());
        }
        return List.copyOf(all);
    }

    /// Finds a tool by name.
    ///
    /// Without a server id the first match in server insertion order wins;
    /// tool names are only unique within one server.
    ///
    /// @param name tool name, not null
    /// @param serverId restrict to one server, or null for all servers
    /// @return the first matching tool
    public Optional<ToolDescriptor> findTool(String name, String serverId) {
        Objects.requireNonNull(name, "name must not be null");
        return listTools(serverId).stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    /// Stops every server.
    ///
    /// @return completes when all servers are stopped
    public Uni<Void> shutdown() {
        List<ServerSupervisor> all = supervisors();
        if (all.isEmpty()) {
            return Uni.createFrom().voidItem();
        }
        LOG.infov("Stopping {0} servers", all.size());
        List<Uni<ServerSnapshot>> stops =
                all.stream()
                        .map(
                                supervisor ->
                                        supervisor
                                                .stop()
                                                .onFailure()
                                                .recoverWithItem(
                                                        error -> {
                                                            LOG.warnv(
                                                                    error,
                                                                    "[{0}] Stop failed",
                                                                    supervisor.config().id());
                                                            return supervisor.snapshot();
                                                        }))
                        .toList();
        return Uni.join().all(stops).andFailFast().replaceWithVoid();
    }

    @PreDestroy
    void close() {
        scheduler.shutdownNow();
    }

    private void publish(HostEvent event) {
        for (HostEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Event listener failed for {0}", event.type());
            }
        }
    }

    private ServerSupervisor lookup(String serverId) {
        synchronized (servers) {
            return servers.get(serverId);
        }
    }

    private List<ServerSupervisor> supervisors() {
        synchronized (servers) {
            return List.copyOf(servers.values());
        }
    }

    /// Counts STARTING and RUNNING servers other than `self`. Caller holds the map monitor.
    private int activeCountExcluding(ServerSupervisor self) {
        int active = 0;
        for (ServerSupervisor supervisor : servers.values()) {
            if (supervisor != self && supervisor.status().isActive()) {
                active++;
            }
        }
        return active;
    }

    /// Turns expected failures into failed results; anything else stays a failure of the Uni.
    private static <T> Uni<HostResult<T>> toResult(Uni<T> operation) {
        return operation
                .map(HostResult::success)
                .onFailure(ToolHostException.class)
                .recoverWithItem(error -> HostResult.failure((ToolHostException) error));
    }

    private static <T> HostResult<T> notFound(String serverId) {
        return HostResult.failure(ToolHostException.notFound(serverId));
    }
}
