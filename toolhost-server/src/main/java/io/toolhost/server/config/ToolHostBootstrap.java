package io.toolhost.server.config;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.server.host.ToolHostRegistry;
import io.toolhost.server.streaming.HostEventBroadcaster;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Wires the tool host on application startup and stops it on shutdown.
///
/// On startup:
/// - registers {@link HostEventBroadcaster} so lifecycle events reach SSE clients
/// - loads `toolhost.servers.config-path`, when set, and adds every server in it;
///   servers marked `autoStart` are started in the background
///
/// On shutdown every running server is stopped.
@ApplicationScoped
public class ToolHostBootstrap {

    private static final Logger LOG = Logger.getLogger(ToolHostBootstrap.class);

    private final ToolHostRegistry registry;
    private final ServerConfigLoader loader;
    private final HostEventBroadcaster broadcaster;

    @ConfigProperty(name = "toolhost.servers.config-path")
    Optional<String> configPath;

    @ConfigProperty(name = "toolhost.stop-grace-period", defaultValue = "5s")
    Duration stopGracePeriod;

    @Inject
    public ToolHostBootstrap(
            ToolHostRegistry registry,
            ServerConfigLoader loader,
            HostEventBroadcaster broadcaster) {
        this.registry = registry;
        this.loader = loader;
        this.broadcaster = broadcaster;
    }

    void onStart(@Observes StartupEvent ev) {
        registry.addListener(broadcaster);
        LOG.info("Registered HostEventBroadcaster for SSE streaming");

        configPath.ifPresent(path -> addConfiguredServers(Path.of(path)));
    }

    void onStop(@Observes ShutdownEvent ev) {
        LOG.info("Stopping tool servers...");
        Duration limit = stopGracePeriod.multipliedBy(3);
        try {
            registry.shutdown().await().atMost(limit);
        } catch (TimeoutException e) {
            LOG.warnv(
                    "Tool servers still stopping after {0}ms, continuing shutdown",
                    limit.toMillis());
        }
    }

    /// Adds every server from the configuration file.
    ///
    /// Each add runs independently; one failing server never prevents the others.
    ///
    /// @param path configuration file, not null
    void addConfiguredServers(Path path) {
        List<ServerConfig> configs;
        try {
            configs = loader.load(path);
        } catch (IOException e) {
            LOG.errorv(e, "Cannot read server configuration {0}", path);
            return;
        }

        LOG.infov("Adding {0} configured servers", configs.size());
        for (ServerConfig config : configs) {
            registry.addServer(config)
                    .onFailure()
                    .recoverWithUni(
                            error -> {
                                LOG.errorv(
                                        error,
                                        "Adding server {0} failed",
                                        LogSanitizer.sanitize(config.id()));
                                return Uni.createFrom().nullItem();
                            })
                    .subscribe()
                    .with(
                            result -> {
                                if (result != null && result.isFailure()) {
                                    LOG.warnv(
                                            "Server {0}: {1}",
                                            LogSanitizer.sanitize(config.id()),
                                            result.message());
                                }
                            });
        }
    }
}
