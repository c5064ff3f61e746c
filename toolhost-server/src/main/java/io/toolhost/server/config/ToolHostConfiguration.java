package io.toolhost.server.config;

import io.toolhost.core.HostConfig;
import io.toolhost.server.stdio.DefaultProcessLauncher;
import io.toolhost.server.stdio.ProcessLauncher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI configuration for the tool host.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `toolhost.handshake-timeout` | Duration | `10s` | initialize and tools/list deadline |
/// | `toolhost.tool-call-timeout` | Duration | `60s` | tools/call deadline |
/// | `toolhost.startup-timeout` | Duration | `30s` | spawn + handshake + discovery deadline |
/// | `toolhost.stop-grace-period` | Duration | `5s` | wait before a forced kill |
/// | `toolhost.max-running-servers` | int | `10` | running-server cap |
/// | `toolhost.protocol-version` | String | `2024-11-05` | protocol version sent in initialize |
/// | `toolhost.client.name` | String | `toolhost` | clientInfo name |
/// | `toolhost.client.version` | String | `1.0.0` | clientInfo version |
@ApplicationScoped
public class ToolHostConfiguration {

    @ConfigProperty(name = "toolhost.handshake-timeout", defaultValue = "10s")
    Duration handshakeTimeout;

    @ConfigProperty(name = "toolhost.tool-call-timeout", defaultValue = "60s")
    Duration toolCallTimeout;

    @ConfigProperty(name = "toolhost.startup-timeout", defaultValue = "30s")
    Duration startupTimeout;

    @ConfigProperty(name = "toolhost.stop-grace-period", defaultValue = "5s")
    Duration stopGracePeriod;

    @ConfigProperty(name = "toolhost.max-running-servers", defaultValue = "10")
    int maxRunningServers;

    @ConfigProperty(
            name = "toolhost.protocol-version",
            defaultValue = HostConfig.DEFAULT_PROTOCOL_VERSION)
    String protocolVersion;

    @ConfigProperty(name = "toolhost.client.name", defaultValue = "toolhost")
    String clientName;

    @ConfigProperty(name = "toolhost.client.version", defaultValue = "1.0.0")
    String clientVersion;

    /// Produces the host tuning options from application configuration.
    ///
    /// @return validated configuration, never null
    @Produces
    @Singleton
    public HostConfig hostConfig() {
        return HostConfig.builder()
                .handshakeTimeout(handshakeTimeout)
                .toolCallTimeout(toolCallTimeout)
                .startupTimeout(startupTimeout)
                .stopGracePeriod(stopGracePeriod)
                .maxRunningServers(maxRunningServers)
                .protocolVersion(protocolVersion)
                .clientName(clientName)
                .clientVersion(clientVersion)
                .build();
    }

    @Produces
    @Singleton
    public ProcessLauncher processLauncher() {
        return new DefaultProcessLauncher();
    }
}
