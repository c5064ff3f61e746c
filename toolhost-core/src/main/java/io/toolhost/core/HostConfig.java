package io.toolhost.core;

import java.time.Duration;
import java.util.Objects;

/// Tuning options for the tool host.
///
/// Controls request deadlines, the stop grace period, the running-server cap
/// and the identity the host announces during the handshake.
///
/// ### Default Values
/// - `handshakeTimeout`: 10s (initialize and tools/list requests)
/// - `toolCallTimeout`: 60s (tools/call requests)
/// - `startupTimeout`: 30s (spawn + handshake + discovery as a whole)
/// - `stopGracePeriod`: 5s (between graceful and forced termination)
/// - `maxRunningServers`: 10
/// - `protocolVersion`: `"2024-11-05"`
/// - `clientName` / `clientVersion`: `"toolhost"` / `"1.0.0"`
///
/// @implNote **Not thread-safe**. Configure before handing it to the host and
/// do not modify afterwards.
///
/// @see Builder
public class HostConfig {

    public static final String DEFAULT_PROTOCOL_VERSION = "2024-11-05";

    private Duration handshakeTimeout = Duration.ofSeconds(10);
    private Duration toolCallTimeout = Duration.ofSeconds(60);
    private Duration startupTimeout = Duration.ofSeconds(30);
    private Duration stopGracePeriod = Duration.ofSeconds(5);
    private int maxRunningServers = 10;
    private String protocolVersion = DEFAULT_PROTOCOL_VERSION;
    private String clientName = "toolhost";
    private String clientVersion = "1.0.0";

    /// Creates a configuration with default values.
    public HostConfig() {}

    /// Returns the deadline for each handshake and discovery request.
    ///
    /// @return timeout, never null
    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public void setHandshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = requirePositive(handshakeTimeout, "handshakeTimeout");
    }

    /// Returns the deadline for each tool invocation.
    ///
    /// @return timeout, never null
    public Duration getToolCallTimeout() {
        return toolCallTimeout;
    }

    public void setToolCallTimeout(Duration toolCallTimeout) {
        this.toolCallTimeout = requirePositive(toolCallTimeout, "toolCallTimeout");
    }

    /// Returns the overall deadline for spawn, handshake and discovery.
    ///
    /// @return timeout, never null
    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public void setStartupTimeout(Duration startupTimeout) {
        this.startupTimeout = requirePositive(startupTimeout, "startupTimeout");
    }

    /// Returns how long a stop waits for a graceful exit before killing the process.
    ///
    /// @return grace period, never null
    public Duration getStopGracePeriod() {
        return stopGracePeriod;
    }

    public void setStopGracePeriod(Duration stopGracePeriod) {
        this.stopGracePeriod = requirePositive(stopGracePeriod, "stopGracePeriod");
    }

    /// Returns the maximum number of servers that may be running at once.
    ///
    /// @return positive cap
    public int getMaxRunningServers() {
        return maxRunningServers;
    }

    /// Sets the running-server cap.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxRunningServers` must be positive
    ///
    /// @param maxRunningServers the cap
    public void setMaxRunningServers(int maxRunningServers) {
        if (maxRunningServers <= 0) {
            throw new IllegalArgumentException("maxRunningServers must be positive");
        }
        this.maxRunningServers = maxRunningServers;
    }

    /// Returns the protocol version sent in the initialize request.
    ///
    /// @return version identifier, never null
    public String getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(String protocolVersion) {
        this.protocolVersion =
                Objects.requireNonNull(protocolVersion, "protocolVersion must not be null");
    }

    /// Returns the client name sent in the initialize request.
    ///
    /// @return name, never null
    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = Objects.requireNonNull(clientName, "clientName must not be null");
    }

    /// Returns the client version sent in the initialize request.
    ///
    /// @return version, never null
    public String getClientVersion() {
        return clientVersion;
    }

    public void setClientVersion(String clientVersion) {
        this.clientVersion = Objects.requireNonNull(clientVersion, "clientVersion must not be null");
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link HostConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it
    /// on {@link #build()}.
    public static class Builder {
        private final HostConfig config = new HostConfig();

        public Builder handshakeTimeout(Duration handshakeTimeout) {
            config.setHandshakeTimeout(handshakeTimeout);
            return this;
        }

        public Builder toolCallTimeout(Duration toolCallTimeout) {
            config.setToolCallTimeout(toolCallTimeout);
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            config.setStartupTimeout(startupTimeout);
            return this;
        }

        public Builder stopGracePeriod(Duration stopGracePeriod) {
            config.setStopGracePeriod(stopGracePeriod);
            return this;
        }

        public Builder maxRunningServers(int maxRunningServers) {
            config.setMaxRunningServers(maxRunningServers);
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            config.setProtocolVersion(protocolVersion);
            return this;
        }

        public Builder clientName(String clientName) {
            config.setClientName(clientName);
            return this;
        }

        public Builder clientVersion(String clientVersion) {
            config.setClientVersion(clientVersion);
            return this;
        }

        /// Builds and returns the configured {@link HostConfig} instance.
        ///
        /// @return the configured instance, never null
        public HostConfig build() {
            return config;
        }
    }
}
