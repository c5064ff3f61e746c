package io.toolhost.core.event;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Lifecycle events published by the tool host.
///
/// ### Event Types
/// - `server.added` - server configuration registered
/// - `server.starting` - child process is being spawned
/// - `server.started` - handshake and discovery succeeded
/// - `server.stopped` - process stopped on request
/// - `server.error` - spawn, handshake or running process failed
/// - `server.removed` - server configuration discarded
/// - `tools.discovered` - tool registry replaced by a discovery
///
/// @see HostEventListener for consumers
public sealed interface HostEvent {

    /// Returns the event type identifier.
    ///
    /// @return event type string, never null
    String type();

    /// Returns the id of the server the event concerns.
    ///
    /// @return server id, never null
    String serverId();

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    record ServerAdded(String serverId, String name, Instant timestamp) implements HostEvent {
        public ServerAdded {
            Objects.requireNonNull(serverId, "serverId must not be null");
        }

        @Override
        public String type() {
            return "server.added";
        }

        public static ServerAdded now(String serverId, String name) {
            return new ServerAdded(serverId, name, Instant.now());
        }
    }

    record ServerStarting(String serverId, Instant timestamp) implements HostEvent {
        @Override
        public String type() {
            return "server.starting";
        }

        public static ServerStarting now(String serverId) {
            return new ServerStarting(serverId, Instant.now());
        }
    }

    record ServerStarted(String serverId, Long pid, int toolCount, Instant timestamp)
            implements HostEvent {
        @Override
        public String type() {
            return "server.started";
        }

        public static ServerStarted now(String serverId, Long pid, int toolCount) {
            return new ServerStarted(serverId, pid, toolCount, Instant.now());
        }
    }

    record ServerStopped(String serverId, Instant timestamp) implements HostEvent {
        @Override
        public String type() {
            return "server.stopped";
        }

        public static ServerStopped now(String serverId) {
            return new ServerStopped(serverId, Instant.now());
        }
    }

    /// Server entered the ERROR status.
    record ServerFailed(String serverId, String error, Instant timestamp) implements HostEvent {
        @Override
        public String type() {
            return "server.error";
        }

        public static ServerFailed now(String serverId, String error) {
            return new ServerFailed(serverId, error, Instant.now());
        }
    }

    record ServerRemoved(String serverId, Instant timestamp) implements HostEvent {
        @Override
        public String type() {
            return "server.removed";
        }

        public static ServerRemoved now(String serverId) {
            return new ServerRemoved(serverId, Instant.now());
        }
    }

    record ToolsDiscovered(String serverId, List<String> toolNames, Instant timestamp)
            implements HostEvent {
        public ToolsDiscovered {
            toolNames = toolNames != null ? List.copyOf(toolNames) : List.of();
        }

        @Override
        public String type() {
            return "tools.discovered";
        }

        public static ToolsDiscovered now(String serverId, List<String> toolNames) {
            return new ToolsDiscovered(serverId, toolNames, Instant.now());
        }
    }
}
