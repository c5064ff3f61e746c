package io.toolhost.core.server;

import io.toolhost.core.util.JsonValues;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Point-in-time copy of one server's runtime state.
///
/// Snapshots are detached from the live supervisor: mutating the host later
/// never changes a snapshot a caller already holds.
///
/// @param id server id, not null
/// @param name display name, not null
/// @param description description, not null
/// @param status lifecycle status at snapshot time, not null
/// @param toolCount number of discovered tools
/// @param lastError message of the most recent failure, may be null
/// @param pid child process id, may be null when not running or unsupported
/// @param startedAt when the current process was spawned, may be null
/// @param capabilities capabilities the provider declared during the handshake, never null
/// @param serverInfo provider's self-description from the handshake, never null
public record ServerSnapshot(
        String id,
        String name,
        String description,
        ServerStatus status,
        int toolCount,
        String lastError,
        Long pid,
        Instant startedAt,
        Map<String, Object> capabilities,
        Map<String, Object> serverInfo) {

    public ServerSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        name = name != null ? name : id;
        description = description != null ? description : "";
        capabilities = JsonValues.immutableCopy(capabilities);
        serverInfo = JsonValues.immutableCopy(serverInfo);
    }

    /// Returns whether the server can currently execute tools.
    ///
    /// @return true if status is RUNNING
    public boolean isRunning() {
        return status == ServerStatus.RUNNING;
    }
}
