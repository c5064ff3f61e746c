package io.toolhost.server.stdio;

import io.toolhost.core.server.ServerConfig;

/// Spawns the child process for a server.
///
/// The seam between supervision and the operating system; tests replace it
/// with an in-memory process.
@FunctionalInterface
public interface ProcessLauncher {

    /// Starts the process described by `config`.
    ///
    /// @param config server configuration, not null
    /// @return the running process, never null
    /// @throws io.toolhost.core.exception.ToolHostException of kind SPAWN_FAILURE
    ///     if the process cannot be started
    Process launch(ServerConfig config);
}
