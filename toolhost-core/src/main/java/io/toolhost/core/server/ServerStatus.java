package io.toolhost.core.server;

/// Lifecycle status of a supervised tool-provider server.
///
/// ```
/// STOPPED ──start──> STARTING ──handshake ok──> RUNNING ──stop──> STOPPED
///                        │                          │
///                        └──spawn/handshake fail──> ERROR <──unexpected exit
/// ```
public enum ServerStatus {
    /// No child process; the initial state and the state after a stop.
    STOPPED,

    /// Child process spawned, handshake or discovery still in progress.
    STARTING,

    /// Handshake and discovery finished; tools may be executed.
    RUNNING,

    /// Spawn, handshake or the running process failed; see the last error.
    ERROR;

    /// Returns whether a child process may be attached in this status.
    ///
    /// @return true for STARTING and RUNNING
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}
