package io.toolhost.core.exception;

/// Failure taxonomy of the tool host.
///
/// Every expected failure a caller can observe carries exactly one kind, so
/// callers can decide between retrying, surfacing the error, or falling back
/// without parsing messages.
public enum ErrorKind {
    /// The executable is missing or could not be started.
    SPAWN_FAILURE,

    /// The provider answered the handshake badly or not at all.
    HANDSHAKE_FAILURE,

    /// No response arrived before the request deadline.
    TIMEOUT,

    /// The provider's pipes closed or the process exited.
    CONNECTION_LOST,

    /// The operation needs a RUNNING server.
    NOT_RUNNING,

    /// The named tool is not in the server's discovered registry.
    TOOL_NOT_FOUND,

    /// A server with the same id was already added.
    ALREADY_EXISTS,

    /// No server with the given id exists.
    NOT_FOUND,

    /// A protocol line was not JSON or not a valid message.
    MALFORMED_MESSAGE,

    /// The provider answered with a JSON-RPC error object.
    REMOTE_ERROR,

    /// The maximum number of running servers is reached.
    LIMIT_REACHED
}
