package io.toolhost.core.exception;

import java.io.Serial;
import java.time.Duration;
import java.util.Objects;

/// Exception thrown when a tool-host operation fails.
///
/// Carries an {@link ErrorKind} so failures can be turned into
/// {@link io.toolhost.core.result.HostResult} values at the API boundary.
/// Provider-side JSON-RPC errors additionally keep the remote error code and
/// the optional `data` payload.
public class ToolHostException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3160871204572593871L;

    private final ErrorKind kind;
    private final Integer remoteCode;
    private final transient Object remoteData;

    /// Creates an exception of the given kind.
    ///
    /// @param kind failure kind, not null
    /// @param message the error message
    public ToolHostException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    /// Creates an exception of the given kind with a cause.
    ///
    /// @param kind failure kind, not null
    /// @param message the error message
    /// @param cause the underlying cause, may be null
    public ToolHostException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.remoteCode = null;
        this.remoteData = null;
    }

    private ToolHostException(String message, int remoteCode, Object remoteData) {
        super(message);
        this.kind = ErrorKind.REMOTE_ERROR;
        this.remoteCode = remoteCode;
        this.remoteData = remoteData;
    }

    /// Returns the failure kind.
    ///
    /// @return kind, never null
    public ErrorKind getKind() {
        return kind;
    }

    /// Returns the JSON-RPC error code sent by the provider.
    ///
    /// @return code, or null unless kind is REMOTE_ERROR
    public Integer getRemoteCode() {
        return remoteCode;
    }

    /// Returns the JSON-RPC error `data` sent by the provider.
    ///
    /// @return data payload, may be null
    public Object getRemoteData() {
        return remoteData;
    }

    public static ToolHostException spawnFailure(String serverId, Throwable cause) {
        return new ToolHostException(
                ErrorKind.SPAWN_FAILURE,
                "Failed to start process for server '" + serverId + "': " + cause.getMessage(),
                cause);
    }

    public static ToolHostException handshakeFailure(String serverId, String reason) {
        return new ToolHostException(
                ErrorKind.HANDSHAKE_FAILURE,
                "Handshake with server '" + serverId + "' failed: " + reason);
    }

    public static ToolHostException handshakeFailure(String serverId, Throwable cause) {
        return new ToolHostException(
                ErrorKind.HANDSHAKE_FAILURE,
                "Handshake with server '" + serverId + "' failed: " + cause.getMessage(),
                cause);
    }

    public static ToolHostException timeout(String method, Duration timeout) {
        return new ToolHostException(
                ErrorKind.TIMEOUT,
                "Request '" + method + "' timed out after " + timeout.toMillis() + "ms");
    }

    public static ToolHostException connectionLost(String serverId, String reason) {
        return new ToolHostException(
                ErrorKind.CONNECTION_LOST,
                "Connection to server '" + serverId + "' lost: " + reason);
    }

    public static ToolHostException notRunning(String serverId) {
        return new ToolHostException(
                ErrorKind.NOT_RUNNING, "Server '" + serverId + "' is not running");
    }

    public static ToolHostException toolNotFound(String toolName, String serverId) {
        return new ToolHostException(
                ErrorKind.TOOL_NOT_FOUND,
                serverId != null
                        ? "Tool '" + toolName + "' not found on server '" + serverId + "'"
                        : "Tool '" + toolName + "' not found on any server");
    }

    public static ToolHostException alreadyExists(String serverId) {
        return new ToolHostException(
                ErrorKind.ALREADY_EXISTS, "Server '" + serverId + "' already exists");
    }

    public static ToolHostException notFound(String serverId) {
        return new ToolHostException(ErrorKind.NOT_FOUND, "Server '" + serverId + "' not found");
    }

    public static ToolHostException malformed(String reason) {
        return new ToolHostException(ErrorKind.MALFORMED_MESSAGE, reason);
    }

    public static ToolHostException limitReached(int maxRunning) {
        return new ToolHostException(
                ErrorKind.LIMIT_REACHED,
                "Maximum number of running servers reached (" + maxRunning + ")");
    }

    /// Creates an exception for a JSON-RPC error response.
    ///
    /// @param method the request method that failed
    /// @param code JSON-RPC error code
    /// @param message provider's error message
    /// @param data provider's error data, may be null
    /// @return new exception of kind REMOTE_ERROR
    public static ToolHostException remoteError(
            String method, int code, String message, Object data) {
        return new ToolHostException(
                "Request '" + method + "' failed with error " + code + ": " + message, code, data);
    }
}
