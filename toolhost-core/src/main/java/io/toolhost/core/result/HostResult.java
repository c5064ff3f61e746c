package io.toolhost.core.result;

import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import java.util.Objects;

/// Outcome of a caller-facing host operation.
///
/// Expected failures (unknown server, tool missing, timeouts, crashed
/// providers) are reported as values rather than thrown, so the surrounding
/// application can decide per kind whether to retry, surface or fall back.
///
/// ### Usage
/// {@snippet :
/// HostResult<ServerSnapshot> result = registry.getServer("echo");
/// if (result.success()) {
///     render(result.value());
/// } else if (result.errorKind() == ErrorKind.NOT_FOUND) {
///     offerToAdd("echo");
/// }
/// }
///
/// @param success whether the operation succeeded
/// @param value result value on success, may be null for void operations
/// @param errorKind failure kind, null on success
/// @param message failure message, null on success
/// @param <T> value type
public record HostResult<T>(boolean success, T value, ErrorKind errorKind, String message) {

    public HostResult {
        if (success && errorKind != null) {
            throw new IllegalArgumentException("successful result must not carry an error kind");
        }
        if (!success) {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failure");
        }
    }

    public static <T> HostResult<T> success(T value) {
        return new HostResult<>(true, value, null, null);
    }

    public static HostResult<Void> ok() {
        return new HostResult<>(true, null, null, null);
    }

    public static <T> HostResult<T> failure(ErrorKind kind, String message) {
        return new HostResult<>(false, null, kind, message);
    }

    public static <T> HostResult<T> failure(ToolHostException exception) {
        return new HostResult<>(false, null, exception.getKind(), exception.getMessage());
    }

    /// Returns whether the operation failed.
    ///
    /// @return true on failure
    public boolean isFailure() {
        return !success;
    }

    /// Returns the value or throws the failure as an exception.
    ///
    /// @return the value on success
    /// @throws ToolHostException on failure, carrying the same kind and message
    public T orElseThrow() {
        if (!success) {
            throw new ToolHostException(errorKind, message);
        }
        return value;
    }
}
