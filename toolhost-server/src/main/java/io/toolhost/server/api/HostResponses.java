package io.toolhost.server.api;

import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.result.HostResult;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;

/// Maps {@link HostResult}s and error kinds to HTTP responses.
///
/// ### Status Mapping
/// | Kind | Status |
/// |------|--------|
/// | `NOT_FOUND`, `TOOL_NOT_FOUND` | 404 |
/// | `ALREADY_EXISTS`, `NOT_RUNNING`, `LIMIT_REACHED` | 409 |
/// | `TIMEOUT` | 504 |
/// | everything else | 502 |
///
/// Error bodies have the form `{"error": message, "kind": kind, "status": status}`.
final class HostResponses {

    private HostResponses() {}

    /// Builds the response for a result.
    ///
    /// @param result operation result, not null
    /// @param success status used when the result is a success
    /// @return response carrying the value or an error body
    static Response of(HostResult<?> result, Response.Status success) {
        if (result.isFailure()) {
            return error(result.errorKind(), result.message());
        }
        if (result.value() == null) {
            return Response.status(success).build();
        }
        return Response.status(success)
                .type(MediaType.APPLICATION_JSON)
                .entity(result.value())
                .build();
    }

    static Response ok(HostResult<?> result) {
        return of(result, Response.Status.OK);
    }

    static Response error(ErrorKind kind, String message) {
        int status = statusOf(kind);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message != null ? message : kind.name());
        body.put("kind", kind.name());
        body.put("status", status);
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(body).build();
    }

    static int statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND, TOOL_NOT_FOUND -> 404;
            case ALREADY_EXISTS, NOT_RUNNING, LIMIT_REACHED -> 409;
            case TIMEOUT -> 504;
            default -> 502;
        };
    }
}
