package io.toolhost.server.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.toolhost.core.exception.ToolHostException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper that prevents stack trace leakage to clients.
///
/// - {@link ToolHostException}: mapped by kind, see {@link HostResponses}
/// - invalid arguments and unreadable bodies: 400 with the message
/// - {@link WebApplicationException}: its own status with a generic message
/// - anything else: 500, logged with its stack trace
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 400}
/// ```
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof ToolHostException hostError) {
            LOG.debugv("Host error {0}: {1}", hostError.getKind(), hostError.getMessage());
            return HostResponses.error(hostError.getKind(), hostError.getMessage());
        }

        Throwable badRequest = findBadRequestCause(exception);
        if (badRequest != null) {
            String message =
                    badRequest instanceof JsonProcessingException json
                            ? "Malformed request body: " + json.getOriginalMessage()
                            : badRequest.getMessage();
            LOG.debugv("Bad request: {0}", message);
            return json(400, message != null ? message : "Bad request");
        }

        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());
            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return json(status, message);
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return json(500, "Internal server error");
    }

    private static Throwable findBadRequestCause(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof IllegalArgumentException
                    || current instanceof JsonProcessingException) {
                return current;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }

    private static Response json(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) {
                    yield "Internal server error";
                }
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
