package io.toolhost.server.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonParseException;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    void shouldMapHostErrorsByKind() {
        Response response = mapper.toResponse(ToolHostException.toolNotFound("x", "srv"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("kind", "TOOL_NOT_FOUND");
        assertThat(
                        mapper.toResponse(new ToolHostException(ErrorKind.REMOTE_ERROR, "bad"))
                                .getStatus())
                .isEqualTo(502);
    }

    @Test
    void shouldMapInvalidArgumentsTo400() {
        Response response =
                mapper.toResponse(
                        new RuntimeException(new IllegalArgumentException("id must not be blank")));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(body(response)).containsEntry("error", "id must not be blank");
    }

    @Test
    void shouldMapUnreadableBodyTo400() {
        Response response = mapper.toResponse(new JsonParseException(null, "Unexpected character"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat((String) body(response).get("error")).startsWith("Malformed request body");
    }

    @Test
    void shouldHideDetailsOfWebErrors() {
        Response response = mapper.toResponse(new NotFoundException("HTTP 404 /secret/path"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).containsEntry("error", "Resource not found");
    }

    @Test
    void shouldNotLeakUnexpectedErrors() {
        Response response = mapper.toResponse(new IllegalStateException("internal detail"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response)).containsEntry("error", "Internal server error");
    }
}
