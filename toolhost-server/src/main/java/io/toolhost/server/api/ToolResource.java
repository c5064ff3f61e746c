package io.toolhost.server.api;

import io.smallrye.mutiny.Uni;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.tool.ToolCall;
import io.toolhost.core.tool.ToolDescriptor;
import io.toolhost.server.host.ToolHostRegistry;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for discovered tools and tool execution.
@Path("/api/v1/tools")
@Produces(MediaType.APPLICATION_JSON)
public class ToolResource {

    private static final Logger LOG = Logger.getLogger(ToolResource.class);

    private final ToolHostRegistry registry;

    @Inject
    public ToolResource(ToolHostRegistry registry) {
        this.registry = registry;
    }

    /// Lists tools of all servers, or of one with `?server=id`.
    @GET
    public List<ToolDescriptor> list(@QueryParam("server") String server) {
        return registry.listTools(blankToNull(server));
    }

    /// Finds a tool by name. Without `?server=` the first match wins.
    @GET
    @Path("/{name}")
    public Response find(@PathParam("name") String name, @QueryParam("server") String server) {
        String serverId = blankToNull(server);
        return registry.findTool(name, serverId)
                .map(tool -> Response.ok(tool).build())
                .orElseGet(
                        () -> {
                            ToolHostException missing =
                                    ToolHostException.toolNotFound(name, serverId);
                            return HostResponses.error(missing.getKind(), missing.getMessage());
                        });
    }

    /// Runs a tool.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/tools/call
    /// Content-Type: application/json
    ///
    /// {"server": "echo", "tool": "ping", "arguments": {}}
    /// ```
    ///
    /// ### Response (200 OK)
    /// The provider's result object, e.g. `{"content": [{"type": "text", "text": "pong"}]}`.
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Path("/call")
    public Uni<Response> call(ToolCallRequest request) {
        if (request == null || request.tool() == null || request.tool().isBlank()) {
            throw new BadRequestException("tool is required");
        }
        if (request.server() == null || request.server().isBlank()) {
            throw new BadRequestException("server is required");
        }

        LOG.debugv(
                "Tool call request: {0} on {1}",
                LogSanitizer.sanitize(request.tool()), LogSanitizer.sanitize(request.server()));
        ToolCall call = new ToolCall(request.tool(), request.arguments(), request.server());
        return registry.executeTool(call).map(HostResponses::ok);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /// Request body for a tool call.
    public record ToolCallRequest(String server, String tool, Map<String, Object> arguments) {}
}
