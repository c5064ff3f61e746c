package io.toolhost.server.api;

import io.smallrye.mutiny.Uni;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.core.server.ServerSnapshot;
import io.toolhost.server.host.ToolHostRegistry;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST API for server lifecycle.
///
/// Failed operations answer with `{"error", "kind", "status"}`, see
/// {@link HostResponses} for the status mapping.
///
/// @see ToolHostRegistry for the operations behind each endpoint
@Path("/api/v1/servers")
@Produces(MediaType.APPLICATION_JSON)
public class ServerResource {

    private static final Logger LOG = Logger.getLogger(ServerResource.class);

    private final ToolHostRegistry registry;

    @Inject
    public ServerResource(ToolHostRegistry registry) {
        this.registry = registry;
    }

    /// Lists all servers.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// [{"id": "echo", "name": "Echo", "status": "RUNNING", "toolCount": 1, ...}]
    /// ```
    @GET
    public List<ServerSnapshot> list() {
        return registry.listServers();
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") String id) {
        return HostResponses.ok(registry.getServer(id));
    }

    /// Adds a server.
    ///
    /// ### Request
    /// ```
    /// POST /api/v1/servers
    /// Content-Type: application/json
    ///
    /// {"id": "memory", "command": "npx", "args": ["-y", "@modelcontextprotocol/server-memory"],
    ///  "autoStart": true}
    /// ```
    ///
    /// ### Response (201 Created)
    /// The new server's snapshot. 409 if the id is taken.
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> add(ServerRequest request) {
        ServerConfig config = toConfig(request);
        LOG.infov("Add server request: {0}", LogSanitizer.sanitize(config.id()));
        return registry.addServer(config)
                .map(result -> HostResponses.of(result, Response.Status.CREATED));
    }

    @POST
    @Path("/{id}/start")
    public Uni<Response> start(@PathParam("id") String id) {
        LOG.infov("Start server request: {0}", LogSanitizer.sanitize(id));
        return registry.startServer(id).map(HostResponses::ok);
    }

    @POST
    @Path("/{id}/stop")
    public Uni<Response> stop(@PathParam("id") String id) {
        LOG.infov("Stop server request: {0}", LogSanitizer.sanitize(id));
        return registry.stopServer(id).map(HostResponses::ok);
    }

    /// Re-runs tool discovery and returns the refreshed tools.
    @POST
    @Path("/{id}/refresh")
    public Uni<Response> refresh(@PathParam("id") String id) {
        return registry.refreshTools(id).map(HostResponses::ok);
    }

    /// Stops and removes a server.
    ///
    /// ### Response (204 No Content)
    @DELETE
    @Path("/{id}")
    public Uni<Response> remove(@PathParam("id") String id) {
        LOG.infov("Remove server request: {0}", LogSanitizer.sanitize(id));
        return registry.removeServer(id)
                .map(result -> HostResponses.of(result, Response.Status.NO_CONTENT));
    }

    private static ServerConfig toConfig(ServerRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        if (request.id() == null || request.id().isBlank()) {
            throw new BadRequestException("id is required");
        }
        if (request.command() == null || request.command().isBlank()) {
            throw new BadRequestException("command is required");
        }
        return ServerConfig.builder()
                .id(request.id())
                .name(request.name())
                .description(request.description())
                .command(request.command())
                .args(request.args())
                .env(request.env())
                .cwd(request.cwd())
                .autoStart(Boolean.TRUE.equals(request.autoStart()))
                .build();
    }

    /// Request body for adding a server.
    public record ServerRequest(
            String id,
            String name,
            String description,
            String command,
            List<String> args,
            Map<String, String> env,
            String cwd,
            Boolean autoStart) {}
}
