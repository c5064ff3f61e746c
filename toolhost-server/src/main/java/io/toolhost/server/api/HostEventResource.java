package io.toolhost.server.api;

import io.smallrye.mutiny.Multi;
import io.toolhost.server.streaming.HostEventBroadcaster;
import io.toolhost.server.streaming.HostEventMessage;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// SSE endpoint for host lifecycle events.
///
/// ```
/// event data: {"type":"server.started","serverId":"echo","timestamp":"...","event":{...}}
/// ```
///
/// ### Event Types
/// - `server.added`, `server.removed`
/// - `server.starting`, `server.started`, `server.stopped`, `server.error`
/// - `tools.discovered`
///
/// @see HostEventBroadcaster for event publishing
@Path("/api/v1/events")
public class HostEventResource {

    private static final Logger LOG = Logger.getLogger(HostEventResource.class);

    private final HostEventBroadcaster broadcaster;

    @Inject
    public HostEventResource(HostEventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    /// Streams events of all servers, or of one with `?server=id`.
    ///
    /// @param server optional server filter
    /// @return SSE event stream
    @GET
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<HostEventMessage> stream(@QueryParam("server") String server) {
        String serverId = server == null || server.isBlank() ? null : server;
        LOG.infov("SSE subscription: server={0}", LogSanitizer.sanitize(serverId));

        return broadcaster
                .subscribe(serverId)
                .onTermination()
                .invoke(
                        (failure, cancelled) -> {
                            if (failure != null) {
                                LOG.warnv(failure, "SSE stream error");
                            } else {
                                LOG.debugv("SSE stream closed, cancelled={0}", cancelled);
                            }
                        });
    }
}
