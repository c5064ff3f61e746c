package io.toolhost.server.streaming;

import io.toolhost.core.event.HostEvent;
import java.time.Instant;

/// SSE payload for one lifecycle event.
///
/// @param type event type, e.g. `server.started`
/// @param serverId server the event is about
/// @param timestamp when the event occurred
/// @param event the full event
public record HostEventMessage(String type, String serverId, Instant timestamp, HostEvent event) {

    public static HostEventMessage from(HostEvent event) {
        return new HostEventMessage(event.type(), event.serverId(), event.timestamp(), event);
    }
}
