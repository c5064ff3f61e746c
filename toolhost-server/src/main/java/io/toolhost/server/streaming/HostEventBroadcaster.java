package io.toolhost.server.streaming;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import io.smallrye.mutiny.operators.multi.processors.SerializedProcessor;
import io.toolhost.core.event.HostEvent;
import io.toolhost.core.event.HostEventListener;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/// Broadcasts host lifecycle events to SSE subscribers.
///
/// Registered with the registry as a {@link HostEventListener}. Events are
/// hot: a subscriber only sees events published after it subscribed.
///
/// ### Thread Safety
/// Thread-safe. Supervisors publish from reader and timer threads, so the
/// processor is serialized.
///
/// @see io.toolhost.server.api.HostEventResource for the SSE endpoint
@ApplicationScoped
public class HostEventBroadcaster implements HostEventListener {

    private static final Logger LOG = Logger.getLogger(HostEventBroadcaster.class);

    private final SerializedProcessor<HostEventMessage, HostEventMessage> processor =
            BroadcastProcessor.<HostEventMessage>create().serialized();
    private final AtomicInteger subscribers = new AtomicInteger();

    /// Subscribes to events.
    ///
    /// @param serverId only events of this server, or null for all
    /// @return hot event stream
    public Multi<HostEventMessage> subscribe(String serverId) {
        Multi<HostEventMessage> all = Multi.createFrom().publisher(processor);
        Multi<HostEventMessage> events =
                serverId == null
                        ? all
                        : all.select().where(message -> serverId.equals(message.serverId()));
        return events.onSubscription()
                .invoke(subscribers::incrementAndGet)
                .onTermination()
                .invoke(subscribers::decrementAndGet);
    }

    @Override
    public void onEvent(HostEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        LOG.debugv("Publishing {0} for {1}", event.type(), event.serverId());
        processor.onNext(HostEventMessage.from(event));
    }

    /// Returns the number of connected subscribers.
    ///
    /// @return subscriber count
    public int subscriberCount() {
        return subscribers.get();
    }
}
