package io.toolhost.core.event;

/// Receives lifecycle events from the tool host.
///
/// Called synchronously on whichever thread caused the transition (a caller,
/// a connection reader, or the timeout scheduler), so implementations must be
/// quick and must not block.
@FunctionalInterface
public interface HostEventListener {

    /// Handles one event.
    ///
    /// @param event the event, not null
    void onEvent(HostEvent event);
}
