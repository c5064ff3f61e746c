package io.toolhost.server.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/// An outgoing request awaiting its response.
///
/// @param id request id written to the wire
/// @param method request method, used in diagnostics and error messages
/// @param sentAt when the request was written
/// @param future completed with the `result` value, or exceptionally on error
public record PendingRequest(
        long id, String method, Instant sentAt, CompletableFuture<JsonNode> future) {}
