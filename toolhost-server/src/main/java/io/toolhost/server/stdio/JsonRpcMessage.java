package io.toolhost.server.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/// One decoded JSON-RPC 2.0 message received from a tool provider.
///
/// The shape is decided once by {@link JsonRpc#classify(JsonNode)}, so the
/// connection dispatches on the message type instead of probing fields at
/// every use site.
///
/// ### Message Types
/// - **Request**: has `id` and `method`; the provider expects a reply
/// - **Notification**: has `method`, no `id`; no reply
/// - **Response**: has `id` and `result` or `error`
public sealed interface JsonRpcMessage {

    /// Request sent by the provider to the host (for example `ping`).
    ///
    /// @param id request id chosen by the provider, not null
    /// @param method method name, not null
    /// @param params parameters, may be null
    record Request(JsonNode id, String method, JsonNode params) implements JsonRpcMessage {
        public Request {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(method, "method must not be null");
        }
    }

    /// Notification sent by the provider; never answered.
    ///
    /// @param method method name, not null
    /// @param params parameters, may be null
    record Notification(String method, JsonNode params) implements JsonRpcMessage {
        public Notification {
            Objects.requireNonNull(method, "method must not be null");
        }
    }

    /// Response to a request the host sent.
    ///
    /// Exactly one of `result` and `error` is meaningful: when the provider
    /// sent an `error` object the response is an error, whatever else it holds.
    ///
    /// @param id echoed request id, may be null when the provider could not parse the request
    /// @param result the result payload, null for error responses
    /// @param error the error payload, null for successful responses
    record Response(JsonNode id, JsonNode result, RpcError error) implements JsonRpcMessage {

        /// Returns whether the provider reported an error.
        ///
        /// @return true if an error object was present
        public boolean isError() {
            return error != null;
        }

        /// Returns the id as a host request number.
        ///
        /// Host ids are positive integers; providers that echo them back as
        /// numeric strings are accepted too.
        ///
        /// @return the numeric id, or empty when absent or not a number
        public Optional<Long> numericId() {
            if (id == null || id.isNull()) {
                return Optional.empty();
            }
            if (id.canConvertToLong() && id.isIntegralNumber()) {
                return Optional.of(id.asLong());
            }
            if (id.isTextual()) {
                try {
                    return Optional.of(Long.parseLong(id.asText()));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            }
            return Optional.empty();
        }
    }

    /// JSON-RPC error object.
    ///
    /// @param code error code
    /// @param message error message, never null
    /// @param data optional additional data, may be null
    record RpcError(int code, String message, JsonNode data) {
        public RpcError {
            message = message != null ? message : "Unknown error";
        }
    }
}
