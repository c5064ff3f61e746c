package io.toolhost.core.tool;

import io.toolhost.core.util.JsonValues;
import java.util.Map;
import java.util.Objects;

/// Describes one callable tool exposed by a tool-provider server.
///
/// Descriptors are produced by tool discovery after the handshake and are
/// replaced wholesale on every successful re-discovery. The `inputSchema` is
/// the provider's JSON Schema for the tool arguments, kept as plain maps and
/// lists so the core module stays free of any JSON library.
///
/// ### Contracts
/// - **Precondition**: `name` and `server` must not be null or blank
/// - **Postcondition**: All fields immutable after construction, including the
///   maps and lists nested inside `inputSchema`
///
/// ### Usage
/// {@snippet :
/// ToolDescriptor ping = new ToolDescriptor(
///     "ping",
///     "Replies with pong",
///     Map.of("type", "object", "properties", Map.of()),
///     "echo");
/// }
///
/// @param name tool name, unique within its server but not across servers, not null
/// @param description human-readable description, never null (may be empty)
/// @param inputSchema JSON Schema of the accepted arguments, never null (may be empty)
/// @param server id of the owning server, not null
/// @see ToolRegistry for per-server tool storage
public record ToolDescriptor(
        String name, String description, Map<String, Object> inputSchema, String server) {

    /// Compact constructor with validation.
    public ToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(server, "server must not be null");
        if (server.isBlank()) {
            throw new IllegalArgumentException("server must not be blank");
        }
        description = description != null ? description : "";
        inputSchema = JsonValues.immutableCopy(inputSchema);
    }
}
