package io.toolhost.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A caller's request to run one tool on one server.
///
/// @param tool tool name, not null
/// @param parameters tool arguments matching the tool's input schema, never null
/// @param server target server id, not null
public record ToolCall(String tool, Map<String, Object> parameters, String server) {

    public ToolCall {
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(server, "server must not be null");
        parameters =
                parameters != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                        : Map.of();
    }

    /// Creates a call without arguments.
    ///
    /// @param tool tool name, not null
    /// @param server target server id, not null
    /// @return new call, never null
    public static ToolCall of(String tool, String server) {
        return new ToolCall(tool, Map.of(), server);
    }
}
