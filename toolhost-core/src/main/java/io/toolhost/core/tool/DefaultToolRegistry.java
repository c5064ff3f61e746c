package io.toolhost.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Default thread-safe implementation of {@link ToolRegistry}.
///
/// Holds an immutable, insertion-ordered snapshot that is swapped in one
/// volatile write, so concurrent readers see either the old or the new tool
/// list and never a mix of both.
///
/// ### Thread Safety
/// @implNote Thread-safe. Reads are lock-free; writers replace the snapshot.
///
/// @see ToolRegistry for the contract
public final class DefaultToolRegistry implements ToolRegistry {

    private final String serverId;
    private volatile Map<String, ToolDescriptor> tools = Map.of();

    /// Creates an empty registry for a server.
    ///
    /// @param serverId owning server id, not null
    public DefaultToolRegistry(String serverId) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
    }

    @Override
    public String serverId() {
        return serverId;
    }

    @Override
    public void replaceAll(List<ToolDescriptor> newTools) {
        Objects.requireNonNull(newTools, "tools must not be null");
        Map<String, ToolDescriptor> next = new LinkedHashMap<>();
        for (ToolDescriptor tool : newTools) {
            next.putIfAbsent(tool.name(), tool);
        }
        tools = Collections.unmodifiableMap(next);
    }

    @Override
    public Optional<ToolDescriptor> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public List<ToolDescriptor> all() {
        return List.copyOf(tools.values());
    }

    @Override
    public void clear() {
        tools = Map.of();
    }

    @Override
    public int size() {
        return tools.size();
    }
}
