package io.toolhost.core.tool;

import java.util.List;
import java.util.Optional;

/// Tools discovered on one tool-provider server.
///
/// Each running server owns exactly one registry. Discovery replaces the
/// whole content in one step, and stopping the server clears it, so readers
/// never observe a half-updated tool list.
///
/// ### Thread Safety
/// @implNote Implementations must be safe for concurrent reads while a
/// discovery on another thread replaces the content.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new DefaultToolRegistry("echo");
/// registry.replaceAll(discoveredTools);
///
/// Optional<ToolDescriptor> ping = registry.get("ping");
/// }
///
/// @see ToolDescriptor for the tool shape
public interface ToolRegistry {

    /// Returns the id of the server whose tools this registry holds.
    ///
    /// @return server id, never null
    String serverId();

    /// Replaces the entire content with the given tools.
    ///
    /// When two descriptors share a name the first one wins.
    ///
    /// @apiNote **Side effects**: Discards every previously held tool
    ///
    /// @param tools freshly discovered tools, not null (may be empty)
    /// @throws NullPointerException if tools is null
    void replaceAll(List<ToolDescriptor> tools);

    /// Retrieves a tool by name.
    ///
    /// @param name the tool name, not null
    /// @return Optional containing the tool if present
    /// @throws NullPointerException if name is null
    Optional<ToolDescriptor> get(String name);

    /// Returns all tools in discovery order.
    ///
    /// @return immutable copy of the tools, never null
    List<ToolDescriptor> all();

    /// Checks whether a tool is present.
    ///
    /// @param name the tool name, not null
    /// @return true if the tool is registered
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Removes every tool.
    void clear();

    /// Returns the number of tools.
    ///
    /// @return tool count
    int size();
}
