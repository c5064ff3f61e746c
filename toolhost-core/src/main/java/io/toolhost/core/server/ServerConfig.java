package io.toolhost.core.server;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable description of how to launch one tool-provider server.
///
/// Created by a configuration collaborator (config file import, REST call)
/// and handed to the host verbatim; the host never mutates it.
///
/// ### Required Fields
/// - `id` - unique server identifier
/// - `command` - executable to launch
///
/// ### Optional Fields
/// - `name` - display name (defaults to `id`)
/// - `description` - free text (defaults to empty)
/// - `args` - ordered command-line arguments (defaults to none)
/// - `env` - environment overrides merged over the host environment
/// - `cwd` - working directory of the child (defaults to the host's)
/// - `autoStart` - start immediately after being added
///
/// ### Usage
/// {@snippet :
/// ServerConfig config = ServerConfig.builder()
///     .id("memory")
///     .command("npx")
///     .args(List.of("-y", "@modelcontextprotocol/server-memory"))
///     .env(Map.of("MEMORY_FILE", "/tmp/memory.json"))
///     .build();
/// }
///
/// @param id unique server identifier, not null or blank
/// @param name display name, never null
/// @param description description, never null
/// @param command executable, not null or blank
/// @param args command-line arguments, never null
/// @param env environment overrides, never null
/// @param cwd working directory, may be null
/// @param autoStart whether to start the server as soon as it is added
public record ServerConfig(
        String id,
        String name,
        String description,
        String command,
        List<String> args,
        Map<String, String> env,
        String cwd,
        boolean autoStart) {

    /// Compact constructor with validation.
    public ServerConfig {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(command, "command must not be null");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        name = name != null && !name.isBlank() ? name : id;
        description = description != null ? description : "";
        args = args != null ? List.copyOf(args) : List.of();
        env =
                env != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(env))
                        : Map.of();
        cwd = cwd != null && !cwd.isBlank() ? cwd : null;
    }

    /// Creates a minimal configuration with only id and command.
    ///
    /// @param id server identifier, not null
    /// @param command executable, not null
    /// @return new configuration, never null
    public static ServerConfig of(String id, String command) {
        return new ServerConfig(id, null, null, command, List.of(), Map.of(), null, false);
    }

    /// Returns the full command line: the command followed by its arguments.
    ///
    /// @return immutable command line, never null
    public List<String> commandLine() {
        List<String> line = new ArrayList<>(args.size() + 1);
        line.add(command);
        line.addAll(args);
        return List.copyOf(line);
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link ServerConfig}.
    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String command;
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private String cwd;
        private boolean autoStart;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder cwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder autoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @return the configured instance, never null
        /// @throws NullPointerException if id or command is missing
        public ServerConfig build() {
            return new ServerConfig(id, name, description, command, args, env, cwd, autoStart);
        }
    }
}
