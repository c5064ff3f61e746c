package io.toolhost.server.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolhost.core.server.ServerConfig;
import io.toolhost.server.validation.LogSanitizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/// Reads and writes server configuration files.
///
/// The document format is the one commonly used by tool-provider clients:
///
/// ```json
/// {
///   "mcpServers": {
///     "memory": {
///       "command": "npx",
///       "args": ["-y", "@modelcontextprotocol/server-memory"],
///       "env": {"MEMORY_FILE": "/tmp/memory.json"},
///       "cwd": "/tmp",
///       "autoStart": true,
///       "disabled": false
///     }
///   }
/// }
/// ```
///
/// Entries with `"disabled": true` are skipped. Entries without a `command`
/// are skipped with a warning so one bad entry never hides the rest. When no
/// `name` is given, the display name is the id with each dash-separated word
/// capitalized (`memory-server` becomes `Memory Server`).
@ApplicationScoped
public class ServerConfigLoader {

    private static final Logger LOG = Logger.getLogger(ServerConfigLoader.class);

    static final String ROOT_FIELD = "mcpServers";

    private final ObjectMapper mapper;

    @Inject
    public ServerConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /// Reads server configurations from a file.
    ///
    /// @param path configuration file, not null
    /// @return enabled server configurations in file order, never null
    /// @throws IOException if the file cannot be read or is not valid JSON
    public List<ServerConfig> load(Path path) throws IOException {
        LOG.infov("Loading server configuration from {0}", path);
        return parse(Files.readString(path));
    }

    /// Parses a configuration document.
    ///
    /// @param json configuration document, not null
    /// @return enabled server configurations in document order, never null
    /// @throws IOException if the document is not valid JSON or has no server map
    public List<ServerConfig> parse(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        JsonNode servers = root != null ? root.get(ROOT_FIELD) : null;
        if (servers == null || !servers.isObject()) {
            throw new IOException("Configuration has no '" + ROOT_FIELD + "' object");
        }

        List<ServerConfig> configs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = servers.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String id = entry.getKey();
            JsonNode server = entry.getValue();

            if (server.path("disabled").asBoolean(false)) {
                LOG.debugv("Skipping disabled server {0}", LogSanitizer.sanitize(id));
                continue;
            }
            String command = server.path("command").asText("");
            if (id.isBlank() || command.isBlank()) {
                LOG.warnv("Skipping server {0}: no command", LogSanitizer.sanitize(id));
                continue;
            }
            configs.add(toConfig(id, command, server));
        }
        return configs;
    }

    /// Writes configurations as a configuration document.
    ///
    /// @param configs configurations to export, not null
    /// @return pretty-printed document, never null
    /// @throws JsonProcessingException if serialization fails
    public String export(List<ServerConfig> configs) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode servers = root.putObject(ROOT_FIELD);
        for (ServerConfig config : configs) {
            ObjectNode server = servers.putObject(config.id());
            server.put("command", config.command());
            if (!config.args().isEmpty()) {
                ArrayNode args = server.putArray("args");
                config.args().forEach(args::add);
            }
            if (!config.env().isEmpty()) {
                ObjectNode env = server.putObject("env");
                config.env().forEach(env::put);
            }
            if (config.cwd() != null) {
                server.put("cwd", config.cwd());
            }
            if (!config.name().equals(displayName(config.id()))) {
                server.put("name", config.name());
            }
            if (!config.description().isEmpty()) {
                server.put("description", config.description());
            }
            if (config.autoStart()) {
                server.put("autoStart", true);
            }
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    /// Derives a display name from a server id.
    ///
    /// @param id server id, not null
    /// @return id with dash-separated words capitalized
    static String displayName(String id) {
        StringBuilder name = new StringBuilder();
        for (String word : id.split("-")) {
            if (word.isEmpty()) {
                continue;
            }
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return name.length() > 0 ? name.toString() : id;
    }

    private ServerConfig toConfig(String id, String command, JsonNode server) {
        List<String> args = new ArrayList<>();
        server.path("args").forEach(arg -> args.add(arg.asText()));

        Map<String, String> env = new LinkedHashMap<>();
        server.path("env")
                .fields()
                .forEachRemaining(
                        variable ->
                                env.put(
                                        variable.getKey(),
                                        variable.getValue().isNull()
                                                ? null
                                                : variable.getValue().asText()));

        JsonNode name = server.get("name");
        return ServerConfig.builder()
                .id(id)
                .name(name != null && name.isTextual() ? name.asText() : displayName(id))
                .description(server.path("description").asText(""))
                .command(command)
                .args(args)
                .env(env)
                .cwd(server.path("cwd").asText(null))
                .autoStart(server.path("autoStart").asBoolean(false))
                .build();
    }
}
