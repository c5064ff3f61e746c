package io.toolhost.server.stdio;

import io.toolhost.core.exception.ToolHostException;
import io.toolhost.core.server.ServerConfig;
import java.io.File;
import java.io.IOException;
import java.util.Map;
import org.jboss.logging.Logger;

/// Launches servers as operating system processes.
///
/// The child inherits the host environment, overlaid with the server's
/// `env` entries; an entry with a null value removes the variable. The
/// child's stdin, stdout and stderr are all pipes owned by the connection.
public class DefaultProcessLauncher implements ProcessLauncher {

    private static final Logger LOG = Logger.getLogger(DefaultProcessLauncher.class);

    @Override
    public Process launch(ServerConfig config) {
        ProcessBuilder builder = new ProcessBuilder(config.commandLine());

        Map<String, String> environment = builder.environment();
        config.env()
                .forEach(
                        (key, value) -> {
                            if (value == null) {
                                environment.remove(key);
                            } else {
                                environment.put(key, value);
                            }
                        });
        if (config.cwd() != null) {
            builder.directory(new File(config.cwd()));
        }
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);
        builder.redirectOutput(ProcessBuilder.Redirect.PIPE);
        builder.redirectError(ProcessBuilder.Redirect.PIPE);

        try {
            Process process = builder.start();
            LOG.debugv("[{0}] Spawned {1}", config.id(), config.command());
            return process;
        } catch (IOException | SecurityException e) {
            throw ToolHostException.spawnFailure(config.id(), e);
        }
    }
}
