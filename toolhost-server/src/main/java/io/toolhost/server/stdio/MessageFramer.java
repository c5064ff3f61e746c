package io.toolhost.server.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.server.validation.LogSanitizer;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.jboss.logging.Logger;

/// Splits a chunked character stream into newline-delimited JSON values.
///
/// Chunks are appended to an internal buffer; every complete line (up to,
/// not including, `\n`) is cut from the buffer, parsed and handed to the
/// listeners synchronously and in arrival order. An incomplete trailing
/// fragment stays buffered until a later chunk completes it, so the emitted
/// values do not depend on how the stream was chunked.
///
/// Lines that are not JSON are dropped with a DEBUG diagnostic: tool
/// providers often print their own log output on the protocol stream.
/// Blank lines are skipped silently. A trailing `\r` is removed before
/// parsing.
///
/// ### Thread Safety
/// {@link #feed(CharSequence)} is synchronized; a connection feeds from a
/// single reader thread, so listeners observe one ordered stream.
///
/// ### Usage
/// {@snippet :
/// MessageFramer framer = new MessageFramer("echo", jsonRpc);
/// framer.addListener(node -> System.out.println(node));
/// framer.feed("{\"id\":1,\"res");
/// framer.feed("ult\":{}}\n");   // emits {"id":1,"result":{}}
/// }
public class MessageFramer {

    private static final Logger LOG = Logger.getLogger(MessageFramer.class);

    private final String source;
    private final JsonRpc jsonRpc;
    private final StringBuilder buffer = new StringBuilder();
    private final List<Consumer<JsonNode>> listeners = new CopyOnWriteArrayList<>();

    /// Creates a framer.
    ///
    /// @param source name of the stream for diagnostics (usually the server id), not null
    /// @param jsonRpc codec used to parse lines, not null
    public MessageFramer(String source, JsonRpc jsonRpc) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
    }

    /// Registers a listener for decoded values.
    ///
    /// @param listener receives each decoded value, not null
    public void addListener(Consumer<JsonNode> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Appends a chunk and emits every line it completes.
    ///
    /// Never blocks on I/O.
    ///
    /// @param chunk the next piece of the stream, not null (may be empty)
    public synchronized void feed(CharSequence chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        buffer.append(chunk);

        int newline;
        while ((newline = buffer.indexOf("\n")) >= 0) {
            String line = buffer.substring(0, newline);
            buffer.delete(0, newline + 1);
            handleLine(line);
        }
    }

    /// Returns the number of buffered characters that do not yet form a complete line.
    ///
    /// @return length of the pending fragment
    public synchronized int bufferedLength() {
        return buffer.length();
    }

    private void handleLine(String rawLine) {
        String line =
                rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        if (line.isBlank()) {
            return;
        }

        JsonNode value;
        try {
            value = jsonRpc.parse(line);
        } catch (ToolHostException e) {
            LOG.debugv(
                    "[{0}] Ignoring non-protocol output: {1}",
                    source, LogSanitizer.abbreviate(line, 200));
            return;
        }

        for (Consumer<JsonNode> listener : listeners) {
            try {
                listener.accept(value);
            } catch (RuntimeException e) {
                LOG.warnv(e, "[{0}] Message listener failed", source);
            }
        }
    }
}
