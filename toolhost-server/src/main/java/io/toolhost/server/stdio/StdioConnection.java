package io.toolhost.server.stdio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.toolhost.core.exception.ToolHostException;
import io.toolhost.server.validation.LogSanitizer;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/// JSON-RPC connection to one child process over its stdin and stdout.
///
/// Owns the write side of the child's stdin, a reader thread that feeds the
/// child's stdout into a {@link MessageFramer}, and a drain thread for the
/// child's stderr. Outgoing requests get ids from a per-connection counter
/// starting at 1 and are tracked in a pending table until the response with
/// the same id arrives, the per-request timeout fires, or the connection
/// closes. Each pending entry is resolved exactly once; responses for ids that
/// are no longer pending (late after a timeout, or never sent) are dropped.
///
/// Provider-initiated traffic:
/// - notifications are forwarded to the {@link Listener}
/// - a `ping` request is answered with an empty result
/// - every other request is answered with `-32601` (method not found)
///
/// ### Thread Safety
/// Safe for concurrent use. Writes are serialized so that lines from
/// concurrent requests never interleave.
///
/// @see HandshakeProtocol for the initialization sequence run over this connection
public class StdioConnection {

    private static final Logger LOG = Logger.getLogger(StdioConnection.class);

    /// Receives provider notifications and the connection's end.
    public interface Listener {

        /// Called on the reader thread for each provider notification.
        ///
        /// @param notification the notification, not null
        default void onNotification(JsonRpcMessage.Notification notification) {}

        /// Called once when the connection closes for any reason.
        ///
        /// @param reason why the connection closed, not null
        default void onClosed(ToolHostException reason) {}
    }

    private final String serverId;
    private final Process process;
    private final JsonRpc jsonRpc;
    private final ScheduledExecutorService scheduler;
    private final MessageFramer framer;
    private final Writer stdin;
    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, PendingRequest> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean opened = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Listener listener = new Listener() {};

    /// Creates a connection over an already spawned process.
    ///
    /// @param serverId id of the owning server, used in diagnostics, not null
    /// @param process the child process, not null
    /// @param jsonRpc message codec, not null
    /// @param scheduler scheduler for request timeouts, not null
    public StdioConnection(
            String serverId,
            Process process,
            JsonRpc jsonRpc,
            ScheduledExecutorService scheduler) {
        this.serverId = Objects.requireNonNull(serverId, "serverId must not be null");
        this.process = Objects.requireNonNull(process, "process must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.stdin =
                new BufferedWriter(
                        new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.framer = new MessageFramer(serverId, jsonRpc);
        this.framer.addListener(this::dispatch);
    }

    /// Sets the listener for notifications and close events.
    ///
    /// @param listener the listener, not null
    public void setListener(Listener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Starts the stdout reader and stderr drain threads.
    ///
    /// Subsequent calls are no-ops.
    public void open() {
        if (!opened.compareAndSet(false, true)) {
            return;
        }
        Thread reader = new Thread(this::readStdout, "toolhost-" + serverId + "-stdout");
        reader.setDaemon(true);
        reader.start();

        Thread drain = new Thread(this::drainStderr, "toolhost-" + serverId + "-stderr");
        drain.setDaemon(true);
        drain.start();
    }

    /// Sends a request and returns its eventual result.
    ///
    /// The request is written immediately, before the returned {@link Uni} is
    /// subscribed. The result is emitted on a Mutiny worker thread, never on
    /// the stdout reader, so continuations may write to the child. The result
    /// fails with a TIMEOUT error when no response arrives within `timeout`,
    /// with REMOTE_ERROR when the provider answers with an error, and with
    /// CONNECTION_LOST when the connection closes first.
    ///
    /// @param method request method, not null
    /// @param params request parameters, may be null
    /// @param timeout maximum wait for the response, not null
    /// @return the response's `result` value
    public Uni<JsonNode> request(String method, Object params, Duration timeout) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");

        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(
                    ToolHostException.connectionLost(serverId, "connection closed"));
            return settled(future);
        }

        long id = nextId.getAndIncrement();
        PendingRequest request = new PendingRequest(id, method, Instant.now(), future);
        pending.put(id, request);

        ScheduledFuture<?> timer =
                scheduler.schedule(
                        () -> {
                            if (pending.remove(id, request)) {
                                LOG.warnv(
                                        "[{0}] Request {1} ''{2}'' timed out after {3}ms",
                                        serverId, id, method, timeout.toMillis());
                                future.completeExceptionally(
                                        ToolHostException.timeout(method, timeout));
                            }
                        },
                        timeout.toMillis(),
                        TimeUnit.MILLISECONDS);
        future.whenComplete(
                (result, error) -> {
                    timer.cancel(false);
                    pending.remove(id, request);
                });

        try {
            writeLine(jsonRpc.createRequest(id, method, params));
        } catch (IOException e) {
            ToolHostException lost =
                    ToolHostException.connectionLost(serverId, "write failed: " + e.getMessage());
            closeWith(lost);
            future.completeExceptionally(lost);
        }

        return settled(future);
    }

    /// Sends a notification. Write failures close the connection.
    ///
    /// @param method notification method, not null
    /// @param params notification parameters, may be null
    public void sendNotification(String method, Object params) {
        Objects.requireNonNull(method, "method must not be null");
        try {
            writeLine(jsonRpc.createNotification(method, params));
        } catch (IOException e) {
            closeWith(
                    ToolHostException.connectionLost(serverId, "write failed: " + e.getMessage()));
        }
    }

    /// Closes the connection. Pending requests fail with CONNECTION_LOST.
    ///
    /// Does not terminate the process; the owner does that.
    public void close() {
        closeWith(ToolHostException.connectionLost(serverId, "connection closed"));
    }

    /// Returns whether the connection still accepts requests.
    ///
    /// @return true until closed
    public boolean isOpen() {
        return !closed.get();
    }

    /// Returns the number of requests still awaiting a response.
    ///
    /// @return pending request count
    public int pendingRequestCount() {
        return pending.size();
    }

    /// Returns the id of the owning server.
    ///
    /// @return server id, never null
    public String serverId() {
        return serverId;
    }

    /// Returns the underlying process.
    ///
    /// @return process, never null
    public Process process() {
        return process;
    }

    private static Uni<JsonNode> settled(CompletableFuture<JsonNode> future) {
        return Uni.createFrom()
                .completionStage(future)
                .emitOn(Infrastructure.getDefaultWorkerPool());
    }

    private void writeLine(String line) throws IOException {
        if (closed.get()) {
            throw new IOException("connection closed");
        }
        synchronized (stdin) {
            LOG.tracev("[{0}] -> {1}", serverId, LogSanitizer.sanitize(line));
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        }
    }

    private void readStdout() {
        char[] chunk = new char[8192];
        try (Reader reader =
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(chunk)) != -1) {
                framer.feed(new String(chunk, 0, read));
            }
            closeWith(ToolHostException.connectionLost(serverId, "stdout closed"));
        } catch (IOException e) {
            closeWith(ToolHostException.connectionLost(serverId, "read failed: " + e.getMessage()));
        }
    }

    private void drainStderr() {
        try (BufferedReader reader =
                new BufferedReader(
                        new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debugv("[{0}] stderr: {1}", serverId, LogSanitizer.sanitize(line));
            }
        } catch (IOException e) {
            LOG.debugv("[{0}] stderr closed: {1}", serverId, e.getMessage());
        }
    }

    private void dispatch(JsonNode node) {
        JsonRpcMessage message;
        try {
            message = jsonRpc.classify(node);
        } catch (ToolHostException e) {
            LOG.debugv("[{0}] Ignoring message: {1}", serverId, e.getMessage());
            return;
        }

        if (message instanceof JsonRpcMessage.Response response) {
            handleResponse(response);
        } else if (message instanceof JsonRpcMessage.Notification notification) {
            LOG.debugv("[{0}] Notification {1}", serverId, notification.method());
            try {
                listener.onNotification(notification);
            } catch (RuntimeException e) {
                LOG.warnv(e, "[{0}] Notification listener failed", serverId);
            }
        } else if (message instanceof JsonRpcMessage.Request request) {
            handleProviderRequest(request);
        }
    }

    private void handleResponse(JsonRpcMessage.Response response) {
        Long id = response.numericId().orElse(null);
        PendingRequest request = id != null ? pending.remove(id) : null;
        if (request == null) {
            LOG.debugv(
                    "[{0}] Discarding response for unknown or expired id {1}",
                    serverId, response.id());
            return;
        }

        if (response.isError()) {
            JsonRpcMessage.RpcError error = response.error();
            request.future()
                    .completeExceptionally(
                            ToolHostException.remoteError(
                                    request.method(),
                                    error.code(),
                                    error.message(),
                                    error.data() != null ? jsonRpc.toMap(error.data()) : null));
        } else {
            request.future().complete(response.result());
        }
    }

    private void handleProviderRequest(JsonRpcMessage.Request request) {
        String reply =
                "ping".equals(request.method())
                        ? jsonRpc.createResponse(
                                request.id(), JsonNodeFactory.instance.objectNode())
                        : jsonRpc.createErrorResponse(
                                request.id(),
                                JsonRpc.METHOD_NOT_FOUND,
                                "Method not found: " + request.method());
        // the reader thread never writes; a child blocked on stdout would stall both sides
        Infrastructure.getDefaultWorkerPool()
                .execute(
                        () -> {
                            try {
                                writeLine(reply);
                            } catch (IOException e) {
                                closeWith(
                                        ToolHostException.connectionLost(
                                                serverId, "write failed: " + e.getMessage()));
                            }
                        });
    }

    private void closeWith(ToolHostException reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOG.debugv("[{0}] Connection closed: {1}", serverId, reason.getMessage());

        synchronized (stdin) {
            try {
                stdin.close();
            } catch (IOException e) {
                LOG.debugv("[{0}] Closing stdin failed: {1}", serverId, e.getMessage());
            }
        }

        // the owner sees the loss before any waiting caller does
        try {
            listener.onClosed(reason);
        } catch (RuntimeException e) {
            LOG.warnv(e, "[{0}] Close listener failed", serverId);
        }

        List<PendingRequest> outstanding = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingRequest request : outstanding) {
            request.future().completeExceptionally(reason);
        }
    }
}
