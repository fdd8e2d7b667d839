// file: client/src/main/java/io/revlite/client/session/Session.java
package io.revlite.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.protocol.Envelope;
import io.revlite.core.protocol.Invocation;
import io.revlite.core.protocol.MessageCodec;
import io.revlite.core.protocol.ProviderMessage;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent, self-healing connection to the remote.
 * <p>
 * States:
 *   DISCONNECTED -> CONNECTING -> OPEN -> (CLOSING | ERROR) -> DISCONNECTED,
 *   plus CLOSED after {@link #close()}.
 * <p>
 * Responsibilities:
 *  - Frame invocations and correlate each task/return with its caller through
 *    one pending map keyed by invocation hash. Identical in-flight invocations
 *    share one entry and one frame. This is the one place commands are
 *    deduplicated: byte-identical invocations are answered identically, and
 *    every {@code tx} carries a fresh clientTxId, so no two writes ever merge.
 *  - While not open, keep invocations in the pending map in issue order.
 *    On open: send hello, re-issue active subscriptions, then flush the
 *    pending map in order. Invocations whose answer was lost with a dropped
 *    connection are therefore retried on the next one.
 *  - Abort a connection attempt that neither opens nor fails within the
 *    connection timeout; reconnect with capped exponential backoff.
 *  - Acknowledge every deliver frame immediately and route it to the stream's
 *    listener.
 * <p>
 * All state lives on the session's own single-threaded scheduler; transport
 * callbacks are re-submitted onto it and tagged with a connection generation
 * so late callbacks from an abandoned socket are ignored.
 */
public final class Session implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Session.class.getName());

    public enum State { DISCONNECTED, CONNECTING, OPEN, CLOSING, ERROR, CLOSED }

    private final Transport transport;
    private final URI uri;
    private final SessionSettings settings;
    private final String issuer;
    private final String clientId;
    private final String authorization;
    private final LongSupplier sinceSequence;
    private final ScheduledThreadPoolExecutor exec;

    // session thread only
    private final Map<ContentHash, Pending> pending = new LinkedHashMap<>();
    private final Map<ContentHash, Invocation> subscriptions = new LinkedHashMap<>();
    private final Map<String, Consumer<ProviderMessage.Deliver>> streams = new HashMap<>();
    private Transport.Connection connection;
    private int generation;
    private int attempt;
    private boolean everOpened;
    private ScheduledFuture<?> watchdog;
    private ScheduledFuture<?> reconnect;

    private volatile State state = State.DISCONNECTED;

    /**
     * @param issuer        identity placed on every invocation
     * @param clientId      sent in hello so the remote can resume this client
     * @param authorization opaque token carried on every envelope
     * @param sinceSequence last sequence number seen, read at each hello
     */
    public Session(Transport transport,
                   URI uri,
                   SessionSettings settings,
                   String issuer,
                   String clientId,
                   String authorization,
                   LongSupplier sinceSequence) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.authorization = authorization == null ? "" : authorization;
        this.sinceSequence = Objects.requireNonNull(sinceSequence, "sinceSequence");
        this.exec = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "revlite-session");
            t.setDaemon(true);
            return t;
        });
        this.exec.setRemoveOnCancelPolicy(true);
        this.exec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    public State state() {
        return state;
    }

    public String issuer() {
        return issuer;
    }

    public String clientId() {
        return clientId;
    }

    /** Start connecting. Later reconnects happen on their own. */
    public void connect() {
        submit(() -> {
            if (state == State.DISCONNECTED && connection == null) {
                open();
            }
        });
    }

    /**
     * Send {@code invocation} now or as soon as a connection is open.
     *
     * @return the remote's answer: the ok payload or a typed error; a
     *         {@code ConnectionError} once the session is closed
     */
    public CompletableFuture<Result<JsonNode>> invoke(Invocation invocation) {
        CompletableFuture<Result<JsonNode>> answer = new CompletableFuture<>();
        if (!submit(() -> enqueue(invocation, answer))) {
            answer.complete(Result.failure(closedError()));
        }
        return answer;
    }

    /**
     * Like {@link #invoke}, and remember the subscription so it is re-issued on
     * every reconnect. Deliveries for the invocation's subject go to {@code onDeliver}.
     */
    public CompletableFuture<Result<JsonNode>> subscribe(Invocation invocation,
                                                         Consumer<ProviderMessage.Deliver> onDeliver) {
        CompletableFuture<Result<JsonNode>> answer = new CompletableFuture<>();
        boolean accepted = submit(() -> {
            if (state != State.CLOSED) {
                subscriptions.put(invocation.ref(), invocation);
                streams.put(invocation.subject(), onDeliver);
            }
            enqueue(invocation, answer);
        });
        if (!accepted) {
            answer.complete(Result.failure(closedError()));
        }
        return answer;
    }

    /** Stop reconnecting and fail every pending invocation with a ConnectionError. */
    @Override
    public void close() {
        if (submit(this::shutdown)) {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(2, TimeUnit.SECONDS)) {
                    log.warning("Session executor did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------- state machine (session thread) ----------

    private void enqueue(Invocation invocation, CompletableFuture<Result<JsonNode>> answer) {
        if (state == State.CLOSED) {
            answer.complete(Result.failure(closedError()));
            return;
        }
        ContentHash ref = invocation.ref();
        Pending existing = pending.get(ref);
        if (existing != null) {
            existing.waiters.add(answer);
            return;
        }
        Pending p = new Pending(invocation, frame(invocation));
        p.waiters.add(answer);
        pending.put(ref, p);
        if (state == State.OPEN) {
            send(p);
        }
    }

    private void open() {
        if (state == State.CLOSED) return;
        int gen = ++generation;
        state = State.CONNECTING;
        log.info("Connecting to " + uri + (attempt > 0 ? " (attempt " + (attempt + 1) + ")" : ""));
        watchdog = exec.schedule(() -> onWatchdog(gen), settings.connectionTimeout().toMillis(), TimeUnit.MILLISECONDS);

        CompletableFuture<Transport.Connection> opening;
        try {
            opening = transport.connect(uri, new GenerationListener(gen));
        } catch (RuntimeException e) {
            onConnectFailed(gen, e);
            return;
        }
        opening.whenComplete((conn, err) -> {
            boolean accepted = submit(() -> {
                if (err != null) {
                    onConnectFailed(gen, err);
                } else {
                    onOpen(gen, conn);
                }
            });
            if (!accepted && conn != null) {
                conn.abort();
            }
        });
    }

    private void onOpen(int gen, Transport.Connection conn) {
        if (gen != generation || state != State.CONNECTING) {
            conn.abort();
            return;
        }
        cancel(watchdog);
        connection = conn;
        state = State.OPEN;
        attempt = 0;
        log.info((everOpened ? "Reconnected to " : "Connected to ") + uri);
        everOpened = true;

        ObjectNode hello = CanonicalJson.MAPPER.createObjectNode();
        hello.put("clientId", clientId);
        hello.put("sinceSequence", sinceSequence.getAsLong());
        conn.send(frame(new Invocation(issuer, Invocation.HELLO, issuer, hello)));

        for (Map.Entry<ContentHash, Invocation> s : subscriptions.entrySet()) {
            if (!pending.containsKey(s.getKey())) {
                conn.send(frame(s.getValue()));
            }
        }
        for (Pending p : pending.values()) {
            send(p);
        }
    }

    private void onWatchdog(int gen) {
        if (gen != generation || state != State.CONNECTING) return;
        log.warning("Connection to " + uri + " not established within " + settings.connectionTimeout().toMillis() + " ms");
        generation++;
        state = State.ERROR;
        scheduleReconnect();
    }

    private void onConnectFailed(int gen, Throwable err) {
        if (gen != generation) return;
        cancel(watchdog);
        generation++;
        state = State.ERROR;
        log.warning("Connection to " + uri + " failed: " + describe(err));
        scheduleReconnect();
    }

    private void onDropped(int gen, Throwable err) {
        if (gen != generation) return;
        cancel(watchdog);
        connection = null;
        generation++;
        int unanswered = 0;
        for (Pending p : pending.values()) {
            if (p.sent) unanswered++;
            p.sent = false;
        }
        if (unanswered > 0) {
            log.info(unanswered + " unanswered invocations will be re-sent after reconnect");
        }
        if (err != null) {
            state = State.ERROR;
            log.warning("Connection to " + uri + " lost: " + describe(err));
        } else {
            state = State.CLOSING;
            log.info("Connection to " + uri + " closed by remote");
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (state == State.CLOSED) return;
        state = State.DISCONNECTED;
        long delay = settings.backoffMillis(attempt++);
        log.fine(() -> "Reconnecting in " + delay + " ms");
        reconnect = exec.schedule(this::open, delay, TimeUnit.MILLISECONDS);
    }

    private void onText(int gen, String text) {
        if (gen != generation || connection == null) return;
        ProviderMessage msg;
        try {
            msg = MessageCodec.decode(text);
        } catch (IllegalArgumentException e) {
            log.warning("Dropping malformed frame from " + uri + ": " + e.getMessage());
            return;
        }
        if (msg instanceof ProviderMessage.TaskReturn ret) {
            onTaskReturn(ret);
        } else {
            onDeliver((ProviderMessage.Deliver) msg);
        }
    }

    private void onTaskReturn(ProviderMessage.TaskReturn ret) {
        Pending p = pending.remove(ret.of());
        if (p == null) {
            log.fine(() -> "Ignoring task/return for unknown invocation " + ret.of());
            return;
        }
        log.fine(() -> "task/return for " + p.invocation.command() + " " + ret.of());
        Result<JsonNode> result;
        try {
            result = MessageCodec.unwrap(ret.is());
        } catch (IllegalArgumentException e) {
            result = Result.failure(new ReplicaError.TransactionError("malformed reply: " + e.getMessage()));
        }
        p.complete(result);
    }

    private void onDeliver(ProviderMessage.Deliver deliver) {
        ObjectNode ack = CanonicalJson.MAPPER.createObjectNode();
        ack.put("streamId", deliver.streamId());
        ack.put("epoch", deliver.epoch());
        connection.send(frame(new Invocation(issuer, Invocation.ACK, deliver.streamId(), ack)));

        Consumer<ProviderMessage.Deliver> listener = streams.get(deliver.streamId());
        if (listener == null) {
            log.fine(() -> "No listener for stream " + deliver.streamId());
            return;
        }
        try {
            listener.accept(deliver);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Delivery listener for " + deliver.streamId() + " failed", e);
        }
    }

    private void shutdown() {
        if (state == State.CLOSED) return;
        state = State.CLOSING;
        cancel(watchdog);
        cancel(reconnect);
        generation++;
        if (connection != null) {
            connection.close();
            connection = null;
        }
        ReplicaError closed = closedError();
        List<Pending> abandoned = new ArrayList<>(pending.values());
        pending.clear();
        for (Pending p : abandoned) {
            p.complete(Result.failure(closed));
        }
        state = State.CLOSED;
        log.info("Session to " + uri + " closed");
    }

    // ---------- helpers ----------

    private void send(Pending p) {
        connection.send(p.frame);
        p.sent = true;
    }

    private String frame(Invocation invocation) {
        return MessageCodec.encode(new Envelope(invocation, authorization));
    }

    private boolean submit(Runnable task) {
        try {
            exec.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private ReplicaError closedError() {
        return new ReplicaError.ConnectionError(uri.toString(), "session is closed");
    }

    private static void cancel(ScheduledFuture<?> f) {
        if (f != null) f.cancel(false);
    }

    private static String describe(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() == null ? "" : ": " + root.getMessage());
    }

    private static final class Pending {
        final Invocation invocation;
        final String frame;
        final List<CompletableFuture<Result<JsonNode>>> waiters = new ArrayList<>(1);
        boolean sent;

        Pending(Invocation invocation, String frame) {
            this.invocation = invocation;
            this.frame = frame;
        }

        void complete(Result<JsonNode> result) {
            for (CompletableFuture<Result<JsonNode>> w : waiters) {
                w.complete(result);
            }
        }
    }

    /** Transport callbacks for one connection attempt, re-submitted onto the session thread. */
    private final class GenerationListener implements Transport.Listener {
        private final int gen;

        GenerationListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onText(String text) {
            submit(() -> Session.this.onText(gen, text));
        }

        @Override
        public void onClose(int code, String reason) {
            submit(() -> onDropped(gen, null));
        }

        @Override
        public void onError(Throwable error) {
            submit(() -> onDropped(gen, error));
        }
    }
}
