// file: server/src/main/java/io/revlite/server/ProviderEndpoint.java
package io.revlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.protocol.Envelope;
import io.revlite.core.protocol.Invocation;
import io.revlite.core.protocol.MessageCodec;
import io.revlite.core.protocol.ProviderMessage;
import io.revlite.core.protocol.RevisionCodec;
import io.revlite.core.protocol.Transaction;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket adapter over {@link MemoryProvider}.
 *
 * Responsibilities:
 *  - Decode envelopes, dispatch on the invocation command.
 *  - Answer each invocation with a task/return carrying its hash.
 *  - Track per-connection subscriptions and push a deliver frame to every
 *    subscriber of a space after each accepted transaction.
 *  - On subscribe, backfill changes newer than the sequence the client
 *    reported in its hello.
 *
 * Path layout:
 *   - {path}            WebSocket endpoint (configurable, default /api/storage/memory)
 *   - GET /admin/health Basic health check
 */
public final class ProviderEndpoint {

    private final Undertow server;
    private final MemoryProvider provider;
    private final Set<Peer> peers = ConcurrentHashMap.newKeySet();

    public ProviderEndpoint(ServerConfig cfg, MemoryProvider provider) {
        this.provider = provider;
        this.server = Undertow.builder()
                .addHttpListener(cfg.port(), cfg.host())
                .setHandler(Handlers.path()
                        .addExactPath("/admin/health", this::handleHealth)
                        .addPrefixPath(cfg.path(), Handlers.websocket(this::onConnect)))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Number of open client connections. */
    public int connections() {
        return peers.size();
    }

    // ---------- handlers ----------

    private void handleHealth(HttpServerExchange ex) {
        ObjectNode body = CanonicalJson.MAPPER.createObjectNode();
        body.put("status", "ok");
        body.put("sequence", provider.sequence());
        body.put("connections", peers.size());
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        ex.setStatusCode(200);
        ex.getResponseSender().send(CanonicalJson.string(body), StandardCharsets.UTF_8);
    }

    private void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        Peer peer = new Peer(channel);
        peers.add(peer);
        RequestLogger.logConnection(peer.name, "connected");

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                peer.onText(message.getData());
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                RequestLogger.logConnection(peer.name, "closed (" + cm.getCode() + ")");
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                RequestLogger.logConnection(peer.name, "failed: " + error.getMessage());
                super.onError(ch, error);
            }
        });
        channel.addCloseTask(ch -> peers.remove(peer));
        channel.resumeReceives();
    }

    private void broadcast(String space, Commit commit) {
        List<Revision> changes = provider.changes(space, commit.since() - 1, commit.since());
        for (Peer p : peers) {
            if (p.subscribed.contains(space)) {
                p.deliver(space, changes, ProviderMessage.Doc.DELTA);
            }
        }
    }

    /** One client connection. */
    private final class Peer {
        final WebSocketChannel channel;
        final String name;
        final Set<String> subscribed = ConcurrentHashMap.newKeySet();
        final AtomicLong epoch = new AtomicLong();
        volatile long sinceSequence = Revision.UNCONFIRMED;
        volatile String clientId = "?";

        Peer(WebSocketChannel channel) {
            this.channel = channel;
            this.name = String.valueOf(channel.getPeerAddress());
        }

        void onText(String text) {
            Envelope envelope;
            try {
                envelope = MessageCodec.decodeEnvelope(text);
            } catch (IllegalArgumentException e) {
                RequestLogger.logInvocation(name, "?", "?", "malformed: " + e.getMessage(), 0, null);
                return;
            }
            Invocation inv = envelope.invocation();
            long start = System.nanoTime();
            String outcome;
            Throwable error = null;
            try {
                outcome = dispatch(inv);
            } catch (RuntimeException e) {
                error = e;
                outcome = "TransactionError";
                reply(inv, MessageCodec.error(new ReplicaError.TransactionError("internal error: " + e.getMessage())));
            }
            long totalMs = (System.nanoTime() - start) / 1_000_000;
            RequestLogger.logInvocation(name, inv.command(), inv.subject(), outcome, totalMs, error);
        }

        /** @return "ok", the error name, or a short note for hello */
        private String dispatch(Invocation inv) {
            JsonNode args = inv.args();
            return switch (inv.command()) {
                case Invocation.HELLO -> {
                    clientId = args.path("clientId").asText("?");
                    sinceSequence = args.path("sinceSequence").asLong(Revision.UNCONFIRMED);
                    yield "hello " + clientId + " since=" + sinceSequence;
                }
                case Invocation.GET -> {
                    JsonNode query = args.get("query");
                    try {
                        yield answer(inv, Result.ok(provider.query(inv.subject(), query).toJson()));
                    } catch (IllegalArgumentException e) {
                        yield answer(inv, Result.failure(new ReplicaError.QueryError(e.getMessage(), query)));
                    }
                }
                case Invocation.SUBSCRIBE -> {
                    JsonNode query = args.get("query");
                    try {
                        String outcome = answer(inv, Result.ok(provider.query(inv.subject(), query).toJson()));
                        subscribed.add(inv.subject());
                        backfill(inv.subject());
                        yield outcome;
                    } catch (IllegalArgumentException e) {
                        yield answer(inv, Result.failure(new ReplicaError.QueryError(e.getMessage(), query)));
                    }
                }
                case Invocation.TX -> {
                    Transaction tx;
                    try {
                        tx = Transaction.fromArgs(args);
                    } catch (IllegalArgumentException e) {
                        yield answer(inv, Result.failure(new ReplicaError.TransactionError(e.getMessage())));
                    }
                    Result<Commit> r = provider.transact(inv.subject(), tx);
                    String outcome = answer(inv, r.map(MessageCodec::encodeCommit));
                    if (r.isOk()) {
                        broadcast(inv.subject(), r.value());
                    }
                    yield outcome;
                }
                case Invocation.ACK -> "ok";
                default -> answer(inv, Result.failure(
                        new ReplicaError.TransactionError("unknown command: " + inv.command())));
            };
        }

        private void backfill(String space) {
            long since = sinceSequence;
            if (since < 0) return;
            List<Revision> missed = provider.changes(space, since, Long.MAX_VALUE);
            if (!missed.isEmpty()) {
                deliver(space, missed, ProviderMessage.Doc.SNAPSHOT);
            }
        }

        private String answer(Invocation inv, Result<? extends JsonNode> r) {
            if (r.isOk()) {
                reply(inv, MessageCodec.ok(r.value()));
                return "ok";
            }
            reply(inv, MessageCodec.error(r.error()));
            return r.error().name();
        }

        private void reply(Invocation inv, JsonNode is) {
            send(MessageCodec.encode(new ProviderMessage.TaskReturn(inv.ref(), is)));
        }

        void deliver(String space, List<Revision> revisions, String kind) {
            List<ProviderMessage.Doc> docs = new ArrayList<>(revisions.size());
            for (Revision r : revisions) {
                docs.add(new ProviderMessage.Doc(r.address().key(), kind, RevisionCodec.body(r), r.since()));
            }
            send(MessageCodec.encode(new ProviderMessage.Deliver(space, epoch.incrementAndGet(), docs)));
        }

        synchronized void send(String frame) {
            if (channel.isOpen()) {
                WebSockets.sendText(frame, channel, null);
            }
        }

        @Override
        public String toString() {
            return name + " (" + clientId + ")";
        }
    }
}
