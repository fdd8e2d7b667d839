// file: client/src/main/java/io/revlite/client/session/SessionRemoteSpace.java
package io.revlite.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.client.replica.RemoteSpace;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.protocol.Invocation;
import io.revlite.core.protocol.MessageCodec;
import io.revlite.core.protocol.ProviderMessage;
import io.revlite.core.protocol.QueryResult;
import io.revlite.core.protocol.RevisionCodec;
import io.revlite.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link RemoteSpace} for one memory space over a shared {@link Session}.
 * Builds the get / tx / subscribe invocations and decodes their answers.
 */
public final class SessionRemoteSpace implements RemoteSpace {
    private static final Logger log = Logger.getLogger(SessionRemoteSpace.class.getName());

    private final Session session;
    private final String space;

    public SessionRemoteSpace(Session session, String space) {
        this.session = Objects.requireNonNull(session, "session");
        this.space = Objects.requireNonNull(space, "space");
    }

    @Override
    public String space() {
        return space;
    }

    @Override
    public CompletableFuture<Result<QueryResult>> query(ObjectNode query) {
        return session.invoke(invocation(Invocation.GET, selection(query)))
                .thenApply(r -> decode(r, QueryResult::fromJson, query));
    }

    @Override
    public CompletableFuture<Result<Commit>> transact(Transaction transaction) {
        return session.invoke(invocation(Invocation.TX, transaction.toArgs()))
                .thenApply(r -> decode(r, MessageCodec::decodeCommit, null));
    }

    @Override
    public CompletableFuture<Result<QueryResult>> subscribe(ObjectNode query, Consumer<List<Revision>> onDelivery) {
        Invocation subscribe = invocation(Invocation.SUBSCRIBE, selection(query));
        return session.subscribe(subscribe, deliver -> onDelivery.accept(revisions(deliver)))
                .thenApply(r -> decode(r, QueryResult::fromJson, query));
    }

    // ---------- helpers ----------

    private Invocation invocation(String command, ObjectNode args) {
        return new Invocation(session.issuer(), command, space, args);
    }

    private ObjectNode selection(ObjectNode query) {
        ObjectNode args = CanonicalJson.MAPPER.createObjectNode();
        args.put("consumerId", session.clientId());
        args.set("query", query);
        return args;
    }

    private static <T> Result<T> decode(Result<JsonNode> r, Function<JsonNode, T> decoder, JsonNode selector) {
        if (!r.isOk()) {
            return Result.failure(r.error());
        }
        try {
            return Result.ok(decoder.apply(r.value()));
        } catch (IllegalArgumentException e) {
            String message = "malformed answer: " + e.getMessage();
            return Result.failure(selector == null
                    ? new ReplicaError.TransactionError(message)
                    : new ReplicaError.QueryError(message, selector));
        }
    }

    /** Snapshot and delta documents both carry whole revisions. */
    private List<Revision> revisions(ProviderMessage.Deliver deliver) {
        List<Revision> out = new ArrayList<>(deliver.docs().size());
        for (ProviderMessage.Doc doc : deliver.docs()) {
            try {
                Revision r = RevisionCodec.fromBody(doc.body(), doc.version());
                if (!r.address().equals(Address.fromKey(doc.docId()))) {
                    log.warning("Delivered doc " + doc.docId() + " carries revision for " + r.address());
                    continue;
                }
                out.add(r);
            } catch (IllegalArgumentException e) {
                log.warning("Skipping malformed delivered doc " + doc.docId() + ": " + e.getMessage());
            }
        }
        return out;
    }
}
