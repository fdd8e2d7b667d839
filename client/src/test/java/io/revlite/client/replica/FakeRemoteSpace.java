// file: client/src/test/java/io/revlite/client/replica/FakeRemoteSpace.java
package io.revlite.client.replica;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionBuilder;
import io.revlite.core.protocol.Query;
import io.revlite.core.protocol.QueryResult;
import io.revlite.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Authoritative in-memory space for replica tests. Applies the same cause
 * check a real remote does and counts round trips.
 */
final class FakeRemoteSpace implements RemoteSpace {

    private final String space;
    private final Address head;
    private final Map<Address, Revision> current = new HashMap<>();
    private final Map<Address, ReplicaError> rejectOnly = new HashMap<>();
    private final List<Transaction> transactions = new ArrayList<>();
    private final List<CompletableFuture<Result<Commit>>> held = new ArrayList<>();
    private long sequence;
    private int queries;
    private int failNextQueries;
    private boolean holdTransactions;
    private Consumer<List<Revision>> subscriber;

    final CompletableFuture<Transaction> firstTransaction = new CompletableFuture<>();

    FakeRemoteSpace(String space) {
        this.space = space;
        this.head = new Address(Replica.COMMIT_LOG, space);
    }

    @Override
    public String space() {
        return space;
    }

    @Override
    public synchronized CompletableFuture<Result<QueryResult>> query(ObjectNode query) {
        queries++;
        if (failNextQueries > 0) {
            failNextQueries--;
            return CompletableFuture.completedFuture(
                    Result.failure(new ReplicaError.ConnectionError("fake", "connection reset")));
        }
        return CompletableFuture.completedFuture(Result.ok(answer(query)));
    }

    @Override
    public synchronized CompletableFuture<Result<Commit>> transact(Transaction tx) {
        transactions.add(tx);
        firstTransaction.complete(tx);
        if (holdTransactions) {
            CompletableFuture<Result<Commit>> later = new CompletableFuture<>();
            held.add(later);
            return later;
        }
        return CompletableFuture.completedFuture(commit(tx));
    }

    @Override
    public synchronized CompletableFuture<Result<QueryResult>> subscribe(ObjectNode query,
                                                                      Consumer<List<Revision>> onDelivery) {
        subscriber = onDelivery;
        return CompletableFuture.completedFuture(Result.ok(answer(query)));
    }

    // ---------- test controls ----------

    /** Another writer sets {@code address} to {@code value}. */
    synchronized Revision write(Address address, JsonNode value) {
        Revision r = Revision.asserted(address, value, RevisionBuilder.causeOf(address, current.get(address)), ++sequence);
        current.put(address, r);
        return r;
    }

    synchronized Revision current(Address address) {
        return current.get(address);
    }

    synchronized int queries() {
        return queries;
    }

    synchronized int transactions() {
        return transactions.size();
    }

    synchronized void failNextQueries(int n) {
        failNextQueries = n;
    }

    /** Reject writes to {@code address} inside otherwise accepted transactions. */
    synchronized void rejectOnly(Address address) {
        rejectOnly(address, new ReplicaError.TransactionError("not allowed"));
    }

    synchronized void rejectOnly(Address address, ReplicaError why) {
        rejectOnly.put(address, why);
    }

    synchronized void holdTransactions() {
        holdTransactions = true;
    }

    /** Answer every held transaction as the remote would have. */
    void release() {
        List<CompletableFuture<Result<Commit>>> waiting;
        List<Transaction> txs;
        synchronized (this) {
            holdTransactions = false;
            waiting = new ArrayList<>(held);
            txs = new ArrayList<>(transactions.subList(transactions.size() - held.size(), transactions.size()));
            held.clear();
        }
        for (int i = 0; i < waiting.size(); i++) {
            Result<Commit> r;
            synchronized (this) {
                r = commit(txs.get(i));
            }
            waiting.get(i).complete(r);
        }
    }

    /** Push revisions to the subscriber as a deliver frame would. */
    void deliver(List<Revision> revisions) {
        Consumer<List<Revision>> s;
        synchronized (this) {
            s = subscriber;
        }
        if (s == null) throw new IllegalStateException("nobody subscribed");
        s.accept(revisions);
    }

    // ---------- helpers ----------

    private QueryResult answer(ObjectNode query) {
        List<Revision> facts = new ArrayList<>();
        for (Query.Entry e : Query.entries(query)) {
            Revision r = current.get(e.address());
            if (r != null) facts.add(r);
        }
        return new QueryResult(facts, Map.of());
    }

    private Result<Commit> commit(Transaction tx) {
        for (Transaction.Write w : tx.writes()) {
            if (rejectOnly.containsKey(w.address())) continue;
            if (!w.cause().equals(RevisionBuilder.causeOf(w.address(), current.get(w.address())))) {
                return Result.failure(new ReplicaError.ConflictError(
                        "stale cause for " + w.address(), List.of(w.address())));
            }
        }
        long since = ++sequence;
        Map<Address, ReplicaError> rejected = new HashMap<>();
        for (Transaction.Write w : tx.writes()) {
            if (rejectOnly.containsKey(w.address())) {
                rejected.put(w.address(), rejectOnly.get(w.address()));
                continue;
            }
            current.put(w.address(), w.revision().withSince(since));
        }
        ObjectNode is = CanonicalJson.MAPPER.createObjectNode();
        is.put("since", since);
        Revision newHead = Revision.asserted(head, is, RevisionBuilder.causeOf(head, current.get(head)), since);
        current.put(head, newHead);
        return Result.ok(new Commit(since, newHead, rejected));
    }
}
