// file: server/src/main/java/io/revlite/server/MemoryProvider.java
package io.revlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.ContentHash;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionBuilder;
import io.revlite.core.protocol.Query;
import io.revlite.core.protocol.QueryResult;
import io.revlite.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Authoritative in-memory store behind the development endpoint.
 * <p>
 * Responsibilities:
 *  - Assign one server-wide sequence number per accepted transaction.
 *  - Reject a whole transaction when any write names a cause that is not the
 *    current head of its address.
 *  - Advance the space's commit-log head with every transaction.
 *  - Answer a transaction replayed under the same clientTxId with its
 *    original commit, so a client resending after a dropped connection does
 *    not see its own write as a conflict.
 *  - Keep an append-only change log per space for backfill after reconnect.
 * <p>
 * Not a production engine: no persistence, no link following for schema
 * queries, no authorization.
 */
public final class MemoryProvider {

    /** Attribute of the commit-log head; its entity is the space itself. */
    public static final String COMMIT_LOG = "application/commit+json";

    private final Map<String, Space> spaces = new HashMap<>();
    private long sequence;

    /**
     * Claimed facts for the addresses {@code query} names. Schema-aware
     * queries also report the schema each address was fetched under.
     *
     * @throws IllegalArgumentException if the query is malformed
     */
    public synchronized QueryResult query(String space, JsonNode query) {
        Space s = space(space);
        List<Revision> facts = new ArrayList<>();
        Map<Address, List<ContentHash>> schemas = new LinkedHashMap<>();
        for (Query.Entry e : Query.entries(query)) {
            Revision r = s.current.get(e.address());
            if (r != null) {
                facts.add(r);
            }
            if (e.schema() != null) {
                schemas.put(e.address(), List.of(e.schema().ref()));
            }
        }
        return new QueryResult(facts, schemas);
    }

    /** Apply {@code tx} to {@code space} as one unit. */
    public synchronized Result<Commit> transact(String space, Transaction tx) {
        Space s = space(space);
        if (tx.clientTxId() != null) {
            Commit earlier = s.committed.get(tx.clientTxId());
            if (earlier != null) {
                return Result.ok(earlier);
            }
        }
        List<Address> stale = new ArrayList<>();
        for (Transaction.Write w : tx.writes()) {
            if (!w.cause().equals(RevisionBuilder.causeOf(w.address(), s.current.get(w.address())))) {
                stale.add(w.address());
            }
        }
        if (!stale.isEmpty()) {
            return Result.failure(new ReplicaError.ConflictError(
                    "writes built on a superseded revision: " + stale, stale));
        }

        long since = ++sequence;
        for (Transaction.Write w : tx.writes()) {
            s.apply(w.revision().withSince(since));
        }
        Address headAddress = new Address(COMMIT_LOG, space);
        ObjectNode is = CanonicalJson.MAPPER.createObjectNode();
        is.put("since", since);
        if (tx.clientTxId() != null) {
            is.put("clientTxId", tx.clientTxId());
        }
        Revision head = Revision.asserted(headAddress, is,
                RevisionBuilder.causeOf(headAddress, s.current.get(headAddress)), since);
        s.apply(head);
        Commit commit = new Commit(since, head, Map.of());
        if (tx.clientTxId() != null) {
            s.committed.put(tx.clientTxId(), commit);
        }
        return Result.ok(commit);
    }

    /** Revisions of {@code space} with {@code after < since <= through}, in sequence order. */
    public synchronized List<Revision> changes(String space, long after, long through) {
        List<Revision> out = new ArrayList<>();
        for (Revision r : space(space).log) {
            if (r.since() > after && r.since() <= through) {
                out.add(r);
            }
        }
        return out;
    }

    public synchronized long sequence() {
        return sequence;
    }

    public synchronized Revision current(String space, Address address) {
        return space(space).current.get(address);
    }

    private Space space(String did) {
        return spaces.computeIfAbsent(did, d -> new Space());
    }

    private static final class Space {
        final Map<Address, Revision> current = new HashMap<>();
        final List<Revision> log = new ArrayList<>();
        final Map<String, Commit> committed = new HashMap<>();

        void apply(Revision r) {
            current.put(r.address(), r);
            log.add(r);
        }
    }
}
