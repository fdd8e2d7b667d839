// file: client/src/main/java/io/revlite/client/replica/RemoteSpace.java
package io.revlite.client.replica;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Commit;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.protocol.QueryResult;
import io.revlite.core.protocol.Transaction;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * The remote as one memory space sees it. Implemented over a session in
 * production and by hand-written fakes in tests.
 * <p>
 * Futures complete on a transport thread and never exceptionally: failures
 * come back as {@link Result.Failure}.
 */
public interface RemoteSpace {

    /** Memory space (DID) this remote view is bound to. */
    String space();

    CompletableFuture<Result<QueryResult>> query(ObjectNode query);

    CompletableFuture<Result<Commit>> transact(Transaction transaction);

    /**
     * Subscribe to {@code query}. The future carries the initial answer;
     * later changes arrive through {@code onDelivery}, already decoded.
     */
    CompletableFuture<Result<QueryResult>> subscribe(ObjectNode query, Consumer<List<Revision>> onDelivery);
}
