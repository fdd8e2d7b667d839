// file: storage/src/main/java/io/revlite/storage/RevisionStore.java
package io.revlite.storage;

import io.revlite.core.Address;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionMerger;

import java.util.Collection;
import java.util.Map;

/**
 * Durable key -> revision cache used by a replica.
 * <p>
 * Semantics:
 *  - pull() returns whatever is stored for the given addresses; addresses with
 *    nothing stored are absent from the map (not an error).
 *  - merge() folds each incoming revision into the stored one with the given
 *    merger and persists the winners before returning.
 *  - failures are returned as {@code StoreError}, never thrown.
 */
public interface RevisionStore extends AutoCloseable {

    Result<Map<Address, Revision>> pull(Collection<Address> addresses);

    Result<Void> merge(Collection<Revision> revisions, RevisionMerger merger);

    @Override
    default void close() {
    }
}
