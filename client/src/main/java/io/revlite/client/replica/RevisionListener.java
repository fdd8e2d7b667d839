// file: client/src/main/java/io/revlite/client/replica/RevisionListener.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.Revision;

/**
 * Callback for heap changes at one address.
 * <p>
 * {@code revision == null} means "unresolved"; a revision without a value
 * means "resolved but retracted" (or unclaimed).
 */
@FunctionalInterface
public interface RevisionListener {
    void onRevision(Address address, Revision revision);
}
