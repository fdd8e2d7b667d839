// file: client/src/main/java/io/revlite/client/replica/Nursery.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.Revision;
import io.revlite.core.RevisionMerger;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locally staged, unconfirmed revisions. Reads consult the nursery before the
 * heap, which is what gives a writer read-your-writes before the remote answers.
 * <p>
 * Policies (passed to {@link #merge}):
 *  - PUT:    staged revision replaces whatever is there.
 *  - DELETE: entry is removed, unless a later push has staged something else
 *            at the same address in the meantime.
 *  - EVICT:  used for remote pushes; the entry is dropped once the remote
 *            reports the same fact, so reads fall through to the heap.
 */
public final class Nursery {

    public static final RevisionMerger PUT = (staged, incoming) -> incoming;

    public static final RevisionMerger DELETE = (staged, resolved) -> staged == resolved ? null : staged;

    public static final RevisionMerger EVICT = (staged, remote) -> {
        if (staged == null || remote == null) return staged;
        return staged.hash().equals(remote.hash()) ? null : staged;
    };

    private final Map<Address, Revision> store = new ConcurrentHashMap<>();

    public Revision get(Address address) {
        return store.get(address);
    }

    public int size() {
        return store.size();
    }

    public void merge(Collection<Revision> revisions, RevisionMerger policy) {
        for (Revision r : revisions) {
            store.compute(r.address(), (a, existing) -> policy.merge(existing, r));
        }
    }
}
