// file: client/src/main/java/io/revlite/client/replica/PullQueue.java
package io.revlite.client.replica;

import io.revlite.core.Address;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Addresses waiting for the next background fetch, deduplicated by address.
 * A later request for an address replaces an earlier one, except that a
 * schema-less request never drops a pending schema. Engine thread only.
 */
final class PullQueue {
    private final Map<Address, LoadRequest> members = new LinkedHashMap<>();

    void add(Collection<LoadRequest> requests) {
        for (LoadRequest r : requests) {
            LoadRequest pending = members.get(r.address());
            if (pending != null && pending.hasSchema() && !r.hasSchema()) {
                continue;
            }
            members.put(r.address(), r);
        }
    }

    List<LoadRequest> consume() {
        List<LoadRequest> out = new ArrayList<>(members.values());
        members.clear();
        return out;
    }

    boolean isEmpty() {
        return members.isEmpty();
    }
}
