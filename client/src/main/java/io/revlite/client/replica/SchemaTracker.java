// file: client/src/main/java/io/revlite/client/replica/SchemaTracker.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.ContentHash;
import io.revlite.core.SchemaContext;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which schema variants each address has been fetched under, so a
 * load with a new variant goes back to the remote even if the address itself
 * is already in the heap.
 */
final class SchemaTracker {
    private final Map<Address, Set<ContentHash>> fetched = new ConcurrentHashMap<>();

    boolean satisfied(Address address, SchemaContext schema) {
        if (schema == null) return true;
        Set<ContentHash> refs = fetched.get(address);
        return refs != null && refs.contains(schema.ref());
    }

    void record(Address address, SchemaContext schema) {
        if (schema == null) return;
        record(address, List.of(schema.ref()));
    }

    void record(Address address, Collection<ContentHash> refs) {
        if (refs.isEmpty()) return;
        fetched.computeIfAbsent(address, a -> ConcurrentHashMap.newKeySet()).addAll(refs);
    }

    void forget(Address address) {
        fetched.remove(address);
    }
}
