// file: client/src/test/java/io/revlite/client/replica/HeapTest.java
package io.revlite.client.replica;

import com.fasterxml.jackson.databind.node.IntNode;
import io.revlite.core.Address;
import io.revlite.core.LatestRevisionMerger;
import io.revlite.core.Revision;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HeapTest {

    private static final Address A = new Address("application/json", "of:a");
    private static final Address B = new Address("application/json", "of:b");
    private static final Address C = new Address("application/json", "of:c");

    private final LatestRevisionMerger merger = new LatestRevisionMerger();

    @Test
    void older_revision_does_not_replace_newer() {
        Heap heap = new Heap();
        Revision v2 = rev(A, 2, 2);
        heap.merge(List.of(v2), merger);

        Set<Address> changed = heap.merge(List.of(rev(A, 1, 1)), merger);

        assertTrue(changed.isEmpty());
        assertSame(v2, heap.get(A));
    }

    @Test
    void listeners_fire_once_per_address_after_the_whole_batch() {
        Heap heap = new Heap();
        List<String> seen = new ArrayList<>();
        heap.subscribe(A, (address, r) -> seen.add("A:" + r.since() + " B=" + (heap.get(B) != null)));

        heap.merge(List.of(rev(A, 1, 1), rev(A, 2, 3), rev(B, 1, 2)), merger);

        assertEquals(List.of("A:3 B=true"), seen);
    }

    @Test
    void failing_listener_does_not_stop_the_others() {
        Heap heap = new Heap();
        List<Long> seen = new ArrayList<>();
        heap.subscribe(A, (address, r) -> {
            throw new IllegalStateException("boom");
        });
        heap.subscribe(A, (address, r) -> seen.add(r.since()));

        heap.merge(List.of(rev(A, 1, 4)), merger);

        assertEquals(List.of(4L), seen);
    }

    @Test
    void unsubscribed_listener_is_not_called() {
        Heap heap = new Heap();
        List<Long> seen = new ArrayList<>();
        RevisionListener listener = (address, r) -> seen.add(r.since());
        heap.subscribe(A, listener);
        heap.unsubscribe(A, listener);

        heap.merge(List.of(rev(A, 1, 1)), merger);

        assertTrue(seen.isEmpty());
    }

    @Test
    void bound_evicts_oldest_unsubscribed_addresses() {
        List<Address> evicted = new ArrayList<>();
        Heap heap = new Heap(2, evicted::add);
        heap.subscribe(A, (address, r) -> { });

        heap.merge(List.of(rev(A, 1, 1), rev(B, 1, 2)), merger);
        heap.merge(List.of(rev(C, 1, 3)), merger);

        assertEquals(List.of(B), evicted);
        assertTrue(heap.has(A));
        assertFalse(heap.has(B));
        assertTrue(heap.has(C));
        assertEquals(2, heap.size());
    }

    private static Revision rev(Address address, int value, long since) {
        return Revision.asserted(address, IntNode.valueOf(value), Revision.unclaimed(address).hash(), since);
    }
}
