// file: storage/src/test/java/io/revlite/storage/DurableRevisionStoreDurabilityTest.java
package io.revlite.storage;

import com.fasterxml.jackson.databind.node.TextNode;
import io.revlite.core.Address;
import io.revlite.core.LatestRevisionMerger;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DurableRevisionStoreDurabilityTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private static final Address A = new Address("application/json", "of:a");
    private static final Address B = new Address("application/json", "of:b");

    private static Revision rev(Address a, String value, long since) {
        return Revision.asserted(a, TextNode.valueOf(value), Revision.unclaimed(a).hash(), since);
    }

    private DurableRevisionStore open(int snapshotEvery) {
        return new DurableRevisionStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir),
                new SnapshotPolicy(snapshotEvery));
    }

    @Test
    void latest_revision_survives_restart() {
        var store1 = open(1_000);
        assertTrue(store1.merge(List.of(rev(A, "v1", 1)), new LatestRevisionMerger()).isOk());
        assertTrue(store1.merge(List.of(rev(A, "v2", 2), Revision.unclaimed(B)), new LatestRevisionMerger()).isOk());
        store1.close();

        var store2 = open(1_000);
        Map<Address, Revision> pulled = store2.pull(List.of(A, B)).value();

        assertEquals(rev(A, "v2", 2), pulled.get(A));
        assertEquals(Revision.unclaimed(B), pulled.get(B));
    }

    @Test
    void older_incoming_revision_is_not_persisted() {
        var store = open(1_000);
        store.merge(List.of(rev(A, "new", 5)), new LatestRevisionMerger());
        store.merge(List.of(rev(A, "old", 3)), new LatestRevisionMerger());
        store.close();

        assertEquals(rev(A, "new", 5), open(1_000).pull(List.of(A)).value().get(A));
    }

    @Test
    void snapshot_then_wal_reset_keeps_everything() throws Exception {
        var store1 = open(2);
        store1.merge(List.of(rev(A, "a1", 1)), new LatestRevisionMerger());
        store1.merge(List.of(rev(B, "b1", 2)), new LatestRevisionMerger()); // snapshot here
        store1.merge(List.of(rev(A, "a2", 3)), new LatestRevisionMerger()); // WAL only
        store1.close();

        try (Stream<Path> snaps = Files.list(snapDir)) {
            assertEquals(1, snaps.count());
        }

        var store2 = open(2);
        Map<Address, Revision> pulled = store2.pull(List.of(A, B)).value();
        assertEquals(rev(A, "a2", 3), pulled.get(A));
        assertEquals(rev(B, "b1", 2), pulled.get(B));
        assertEquals(2, store2.size());
    }

    @Test
    void wal_failure_surfaces_as_store_error() {
        Wal broken = new Wal() {
            @Override public void append(byte[] serializedRecord) { throw new RuntimeException("disk full"); }
            @Override public void rotateIfNeeded() {}
            @Override public void reset() {}
            @Override public WalReader openReader() { return new WalReader() {
                @Override public byte[] next() { return null; }
                @Override public void close() {}
            }; }
            @Override public void close() {}
        };
        var store = new DurableRevisionStore(broken, new FileSnapshotter(snapDir), new SnapshotPolicy(10));

        Result<Void> r = store.merge(List.of(rev(A, "v", 1)), new LatestRevisionMerger());

        assertInstanceOf(ReplicaError.StoreError.class, r.error());
        assertTrue(store.pull(List.of(A)).value().isEmpty());
    }

    @Test
    void closed_store_reports_errors_instead_of_throwing() {
        var store = open(10);
        store.close();
        assertFalse(store.pull(List.of(A)).isOk());
        assertFalse(store.merge(List.of(rev(A, "v", 1)), new LatestRevisionMerger()).isOk());
    }
}
