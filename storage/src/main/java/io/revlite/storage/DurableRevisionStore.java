// file: storage/src/main/java/io/revlite/storage/DurableRevisionStore.java
package io.revlite.storage;

import io.revlite.core.Address;
import io.revlite.core.LatestRevisionMerger;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionMerger;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Durable revision cache backed by a WAL and periodic snapshots.
 * <p>
 * Responsibilities:
 *  - Maintain an in-memory map: address key -> Revision.
 *  - On merge:
 *      1) Fold each incoming revision into the stored one with the caller's merger.
 *      2) Append every changed winner to the WAL (fsync'd).
 *      3) Apply the winners to memory.
 *      4) Rotate the WAL segment and maybe snapshot (then reset the WAL).
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records with {@link LatestRevisionMerger}.
 * <p>
 * Replay is idempotent: re-applying a record never lowers a stored sequence
 * number, so records already covered by the snapshot are harmless.
 */
public final class DurableRevisionStore implements RevisionStore {
    private static final Logger log = Logger.getLogger(DurableRevisionStore.class.getName());

    private static final long DEFAULT_ROTATE_BYTES = 16L * 1024 * 1024;
    private static final int DEFAULT_SNAPSHOT_EVERY = 10_000;

    private final Map<String, Revision> mem = new ConcurrentHashMap<>();
    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final RevisionMerger replayMerger = new LatestRevisionMerger();
    private volatile boolean closed;

    public DurableRevisionStore(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy) {
        this.wal = wal;
        this.snaps = snaps;
        this.snapPolicy = snapPolicy;
        recover();
    }

    /** Store rooted at {@code dir} with "wal/" and "snapshots/" underneath. */
    public static DurableRevisionStore open(Path dir) {
        return new DurableRevisionStore(
                new FileWal(dir.resolve("wal"), DEFAULT_ROTATE_BYTES),
                new FileSnapshotter(dir.resolve("snapshots")),
                new SnapshotPolicy(DEFAULT_SNAPSHOT_EVERY));
    }

    @Override
    public Result<Map<Address, Revision>> pull(Collection<Address> addresses) {
        if (closed) {
            return Result.failure(new ReplicaError.StoreError("store is closed", null));
        }
        Map<Address, Revision> found = new LinkedHashMap<>();
        for (Address a : addresses) {
            Revision r = mem.get(a.key());
            if (r != null) {
                found.put(a, r);
            }
        }
        return Result.ok(found);
    }

    @Override
    public synchronized Result<Void> merge(Collection<Revision> revisions, RevisionMerger merger) {
        if (closed) {
            return Result.failure(new ReplicaError.StoreError("store is closed", null));
        }
        try {
            int written = 0;
            for (Revision incoming : revisions) {
                String key = incoming.address().key();
                Revision existing = mem.get(key);
                Revision winner = merger.merge(existing, incoming);
                if (winner == null || winner == existing) {
                    continue;
                }
                wal.append(RecordCodec.encode(winner));
                mem.put(key, winner);
                written++;
            }
            if (written > 0) {
                wal.rotateIfNeeded();
                if (snapPolicy.maybeSnapshot(written, mem, snaps)) {
                    wal.reset();
                }
            }
            return Result.done();
        } catch (RuntimeException e) {
            return Result.failure(new ReplicaError.StoreError("durable merge failed: " + e.getMessage(), e));
        }
    }

    /** Number of stored addresses. */
    public int size() {
        return mem.size();
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        wal.close();
    }

    private void recover() {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null && loaded.data() != null) {
            mem.putAll(loaded.data());
        }

        int replayed = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                Revision rec = RecordCodec.decode(payload);
                mem.put(rec.address().key(), replayMerger.merge(mem.get(rec.address().key()), rec));
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new RuntimeException("Recovery failed", e);
        }
        String from = loaded == null ? "no snapshot" : loaded.id();
        int records = replayed;
        log.fine(() -> "Recovered " + mem.size() + " revisions (" + from + ", " + records + " WAL records)");
    }
}
