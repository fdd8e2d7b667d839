// file: storage/src/main/java/io/revlite/storage/SnapshotPolicy.java
package io.revlite.storage;

import io.revlite.core.Revision;

import java.util.Map;

/**
 * Snapshot policy that triggers a full snapshot after every N persisted revisions.
 * Bounds recovery time by limiting WAL replay length.
 */
public final class SnapshotPolicy {
    private final int everyWrites;
    private int sinceLast;

    public SnapshotPolicy(int everyWrites) {
        if (everyWrites <= 0) throw new IllegalArgumentException("everyWrites must be > 0");
        this.everyWrites = everyWrites;
    }

    /**
     * Call after each durable batch.
     *
     * @param written number of revisions the batch appended
     * @return true if a snapshot was written (the WAL may then be reset)
     */
    public boolean maybeSnapshot(int written, Map<String, Revision> mem, Snapshotter snaps) {
        sinceLast += written;
        if (sinceLast < everyWrites) return false;
        snaps.writeSnapshot(Map.copyOf(mem));
        sinceLast = 0;
        return true;
    }
}
