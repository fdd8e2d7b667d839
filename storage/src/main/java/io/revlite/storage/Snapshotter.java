// file: storage/src/main/java/io/revlite/storage/Snapshotter.java
package io.revlite.storage;

import io.revlite.core.Revision;

import java.util.Map;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full copy of the store's key -> revision map. On restart
 * the latest snapshot is loaded, then the WAL is replayed on top of it.
 */
public interface Snapshotter {

    /**
     * Persist a full copy of the current map.
     *
     * @return snapshot identifier (file name)
     */
    String writeSnapshot(Map<String, Revision> current);

    /** Load the latest snapshot, or null if none was written yet. */
    LoadedSnapshot loadLatest();

    record LoadedSnapshot(String id, Map<String, Revision> data) {}
}
