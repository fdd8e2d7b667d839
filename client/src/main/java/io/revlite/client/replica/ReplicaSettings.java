// file: client/src/main/java/io/revlite/client/replica/ReplicaSettings.java
package io.revlite.client.replica;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs for one replica.
 *
 * @param syncDebounce   how long cache-satisfied loads wait before their
 *                       background remote sync; loads inside the window coalesce
 * @param pullRetryLimit how often a load re-issues a fetch that failed with a
 *                       connection error
 * @param maxHeapEntries heap bound, 0 for unbounded
 */
public record ReplicaSettings(Duration syncDebounce, int pullRetryLimit, int maxHeapEntries) {

    public ReplicaSettings {
        Objects.requireNonNull(syncDebounce, "syncDebounce");
        if (syncDebounce.isNegative()) throw new IllegalArgumentException("syncDebounce must be >= 0");
        if (pullRetryLimit < 0) throw new IllegalArgumentException("pullRetryLimit must be >= 0");
        if (maxHeapEntries < 0) throw new IllegalArgumentException("maxHeapEntries must be >= 0");
    }

    public static ReplicaSettings defaults() {
        return new ReplicaSettings(Duration.ofSeconds(1), 100, 0);
    }
}
