// file: client/src/main/java/io/revlite/client/replica/ReplicaRegistry.java
package io.revlite.client.replica;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the replicas of one client, one per memory space. Passed to whoever
 * needs to mount spaces; there is no process-wide instance.
 */
public final class ReplicaRegistry implements AutoCloseable {
    private static final Logger log = Logger.getLogger(ReplicaRegistry.class.getName());

    private final Map<String, Replica> replicas = new ConcurrentHashMap<>();
    private final Function<String, Replica> factory;

    /**
     * @param factory creates the replica for a space on first mount
     */
    public ReplicaRegistry(Function<String, Replica> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Replica for {@code space}, created on first use. */
    public Replica mount(String space) {
        Objects.requireNonNull(space, "space");
        return replicas.computeIfAbsent(space, s -> {
            log.info("Mounting replica for " + s);
            return factory.apply(s);
        });
    }

    public Collection<Replica> replicas() {
        return List.copyOf(replicas.values());
    }

    /** Highest sequence number seen by any mounted replica, -1 if none. */
    public long lastSequence() {
        long max = -1;
        for (Replica r : replicas.values()) {
            max = Math.max(max, r.lastSequence());
        }
        return max;
    }

    @Override
    public void close() {
        for (Replica r : replicas.values()) {
            try {
                r.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Failed to close replica for " + r.space(), e);
            }
        }
        replicas.clear();
    }
}
