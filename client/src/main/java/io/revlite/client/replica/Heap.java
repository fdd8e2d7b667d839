// file: client/src/main/java/io/revlite/client/replica/Heap.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.Revision;
import io.revlite.core.RevisionMerger;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Latest confirmed revision per address, with per-address subscribers.
 * <p>
 * Threading:
 *  - merge() is called from the replica's engine thread only.
 *  - get() and subscribe()/unsubscribe() are safe from any thread.
 * <p>
 * Notification:
 *  - A merge batch collects every address whose winner changed and notifies
 *    each of them once, after the whole batch is applied, so listeners never
 *    observe a half-applied batch.
 * <p>
 * Bound:
 *  - With maxEntries > 0, the oldest inserted addresses that have no subscribers
 *    are evicted once the bound is exceeded; {@code onEvict} is told about each.
 */
public final class Heap {
    private static final Logger log = Logger.getLogger(Heap.class.getName());

    private final Map<Address, Revision> store = new ConcurrentHashMap<>();
    private final Map<Address, Set<RevisionListener>> subscribers = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Consumer<Address> onEvict;
    // insertion order for eviction; engine thread only
    private final Set<Address> order = new LinkedHashSet<>();

    public Heap() {
        this(0, a -> { });
    }

    public Heap(int maxEntries, Consumer<Address> onEvict) {
        if (maxEntries < 0) throw new IllegalArgumentException("maxEntries must be >= 0");
        this.maxEntries = maxEntries;
        this.onEvict = onEvict;
    }

    public Revision get(Address address) {
        return store.get(address);
    }

    public boolean has(Address address) {
        return store.containsKey(address);
    }

    public int size() {
        return store.size();
    }

    /**
     * Fold {@code revisions} into the heap.
     *
     * @return addresses whose winner changed, in batch order
     */
    public Set<Address> merge(Collection<Revision> revisions, RevisionMerger merger) {
        Map<Address, Revision> changed = new LinkedHashMap<>();
        for (Revision incoming : revisions) {
            Address address = incoming.address();
            Revision existing = store.get(address);
            Revision winner = merger.merge(existing, incoming);
            if (winner == null || winner == existing) {
                continue;
            }
            store.put(address, winner);
            order.add(address);
            changed.put(address, winner);
        }
        for (Map.Entry<Address, Revision> e : changed.entrySet()) {
            notify(e.getKey(), e.getValue());
        }
        evictIfNeeded();
        return changed.keySet();
    }

    public void subscribe(Address address, RevisionListener listener) {
        subscribers.computeIfAbsent(address, a -> new CopyOnWriteArraySet<>()).add(listener);
    }

    public void unsubscribe(Address address, RevisionListener listener) {
        subscribers.computeIfPresent(address, (a, set) -> {
            set.remove(listener);
            return set.isEmpty() ? null : set;
        });
    }

    private void notify(Address address, Revision revision) {
        Set<RevisionListener> listeners = subscribers.get(address);
        if (listeners == null) return;
        for (RevisionListener l : listeners) {
            try {
                l.onRevision(address, revision);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Subscriber for " + address + " failed", e);
            }
        }
    }

    private void evictIfNeeded() {
        if (maxEntries == 0 || store.size() <= maxEntries) return;
        for (Iterator<Address> it = order.iterator(); it.hasNext() && store.size() > maxEntries; ) {
            Address candidate = it.next();
            if (subscribers.containsKey(candidate)) continue;
            it.remove();
            store.remove(candidate);
            onEvict.accept(candidate);
        }
    }
}
