// file: client/src/main/java/io/revlite/client/replica/Replica.java
package io.revlite.client.replica;

import io.revlite.core.Address;
import io.revlite.core.Commit;
import io.revlite.core.Intent;
import io.revlite.core.LatestRevisionMerger;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionBuilder;
import io.revlite.core.RevisionMerger;
import io.revlite.core.protocol.Query;
import io.revlite.core.protocol.QueryResult;
import io.revlite.core.protocol.Transaction;
import io.revlite.storage.NoCache;
import io.revlite.storage.RevisionStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Local mirror of one memory space.
 * <p>
 * Three layers answer reads, newest first:
 *  - nursery: revisions staged by {@link #push} and not yet confirmed,
 *  - heap:    latest confirmed revision per address,
 *  - durable cache: consulted by {@link #load} before the remote.
 * <p>
 * Threading:
 *  - Every heap / nursery / queue mutation runs on a single engine thread.
 *    Remote completions hop back onto it before touching state.
 *  - {@link #get} reads the concurrent maps directly and never blocks.
 * <p>
 * Writes:
 *  - push loads the touched addresses, builds each revision on the current
 *    one, stages it, and sends one transaction.
 *  - Confirmed writes move into the heap before they leave the nursery, so a
 *    reader never sees an older value in between.
 *  - Rejected writes leave the nursery without touching the heap. Addresses
 *    rejected for a stale cause are marked so the next load refetches them
 *    from the remote instead of trusting the heap or the durable cache.
 */
public final class Replica implements AutoCloseable {
    private static final long RETRY_BASE_MILLIS = 50;
    private static final long RETRY_MAX_MILLIS = 2_000;

    private static final Logger log = Logger.getLogger(Replica.class.getName());

    /** Attribute of the commit-log head; its entity is the space itself. */
    public static final String COMMIT_LOG = "application/commit+json";

    private final String space;
    private final Address commitAddress;
    private final RemoteSpace remote;
    private final RevisionStore cache;
    private final ReplicaSettings settings;
    private final RevisionMerger merger = new LatestRevisionMerger();
    private final SchemaTracker schemas = new SchemaTracker();
    private final Heap heap;
    private final Nursery nursery = new Nursery();
    private final PullQueue queue = new PullQueue();
    private final ScheduledThreadPoolExecutor engine;
    private final AtomicLong lastSequence = new AtomicLong(Revision.UNCONFIRMED);
    // addresses whose heap entry a conflict proved outdated; engine thread only
    private final Set<Address> stale = new HashSet<>();

    private ScheduledFuture<?> syncTimer; // engine thread only
    private volatile boolean closed;

    public Replica(RemoteSpace remote, RevisionStore cache, ReplicaSettings settings) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.space = remote.space();
        this.commitAddress = new Address(COMMIT_LOG, space);
        this.cache = cache == null ? NoCache.INSTANCE : cache;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.heap = new Heap(settings.maxHeapEntries(), schemas::forget);
        this.engine = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "revlite-replica-" + space);
            t.setDaemon(true);
            return t;
        });
        this.engine.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.engine.setRemoveOnCancelPolicy(true);
    }

    public String space() {
        return space;
    }

    /** Address of this space's commit-log head. */
    public Address commitAddress() {
        return commitAddress;
    }

    /** Highest server sequence number this replica has observed, -1 if none. */
    public long lastSequence() {
        return lastSequence.get();
    }

    // ---------- reads ----------

    /** Staged revision if there is one, else the confirmed one, else null. No I/O. */
    public Revision get(Address address) {
        Revision staged = nursery.get(address);
        return staged != null ? staged : heap.get(address);
    }

    public void subscribe(Address address, RevisionListener listener) {
        heap.subscribe(address, listener);
    }

    public void unsubscribe(Address address, RevisionListener listener) {
        heap.unsubscribe(address, listener);
    }

    // ---------- load / pull ----------

    /**
     * Make the given addresses available locally.
     * <p>
     * Answers from the durable cache when it holds every schema-less address
     * asked for (a debounced background sync then refreshes them); otherwise
     * fetches from the remote, retrying connection errors with backoff.
     * Addresses that lost a write conflict always go to the remote.
     *
     * @return the revisions that were made available by this call
     */
    public CompletableFuture<Result<List<Revision>>> load(List<LoadRequest> entries) {
        List<LoadRequest> copy = List.copyOf(entries);
        return onEngine(() -> loadNow(copy));
    }

    /** Fetch everything waiting in the pull queue. */
    public CompletableFuture<Result<List<Revision>>> pull() {
        return onEngine(() -> pullNow(queue.consume()));
    }

    /** Fetch the given entries from the remote, bypassing the cache. */
    public CompletableFuture<Result<List<Revision>>> pull(List<LoadRequest> entries) {
        List<LoadRequest> copy = List.copyOf(entries);
        return onEngine(() -> pullNow(copy));
    }

    private CompletableFuture<Result<List<Revision>>> loadNow(List<LoadRequest> entries) {
        List<LoadRequest> needed = new ArrayList<>();
        boolean asksForHead = entries.stream().anyMatch(e -> e.address().equals(commitAddress));
        if (!heap.has(commitAddress) && !asksForHead) {
            needed.add(LoadRequest.of(commitAddress));
        }
        for (LoadRequest e : entries) {
            if (stale.contains(e.address()) || !heap.has(e.address()) || !schemas.satisfied(e.address(), e.schema())) {
                needed.add(e);
            }
        }
        if (needed.isEmpty()) {
            return done(Result.ok(List.of()));
        }

        List<Address> cacheable = new ArrayList<>();
        for (LoadRequest e : needed) {
            if (!e.hasSchema() && !stale.contains(e.address())) cacheable.add(e.address());
        }
        Map<Address, Revision> cached = cacheable.isEmpty() ? Map.of() : pullFromCache(cacheable);
        if (!cached.isEmpty()) {
            heap.merge(cached.values(), merger);
            observe(cached.values());
        }

        boolean complete = needed.stream().allMatch(e -> cacheable.contains(e.address()) && cached.containsKey(e.address()));
        if (complete) {
            queue.add(needed);
            armSync();
            return done(Result.ok(List.copyOf(cached.values())));
        }
        return pullWithRetry(needed, 0);
    }

    private CompletableFuture<Result<List<Revision>>> pullWithRetry(List<LoadRequest> needed, int attempt) {
        return pullNow(needed).thenComposeAsync(r -> retryOrReturn(needed, attempt, r), engine);
    }

    private CompletableFuture<Result<List<Revision>>> retryOrReturn(
            List<LoadRequest> needed, int attempt, Result<List<Revision>> r) {
        boolean retryable = r.error() instanceof ReplicaError.ConnectionError;
        if (retryable && attempt < settings.pullRetryLimit() && !closed) {
            long delay = Math.min(RETRY_BASE_MILLIS << Math.min(attempt, 20), RETRY_MAX_MILLIS);
            log.fine(() -> "Retrying fetch for " + space + " in " + delay + "ms (attempt " + (attempt + 1) + ")");
            return CompletableFuture.runAsync(() -> { }, CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS))
                    .thenComposeAsync(ignored -> pullWithRetry(needed, attempt + 1), engine);
        }
        return done(r);
    }

    private CompletableFuture<Result<List<Revision>>> pullNow(List<LoadRequest> entries) {
        if (entries.isEmpty()) {
            return done(Result.ok(List.of()));
        }
        List<Query.Entry> selection = new ArrayList<>(entries.size());
        for (LoadRequest e : entries) {
            selection.add(new Query.Entry(e.address(), e.schema()));
        }
        return remote.query(Query.of(selection)).thenApplyAsync(r -> fetched(entries, r), engine);
    }

    private Result<List<Revision>> fetched(List<LoadRequest> entries, Result<QueryResult> r) {
        if (!r.isOk()) {
            return Result.failure(r.error());
        }
        QueryResult answer = r.value();
        List<Revision> selection = new ArrayList<>(answer.facts());
        Set<Address> known = new HashSet<>();
        for (Revision f : selection) {
            known.add(f.address());
        }
        // remember "the remote had nothing" so the next load short-circuits
        for (LoadRequest e : entries) {
            if (!known.contains(e.address()) && !heap.has(e.address())) {
                selection.add(Revision.unclaimed(e.address()));
                known.add(e.address());
            }
        }
        integrate(selection);
        for (LoadRequest e : entries) {
            schemas.record(e.address(), e.schema());
            stale.remove(e.address());
        }
        answer.schemas().forEach(schemas::record);
        return Result.ok(selection);
    }

    private Map<Address, Revision> pullFromCache(List<Address> addresses) {
        Result<Map<Address, Revision>> r = cache.pull(addresses);
        if (!r.isOk()) {
            log.warning("Durable cache pull failed for " + space + ", treating as miss: " + r.error().message());
            return Map.of();
        }
        return r.value();
    }

    private void armSync() {
        if (syncTimer != null) {
            syncTimer.cancel(false);
        }
        syncTimer = engine.schedule(this::backgroundSync, settings.syncDebounce().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void backgroundSync() {
        syncTimer = null;
        List<LoadRequest> batch = queue.consume();
        pullNow(batch).thenAccept(r -> {
            if (!r.isOk()) {
                log.warning("Background sync for " + space + " failed, will retry: " + r.error().message());
                if (!closed) {
                    queue.add(batch);
                    armSync();
                }
            }
        });
    }

    // ---------- push ----------

    /**
     * Apply {@code intents} optimistically and send them as one transaction.
     * When an address appears more than once, the last intent for it wins.
     *
     * @return the commit, an empty commit if nothing needed sending, or the
     *         failure. Partial rejections come back as a {@code ConflictError}
     *         naming the rejected addresses when every rejection was a
     *         conflict, otherwise as the first non-conflict rejection.
     */
    public CompletableFuture<Result<Commit>> push(List<Intent> intents) {
        Map<Address, Intent> latest = new LinkedHashMap<>();
        for (Intent i : intents) {
            latest.put(i.address(), i);
        }
        List<LoadRequest> touched = new ArrayList<>();
        for (Address a : latest.keySet()) {
            touched.add(LoadRequest.of(a));
        }
        List<Intent> batch = List.copyOf(latest.values());
        return onEngine(() -> loadNow(touched)
                .thenComposeAsync(loaded -> afterLoad(loaded, batch), engine));
    }

    private CompletableFuture<Result<Commit>> afterLoad(Result<List<Revision>> loaded, List<Intent> intents) {
        if (!loaded.isOk()) {
            return done(Result.failure(loaded.error()));
        }
        List<Revision> staged = new ArrayList<>();
        for (Intent intent : intents) {
            RevisionBuilder.build(get(intent.address()), intent).ifPresent(staged::add);
        }
        if (staged.isEmpty()) {
            return done(Result.ok(Commit.empty()));
        }
        nursery.merge(staged, Nursery.PUT);

        Transaction tx = Transaction.of(UUID.randomUUID().toString(), staged);
        log.fine(() -> "Sending tx " + tx.clientTxId() + " with " + staged.size() + " writes to " + space);
        return remote.transact(tx).thenApplyAsync(r -> settle(staged, r), engine);
    }

    private Result<Commit> settle(List<Revision> staged, Result<Commit> result) {
        if (!result.isOk()) {
            nursery.merge(staged, Nursery.DELETE);
            if (result.error() instanceof ReplicaError.ConflictError conflict) {
                markStale(conflict.addresses().isEmpty() ? addressesOf(staged) : conflict.addresses());
            }
            log.fine(() -> "Transaction on " + space + " failed: " + result.error().name());
            return Result.failure(result.error());
        }
        Commit commit = result.value();
        List<Revision> confirmed = new ArrayList<>();
        List<Address> rejected = new ArrayList<>();
        List<Address> conflicted = new ArrayList<>();
        ReplicaError refused = null;
        for (Revision s : staged) {
            if (commit.accepted(s.address())) {
                confirmed.add(s.withSince(commit.since()));
                continue;
            }
            rejected.add(s.address());
            ReplicaError why = commit.rejected().get(s.address());
            if (why == null || why instanceof ReplicaError.ConflictError) {
                conflicted.add(s.address());
            } else if (refused == null) {
                refused = why;
            }
        }
        markStale(conflicted);
        if (commit.head() != null) {
            confirmed.add(commit.head());
        }
        integrate(confirmed);
        nursery.merge(staged, Nursery.DELETE);

        if (refused != null) {
            log.fine(() -> "Remote refused writes on " + space + ": " + commit.rejected());
            return Result.failure(refused);
        }
        if (!rejected.isEmpty()) {
            return Result.failure(new ReplicaError.ConflictError(
                    "remote rejected " + rejected.size() + " of " + staged.size() + " writes", rejected));
        }
        return Result.ok(commit);
    }

    private void markStale(Collection<Address> addresses) {
        stale.addAll(addresses);
    }

    private static List<Address> addressesOf(List<Revision> revisions) {
        List<Address> out = new ArrayList<>(revisions.size());
        for (Revision r : revisions) {
            out.add(r.address());
        }
        return out;
    }

    // ---------- live updates ----------

    /**
     * Subscribe to this space's commit log. The initial answer is merged like
     * a fetch; later deliveries go through {@link #applyDelivery}.
     */
    public CompletableFuture<Result<List<Revision>>> start() {
        return onEngine(() -> remote.subscribe(Query.select(List.of(commitAddress)), this::applyDelivery)
                .thenApplyAsync(this::subscribed, engine));
    }

    private Result<List<Revision>> subscribed(Result<QueryResult> r) {
        if (!r.isOk()) {
            log.warning("Commit-log subscription for " + space + " failed: " + r.error().message());
            return Result.failure(r.error());
        }
        integrate(r.value().facts());
        return Result.ok(r.value().facts());
    }

    /** Merge revisions pushed by the remote; staged writes the remote now reports are released. */
    public CompletableFuture<Void> applyDelivery(List<Revision> revisions) {
        List<Revision> copy = List.copyOf(revisions);
        try {
            return CompletableFuture.runAsync(() -> {
                integrate(copy);
                nursery.merge(copy, Nursery.EVICT);
            }, engine);
        } catch (RejectedExecutionException e) {
            log.fine(() -> "Dropping delivery for closed replica " + space);
            return CompletableFuture.completedFuture(null);
        }
    }

    // ---------- lifecycle ----------

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        engine.shutdown();
        try {
            if (!engine.awaitTermination(1, TimeUnit.SECONDS)) {
                log.warning("Replica engine for " + space + " did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        cache.close();
    }

    // ---------- helpers ----------

    /** Merge into heap, persist, and track the sequence number. Engine thread. */
    private void integrate(Collection<Revision> revisions) {
        if (revisions.isEmpty()) return;
        heap.merge(revisions, merger);
        Result<Void> persisted = cache.merge(revisions, merger);
        if (!persisted.isOk()) {
            log.warning("Durable cache merge failed for " + space + ": " + persisted.error().message());
        }
        observe(revisions);
    }

    private void observe(Collection<Revision> revisions) {
        for (Revision r : revisions) {
            lastSequence.accumulateAndGet(r.since(), Math::max);
        }
    }

    private <T> CompletableFuture<Result<T>> onEngine(Supplier<CompletableFuture<Result<T>>> work) {
        if (closed) {
            return done(Result.failure(closedError()));
        }
        CompletableFuture<Result<T>> future;
        try {
            future = CompletableFuture.supplyAsync(work, engine).thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            return done(Result.failure(closedError()));
        }
        return future.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RejectedExecutionException) {
                return Result.failure(closedError());
            }
            throw e instanceof CompletionException ? (CompletionException) e : new CompletionException(e);
        });
    }

    private ReplicaError closedError() {
        return new ReplicaError.ConnectionError(space, "replica is closed");
    }

    private static <T> CompletableFuture<Result<T>> done(Result<T> r) {
        return CompletableFuture.completedFuture(r);
    }
}
