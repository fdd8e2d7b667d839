// file: client/src/main/java/io/revlite/client/StorageProvider.java
package io.revlite.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.revlite.client.replica.LoadRequest;
import io.revlite.client.replica.Replica;
import io.revlite.client.replica.ReplicaRegistry;
import io.revlite.client.replica.RevisionListener;
import io.revlite.client.session.Session;
import io.revlite.client.session.SessionRemoteSpace;
import io.revlite.client.session.Transport;
import io.revlite.client.session.WebSocketTransport;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.Intent;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.SchemaContext;
import io.revlite.storage.DurableRevisionStore;
import io.revlite.storage.NoCache;
import io.revlite.storage.RevisionStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entity-level facade over one session and its replicas.
 * <p>
 * Entities live in the configured default space under the configured media
 * type; {@link #mount(String)} gives direct access to other spaces.
 */
public final class StorageProvider implements AutoCloseable {
    private static final Logger log = Logger.getLogger(StorageProvider.class.getName());

    /** One entity write; a null value retracts the entity. */
    public record Update(String entity, JsonNode value) {
        public Update {
            Objects.requireNonNull(entity, "entity");
        }
    }

    private final ClientConfig config;
    private final Session session;
    private final ReplicaRegistry registry;

    public StorageProvider(ClientConfig config, Transport transport) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = new ReplicaRegistry(this::newReplica);
        this.session = new Session(
                transport,
                config.url(),
                config.sessionSettings(),
                config.clientId(),
                config.clientId(),
                config.authorization(),
                registry::lastSequence
        );
    }

    /** Provider over a WebSocket, already connecting. */
    public static StorageProvider connect(ClientConfig config) {
        StorageProvider provider = new StorageProvider(
                config, new WebSocketTransport(config.sessionSettings().connectionTimeout()));
        provider.session.connect();
        return provider;
    }

    /** Start (or keep) the session connecting. */
    public void start() {
        session.connect();
    }

    public Session session() {
        return session;
    }

    public Replica mount(String space) {
        return registry.mount(space);
    }

    /** Replica of the default space. */
    public Replica replica() {
        return mount(config.space());
    }

    public Address address(String entity) {
        return new Address(config.mediaType(), entity);
    }

    /** Make {@code entity} available locally, optionally with everything {@code schema} links to. */
    public CompletableFuture<Result<List<Revision>>> sync(String entity, SchemaContext schema) {
        return replica().load(List.of(new LoadRequest(address(entity), schema)));
    }

    public CompletableFuture<Result<List<Revision>>> sync(String entity) {
        return sync(entity, null);
    }

    /** Current value of {@code entity}, or null when it has none locally. No I/O. */
    public JsonNode get(String entity) {
        Revision r = replica().get(address(entity));
        return r == null ? null : r.is();
    }

    /**
     * Write a batch as one transaction. Entries equal to the current value are
     * skipped; if nothing is left the result is an empty commit.
     */
    public CompletableFuture<Result<Commit>> send(List<Update> batch) {
        List<Intent> intents = new ArrayList<>(batch.size());
        for (Update u : batch) {
            JsonNode current = get(u.entity());
            JsonNode wanted = u.value() == null || u.value().isNull() ? null : u.value();
            if (Objects.equals(current, wanted)) {
                continue;
            }
            Address address = address(u.entity());
            intents.add(wanted == null ? Intent.retraction(address) : Intent.assertion(address, wanted));
        }
        if (intents.isEmpty()) {
            return CompletableFuture.completedFuture(Result.ok(Commit.empty()));
        }
        return replica().push(intents);
    }

    /**
     * Call {@code callback} with every new value of {@code entity}. Entities
     * without a value are reported as an empty object.
     *
     * @return handle that stops the callbacks when closed
     */
    public AutoCloseable sink(String entity, Consumer<JsonNode> callback) {
        Replica replica = replica();
        Address address = address(entity);
        RevisionListener listener = (a, r) -> callback.accept(
                r.is() == null ? CanonicalJson.MAPPER.createObjectNode() : r.is());
        replica.subscribe(address, listener);
        replica.load(List.of(LoadRequest.of(address))).thenAccept(r -> {
            if (!r.isOk()) {
                log.warning("Initial load for sink on " + entity + " failed: " + r.error().message());
            }
        });
        return () -> replica.unsubscribe(address, listener);
    }

    @Override
    public void close() {
        registry.close();
        session.close();
    }

    // ---------- helpers ----------

    private Replica newReplica(String space) {
        Replica replica = new Replica(new SessionRemoteSpace(session, space), openCache(space), config.replicaSettings());
        replica.start();
        return replica;
    }

    private RevisionStore openCache(String space) {
        if (config.cacheDir() == null) {
            return NoCache.INSTANCE;
        }
        Path dir = Path.of(config.cacheDir()).resolve(space.replaceAll("[^A-Za-z0-9._-]", "_"));
        try {
            return DurableRevisionStore.open(dir);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Cannot open durable cache at " + dir + ", continuing without it", e);
            return NoCache.INSTANCE;
        }
    }
}
