// file: server/src/test/java/io/revlite/server/ProviderEndpointTest.java
package io.revlite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import io.revlite.client.ClientConfig;
import io.revlite.client.StorageProvider;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.Intent;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;
import io.revlite.core.RevisionState;
import io.revlite.core.protocol.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs: client StorageProvider against the development endpoint
 * over a real WebSocket.
 *
 * Focus:
 *  - A write from one client is readable by another.
 *  - Live updates reach a sink on another client.
 *  - A write on a superseded head comes back as ConflictError and changes nothing locally.
 *  - The durable cache answers a restarted client before the remote does.
 */
class ProviderEndpointTest {

    private static final String SPACE = "did:key:e2e";

    private int port;
    private MemoryProvider provider;
    private ProviderEndpoint endpoint;
    private final List<StorageProvider> clients = new ArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        port = freePort();
        provider = new MemoryProvider();
        endpoint = new ProviderEndpoint(new ServerConfig("localhost", port, ServerConfig.DEFAULT_PATH), provider);
        endpoint.start();
    }

    @AfterEach
    void stopServer() {
        for (StorageProvider c : clients) {
            c.close();
        }
        endpoint.stop();
    }

    @Test
    void write_from_one_client_is_read_by_another() throws Exception {
        StorageProvider alice = client("alice", null);
        StorageProvider bob = client("bob", null);

        Result<Commit> sent = await(alice.send(List.of(new StorageProvider.Update("of:doc", json("{\"title\":\"hello\"}")))));
        assertTrue(sent.isOk(), () -> "send failed: " + sent.error());
        assertEquals(json("{\"title\":\"hello\"}"), alice.get("of:doc"));

        assertTrue(await(bob.sync("of:doc")).isOk());
        assertEquals(json("{\"title\":\"hello\"}"), bob.get("of:doc"));
    }

    @Test
    void sink_receives_remote_updates() throws Exception {
        StorageProvider alice = client("alice", null);
        StorageProvider bob = client("bob", null);
        List<JsonNode> seen = new CopyOnWriteArrayList<>();
        assertTrue(await(bob.sync("of:counter")).isOk());

        AutoCloseable sink = bob.sink("of:counter", seen::add);
        assertTrue(await(alice.send(List.of(new StorageProvider.Update("of:counter", IntNode.valueOf(1))))).isOk());

        eventually(() -> seen.contains(IntNode.valueOf(1)));
        assertEquals(IntNode.valueOf(1), bob.get("of:counter"));

        assertTrue(await(alice.send(List.of(new StorageProvider.Update("of:counter", null)))).isOk());
        eventually(() -> seen.contains(CanonicalJson.MAPPER.createObjectNode()));
        sink.close();
    }

    @Test
    void conflicting_write_returns_conflict_error() throws Exception {
        StorageProvider alice = client("alice", null);
        assertTrue(await(alice.send(List.of(new StorageProvider.Update("of:doc", IntNode.valueOf(1))))).isOk());
        Revision confirmed = alice.replica().get(alice.address("of:doc"));

        // another writer moves the head without alice's replica hearing about it first
        provider.transact(SPACE, new Transaction("other", List.of(
                new Transaction.Write(confirmed.address(), confirmed.hash(), IntNode.valueOf(7)))));

        Result<Commit> r = await(alice.replica().push(List.of(Intent.assertion(
                alice.address("of:doc"), IntNode.valueOf(2)))));

        assertInstanceOf(ReplicaError.ConflictError.class, r.error());
        assertNotEquals(IntNode.valueOf(2), alice.get("of:doc"));
        assertEquals(IntNode.valueOf(7), provider.current(SPACE, alice.address("of:doc")).is());
    }

    @Test
    void restarted_client_reads_from_its_durable_cache(@TempDir Path cacheDir) throws Exception {
        StorageProvider first = client("laptop", cacheDir);
        assertTrue(await(first.send(List.of(new StorageProvider.Update("of:note", json("{\"text\":\"kept\"}"))))).isOk());
        first.close();
        clients.remove(first);

        // nothing listens on the new port; the cache alone answers the load
        StorageProvider second = client("laptop", cacheDir, freePort());
        Result<List<Revision>> loaded = await(second.sync("of:note"));

        assertTrue(loaded.isOk(), () -> "load failed: " + loaded.error());
        assertEquals(json("{\"text\":\"kept\"}"), second.get("of:note"));
        assertEquals(RevisionState.ASSERTED, second.replica().get(second.address("of:note")).state());
    }

    @Test
    void health_endpoint_reports_ok() throws Exception {
        HttpClient http = HttpClient.newHttpClient();
        HttpResponse<String> resp = http.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/admin/health")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, resp.statusCode());
        assertEquals("ok", CanonicalJson.MAPPER.readTree(resp.body()).path("status").asText());
    }

    // ---------- helpers ----------

    private StorageProvider client(String id, Path cacheDir) {
        return client(id, cacheDir, port);
    }

    private StorageProvider client(String id, Path cacheDir, int remotePort) {
        ClientConfig cfg = new ClientConfig(
                URI.create("ws://localhost:" + remotePort + ServerConfig.DEFAULT_PATH),
                SPACE,
                id,
                "",
                ClientConfig.DEFAULT_MEDIA_TYPE,
                2_000,
                50,
                3,
                cacheDir == null ? null : cacheDir.toString(),
                0
        );
        StorageProvider p = StorageProvider.connect(cfg);
        clients.add(p);
        return p;
    }

    private static int freePort() throws IOException {
        try (ServerSocket probe = new ServerSocket(0)) {
            return probe.getLocalPort();
        }
    }

    private static JsonNode json(String text) throws IOException {
        return CanonicalJson.MAPPER.readTree(text);
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(10, TimeUnit.SECONDS);
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not met within 10s");
            Thread.sleep(10);
        }
    }
}
