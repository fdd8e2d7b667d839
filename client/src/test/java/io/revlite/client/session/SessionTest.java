// file: client/src/test/java/io/revlite/client/session/SessionTest.java
package io.revlite.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.protocol.Envelope;
import io.revlite.core.protocol.Invocation;
import io.revlite.core.protocol.MessageCodec;
import io.revlite.core.protocol.ProviderMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

    private static final URI URL = URI.create("ws://remote.test/api/storage/memory");
    private static final String SPACE = "did:key:space";

    private Session session;

    @AfterEach
    void tearDown() {
        if (session != null) session.close();
    }

    @Test
    void invocations_issued_before_open_are_sent_after_hello_in_order() throws Exception {
        FakeTransport transport = new FakeTransport();
        session = session(transport, Duration.ofSeconds(5), 42);
        session.connect();
        Invocation first = get("of:1");
        Invocation second = get("of:2");

        CompletableFuture<Result<JsonNode>> a = session.invoke(first);
        CompletableFuture<Result<JsonNode>> b = session.invoke(second);
        eventually(() -> transport.attempts.size() == 1);
        FakeTransport.Attempt attempt = transport.last();
        assertTrue(attempt.connection.sent.isEmpty());

        attempt.open();
        eventually(() -> attempt.connection.sent.size() == 3);

        List<Envelope> sent = attempt.connection.envelopes();
        assertEquals(Invocation.HELLO, sent.get(0).invocation().command());
        assertEquals(42, sent.get(0).invocation().args().path("sinceSequence").asLong());
        assertEquals("client-1", sent.get(0).invocation().args().path("clientId").asText());
        assertEquals(first, sent.get(1).invocation());
        assertEquals(second, sent.get(2).invocation());
        assertEquals("token", sent.get(1).authorization());

        attempt.reply(ok(second, IntNode.valueOf(2)));
        attempt.reply(ok(first, IntNode.valueOf(1)));
        assertEquals(IntNode.valueOf(1), await(a).value());
        assertEquals(IntNode.valueOf(2), await(b).value());
        assertEquals(Session.State.OPEN, session.state());
    }

    @Test
    void error_reply_is_returned_as_typed_error() throws Exception {
        FakeTransport transport = new FakeTransport().autoOpen();
        session = session(transport, Duration.ofSeconds(5), -1);
        session.connect();
        Invocation tx = new Invocation("client-1", Invocation.TX, SPACE, null);

        CompletableFuture<Result<JsonNode>> answer = session.invoke(tx);
        eventually(() -> transport.attempts.size() == 1 && transport.last().connection.sent.size() == 2);
        Address a = Address.fromKey("of:1/application/json");
        transport.last().reply(MessageCodec.encode(new ProviderMessage.TaskReturn(
                tx.ref(), MessageCodec.error(new ReplicaError.ConflictError("stale", List.of(a))))));

        ReplicaError.ConflictError conflict = assertInstanceOf(ReplicaError.ConflictError.class, await(answer).error());
        assertEquals(List.of(a), conflict.addresses());
    }

    @Test
    void identical_invocations_share_one_frame_and_one_answer() throws Exception {
        FakeTransport transport = new FakeTransport().autoOpen();
        session = session(transport, Duration.ofSeconds(5), -1);
        session.connect();
        eventually(() -> session.state() == Session.State.OPEN);

        CompletableFuture<Result<JsonNode>> a = session.invoke(get("of:1"));
        CompletableFuture<Result<JsonNode>> b = session.invoke(get("of:1"));
        eventually(() -> transport.last().connection.sent.size() == 2);
        Thread.sleep(50);
        assertEquals(List.of(Invocation.HELLO, Invocation.GET), transport.last().connection.commands());

        transport.last().reply(ok(get("of:1"), IntNode.valueOf(7)));
        assertEquals(IntNode.valueOf(7), await(a).value());
        assertEquals(IntNode.valueOf(7), await(b).value());
    }

    @Test
    void hung_handshake_is_aborted_by_the_watchdog_and_retried() throws Exception {
        FakeTransport transport = new FakeTransport().hangFirst(1).autoOpen();
        session = session(transport, Duration.ofMillis(100), -1);
        CompletableFuture<Result<JsonNode>> answer = session.invoke(get("of:1"));

        session.connect();
        eventually(() -> session.state() == Session.State.OPEN);

        assertEquals(2, transport.attempts.size());
        FakeTransport.Attempt second = transport.last();
        eventually(() -> second.connection.sent.size() == 2);
        second.reply(ok(get("of:1"), IntNode.valueOf(1)));
        assertTrue(await(answer).isOk());

        // the abandoned attempt opening late must not take over
        FakeTransport.Attempt first = transport.attempts.get(0);
        first.open();
        eventually(() -> first.connection.aborted);
        assertTrue(first.connection.sent.isEmpty());
    }

    @Test
    void unanswered_invocation_is_resent_on_the_next_connection() throws Exception {
        FakeTransport transport = new FakeTransport().autoOpen();
        session = session(transport, Duration.ofSeconds(5), -1);
        session.connect();
        Invocation tx = new Invocation("client-1", Invocation.TX, SPACE, null);

        CompletableFuture<Result<JsonNode>> answer = session.invoke(tx);
        eventually(() -> transport.attempts.size() == 1 && transport.last().connection.sent.size() == 2);
        FakeTransport.Attempt dropped = transport.last();
        dropped.listener.onClose(1006, "gone");

        eventually(() -> transport.attempts.size() == 2 && transport.last().connection.sent.size() == 2);
        FakeTransport.Attempt reconnected = transport.last();
        assertEquals(List.of(Invocation.HELLO, Invocation.TX), reconnected.connection.commands());
        assertFalse(answer.isDone());

        // a late answer on the dropped socket is ignored
        dropped.reply(ok(tx, IntNode.valueOf(0)));
        reconnected.reply(ok(tx, IntNode.valueOf(1)));
        assertEquals(IntNode.valueOf(1), await(answer).value());
    }

    @Test
    void subscriptions_are_reissued_and_deliveries_acknowledged() throws Exception {
        FakeTransport transport = new FakeTransport().autoOpen();
        session = session(transport, Duration.ofSeconds(5), -1);
        session.connect();
        List<ProviderMessage.Deliver> delivered = new CopyOnWriteArrayList<>();
        Invocation subscribe = new Invocation("client-1", Invocation.SUBSCRIBE, SPACE, null);

        CompletableFuture<Result<JsonNode>> answer = session.subscribe(subscribe, delivered::add);
        eventually(() -> transport.last().connection.sent.size() == 2);
        transport.last().reply(ok(subscribe, CanonicalJson.MAPPER.createObjectNode()));
        assertTrue(await(answer).isOk());

        transport.last().listener.onError(new java.io.IOException("reset"));
        eventually(() -> transport.attempts.size() == 2 && transport.last().connection.sent.size() == 2);
        FakeTransport.Attempt second = transport.last();
        assertEquals(List.of(Invocation.HELLO, Invocation.SUBSCRIBE), second.connection.commands());

        ObjectNode body = CanonicalJson.MAPPER.createObjectNode().put("the", "application/json").put("of", "of:1");
        second.reply(MessageCodec.encode(new ProviderMessage.Deliver(SPACE, 3,
                List.of(new ProviderMessage.Doc("of:1/application/json", ProviderMessage.Doc.DELTA, body, 5)))));

        eventually(() -> delivered.size() == 1);
        eventually(() -> second.connection.sent.size() == 3);
        Invocation ack = second.connection.envelopes().get(2).invocation();
        assertEquals(Invocation.ACK, ack.command());
        assertEquals(SPACE, ack.subject());
        assertEquals(3, ack.args().path("epoch").asLong());
        assertEquals(SPACE, ack.args().path("streamId").asText());
    }

    @Test
    void close_fails_pending_invocations_with_connection_error() throws Exception {
        FakeTransport transport = new FakeTransport();
        session = session(transport, Duration.ofSeconds(5), -1);

        CompletableFuture<Result<JsonNode>> pending = session.invoke(get("of:1"));
        session.close();

        assertInstanceOf(ReplicaError.ConnectionError.class, await(pending).error());
        assertEquals(Session.State.CLOSED, session.state());
        assertInstanceOf(ReplicaError.ConnectionError.class, await(session.invoke(get("of:2"))).error());
    }

    @Test
    void backoff_doubles_and_is_capped_by_the_connection_timeout() {
        SessionSettings settings = new SessionSettings(Duration.ofMillis(1_000), Duration.ofMillis(100));

        assertEquals(100, settings.backoffMillis(0));
        assertEquals(200, settings.backoffMillis(1));
        assertEquals(800, settings.backoffMillis(3));
        assertEquals(1_000, settings.backoffMillis(4));
        assertEquals(1_000, settings.backoffMillis(80));
    }

    // ---------- helpers ----------

    private static Session session(Transport transport, Duration timeout, long since) {
        SessionSettings settings = new SessionSettings(timeout, Duration.ofMillis(10));
        return new Session(transport, URL, settings, "client-1", "client-1", "token", () -> since);
    }

    private static Invocation get(String entity) {
        ObjectNode args = CanonicalJson.MAPPER.createObjectNode();
        args.put("consumerId", "client-1");
        args.putObject("query").putObject("select").putObject(entity).putObject("application/json");
        return new Invocation("client-1", Invocation.GET, SPACE, args);
    }

    private static String ok(Invocation invocation, JsonNode value) {
        return MessageCodec.encode(new ProviderMessage.TaskReturn(invocation.ref(), MessageCodec.ok(value)));
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(5, TimeUnit.SECONDS);
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) fail("condition not met within 5s");
            Thread.sleep(5);
        }
    }
}
