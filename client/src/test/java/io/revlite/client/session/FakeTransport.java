// file: client/src/test/java/io/revlite/client/session/FakeTransport.java
package io.revlite.client.session;

import io.revlite.core.protocol.Envelope;
import io.revlite.core.protocol.MessageCodec;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport. Each connect attempt is recorded; tests either open it
 * by hand or let it open on its own.
 */
final class FakeTransport implements Transport {

    final List<Attempt> attempts = new CopyOnWriteArrayList<>();
    private volatile boolean autoOpen;
    private volatile int hangFirst;

    /** Open every later connection attempt as soon as it is made. */
    FakeTransport autoOpen() {
        autoOpen = true;
        return this;
    }

    /** Let the first {@code n} attempts hang without opening or failing. */
    FakeTransport hangFirst(int n) {
        hangFirst = n;
        return this;
    }

    @Override
    public CompletableFuture<Connection> connect(URI uri, Listener listener) {
        Attempt attempt = new Attempt(listener);
        attempts.add(attempt);
        if (autoOpen && attempts.size() > hangFirst) {
            attempt.open();
        }
        return attempt.future;
    }

    Attempt last() {
        return attempts.get(attempts.size() - 1);
    }

    static final class Attempt {
        final Listener listener;
        final CompletableFuture<Connection> future = new CompletableFuture<>();
        final FakeConnection connection = new FakeConnection();

        Attempt(Listener listener) {
            this.listener = listener;
        }

        void open() {
            future.complete(connection);
        }

        void reply(String frame) {
            listener.onText(frame);
        }
    }

    static final class FakeConnection implements Connection {
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile boolean closed;
        volatile boolean aborted;

        @Override
        public void send(String text) {
            sent.add(text);
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public void abort() {
            aborted = true;
        }

        List<Envelope> envelopes() {
            List<Envelope> out = new ArrayList<>();
            for (String s : sent) {
                out.add(MessageCodec.decodeEnvelope(s));
            }
            return out;
        }

        List<String> commands() {
            List<String> out = new ArrayList<>();
            for (Envelope e : envelopes()) {
                out.add(e.invocation().command());
            }
            return out;
        }
    }
}
