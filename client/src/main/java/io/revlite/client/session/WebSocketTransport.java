// file: client/src/main/java/io/revlite/client/session/WebSocketTransport.java
package io.revlite.client.session;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} over the JDK's {@code java.net.http} WebSocket client.
 * <p>
 * Notes:
 *  - Fragmented text messages are reassembled before reaching the listener.
 *  - WebSocket allows one outstanding send at a time, so sends are chained.
 */
public final class WebSocketTransport implements Transport {
    private static final Logger log = Logger.getLogger(WebSocketTransport.class.getName());

    private final HttpClient http;
    private final Duration connectTimeout;

    public WebSocketTransport(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public CompletableFuture<Connection> connect(URI uri, Listener listener) {
        return http.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, new Adapter(listener))
                .thenApply(SocketConnection::new);
    }

    private static final class SocketConnection implements Connection {
        private final WebSocket ws;
        private CompletableFuture<WebSocket> sending;

        SocketConnection(WebSocket ws) {
            this.ws = ws;
            this.sending = CompletableFuture.completedFuture(ws);
        }

        @Override
        public synchronized void send(String text) {
            sending = sending
                    .thenCompose(s -> s.sendText(text, true))
                    .exceptionally(e -> {
                        log.log(Level.FINE, "WebSocket send failed", e);
                        return ws;
                    });
        }

        @Override
        public synchronized void close() {
            sending = sending.thenCompose(s -> s.sendClose(WebSocket.NORMAL_CLOSURE, "bye"));
        }

        @Override
        public void abort() {
            ws.abort();
        }
    }

    private static final class Adapter implements WebSocket.Listener {
        private final Listener listener;
        private final StringBuilder text = new StringBuilder();

        Adapter(Listener listener) {
            this.listener = listener;
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                String frame = text.toString();
                text.setLength(0);
                listener.onText(frame);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            listener.onError(error);
        }
    }
}
