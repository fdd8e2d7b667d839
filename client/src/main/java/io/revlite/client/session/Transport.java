// file: client/src/main/java/io/revlite/client/session/Transport.java
package io.revlite.client.session;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Duplex text-frame connection factory. The session owns reconnect logic;
 * a transport only opens one connection per call.
 */
public interface Transport {

    /**
     * Open a connection. The future completes once the connection is open, or
     * exceptionally if it could not be opened. Listener callbacks may arrive on
     * any thread.
     */
    CompletableFuture<Connection> connect(URI uri, Listener listener);

    interface Connection {

        /** Send one text frame. Frames are delivered in call order. */
        void send(String text);

        /** Orderly close. */
        void close();

        /** Drop the connection without a close handshake. */
        void abort();
    }

    interface Listener {

        void onText(String text);

        void onClose(int code, String reason);

        void onError(Throwable error);
    }
}
