// file: server/src/main/java/io/revlite/server/Main.java
package io.revlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the development provider.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Create the in-memory provider and its WebSocket endpoint.
 *  - Stop the endpoint on JVM shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);

        var provider = new MemoryProvider();
        var endpoint = new ProviderEndpoint(cfg, provider);
        endpoint.start();

        System.out.printf(
                "revlite provider listening on ws://%s:%d%s (health: http://%s:%d/admin/health)%n",
                cfg.host(), cfg.port(), cfg.path(),
                cfg.host(), cfg.port()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                endpoint.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Failed to stop endpoint cleanly", e);
            }
        }, "revlite-server-shutdown"));
    }
}
