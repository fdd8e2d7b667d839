// file: server/src/test/java/io/revlite/server/ServerConfigTest.java
package io.revlite.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @Test
    void defaults_for_local_dev() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[0]);

        assertEquals("0.0.0.0", cfg.host());
        assertEquals(8080, cfg.port());
        assertEquals(ServerConfig.DEFAULT_PATH, cfg.path());
    }

    @Test
    void flags_override_defaults() {
        ServerConfig cfg = ServerConfig.fromArgs(new String[]{"-H", "127.0.0.1", "--port", "9001", "--path", "/ws"});

        assertEquals("127.0.0.1", cfg.host());
        assertEquals(9001, cfg.port());
        assertEquals("/ws", cfg.path());
    }

    @Test
    void path_must_be_absolute() {
        assertThrows(IllegalArgumentException.class, () -> new ServerConfig("localhost", 8080, "ws"));
    }
}
