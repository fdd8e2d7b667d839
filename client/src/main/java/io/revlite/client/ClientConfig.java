// file: client/src/main/java/io/revlite/client/ClientConfig.java
package io.revlite.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.revlite.client.replica.ReplicaSettings;
import io.revlite.client.session.SessionSettings;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Client configuration, from CLI args and/or a JSON file.
 *
 * Supports:
 *  - url:                     WebSocket endpoint of the remote
 *  - space:                   default memory space (DID)
 *  - clientId:                identity sent as issuer and in hello
 *  - authorization:           opaque token carried on every envelope
 *  - mediaType:               attribute used for entity-level reads and writes
 *  - connectionTimeoutMillis: watchdog per connection attempt, caps reconnect backoff
 *  - syncDebounceMillis:      coalescing window for background syncs
 *  - pullRetryLimit:          fetch retries on connection errors
 *  - cacheDir:                durable cache root (null = no durable cache)
 *  - maxHeapEntries:          heap bound (0 = unbounded)
 */
public record ClientConfig(
        URI url,
        String space,
        String clientId,
        String authorization,
        String mediaType,
        long connectionTimeoutMillis,
        long syncDebounceMillis,
        int pullRetryLimit,
        String cacheDir,
        int maxHeapEntries
) {

    public static final URI DEFAULT_URL = URI.create("ws://localhost:8080/api/storage/memory");
    public static final String DEFAULT_SPACE = "did:key:revlite-dev";
    public static final String DEFAULT_MEDIA_TYPE = "application/json";

    public ClientConfig {
        Objects.requireNonNull(url, "url");
        if (space == null || space.isBlank()) throw new IllegalArgumentException("space must not be blank");
        if (clientId == null || clientId.isBlank()) throw new IllegalArgumentException("clientId must not be blank");
        if (mediaType == null || mediaType.isBlank()) throw new IllegalArgumentException("mediaType must not be blank");
        if (connectionTimeoutMillis <= 0) throw new IllegalArgumentException("connectionTimeoutMillis must be > 0");
        if (syncDebounceMillis < 0) throw new IllegalArgumentException("syncDebounceMillis must be >= 0");
        if (pullRetryLimit < 0) throw new IllegalArgumentException("pullRetryLimit must be >= 0");
        if (maxHeapEntries < 0) throw new IllegalArgumentException("maxHeapEntries must be >= 0");
        if (authorization == null) authorization = "";
    }

    public static ClientConfig defaults() {
        return new Builder().build();
    }

    public SessionSettings sessionSettings() {
        return new SessionSettings(Duration.ofMillis(connectionTimeoutMillis), Duration.ofMillis(100));
    }

    public ReplicaSettings replicaSettings() {
        return new ReplicaSettings(Duration.ofMillis(syncDebounceMillis), pullRetryLimit, maxHeapEntries);
    }

    /** Parsed options plus the positional arguments left over (the command). */
    public record Parsed(ClientConfig config, List<String> rest) {}

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config,      -c   <path>   JSON file; later flags override it
     *   --url,         -u   <ws-url>
     *   --space,       -s   <did>
     *   --client-id         <id>
     *   --authorization     <token>
     *   --media-type        <type>
     *   --connection-timeout-ms <ms>
     *   --sync-debounce-ms      <ms>
     *   --pull-retry-limit      <n>
     *   --cache-dir         <path>
     *   --max-heap-entries  <n>
     *
     * All flags are optional; defaults are reasonable for local dev.
     *
     * @throws IllegalArgumentException on unknown flags, missing or invalid values
     */
    public static Parsed fromArgs(String[] args) {
        Builder b = new Builder();
        List<String> rest = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> b = Builder.from(fromJsonFile(Path.of(value(args, i++))));
                case "--url", "-u" -> b.url = URI.create(value(args, i++));
                case "--space", "-s" -> b.space = value(args, i++);
                case "--client-id" -> b.clientId = value(args, i++);
                case "--authorization" -> b.authorization = value(args, i++);
                case "--media-type" -> b.mediaType = value(args, i++);
                case "--connection-timeout-ms" -> b.connectionTimeoutMillis = number(args, i++);
                case "--sync-debounce-ms" -> b.syncDebounceMillis = number(args, i++);
                case "--pull-retry-limit" -> b.pullRetryLimit = (int) number(args, i++);
                case "--cache-dir" -> b.cacheDir = value(args, i++);
                case "--max-heap-entries" -> b.maxHeapEntries = (int) number(args, i++);
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    rest.add(args[i]);
                }
            }
        }
        return new Parsed(b.build(), List.copyOf(rest));
    }

    /** Load a config file; absent fields keep their defaults. */
    public static ClientConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonClientConfig cfg = mapper.readValue(path.toFile(), JsonClientConfig.class);
            Builder b = new Builder();
            if (cfg.url != null) b.url = URI.create(cfg.url);
            if (cfg.space != null) b.space = cfg.space;
            if (cfg.clientId != null) b.clientId = cfg.clientId;
            if (cfg.authorization != null) b.authorization = cfg.authorization;
            if (cfg.mediaType != null) b.mediaType = cfg.mediaType;
            if (cfg.connectionTimeoutMillis != null) b.connectionTimeoutMillis = cfg.connectionTimeoutMillis;
            if (cfg.syncDebounceMillis != null) b.syncDebounceMillis = cfg.syncDebounceMillis;
            if (cfg.pullRetryLimit != null) b.pullRetryLimit = cfg.pullRetryLimit;
            if (cfg.cacheDir != null) b.cacheDir = cfg.cacheDir;
            if (cfg.maxHeapEntries != null) b.maxHeapEntries = cfg.maxHeapEntries;
            return b.build();
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ClientConfig from " + path, e);
        }
    }

    // ---------- helpers ----------

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static long number(String[] args, int i) {
        String v = value(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v);
        }
    }

    private static final class Builder {
        URI url = DEFAULT_URL;
        String space = DEFAULT_SPACE;
        String clientId = "revlite-client";
        String authorization = "";
        String mediaType = DEFAULT_MEDIA_TYPE;
        long connectionTimeoutMillis = 30_000;
        long syncDebounceMillis = 1_000;
        int pullRetryLimit = 100;
        String cacheDir = null;
        int maxHeapEntries = 0;

        static Builder from(ClientConfig c) {
            Builder b = new Builder();
            b.url = c.url();
            b.space = c.space();
            b.clientId = c.clientId();
            b.authorization = c.authorization();
            b.mediaType = c.mediaType();
            b.connectionTimeoutMillis = c.connectionTimeoutMillis();
            b.syncDebounceMillis = c.syncDebounceMillis();
            b.pullRetryLimit = c.pullRetryLimit();
            b.cacheDir = c.cacheDir();
            b.maxHeapEntries = c.maxHeapEntries();
            return b;
        }

        ClientConfig build() {
            return new ClientConfig(url, space, clientId, authorization, mediaType,
                    connectionTimeoutMillis, syncDebounceMillis, pullRetryLimit, cacheDir, maxHeapEntries);
        }
    }
}
