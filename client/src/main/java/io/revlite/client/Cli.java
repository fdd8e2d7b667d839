// file: client/src/main/java/io/revlite/client/Cli.java
package io.revlite.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.Result;
import io.revlite.core.Revision;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command-line client for a revlite remote over WebSocket.
 *
 * Usage:
 *   revlite-cli [options] get <entity>
 *   revlite-cli [options] put <entity> <json>
 *   revlite-cli [options] del <entity>
 *   revlite-cli [options] watch <entity>
 *
 * Examples:
 *   revlite-cli put of:profile '{"name":"ada"}'
 *   revlite-cli --space did:key:team get of:profile
 *   revlite-cli --cache-dir ./data/cache watch of:profile
 */
public final class Cli implements AutoCloseable {

    private final StorageProvider provider;
    private final long waitMillis;

    private Cli(ClientConfig config) {
        this.provider = StorageProvider.connect(config);
        this.waitMillis = config.connectionTimeoutMillis() * 2;
    }

    public static void main(String[] args) {
        try {
            ClientConfig.Parsed parsed;
            try {
                parsed = ClientConfig.fromArgs(args);
            } catch (IllegalArgumentException e) {
                usageAndExit(e.getMessage());
                return;
            }
            List<String> rest = parsed.rest();
            if (rest.isEmpty()) {
                usageAndExit("missing command");
            }

            String cmd = rest.get(0);
            switch (cmd) {
                case "get" -> {
                    if (rest.size() != 2) {
                        usageAndExit("get requires <entity>");
                    }
                    try (Cli cli = new Cli(parsed.config())) {
                        cli.get(rest.get(1));
                    }
                }
                case "put" -> {
                    if (rest.size() != 3) {
                        usageAndExit("put requires <entity> <json>");
                    }
                    JsonNode value = parseJson(rest.get(2));
                    try (Cli cli = new Cli(parsed.config())) {
                        cli.write(rest.get(1), value);
                    }
                }
                case "del" -> {
                    if (rest.size() != 2) {
                        usageAndExit("del requires <entity>");
                    }
                    try (Cli cli = new Cli(parsed.config())) {
                        cli.write(rest.get(1), null);
                    }
                }
                case "watch" -> {
                    if (rest.size() != 2) {
                        usageAndExit("watch requires <entity>");
                    }
                    Cli cli = new Cli(parsed.config());
                    Runtime.getRuntime().addShutdownHook(new Thread(cli.provider::close, "revlite-cli-shutdown"));
                    cli.watch(rest.get(1));
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    @Override
    public void close() {
        provider.close();
    }

    private void get(String entity) throws Exception {
        Result<List<Revision>> r = await(provider.sync(entity));
        if (!r.isOk()) {
            throw new CliException("get failed: " + r.error().name() + ": " + r.error().message());
        }
        JsonNode value = provider.get(entity);
        System.out.println(value == null ? "(not found)" : CanonicalJson.string(value));
    }

    private void write(String entity, JsonNode value) throws Exception {
        Result<Commit> r = await(provider.send(List.of(new StorageProvider.Update(entity, value))));
        if (!r.isOk()) {
            throw new CliException("write failed: " + r.error().name() + ": " + r.error().message());
        }
        System.out.println(r.value().since() < 0 ? "OK (unchanged)" : "OK since=" + r.value().since());
    }

    private void watch(String entity) throws InterruptedException {
        provider.sink(entity, value -> System.out.println(CanonicalJson.string(value)));
        new CountDownLatch(1).await();
    }

    private <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new CliException("no answer from remote within " + waitMillis + " ms");
        }
    }

    private static JsonNode parseJson(String text) {
        try {
            return CanonicalJson.MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new CliException("value is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  revlite-cli [options] get <entity>
                  revlite-cli [options] put <entity> <json>
                  revlite-cli [options] del <entity>
                  revlite-cli [options] watch <entity>

                Options:
                  --config, -c <path>        JSON config file
                  --url, -u <ws-url>         remote endpoint (default ws://localhost:8080/api/storage/memory)
                  --space, -s <did>          memory space
                  --client-id <id>
                  --authorization <token>
                  --media-type <type>        default application/json
                  --connection-timeout-ms <ms>
                  --sync-debounce-ms <ms>
                  --pull-retry-limit <n>
                  --cache-dir <path>         enable the durable cache
                  --max-heap-entries <n>
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
