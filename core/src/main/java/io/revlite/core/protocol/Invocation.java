// file: core/src/main/java/io/revlite/core/protocol/Invocation.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;

import java.util.Objects;

/**
 * A command addressed to the remote.
 *
 * @param issuer  identity of the caller (client id / DID)
 * @param command one of {@link #HELLO}, {@link #SUBSCRIBE}, {@link #GET}, {@link #TX}, {@link #ACK}
 * @param subject memory space the command applies to
 * @param args    command arguments
 */
public record Invocation(String issuer, String command, String subject, JsonNode args) {

    public static final String HELLO = "hello";
    public static final String SUBSCRIBE = "subscribe";
    public static final String GET = "get";
    public static final String TX = "tx";
    public static final String ACK = "ack";

    public Invocation {
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(subject, "subject");
        if (args == null) {
            args = CanonicalJson.MAPPER.createObjectNode();
        }
    }

    public ObjectNode toJson() {
        ObjectNode node = CanonicalJson.MAPPER.createObjectNode();
        node.put("issuer", issuer);
        node.put("command", command);
        node.put("subject", subject);
        node.set("args", args);
        return node;
    }

    public static Invocation fromJson(JsonNode node) {
        return new Invocation(
                text(node, "issuer"),
                text(node, "command"),
                text(node, "subject"),
                node.get("args")
        );
    }

    /**
     * Correlation id: the remote answers with a task/return whose {@code of}
     * equals this hash. Identical invocations share one id.
     */
    public ContentHash ref() {
        return ContentHash.of(toJson());
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException("invocation." + field + " must be a string");
        }
        return v.asText();
    }
}
