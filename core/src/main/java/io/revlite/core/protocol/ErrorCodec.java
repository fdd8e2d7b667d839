// file: core/src/main/java/io/revlite/core/protocol/ErrorCodec.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ReplicaError;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps {@link ReplicaError} to and from its wire form {@code {name, message, ...}}.
 * Conflicts carry the rejected address keys under "addresses"; query errors
 * echo the selector.
 */
public final class ErrorCodec {

    private ErrorCodec() {
        // utility
    }

    public static ObjectNode toJson(ReplicaError error) {
        ObjectNode node = CanonicalJson.MAPPER.createObjectNode();
        node.put("name", error.name());
        node.put("message", error.message());
        if (error instanceof ReplicaError.ConflictError conflict) {
            ArrayNode keys = node.putArray("addresses");
            for (Address a : conflict.addresses()) {
                keys.add(a.key());
            }
        } else if (error instanceof ReplicaError.QueryError query && query.selector() != null) {
            node.set("selector", query.selector());
        } else if (error instanceof ReplicaError.ConnectionError connection && connection.address() != null) {
            node.put("address", connection.address());
        }
        return node;
    }

    /**
     * Decode an error object. Unknown names are reported as transaction errors
     * so callers never retry them.
     */
    public static ReplicaError fromJson(JsonNode node) {
        String name = node.path("name").asText("");
        String message = node.path("message").asText(name);
        return switch (name) {
            case "ConnectionError" -> new ReplicaError.ConnectionError(textOrNull(node.get("address")), message);
            case "QueryError" -> new ReplicaError.QueryError(message, node.get("selector"));
            case "ConflictError" -> {
                List<Address> addresses = new ArrayList<>();
                for (JsonNode key : node.path("addresses")) {
                    addresses.add(Address.fromKey(key.asText()));
                }
                yield new ReplicaError.ConflictError(message, addresses);
            }
            case "AuthorizationError" -> new ReplicaError.AuthorizationError(message);
            case "StoreError" -> new ReplicaError.StoreError(message, null);
            case "TransactionError" -> new ReplicaError.TransactionError(message);
            default -> new ReplicaError.TransactionError(name.isEmpty() ? message : name + ": " + message);
        };
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
