// file: core/src/main/java/io/revlite/core/CanonicalJson.java
package io.revlite.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Canonical JSON form used for content hashing.
 * <p>
 * Rules:
 *  - object keys sorted lexicographically at every depth,
 *  - array order preserved,
 *  - compact output (no whitespace), UTF-8.
 * <p>
 * Two JSON trees that are equal as values produce identical bytes, regardless of
 * the order in which their fields were built or parsed.
 */
public final class CanonicalJson {

    /** Shared mapper; ObjectMapper is thread safe once configured. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {
        // utility
    }

    public static byte[] bytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical JSON", e);
        }
    }

    public static String string(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical JSON", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return MAPPER.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>(node.size());
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                names.add(it.next());
            }
            names.sort(null);
            ObjectNode sorted = MAPPER.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode out = MAPPER.createArrayNode();
            for (JsonNode element : node) {
                out.add(canonicalize(element));
            }
            return out;
        }
        return node;
    }
}
