// file: core/src/main/java/io/revlite/core/SchemaContext.java
package io.revlite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Declares which linked addresses a caller needs along with the one it loads,
 * so the remote can return a connected subgraph in one round trip.
 * <p>
 * The schema itself is opaque to the client; only its content hash matters
 * (two loads with equal schemas are the same variant).
 */
public record SchemaContext(JsonNode schema, JsonNode rootSchema) {

    public SchemaContext {
        Objects.requireNonNull(schema, "schema");
        if (rootSchema == null) {
            rootSchema = schema;
        }
    }

    public static SchemaContext of(JsonNode schema) {
        return new SchemaContext(schema, schema);
    }

    public static SchemaContext fromJson(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        return new SchemaContext(json.get("schema"), json.get("rootSchema"));
    }

    public ObjectNode toJson() {
        ObjectNode node = CanonicalJson.MAPPER.createObjectNode();
        node.set("schema", schema);
        node.set("rootSchema", rootSchema);
        return node;
    }

    /** Identity of this schema variant. */
    public ContentHash ref() {
        return ContentHash.of(toJson());
    }
}
