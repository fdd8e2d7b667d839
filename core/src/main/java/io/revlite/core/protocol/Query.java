// file: core/src/main/java/io/revlite/core/protocol/Query.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.SchemaContext;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Query selectors for {@code get} / {@code subscribe}.
 * <p>
 * Flat form:
 * <pre>
 *   { "select": { "&lt;entity&gt;": { "&lt;attribute&gt;": {} } } }
 * </pre>
 * Schema-aware form (the remote follows links described by the schema):
 * <pre>
 *   { "selectSchema": { "&lt;entity&gt;": { "&lt;attribute&gt;": { "_": { "path": [], "schemaContext": {...} } } } } }
 * </pre>
 */
public final class Query {

    public static final String SELECT = "select";
    public static final String SELECT_SCHEMA = "selectSchema";

    private Query() {
        // utility
    }

    /** One (address, schema?) pair named by a query. */
    public record Entry(Address address, SchemaContext schema) {}

    public static ObjectNode select(List<Address> addresses) {
        ObjectNode selector = CanonicalJson.MAPPER.createObjectNode();
        for (Address a : addresses) {
            selector.withObjectProperty(a.of()).set(a.the(), CanonicalJson.MAPPER.createObjectNode());
        }
        ObjectNode query = CanonicalJson.MAPPER.createObjectNode();
        query.set(SELECT, selector);
        return query;
    }

    /**
     * Schema-aware query. Entries without a schema are still included with an
     * empty path so the whole batch goes out as one query.
     */
    public static ObjectNode selectSchema(List<Entry> entries) {
        ObjectNode selector = CanonicalJson.MAPPER.createObjectNode();
        for (Entry e : entries) {
            ObjectNode match = CanonicalJson.MAPPER.createObjectNode();
            match.set("path", CanonicalJson.MAPPER.createArrayNode());
            if (e.schema() != null) {
                match.set("schemaContext", e.schema().toJson());
            }
            ObjectNode attribute = CanonicalJson.MAPPER.createObjectNode();
            attribute.set("_", match);
            selector.withObjectProperty(e.address().of()).set(e.address().the(), attribute);
        }
        ObjectNode query = CanonicalJson.MAPPER.createObjectNode();
        query.set(SELECT_SCHEMA, selector);
        return query;
    }

    /** Build the right query form for a batch: schema-aware if any entry carries a schema. */
    public static ObjectNode of(List<Entry> entries) {
        boolean hasSchema = entries.stream().anyMatch(e -> e.schema() != null);
        if (hasSchema) {
            return selectSchema(entries);
        }
        List<Address> addresses = new ArrayList<>(entries.size());
        for (Entry e : entries) {
            addresses.add(e.address());
        }
        return select(addresses);
    }

    /** Inverse of {@link #select} / {@link #selectSchema}: the entries a query names. */
    public static List<Entry> entries(JsonNode query) {
        List<Entry> out = new ArrayList<>();
        if (query == null) {
            return out;
        }
        boolean schemaAware = query.has(SELECT_SCHEMA);
        JsonNode selector = schemaAware ? query.get(SELECT_SCHEMA) : query.get(SELECT);
        if (selector == null || !selector.isObject()) {
            throw new IllegalArgumentException("query must have a select or selectSchema object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> entities = selector.fields(); entities.hasNext(); ) {
            Map.Entry<String, JsonNode> entity = entities.next();
            for (Iterator<Map.Entry<String, JsonNode>> attrs = entity.getValue().fields(); attrs.hasNext(); ) {
                Map.Entry<String, JsonNode> attr = attrs.next();
                SchemaContext schema = null;
                if (schemaAware) {
                    JsonNode match = attr.getValue().path("_");
                    schema = SchemaContext.fromJson(match.get("schemaContext"));
                }
                out.add(new Entry(new Address(attr.getKey(), entity.getKey()), schema));
            }
        }
        return out;
    }
}
