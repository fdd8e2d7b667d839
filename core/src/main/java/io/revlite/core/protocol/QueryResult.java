// file: core/src/main/java/io/revlite/core/protocol/QueryResult.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;
import io.revlite.core.Revision;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Successful answer to a {@code get}: the facts the remote holds for the
 * queried addresses (and, for schema queries, linked addresses), plus the
 * schema variants each address was fetched under.
 * <p>
 * Addresses the remote has nothing for are simply absent from {@code facts}.
 */
public record QueryResult(List<Revision> facts, Map<Address, List<ContentHash>> schemas) {

    public QueryResult {
        facts = List.copyOf(facts);
        schemas = schemas == null ? Map.of() : Map.copyOf(schemas);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), Map.of());
    }

    public ObjectNode toJson() {
        ObjectNode node = CanonicalJson.MAPPER.createObjectNode();
        ArrayNode arr = node.putArray("facts");
        for (Revision r : facts) {
            arr.add(RevisionCodec.toJson(r));
        }
        ObjectNode refs = node.putObject("schemas");
        for (Map.Entry<Address, List<ContentHash>> e : schemas.entrySet()) {
            ArrayNode list = refs.putArray(e.getKey().key());
            for (ContentHash h : e.getValue()) {
                list.add(h.value());
            }
        }
        return node;
    }

    public static QueryResult fromJson(JsonNode node) {
        List<Revision> facts = new ArrayList<>();
        for (JsonNode fact : node.path("facts")) {
            facts.add(RevisionCodec.fromJson(fact));
        }
        Map<Address, List<ContentHash>> schemas = new LinkedHashMap<>();
        JsonNode refs = node.path("schemas");
        for (Iterator<Map.Entry<String, JsonNode>> it = refs.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            List<ContentHash> hashes = new ArrayList<>();
            for (JsonNode h : e.getValue()) {
                hashes.add(ContentHash.parse(h.asText()));
            }
            schemas.put(Address.fromKey(e.getKey()), hashes);
        }
        return new QueryResult(facts, schemas);
    }
}
