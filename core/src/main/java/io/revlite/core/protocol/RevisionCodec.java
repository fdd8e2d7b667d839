// file: core/src/main/java/io/revlite/core/protocol/RevisionCodec.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;
import io.revlite.core.Revision;

/**
 * JSON form of a revision.
 * <p>
 * Body:     {"the", "of", "is"?, "cause"?}
 * Full:     body + "since"
 */
public final class RevisionCodec {

    private RevisionCodec() {
        // utility
    }

    public static ObjectNode body(Revision r) {
        ObjectNode node = CanonicalJson.MAPPER.createObjectNode();
        node.put("the", r.the());
        node.put("of", r.of());
        if (r.is() != null) {
            node.set("is", r.is());
        }
        if (r.cause() != null) {
            node.put("cause", r.cause().value());
        }
        return node;
    }

    public static ObjectNode toJson(Revision r) {
        ObjectNode node = body(r);
        node.put("since", r.since());
        return node;
    }

    /** Decode a full revision; a missing {@code since} means unconfirmed. */
    public static Revision fromJson(JsonNode node) {
        long since = node.path("since").asLong(Revision.UNCONFIRMED);
        return fromBody(node, since);
    }

    public static Revision fromBody(JsonNode body, long since) {
        if (body == null || !body.isObject()) {
            throw new IllegalArgumentException("revision must be a JSON object");
        }
        JsonNode the = body.get("the");
        JsonNode of = body.get("of");
        if (the == null || !the.isTextual() || of == null || !of.isTextual()) {
            throw new IllegalArgumentException("revision needs string fields 'the' and 'of': " + body);
        }
        JsonNode cause = body.get("cause");
        ContentHash causeHash = (cause == null || cause.isNull()) ? null : ContentHash.parse(cause.asText());
        return new Revision(the.asText(), of.asText(), body.get("is"), causeHash, since);
    }
}
