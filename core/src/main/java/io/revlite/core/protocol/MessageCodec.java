// file: core/src/main/java/io/revlite/core/protocol/MessageCodec.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.Commit;
import io.revlite.core.ContentHash;
import io.revlite.core.ReplicaError;
import io.revlite.core.Result;
import io.revlite.core.Revision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text-frame codec for both directions of the session.
 * <p>
 * Outbound (client -> remote):
 *   {"invocation": {"issuer", "command", "subject", "args"}, "authorization": "..."}
 * <p>
 * Inbound (remote -> client):
 *   {"the": "task/return", "of": "sha256:...", "is": {"ok": ...} | {"error": {...}}}
 *   {"the": "deliver", "streamId": "...", "epoch": n, "docs": [{docId, kind, body, version}]}
 * <p>
 * Malformed frames throw {@link IllegalArgumentException}.
 */
public final class MessageCodec {

    public static final String TASK_RETURN = "task/return";
    public static final String DELIVER = "deliver";

    private static final ObjectMapper json = CanonicalJson.MAPPER;

    private MessageCodec() {
        // utility
    }

    // ---------- envelopes ----------

    public static String encode(Envelope envelope) {
        ObjectNode node = json.createObjectNode();
        node.set("invocation", envelope.invocation().toJson());
        node.put("authorization", envelope.authorization());
        return write(node);
    }

    public static Envelope decodeEnvelope(String text) {
        JsonNode node = read(text);
        JsonNode invocation = node.get("invocation");
        if (invocation == null || !invocation.isObject()) {
            throw new IllegalArgumentException("envelope without invocation");
        }
        return new Envelope(Invocation.fromJson(invocation), node.path("authorization").asText(""));
    }

    // ---------- provider messages ----------

    public static String encode(ProviderMessage message) {
        ObjectNode node = json.createObjectNode();
        if (message instanceof ProviderMessage.TaskReturn ret) {
            node.put("the", TASK_RETURN);
            node.put("of", ret.of().value());
            node.set("is", ret.is());
        } else {
            ProviderMessage.Deliver deliver = (ProviderMessage.Deliver) message;
            node.put("the", DELIVER);
            node.put("streamId", deliver.streamId());
            node.put("epoch", deliver.epoch());
            ArrayNode docs = node.putArray("docs");
            for (ProviderMessage.Doc doc : deliver.docs()) {
                ObjectNode d = docs.addObject();
                d.put("docId", doc.docId());
                d.put("kind", doc.kind());
                d.set("body", doc.body());
                d.put("version", doc.version());
            }
        }
        return write(node);
    }

    public static ProviderMessage decode(String text) {
        JsonNode node = read(text);
        String the = node.path("the").asText("");
        return switch (the) {
            case TASK_RETURN -> {
                JsonNode is = node.get("is");
                if (is == null) {
                    throw new IllegalArgumentException("task/return without 'is'");
                }
                yield new ProviderMessage.TaskReturn(ContentHash.parse(node.path("of").asText()), is);
            }
            case DELIVER -> {
                List<ProviderMessage.Doc> docs = new ArrayList<>();
                for (JsonNode d : node.path("docs")) {
                    docs.add(new ProviderMessage.Doc(
                            d.path("docId").asText(),
                            d.path("kind").asText(ProviderMessage.Doc.SNAPSHOT),
                            d.get("body"),
                            d.path("version").asLong(Revision.UNCONFIRMED)));
                }
                yield new ProviderMessage.Deliver(
                        node.path("streamId").asText(""), node.path("epoch").asLong(), docs);
            }
            default -> throw new IllegalArgumentException("unknown message kind: " + the);
        };
    }

    // ---------- task/return payloads ----------

    public static ObjectNode ok(JsonNode value) {
        ObjectNode node = json.createObjectNode();
        node.set("ok", value == null ? json.createObjectNode() : value);
        return node;
    }

    public static ObjectNode error(ReplicaError error) {
        ObjectNode node = json.createObjectNode();
        node.set("error", ErrorCodec.toJson(error));
        return node;
    }

    /** Split a task/return {@code is} into its ok payload or typed error. */
    public static Result<JsonNode> unwrap(JsonNode is) {
        if (is.has("ok")) {
            return Result.ok(is.get("ok"));
        }
        if (is.has("error")) {
            return Result.failure(ErrorCodec.fromJson(is.get("error")));
        }
        throw new IllegalArgumentException("task/return is neither ok nor error: " + is);
    }

    // ---------- commits ----------

    public static ObjectNode encodeCommit(Commit commit) {
        ObjectNode node = json.createObjectNode();
        node.put("since", commit.since());
        if (commit.head() != null) {
            node.set("commit", RevisionCodec.toJson(commit.head()));
        }
        ArrayNode rejected = node.putArray("rejected");
        for (Map.Entry<Address, ReplicaError> e : commit.rejected().entrySet()) {
            ObjectNode r = rejected.addObject();
            r.put("ref", e.getKey().key());
            r.put("name", e.getValue().name());
            r.put("message", e.getValue().message());
        }
        return node;
    }

    public static Commit decodeCommit(JsonNode ok) {
        JsonNode since = ok.get("since");
        if (since == null || !since.canConvertToLong()) {
            throw new IllegalArgumentException("commit without a sequence number: " + ok);
        }
        JsonNode head = ok.get("commit");
        Map<Address, ReplicaError> rejected = new LinkedHashMap<>();
        for (JsonNode r : ok.path("rejected")) {
            rejected.put(Address.fromKey(r.path("ref").asText()), ErrorCodec.fromJson(r));
        }
        return new Commit(
                since.asLong(),
                head == null || head.isNull() ? null : RevisionCodec.fromJson(head),
                rejected);
    }

    // ---------- helpers ----------

    private static String write(JsonNode node) {
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode message", e);
        }
    }

    private static JsonNode read(String text) {
        try {
            JsonNode node = json.readTree(text);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("frame must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed frame: " + e.getOriginalMessage(), e);
        }
    }
}
