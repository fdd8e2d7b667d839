// file: core/src/main/java/io/revlite/core/protocol/Transaction.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.revlite.core.Address;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;
import io.revlite.core.Revision;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arguments of a {@code tx} command.
 * <p>
 * Each write names the revision it was built on ({@code baseHeads}) and the
 * staged body ({@code changes}); the remote rejects a write whose base is no
 * longer the current head of its address.
 */
public record Transaction(String clientTxId, List<Write> writes) {

    public Transaction {
        writes = List.copyOf(writes);
    }

    /**
     * @param address    address being written
     * @param cause      hash of the revision the write supersedes
     * @param is         new value, null for a retraction
     */
    public record Write(Address address, ContentHash cause, JsonNode is) {
        public Write {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(cause, "cause");
            if (is != null && (is.isNull() || is.isMissingNode())) {
                is = null;
            }
        }

        public static Write of(Revision staged) {
            return new Write(staged.address(), staged.cause(), staged.is());
        }

        /** The provisional revision this write stands for. */
        public Revision revision() {
            return new Revision(address.the(), address.of(), is, cause, Revision.UNCONFIRMED);
        }
    }

    public static Transaction of(String clientTxId, List<Revision> staged) {
        List<Write> writes = new ArrayList<>(staged.size());
        for (Revision r : staged) {
            writes.add(Write.of(r));
        }
        return new Transaction(clientTxId, writes);
    }

    public ObjectNode toArgs() {
        ObjectNode args = CanonicalJson.MAPPER.createObjectNode();
        if (clientTxId != null) {
            args.put("clientTxId", clientTxId);
        }
        args.putArray("reads");
        ArrayNode out = args.putArray("writes");
        for (Write w : writes) {
            ObjectNode write = out.addObject();
            write.put("ref", w.address().key());
            write.putArray("baseHeads").add(w.cause().value());
            ObjectNode changes = write.putObject("changes");
            if (w.is() != null) {
                changes.set("is", w.is());
            }
            write.put("allowServerMerge", false);
        }
        return args;
    }

    public static Transaction fromArgs(JsonNode args) {
        JsonNode id = args.get("clientTxId");
        List<Write> writes = new ArrayList<>();
        for (JsonNode write : args.path("writes")) {
            JsonNode ref = write.get("ref");
            JsonNode heads = write.path("baseHeads");
            if (ref == null || !ref.isTextual() || heads.size() != 1) {
                throw new IllegalArgumentException("write needs a ref and exactly one base head: " + write);
            }
            writes.add(new Write(
                    Address.fromKey(ref.asText()),
                    ContentHash.parse(heads.get(0).asText()),
                    write.path("changes").get("is")));
        }
        return new Transaction(id == null || id.isNull() ? null : id.asText(), writes);
    }
}
