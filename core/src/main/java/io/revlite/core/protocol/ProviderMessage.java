// file: core/src/main/java/io/revlite/core/protocol/ProviderMessage.java
package io.revlite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import io.revlite.core.ContentHash;

import java.util.List;
import java.util.Objects;

/**
 * Inbound frames sent by the remote.
 */
public sealed interface ProviderMessage permits ProviderMessage.TaskReturn, ProviderMessage.Deliver {

    /** Answer to the invocation whose {@link Invocation#ref()} equals {@code of}. */
    record TaskReturn(ContentHash of, JsonNode is) implements ProviderMessage {
        public TaskReturn {
            Objects.requireNonNull(of, "of");
            Objects.requireNonNull(is, "is");
        }
    }

    /**
     * Pushed documents for a subscription stream; must be acknowledged with an
     * {@code ack {streamId, epoch}} as soon as it is received.
     */
    record Deliver(String streamId, long epoch, List<Doc> docs) implements ProviderMessage {
        public Deliver {
            Objects.requireNonNull(streamId, "streamId");
            docs = docs == null ? List.of() : List.copyOf(docs);
        }
    }

    /**
     * One pushed document.
     *
     * @param docId   address key ({@code of/the})
     * @param kind    "snapshot" or "delta"
     * @param body    revision body {@code {the, of, is?, cause?}}
     * @param version sequence number of the revision
     */
    record Doc(String docId, String kind, JsonNode body, long version) {
        public static final String SNAPSHOT = "snapshot";
        public static final String DELTA = "delta";
    }
}
