// file: core/src/main/java/io/revlite/core/protocol/Envelope.java
package io.revlite.core.protocol;

import java.util.Objects;

/**
 * Outbound frame: an invocation plus its authorization.
 * The authorization is opaque to this codebase; signing happens elsewhere.
 */
public record Envelope(Invocation invocation, String authorization) {

    public Envelope {
        Objects.requireNonNull(invocation, "invocation");
        if (authorization == null) {
            authorization = "";
        }
    }
}
