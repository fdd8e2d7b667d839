// file: core/src/main/java/io/revlite/core/ContentHash.java
package io.revlite.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content address of a JSON value: SHA-256 over its canonical JSON bytes.
 * <p>
 * Used for:
 *  - revision causes (a revision names the hash of the revision it supersedes),
 *  - invocation correlation (a task/return names the hash of its invocation),
 *  - schema variants (the replica remembers which schema hashes fetched an address).
 */
public record ContentHash(String value) {

    public static final String PREFIX = "sha256:";

    public ContentHash {
        Objects.requireNonNull(value, "value");
        if (!value.startsWith(PREFIX) || value.length() != PREFIX.length() + 64) {
            throw new IllegalArgumentException("not a content hash: " + value);
        }
    }

    public static ContentHash parse(String value) {
        return new ContentHash(value);
    }

    /** Hash of an arbitrary JSON value. */
    public static ContentHash of(JsonNode node) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(CanonicalJson.bytes(node));
            return new ContentHash(PREFIX + HexFormat.of().formatHex(digest));
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Hash of the fact carried by a revision: {@code {the, of, is?, cause?}}.
     * The sequence number is not part of the fact, so the same fact observed at
     * different times hashes identically.
     */
    public static ContentHash of(Revision revision) {
        ObjectNode fact = CanonicalJson.MAPPER.createObjectNode();
        fact.put("the", revision.the());
        fact.put("of", revision.of());
        if (revision.is() != null) {
            fact.set("is", revision.is());
        }
        if (revision.cause() != null) {
            fact.put("cause", revision.cause().value());
        }
        return of(fact);
    }

    @Override
    public String toString() {
        return value;
    }
}
