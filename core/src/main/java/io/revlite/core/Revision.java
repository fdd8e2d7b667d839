// file: core/src/main/java/io/revlite/core/Revision.java
package io.revlite.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Immutable state of one address as of a server sequence number.
 * <p>
 * Fields:
 *  - the, of: the address.
 *  - is:      the value (null when retracted or unclaimed).
 *  - cause:   content hash of the revision this one supersedes
 *             (null only for the unclaimed sentinel).
 *  - since:   server-assigned sequence number; within one address this is the
 *             single total order used for reconciliation. {@link #UNCONFIRMED}
 *             marks both the unclaimed sentinel and provisional (staged) revisions.
 * <p>
 * Invariants:
 *  - a revision with a value always names its cause,
 *  - JSON null and missing values are normalized to "no value".
 */
public record Revision(String the, String of, JsonNode is, ContentHash cause, long since) {

    /** Sequence number of revisions the server has not confirmed (or never had). */
    public static final long UNCONFIRMED = -1L;

    public Revision {
        Objects.requireNonNull(the, "the");
        Objects.requireNonNull(of, "of");
        if (is != null && (is.isNull() || is.isMissingNode())) {
            is = null;
        }
        if (is != null && cause == null) {
            throw new IllegalArgumentException("asserted revision must name its cause: " + of + "/" + the);
        }
    }

    /** "We asked and the server had nothing." Any real revision outranks it. */
    public static Revision unclaimed(Address address) {
        return new Revision(address.the(), address.of(), null, null, UNCONFIRMED);
    }

    public static Revision asserted(Address address, JsonNode is, ContentHash cause, long since) {
        Objects.requireNonNull(is, "is");
        return new Revision(address.the(), address.of(), is, cause, since);
    }

    public static Revision retracted(Address address, ContentHash cause, long since) {
        Objects.requireNonNull(cause, "cause");
        return new Revision(address.the(), address.of(), null, cause, since);
    }

    public Address address() {
        return new Address(the, of);
    }

    public RevisionState state() {
        if (is != null) return RevisionState.ASSERTED;
        return cause == null ? RevisionState.UNCLAIMED : RevisionState.RETRACTED;
    }

    public boolean hasValue() {
        return is != null;
    }

    public Revision withSince(long since) {
        return new Revision(the, of, is, cause, since);
    }

    /** Content hash of the fact (excludes {@link #since()}). */
    public ContentHash hash() {
        return ContentHash.of(this);
    }
}
