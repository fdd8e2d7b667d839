// file: core/src/main/java/io/revlite/core/RevisionMerger.java
package io.revlite.core;

/**
 * Pure reconciliation function for two revisions of the same address.
 * <p>
 * Implementations must be:
 *  - total over nulls (null means "no revision known"),
 *  - side-effect free,
 *  - return one of their arguments by reference, so callers can detect
 *    "winner unchanged" with an identity check.
 * <p>
 * The same merger is applied to durable-cache pulls, remote fetches and live
 * pushes; storage layers use it as well, which keeps log replay idempotent.
 */
@FunctionalInterface
public interface RevisionMerger {

    /**
     * @param existing revision currently held (may be null)
     * @param incoming revision being merged in (may be null)
     * @return the winner, or null when both are null
     */
    Revision merge(Revision existing, Revision incoming);
}
