// file: core/src/main/java/io/revlite/core/LatestRevisionMerger.java
package io.revlite.core;

/**
 * Default merger: highest server sequence number wins.
 * <p>
 * Algorithm:
 *  - if either side is absent, the other wins;
 *  - otherwise the revision with the strictly greater {@code since} wins;
 *  - ties keep {@code existing}, so re-merging the same server push never oscillates.
 * <p>
 * Notes:
 *  - Looks at sequence numbers only, never at values.
 *  - Order-insensitive: merging a set of revisions in any order yields the one
 *    with the greatest {@code since} (first seen among equals).
 */
public final class LatestRevisionMerger implements RevisionMerger {

    @Override
    public Revision merge(Revision existing, Revision incoming) {
        if (incoming == null) return existing;
        if (existing == null) return incoming;
        return existing.since() < incoming.since() ? incoming : existing;
    }
}
