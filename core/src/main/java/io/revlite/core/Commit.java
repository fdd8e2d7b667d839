// file: core/src/main/java/io/revlite/core/Commit.java
package io.revlite.core;

import java.util.Map;

/**
 * Remote verdict on a successful transaction.
 *
 * @param since    sequence number assigned to every accepted write
 * @param head     new commit-log head revision (null if the remote did not send it)
 * @param rejected per-address rejections when the remote accepted only part of
 *                 the batch; empty for an all-or-nothing success
 */
public record Commit(long since, Revision head, Map<Address, ReplicaError> rejected) {

    public Commit {
        rejected = rejected == null ? Map.of() : Map.copyOf(rejected);
    }

    /** Commit for a push that had nothing to send. */
    public static Commit empty() {
        return new Commit(Revision.UNCONFIRMED, null, Map.of());
    }

    public boolean accepted(Address address) {
        return !rejected.containsKey(address);
    }
}
