// file: core/src/main/java/io/revlite/core/RevisionBuilder.java
package io.revlite.core;

import java.util.Optional;

/**
 * Builds the revision to stage for an intent, given the current revision at
 * its address. Pure: no I/O, no shared state.
 * <p>
 * Rules:
 *  - Retract over an absent value is a no-op (empty result, nothing is sent).
 *  - Retract otherwise names the current revision as its cause.
 *  - Assert names the current revision as its cause when the address was ever
 *    claimed; on an unclaimed address it names the unclaimed fact instead, so
 *    every asserted value carries a predecessor.
 * <p>
 * Built revisions are provisional: their {@code since} is {@link Revision#UNCONFIRMED}
 * until the commit assigns one.
 */
public final class RevisionBuilder {

    private RevisionBuilder() {
        // utility
    }

    /**
     * @param current current revision at the intent's address (null if unknown)
     * @param intent  desired change
     */
    public static Optional<Revision> build(Revision current, Intent intent) {
        Address address = intent.address();
        if (current != null && !current.address().equals(address)) {
            throw new IllegalArgumentException(
                    "current revision " + current.address() + " does not match " + address);
        }

        if (intent instanceof Intent.Retract) {
            if (current == null || !current.hasValue()) {
                return Optional.empty();
            }
            return Optional.of(Revision.retracted(address, current.hash(), Revision.UNCONFIRMED));
        }

        Intent.Assert assertion = (Intent.Assert) intent;
        return Optional.of(Revision.asserted(
                address, assertion.value(), causeOf(address, current), Revision.UNCONFIRMED));
    }

    /** Hash the next revision at {@code address} must name as its cause. */
    public static ContentHash causeOf(Address address, Revision current) {
        if (current == null || current.state() == RevisionState.UNCLAIMED) {
            return Revision.unclaimed(address).hash();
        }
        return current.hash();
    }
}
