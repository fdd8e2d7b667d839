// file: core/src/main/java/io/revlite/core/RevisionState.java
package io.revlite.core;

/**
 * Lifecycle of the revision stored at an address.
 * <p>
 * Transitions:
 *  - UNCLAIMED: nothing was ever asserted (no value, no cause).
 *  - ASSERTED:  a value is present; the revision names the one it superseded.
 *  - RETRACTED: the value was removed; the revision still names its cause.
 * <p>
 * UNCLAIMED -> ASSERTED -> RETRACTED -> ASSERTED ... ; never back to UNCLAIMED.
 */
public enum RevisionState {
    UNCLAIMED, ASSERTED, RETRACTED;

    /** True when a reader would see a value at the address. */
    public boolean hasValue() {
        return this == ASSERTED;
    }
}
