// file: core/src/main/java/io/revlite/core/Address.java
package io.revlite.core;

import java.util.Objects;

/**
 * One attribute slot of one entity: {@code the} (attribute / media type) of {@code of} (entity).
 * <p>
 * Addresses are never deleted; only the revision stored at them changes.
 * Map lookups go through {@link #key()}, which is stable across processes.
 */
public record Address(String the, String of) {

    public Address {
        Objects.requireNonNull(the, "the");
        Objects.requireNonNull(of, "of");
        if (the.isBlank()) throw new IllegalArgumentException("the must not be blank");
        if (of.isBlank()) throw new IllegalArgumentException("of must not be blank");
        if (of.indexOf('/') >= 0) throw new IllegalArgumentException("entity must not contain '/': " + of);
    }

    /** Stable lookup key in the form {@code of/the}. */
    public String key() {
        return of + "/" + the;
    }

    /**
     * Inverse of {@link #key()}. The entity part never contains a slash, so the
     * first slash separates it from the attribute (which may contain slashes).
     */
    public static Address fromKey(String key) {
        Objects.requireNonNull(key, "key");
        int slash = key.indexOf('/');
        if (slash <= 0 || slash == key.length() - 1) {
            throw new IllegalArgumentException("not an address key: " + key);
        }
        return new Address(key.substring(slash + 1), key.substring(0, slash));
    }

    @Override
    public String toString() {
        return key();
    }
}
