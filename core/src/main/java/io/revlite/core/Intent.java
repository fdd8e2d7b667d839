// file: core/src/main/java/io/revlite/core/Intent.java
package io.revlite.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * What a writer wants an address to look like after its transaction.
 * Resolved into a concrete {@link Revision} by {@link RevisionBuilder}.
 */
public sealed interface Intent permits Intent.Assert, Intent.Retract {

    Address address();

    static Intent assertion(Address address, JsonNode value) {
        return new Assert(address, value);
    }

    static Intent retraction(Address address) {
        return new Retract(address);
    }

    /** Set the address to {@code value}. */
    record Assert(Address address, JsonNode value) implements Intent {
        public Assert {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(value, "value");
            if (value.isNull() || value.isMissingNode()) {
                throw new IllegalArgumentException("use a retraction to clear " + address);
            }
        }
    }

    /** Remove the value at the address. */
    record Retract(Address address) implements Intent {
        public Retract {
            Objects.requireNonNull(address, "address");
        }
    }
}
