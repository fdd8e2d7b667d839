// file: core/src/main/java/io/revlite/core/ReplicaError.java
package io.revlite.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Failures surfaced by replica operations, returned inside {@link Result}
 * rather than thrown so callers can branch on the kind.
 * <p>
 * Taxonomy:
 *  - ConnectionError:    transport unavailable; the session retries by reconnecting.
 *  - QueryError:         malformed or unauthorized read; not retried.
 *  - ConflictError:      a write was built on a stale cause; caller must reload and rebuild.
 *  - TransactionError:   write rejected by policy; not retried.
 *  - AuthorizationError: caller not allowed; not retried.
 *  - StoreError:         durable cache failure; callers downgrade it to a cache miss.
 */
public sealed interface ReplicaError {

    /** Stable kind name, as carried on the wire. */
    String name();

    String message();

    record ConnectionError(String address, String message) implements ReplicaError {
        public ConnectionError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name() {
            return "ConnectionError";
        }
    }

    record QueryError(String message, JsonNode selector) implements ReplicaError {
        public QueryError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name() {
            return "QueryError";
        }
    }

    /**
     * @param addresses addresses whose causal assumption the remote rejected
     *                  (empty when the remote did not say)
     */
    record ConflictError(String message, List<Address> addresses) implements ReplicaError {
        public ConflictError {
            Objects.requireNonNull(message, "message");
            addresses = addresses == null ? List.of() : List.copyOf(addresses);
        }

        @Override
        public String name() {
            return "ConflictError";
        }
    }

    record TransactionError(String message) implements ReplicaError {
        public TransactionError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name() {
            return "TransactionError";
        }
    }

    record AuthorizationError(String message) implements ReplicaError {
        public AuthorizationError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name() {
            return "AuthorizationError";
        }
    }

    record StoreError(String message, Throwable cause) implements ReplicaError {
        public StoreError {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String name() {
            return "StoreError";
        }
    }
}
