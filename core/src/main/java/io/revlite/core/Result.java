// file: core/src/main/java/io/revlite/core/Result.java
package io.revlite.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a replica operation: either a value or a typed {@link ReplicaError}.
 */
public sealed interface Result<T> permits Result.Ok, Result.Failure {

    record Ok<T>(T value) implements Result<T> {}

    record Failure<T>(ReplicaError error) implements Result<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    /** Successful result with no payload. */
    static Result<Void> done() {
        return new Ok<>(null);
    }

    static <T> Result<T> failure(ReplicaError error) {
        return new Failure<>(error);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /** The value of a successful result. */
    default T value() {
        throw new IllegalStateException("no value on failed result: " + error());
    }

    /** The error of a failed result, null on success. */
    default ReplicaError error() {
        return null;
    }

    default <U> Result<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(f.apply(ok.value()));
        }
        return new Failure<>(error());
    }
}
