// file: client/src/main/java/io/revlite/client/session/SessionSettings.java
package io.revlite.client.session;

import java.time.Duration;
import java.util.Objects;

/**
 * @param connectionTimeout watchdog for one connection attempt; also caps the reconnect backoff
 * @param initialBackoff    first reconnect delay, doubled per failed attempt
 */
public record SessionSettings(Duration connectionTimeout, Duration initialBackoff) {

    public SessionSettings {
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (connectionTimeout.isZero() || connectionTimeout.isNegative()) {
            throw new IllegalArgumentException("connectionTimeout must be > 0");
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(Duration.ofSeconds(30), Duration.ofMillis(100));
    }

    /** Delay before reconnect attempt {@code attempt} (0-based): min(initial * 2^attempt, timeout). */
    public long backoffMillis(int attempt) {
        long cap = connectionTimeout.toMillis();
        long base = initialBackoff.toMillis();
        if (attempt >= 62 || base << attempt >= cap || (base << attempt) >> attempt != base) {
            return cap;
        }
        return base << attempt;
    }
}
