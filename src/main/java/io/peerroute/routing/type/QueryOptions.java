package io.peerroute.routing.type;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-call routing options.
 *
 * @param timeout bound on the whole call, or {@code null} for none
 */
public record QueryOptions(Duration timeout) {

    private static final QueryOptions NONE = new QueryOptions(null);

    public QueryOptions {
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static QueryOptions none() {
        return NONE;
    }

    public static QueryOptions withTimeout(final Duration timeout) {
        return new QueryOptions(timeout);
    }

    public Optional<Duration> timeoutIfSet() {
        return Optional.ofNullable(timeout);
    }
}
