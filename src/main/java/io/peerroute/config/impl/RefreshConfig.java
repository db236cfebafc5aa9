package io.peerroute.config.impl;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the routing table refresh manager ({@code peerRouting.refreshManager}).
 *
 * @param bootDelay wait between start and the first self-lookup; zero is allowed
 * @param interval  wait between the end of one self-lookup and the start of the next
 * @param timeout   bound on a single self-lookup, or {@code null} for none
 */
public record RefreshConfig(boolean enabled, Duration bootDelay, Duration interval, Duration timeout) {

    public static final Duration DEFAULT_BOOT_DELAY = Duration.ofSeconds(10);
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(10);

    public RefreshConfig {
        Objects.requireNonNull(bootDelay, "bootDelay");
        Objects.requireNonNull(interval, "interval");
        if (bootDelay.isNegative()) {
            throw new IllegalArgumentException("bootDelay must not be negative: " + bootDelay);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public RefreshConfig(final boolean enabled, final Duration bootDelay, final Duration interval) {
        this(enabled, bootDelay, interval, null);
    }

    public static RefreshConfig defaults() {
        return new RefreshConfig(true, DEFAULT_BOOT_DELAY, DEFAULT_INTERVAL, null);
    }

    public static RefreshConfig disabled() {
        return new RefreshConfig(false, DEFAULT_BOOT_DELAY, DEFAULT_INTERVAL, null);
    }
}
