package io.peerroute.refresh;

/**
 * Lifecycle of {@link PeerRoutingRefreshManager}.
 */
public enum RefreshState {
    /** Constructed, not started. */
    IDLE,
    /** Boot delay timer armed. */
    SCHEDULED,
    /** Self-lookup in flight. */
    RUNNING,
    /** Interval timer armed. */
    WAITING,
    /** Stopped or disabled; terminal. */
    STOPPED
}
