package io.peerroute.routing.error;

/**
 * Machine-readable failure kinds of the peer routing API.
 */
public enum ErrorCode {
    /** No backend is configured. */
    NO_ROUTERS_AVAILABLE,
    /** Every backend was consulted and none had the peer. */
    ERR_NOT_FOUND,
    /** The last consulted backend failed; the cause carries its error. */
    BACKEND_FAILURE,
    /** The caller's timeout elapsed first. */
    ERR_TIMEOUT,
    /** The node asked for its own id. */
    ERR_FIND_SELF
}
