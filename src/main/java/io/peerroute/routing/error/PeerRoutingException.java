package io.peerroute.routing.error;

import lombok.Getter;

/**
 * Base of all caller-visible peer routing failures.
 */
@Getter
public class PeerRoutingException extends RuntimeException {

    private final ErrorCode code;

    public PeerRoutingException(final ErrorCode code, final String message) {
        super(message);
        this.code = code;
    }

    public PeerRoutingException(final ErrorCode code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
