package io.peerroute.routing.error;

/** Wraps the error of the last backend consulted. */
public final class BackendFailureException extends PeerRoutingException {
    public BackendFailureException(final Throwable cause) {
        super(ErrorCode.BACKEND_FAILURE, "Peer router failed: " + cause.getMessage(), cause);
    }
}
