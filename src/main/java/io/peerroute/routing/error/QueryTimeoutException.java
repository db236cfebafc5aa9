package io.peerroute.routing.error;

import java.time.Duration;

public final class QueryTimeoutException extends PeerRoutingException {
    public QueryTimeoutException(final Duration timeout) {
        super(ErrorCode.ERR_TIMEOUT, "Peer routing query timed out after " + timeout.toMillis() + " ms");
    }
}
