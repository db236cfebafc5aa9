package io.peerroute.routing.error;

import io.peerroute.core.model.PeerId;

public final class FindSelfException extends PeerRoutingException {
    public FindSelfException(final PeerId self) {
        super(ErrorCode.ERR_FIND_SELF, "Should not try to find self (" + self + ")");
    }
}
