package io.peerroute.routing.error;

import io.peerroute.core.model.PeerId;

public final class PeerNotFoundException extends PeerRoutingException {
    public PeerNotFoundException(final PeerId id) {
        super(ErrorCode.ERR_NOT_FOUND, "Peer not found: " + id);
    }
}
