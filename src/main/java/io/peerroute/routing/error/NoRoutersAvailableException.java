package io.peerroute.routing.error;

public final class NoRoutersAvailableException extends PeerRoutingException {
    public NoRoutersAvailableException() {
        super(ErrorCode.NO_ROUTERS_AVAILABLE, "No peer routers available");
    }
}
