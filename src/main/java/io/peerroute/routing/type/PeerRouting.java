package io.peerroute.routing.type;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;

import java.util.concurrent.CompletableFuture;

/**
 * Node-facing peer routing API.
 */
public interface PeerRouting {

    /**
     * Locates a peer's addresses.
     *
     * @return a future failing with a {@link io.peerroute.routing.error.PeerRoutingException} when
     *         no backend can answer
     */
    CompletableFuture<PeerRecord> findPeer(PeerId id, QueryOptions options);

    default CompletableFuture<PeerRecord> findPeer(final PeerId id) {
        return findPeer(id, QueryOptions.none());
    }

    /** Lazy sequence of the peers closest to {@code key}. */
    PeerCursor getClosestPeers(byte[] key, QueryOptions options);

    default PeerCursor getClosestPeers(final byte[] key) {
        return getClosestPeers(key, QueryOptions.none());
    }
}
