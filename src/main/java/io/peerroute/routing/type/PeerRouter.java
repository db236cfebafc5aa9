package io.peerroute.routing.type;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A pluggable peer discovery backend: a local routing table, a remote delegate, etc.
 * <p>
 * Cancelling the future returned by {@link #findPeer} or closing the cursor returned by
 * {@link #getClosestPeers} is the cancellation signal; backends able to abort their I/O should do so.
 */
public interface PeerRouter extends AutoCloseable {

    /**
     * Resolves a peer to its known addresses.
     *
     * @return the record, {@link Optional#empty()} if the backend has no answer, or a failed future
     */
    CompletableFuture<Optional<PeerRecord>> findPeer(PeerId id, QueryOptions options);

    /**
     * Peers this backend judges closest to {@code key}, closest first. Must not start any work before
     * the first pull.
     */
    PeerCursor getClosestPeers(byte[] key, QueryOptions options);

    @Override
    default void close() {
        // no-op
    }
}
