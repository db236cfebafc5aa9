package io.peerroute.routing.table;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.QueryOptions;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory peer table answering from what it has been told, typically the configured bootstrap peers.
 * Closest peers are ranked by the XOR of SHA-256(key) and SHA-256(peer id), over the whole table.
 */
public final class StaticPeerRouter implements PeerRouter {

    public static final int DEFAULT_K = 20;

    private final ConcurrentMap<PeerId, PeerRecord> peers = new ConcurrentHashMap<>();
    private final int k;

    public StaticPeerRouter(final int k, final Collection<PeerRecord> initial) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive: " + k);
        this.k = k;
        initial.forEach(this::put);
    }

    public StaticPeerRouter(final Collection<PeerRecord> initial) {
        this(DEFAULT_K, initial);
    }

    public void put(final PeerRecord record) {
        peers.put(record.id(), record);
    }

    public void remove(final PeerId id) {
        peers.remove(id);
    }

    public int size() {
        return peers.size();
    }

    @Override
    public CompletableFuture<Optional<PeerRecord>> findPeer(final PeerId id, final QueryOptions options) {
        return CompletableFuture.completedFuture(Optional.ofNullable(peers.get(id)));
    }

    @Override
    public PeerCursor getClosestPeers(final byte[] key, final QueryOptions options) {
        final byte[] target = sha256(key);
        return PeerCursors.deferred(() -> {
            final List<PeerRecord> closest = peers.values().stream()
                    .map(r -> new Ranked(r, xor(target, sha256(r.id().bytes()))))
                    .sorted(Comparator.comparing(Ranked::distance, Arrays::compareUnsigned))
                    .limit(k)
                    .map(Ranked::record)
                    .toList();
            return PeerCursors.of(closest);
        });
    }

    @Override
    public String toString() {
        return "StaticPeerRouter{peers=" + peers.size() + ", k=" + k + "}";
    }

    private record Ranked(PeerRecord record, byte[] distance) {
    }

    private static byte[] xor(final byte[] a, final byte[] b) {
        final byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }

    private static byte[] sha256(final byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
