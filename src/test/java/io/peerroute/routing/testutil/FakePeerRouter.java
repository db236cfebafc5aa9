package io.peerroute.routing.testutil;

import io.peerroute.core.cursor.BufferedPeerCursor;
import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.QueryOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable in-process backend. Counts invocations and remembers the futures and cursors it handed
 * out so tests can check cancellation.
 */
public final class FakePeerRouter implements PeerRouter {

    private final String name;

    private Supplier<CompletableFuture<Optional<PeerRecord>>> findPeer =
            () -> CompletableFuture.completedFuture(Optional.empty());
    private Supplier<PeerCursor> closestPeers = PeerCursors::empty;

    public final AtomicInteger findPeerCalls = new AtomicInteger();
    public final AtomicInteger closestPeersCalls = new AtomicInteger();
    public final AtomicInteger closeCalls = new AtomicInteger();
    public final List<CompletableFuture<Optional<PeerRecord>>> issuedFutures = new CopyOnWriteArrayList<>();
    public final List<BufferedPeerCursor> issuedStreams = new CopyOnWriteArrayList<>();
    public final List<QueryOptions> seenOptions = new CopyOnWriteArrayList<>();
    /* System.nanoTime() of every getClosestPeers call */
    public final List<Long> closestPeersAt = new CopyOnWriteArrayList<>();
    public volatile byte[] lastKey;

    public FakePeerRouter(final String name) {
        this.name = name;
    }

    public FakePeerRouter findsPeer(final PeerRecord record) {
        findPeer = () -> CompletableFuture.completedFuture(Optional.of(record));
        return this;
    }

    public FakePeerRouter findsNothing() {
        findPeer = () -> CompletableFuture.completedFuture(Optional.empty());
        return this;
    }

    public FakePeerRouter failsFindPeer(final Throwable error) {
        findPeer = () -> CompletableFuture.failedFuture(error);
        return this;
    }

    public FakePeerRouter throwsOnFindPeer(final RuntimeException error) {
        findPeer = () -> {
            throw error;
        };
        return this;
    }

    /** findPeer never completes on its own. */
    public FakePeerRouter hangsFindPeer() {
        findPeer = CompletableFuture::new;
        return this;
    }

    public FakePeerRouter yields(final PeerRecord... records) {
        final List<PeerRecord> snapshot = List.of(records);
        closestPeers = () -> PeerCursors.of(snapshot);
        return this;
    }

    /** Yields {@code records}, then fails with {@code error}. */
    public FakePeerRouter yieldsThenFails(final Throwable error, final PeerRecord... records) {
        final List<PeerRecord> snapshot = List.of(records);
        closestPeers = () -> {
            final BufferedPeerCursor cursor = new BufferedPeerCursor(() -> { }, () -> { });
            snapshot.forEach(cursor::offer);
            cursor.fail(error);
            return cursor;
        };
        return this;
    }

    public FakePeerRouter failsClosestPeers(final Throwable error) {
        closestPeers = () -> {
            final BufferedPeerCursor cursor = new BufferedPeerCursor(() -> { }, () -> { });
            cursor.fail(error);
            return cursor;
        };
        return this;
    }

    public FakePeerRouter throwsOnClosestPeers(final RuntimeException error) {
        closestPeers = () -> {
            throw error;
        };
        return this;
    }

    /**
     * Hands out a cursor the test feeds by hand through {@link #issuedStreams}; it yields
     * {@code initial} immediately and then waits.
     */
    public FakePeerRouter streams(final PeerRecord... initial) {
        final List<PeerRecord> snapshot = List.of(initial);
        closestPeers = () -> {
            final BufferedPeerCursor cursor = new BufferedPeerCursor(() -> { }, () -> { });
            snapshot.forEach(cursor::offer);
            issuedStreams.add(cursor);
            return cursor;
        };
        return this;
    }

    @Override
    public CompletableFuture<Optional<PeerRecord>> findPeer(final PeerId id, final QueryOptions options) {
        findPeerCalls.incrementAndGet();
        seenOptions.add(options);
        final CompletableFuture<Optional<PeerRecord>> future = findPeer.get();
        issuedFutures.add(future);
        return future;
    }

    @Override
    public PeerCursor getClosestPeers(final byte[] key, final QueryOptions options) {
        closestPeersAt.add(System.nanoTime());
        lastKey = key.clone();
        closestPeersCalls.incrementAndGet();
        seenOptions.add(options);
        return closestPeers.get();
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }

    public static List<PeerRecord> peers(final int count) {
        final List<PeerRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(PeerRecord.of(PeerId.fromBytes(new byte[]{0x12, 0x20, 0x01, (byte) i})));
        }
        return out;
    }

    @Override
    public String toString() {
        return "FakePeerRouter{" + name + "}";
    }
}
