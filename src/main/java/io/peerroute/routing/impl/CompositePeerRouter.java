package io.peerroute.routing.impl;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.error.BackendFailureException;
import io.peerroute.routing.error.FindSelfException;
import io.peerroute.routing.error.NoRoutersAvailableException;
import io.peerroute.routing.error.PeerNotFoundException;
import io.peerroute.routing.error.QueryTimeoutException;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.PeerRouting;
import io.peerroute.routing.type.QueryOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fallback façade over an ordered list of {@link PeerRouter}s.
 * <p>
 * {@link #findPeer} asks the backends one after another and returns the first record found.
 * {@link #getClosestPeers} streams the first backend that yields anything, start to finish.
 * Per-backend failures are logged and swallowed; only exhaustion of every backend reaches the caller.
 */
@Slf4j
public final class CompositePeerRouter implements PeerRouting, AutoCloseable {

    private final PeerId selfId;
    private final List<PeerRouter> routers;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "peer-routing-timeout");
        t.setDaemon(true);
        return t;
    });

    /**
     * @param selfId  this node's id; lookups of it are rejected
     * @param routers backends in priority order; copied, never modified afterwards
     */
    public CompositePeerRouter(final PeerId selfId, final List<? extends PeerRouter> routers) {
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.routers = List.copyOf(routers);
    }

    public List<PeerRouter> routers() {
        return routers;
    }

    @Override
    public CompletableFuture<PeerRecord> findPeer(final PeerId id, final QueryOptions options) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(options, "options");

        if (routers.isEmpty()) {
            return CompletableFuture.failedFuture(new NoRoutersAvailableException());
        }
        if (id.equals(selfId)) {
            return CompletableFuture.failedFuture(new FindSelfException(selfId));
        }

        final FindPeerCall call = new FindPeerCall(id, options);
        call.start();
        return call.result;
    }

    @Override
    public PeerCursor getClosestPeers(final byte[] key, final QueryOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(options, "options");

        if (routers.isEmpty()) {
            return PeerCursors.failed(new NoRoutersAvailableException());
        }
        return new FallbackPeerCursor(routers, key.clone(), options, scheduler);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /**
     * One sequential walk over the backends. Results from a backend that settles after the call
     * has completed (timeout, caller cancellation) are dropped.
     */
    private final class FindPeerCall {
        private final PeerId target;
        private final QueryOptions options;
        private final CompletableFuture<PeerRecord> result = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<Optional<PeerRecord>>> inFlight = new AtomicReference<>();

        private FindPeerCall(final PeerId target, final QueryOptions options) {
            this.target = target;
            this.options = options;
        }

        void start() {
            options.timeoutIfSet().ifPresent(this::armTimeout);
            result.whenComplete((r, err) -> {
                final CompletableFuture<Optional<PeerRecord>> pending = inFlight.getAndSet(null);
                if (pending != null) pending.cancel(true);
            });
            attempt(0);
        }

        private void armTimeout(final Duration timeout) {
            final ScheduledFuture<?> timer = scheduler.schedule(() -> {
                if (result.completeExceptionally(new QueryTimeoutException(timeout))) {
                    log.debug("findPeer({}) timed out after {} ms", target, timeout.toMillis());
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            result.whenComplete((r, err) -> timer.cancel(false));
        }

        private void attempt(final int index) {
            if (result.isDone()) return;

            final PeerRouter router = routers.get(index);
            final CompletableFuture<Optional<PeerRecord>> pending;
            try {
                pending = Objects.requireNonNull(router.findPeer(target, options),
                        () -> router + " returned no future");
            } catch (final RuntimeException e) {
                failed(index, e);
                return;
            }

            inFlight.set(pending);
            if (result.isDone()) {
                // completed (timeout) while the backend was being invoked
                if (inFlight.compareAndSet(pending, null)) pending.cancel(true);
                return;
            }

            pending.whenComplete((found, err) -> {
                inFlight.compareAndSet(pending, null);
                if (result.isDone()) return;

                if (err != null) {
                    failed(index, PeerCursors.unwrap(err));
                } else if (found != null && found.isPresent()) {
                    result.complete(found.get());
                } else {
                    empty(index);
                }
            });
        }

        private void failed(final int index, final Throwable err) {
            log.debug("Peer router {} failed to find {}: {}", routers.get(index), target, err.toString());
            if (index + 1 < routers.size()) {
                attempt(index + 1);
            } else {
                result.completeExceptionally(new BackendFailureException(err));
            }
        }

        private void empty(final int index) {
            log.debug("Peer router {} has no record for {}", routers.get(index), target);
            if (index + 1 < routers.size()) {
                attempt(index + 1);
            } else {
                result.completeExceptionally(new PeerNotFoundException(target));
            }
        }
    }
}
