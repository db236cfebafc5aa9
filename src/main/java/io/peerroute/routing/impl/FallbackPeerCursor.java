package io.peerroute.routing.impl;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.error.BackendFailureException;
import io.peerroute.routing.error.QueryTimeoutException;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.QueryOptions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Closest-peers stream over several backends: the first backend that yields a record is streamed to
 * the end, backends that fail or yield nothing before that are skipped.
 * <p>
 * Outcome once every backend was skipped: an empty stream if at least one of them ended cleanly,
 * a {@link BackendFailureException} carrying the last error if all of them failed.
 * The timeout clock starts at the first pull.
 */
@Slf4j
final class FallbackPeerCursor implements PeerCursor {

    private final List<PeerRouter> routers;
    private final byte[] key;
    private final QueryOptions options;
    private final ScheduledExecutorService scheduler;

    /* all guarded by this */
    private int index = -1;
    private PeerCursor active;
    private boolean started;
    private boolean produced;
    private boolean sawEmpty;
    private Throwable lastError;
    private boolean exhausted;
    private Throwable terminal;
    private CompletableFuture<Optional<PeerRecord>> pending;
    private ScheduledFuture<?> timer;

    FallbackPeerCursor(final List<PeerRouter> routers,
                       final byte[] key,
                       final QueryOptions options,
                       final ScheduledExecutorService scheduler) {
        this.routers = routers;
        this.key = key;
        this.options = options;
        this.scheduler = scheduler;
    }

    @Override
    public CompletableFuture<Optional<PeerRecord>> next() {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        synchronized (this) {
            if (terminal != null) return CompletableFuture.failedFuture(terminal);
            if (exhausted) return CompletableFuture.completedFuture(Optional.empty());
            if (pending != null) {
                return CompletableFuture.failedFuture(new IllegalStateException("A pull is already outstanding"));
            }
            waiter = new CompletableFuture<>();
            pending = waiter;
            if (!started) {
                started = true;
                options.timeoutIfSet().ifPresent(this::armTimeout);
            }
        }
        pull();
        return waiter;
    }

    @Override
    public void close() {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        final PeerCursor cursor;
        final CancellationException closed = new CancellationException("Cursor closed");
        synchronized (this) {
            if (terminal instanceof CancellationException) return;
            terminal = closed;
            waiter = pending;
            pending = null;
            cursor = active;
            active = null;
            cancelTimer();
        }
        if (cursor != null) cursor.close();
        if (waiter != null) waiter.completeExceptionally(closed);
    }

    private void armTimeout(final Duration timeout) {
        timer = scheduler.schedule(() -> expire(timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void expire(final Duration timeout) {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        final PeerCursor cursor;
        final QueryTimeoutException timedOut = new QueryTimeoutException(timeout);
        synchronized (this) {
            if (terminal != null || exhausted) return;
            terminal = timedOut;
            waiter = pending;
            pending = null;
            cursor = active;
            active = null;
            timer = null;
        }
        log.debug("Closest-peers query timed out after {} ms", timeout.toMillis());
        if (cursor != null) cursor.close();
        if (waiter != null) waiter.completeExceptionally(timedOut);
    }

    /* Moves the outstanding pull forward: opens the next backend if needed, then pulls from it. */
    private void pull() {
        while (true) {
            PeerCursor cursor;
            PeerRouter router = null;
            CompletableFuture<Optional<PeerRecord>> settled = null;
            Throwable settledFailure = null;
            synchronized (this) {
                if (pending == null) return;
                cursor = active;
                if (cursor == null) {
                    if (index + 1 < routers.size()) {
                        index++;
                        router = routers.get(index);
                    } else {
                        settled = pending;
                        pending = null;
                        cancelTimer();
                        if (sawEmpty || lastError == null) {
                            exhausted = true;
                        } else {
                            terminal = new BackendFailureException(lastError);
                            settledFailure = terminal;
                        }
                    }
                }
            }

            if (settled != null) {
                if (settledFailure != null) {
                    settled.completeExceptionally(settledFailure);
                } else {
                    settled.complete(Optional.empty());
                }
                return;
            }

            if (cursor == null) {
                final PeerRouter opening = router;
                try {
                    cursor = Objects.requireNonNull(opening.getClosestPeers(key, options),
                            () -> opening + " returned no cursor");
                } catch (final RuntimeException e) {
                    synchronized (this) {
                        lastError = e;
                    }
                    log.debug("Peer router {} rejected closest-peers query: {}", opening, e.toString());
                    continue;
                }
                synchronized (this) {
                    if (pending == null) {
                        // closed or timed out while opening
                        cursor.close();
                        return;
                    }
                    active = cursor;
                }
            }

            CompletableFuture<Optional<PeerRecord>> step;
            try {
                step = cursor.next();
            } catch (final RuntimeException e) {
                step = CompletableFuture.failedFuture(e);
            }
            final PeerCursor source = cursor;
            step.whenComplete((record, err) -> onStep(source, record, err));
            return;
        }
    }

    private void onStep(final PeerCursor source, final Optional<PeerRecord> record, final Throwable err) {
        final CompletableFuture<Optional<PeerRecord>> waiter;
        final Optional<PeerRecord> value;
        final Throwable failure;
        synchronized (this) {
            if (source != active || pending == null) return;

            if (err != null) {
                final Throwable cause = PeerCursors.unwrap(err);
                if (!produced) {
                    active = null;
                    lastError = cause;
                    log.debug("Peer router {} failed closest-peers query: {}", routers.get(index), cause.toString());
                    value = null;
                    failure = null;
                    waiter = null;
                } else {
                    active = null;
                    terminal = new BackendFailureException(cause);
                    cancelTimer();
                    value = null;
                    failure = terminal;
                    waiter = pending;
                    pending = null;
                }
            } else if (record != null && record.isPresent()) {
                produced = true;
                value = record;
                failure = null;
                waiter = pending;
                pending = null;
            } else if (!produced) {
                active = null;
                sawEmpty = true;
                log.debug("Peer router {} has no closest peers, trying next", routers.get(index));
                value = null;
                failure = null;
                waiter = null;
            } else {
                active = null;
                exhausted = true;
                cancelTimer();
                value = Optional.empty();
                failure = null;
                waiter = pending;
                pending = null;
            }
        }

        if (waiter == null) {
            // skipped this backend
            source.close();
            pull();
            return;
        }
        if (value != null && value.isEmpty()) source.close();
        if (failure != null) {
            source.close();
            waiter.completeExceptionally(failure);
        } else {
            waiter.complete(value);
        }
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
