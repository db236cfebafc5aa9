package io.peerroute.refresh;

import io.peerroute.addressbook.AddressBook;
import io.peerroute.config.impl.RefreshConfig;
import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.QueryOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background job that keeps the routing table warm:
 * after {@code bootDelay}, and then {@code interval} after each lookup finishes, it asks the
 * routing table for the peers closest to this node and records their addresses in the address book.
 * <p>
 * At most one lookup is in flight. Lookup failures are logged and the schedule carries on.
 * {@link #stop()} cancels the pending timer and closes an in-flight lookup; records that still
 * arrive afterwards are dropped.
 */
@Slf4j
public final class PeerRoutingRefreshManager implements AutoCloseable {

    private final PeerId selfId;
    private final PeerRouter routingTable;
    private final AddressBook addressBook;
    private final RefreshConfig config;

    private final AtomicLong completedRefreshes = new AtomicLong();

    /* guarded by this */
    private volatile RefreshState state = RefreshState.IDLE;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> timer;
    private PeerCursor inFlight;

    public PeerRoutingRefreshManager(final PeerId selfId,
                                     final PeerRouter routingTable,
                                     final AddressBook addressBook,
                                     final RefreshConfig config) {
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
        this.addressBook = Objects.requireNonNull(addressBook, "addressBook");
        this.config = Objects.requireNonNull(config, "config");
    }

    public RefreshState state() {
        return state;
    }

    /** Number of lookups that have settled, successfully or not. */
    public long refreshCount() {
        return completedRefreshes.get();
    }

    /**
     * Arms the boot delay timer, or does nothing further when disabled.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (state != RefreshState.IDLE) {
            throw new IllegalStateException("Refresh manager already started (state " + state + ")");
        }
        if (!config.enabled()) {
            state = RefreshState.STOPPED;
            log.info("Peer routing refresh disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "peer-routing-refresh");
            t.setDaemon(true);
            return t;
        });
        state = RefreshState.SCHEDULED;
        timer = scheduler.schedule(this::refresh, config.bootDelay().toMillis(), TimeUnit.MILLISECONDS);

        log.info("Peer routing refresh scheduled: first run in {} ms, then every {} ms",
                config.bootDelay().toMillis(), config.interval().toMillis());
    }

    /** Safe from any state and idempotent. */
    public void stop() {
        final PeerCursor cursor;
        synchronized (this) {
            if (state == RefreshState.STOPPED) return;
            final boolean wasStarted = state != RefreshState.IDLE;
            state = RefreshState.STOPPED;

            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            cursor = inFlight;
            inFlight = null;
            if (scheduler != null) scheduler.shutdownNow();

            if (!wasStarted) return;
        }
        if (cursor != null) cursor.close();
        log.info("Peer routing refresh stopped after {} runs", completedRefreshes.get());
    }

    @Override
    public void close() {
        stop();
    }

    private void refresh() {
        synchronized (this) {
            if (state != RefreshState.SCHEDULED && state != RefreshState.WAITING) return;
            state = RefreshState.RUNNING;
            timer = null;
        }

        final QueryOptions options = config.timeout() == null
                ? QueryOptions.none()
                : QueryOptions.withTimeout(config.timeout());

        final PeerCursor cursor;
        try {
            cursor = routingTable.getClosestPeers(selfId.bytes(), options);
        } catch (final RuntimeException e) {
            log.warn("Peer routing refresh could not start a lookup: {}", e.toString());
            settle(null);
            return;
        }

        synchronized (this) {
            if (state != RefreshState.RUNNING) {
                cursor.close();
                return;
            }
            inFlight = cursor;
        }

        CompletableFuture<Void> lookup = PeerCursors.forEach(cursor, this::record);
        if (config.timeout() != null) {
            lookup = lookup.orTimeout(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        lookup.whenComplete((v, err) -> {
            if (err != null && state == RefreshState.RUNNING) {
                final Throwable cause = PeerCursors.unwrap(err);
                log.warn("Peer routing refresh failed: {}", cause.toString());
                log.debug("Peer routing refresh failure", cause);
            }
            // orTimeout fails the future without reaching the cursor
            cursor.close();
            settle(cursor);
        });
    }

    private void record(final PeerRecord record) {
        if (state != RefreshState.RUNNING) return;
        addressBook.add(record.id(), record.addresses());
    }

    private void settle(final PeerCursor cursor) {
        synchronized (this) {
            if (inFlight == cursor) inFlight = null;
            if (state != RefreshState.RUNNING) return;

            completedRefreshes.incrementAndGet();
            state = RefreshState.WAITING;
            timer = scheduler.schedule(this::refresh, config.interval().toMillis(), TimeUnit.MILLISECONDS);
        }
        log.debug("Peer routing refresh run {} done, next in {} ms",
                completedRefreshes.get(), config.interval().toMillis());
    }
}
