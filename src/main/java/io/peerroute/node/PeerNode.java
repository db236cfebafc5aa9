package io.peerroute.node;

import io.peerroute.addressbook.AddressBook;
import io.peerroute.addressbook.InMemoryAddressBook;
import io.peerroute.config.impl.DelegateConfig;
import io.peerroute.config.impl.NodeConfig;
import io.peerroute.config.impl.RefreshConfig;
import io.peerroute.core.model.PeerId;
import io.peerroute.refresh.PeerRoutingRefreshManager;
import io.peerroute.routing.delegate.DelegatedPeerRouter;
import io.peerroute.routing.impl.CompositePeerRouter;
import io.peerroute.routing.table.StaticPeerRouter;
import io.peerroute.routing.type.PeerRouter;
import io.peerroute.routing.type.PeerRouting;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns the peer routing pieces of a node: the backends, the composite router over them, the
 * address book and the refresh manager. Constructed once, {@link #start()}ed on node start,
 * {@link #close()}d on shutdown.
 */
@Slf4j
public final class PeerNode implements AutoCloseable {

    private final PeerId peerId;
    private final List<PeerRouter> routers;
    private final CompositePeerRouter peerRouting;
    private final AddressBook addressBook;
    private final PeerRoutingRefreshManager refreshManager;

    private boolean started;
    private boolean closed;

    /**
     * @param routingTable backend the refresh manager primes; {@code null} disables refresh
     * @param routers      every backend, in priority order, usually including {@code routingTable}
     */
    public PeerNode(final PeerId peerId,
                    final PeerRouter routingTable,
                    final List<? extends PeerRouter> routers,
                    final AddressBook addressBook,
                    final RefreshConfig refreshConfig) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        this.routers = List.copyOf(routers);
        this.addressBook = Objects.requireNonNull(addressBook, "addressBook");
        this.peerRouting = new CompositePeerRouter(peerId, this.routers);

        if (routingTable == null) {
            if (refreshConfig.enabled()) {
                log.warn("No routing table backend configured; peer routing refresh disabled");
            }
            this.refreshManager = new PeerRoutingRefreshManager(peerId, NO_TABLE, addressBook, RefreshConfig.disabled());
        } else {
            this.refreshManager = new PeerRoutingRefreshManager(peerId, routingTable, addressBook, refreshConfig);
        }
    }

    /** Builds the local peer table (if enabled) followed by the configured delegates. */
    public static PeerNode create(final NodeConfig cfg) {
        final List<PeerRouter> routers = new ArrayList<>();
        StaticPeerRouter table = null;
        if (cfg.isDhtEnabled()) {
            table = new StaticPeerRouter(cfg.getDhtK(), cfg.getDhtPeers());
            routers.add(table);
        }
        for (final DelegateConfig delegate : cfg.getDelegates()) {
            routers.add(new DelegatedPeerRouter(delegate));
        }
        return new PeerNode(cfg.getPeerId(), table, routers, new InMemoryAddressBook(), cfg.getRefresh());
    }

    public synchronized void start() {
        if (closed) throw new IllegalStateException("PeerNode is closed");
        if (started) return;
        started = true;
        refreshManager.start();
        log.info("PeerNode {} started with {} peer router(s)", peerId, routers.size());
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;

        refreshManager.stop();
        peerRouting.close();
        for (final PeerRouter router : routers) {
            try {
                router.close();
            } catch (final RuntimeException e) {
                log.warn("Failed to close peer router {}", router, e);
            }
        }
        log.info("PeerNode {} stopped", peerId);
    }

    public PeerId peerId() {
        return peerId;
    }

    public PeerRouting peerRouting() {
        return peerRouting;
    }

    public AddressBook addressBook() {
        return addressBook;
    }

    public PeerRoutingRefreshManager refreshManager() {
        return refreshManager;
    }

    /* Placeholder target for a refresh manager that is never enabled. */
    private static final PeerRouter NO_TABLE = new StaticPeerRouter(List.of());
}
