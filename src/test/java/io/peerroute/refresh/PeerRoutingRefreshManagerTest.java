package io.peerroute.refresh;

import io.peerroute.addressbook.AddressBook;
import io.peerroute.addressbook.InMemoryAddressBook;
import io.peerroute.config.impl.RefreshConfig;
import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.testutil.FakePeerRouter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class PeerRoutingRefreshManagerTest {

    private static final PeerId SELF = PeerId.fromBase58("12D3KooWLewYMMdGWAtuX852n4rgCWkK7EBn4CWbwwBzhsVoKxk3");

    private PeerRoutingRefreshManager manager;

    @AfterEach
    void tearDown() {
        if (manager != null) manager.stop();
    }

    private static RefreshConfig config(final long bootDelayMs, final long intervalMs) {
        return new RefreshConfig(true, Duration.ofMillis(bootDelayMs), Duration.ofMillis(intervalMs));
    }

    private static void waitUntil(final BooleanSupplier condition, final long timeoutMs) throws InterruptedException {
        final long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within " + timeoutMs + " ms");
    }

    /** Remembers the order of writes. */
    private static final class RecordingAddressBook implements AddressBook {
        final InMemoryAddressBook delegate = new InMemoryAddressBook();
        final List<PeerId> writes = new CopyOnWriteArrayList<>();

        @Override
        public void add(final PeerId id, final List<NetworkAddress> addresses) {
            writes.add(id);
            delegate.add(id, addresses);
        }

        @Override
        public List<NetworkAddress> get(final PeerId id) {
            return delegate.get(id);
        }

        @Override
        public Set<PeerId> peers() {
            return delegate.peers();
        }
    }

    @Test
    void runsAfterBootDelayThenAfterInterval() throws Exception {
        final List<PeerRecord> found = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            found.add(PeerRecord.of(PeerId.fromBytes(new byte[]{0x12, 0x20, 0x03, (byte) i}),
                    NetworkAddress.tcp("10.1.0." + (i + 1), 4001)));
        }
        final FakePeerRouter table = new FakePeerRouter("table").yields(found.toArray(PeerRecord[]::new));
        final RecordingAddressBook book = new RecordingAddressBook();

        manager = new PeerRoutingRefreshManager(SELF, table, book, config(100, 500));
        final long started = System.nanoTime();
        manager.start();
        assertEquals(RefreshState.SCHEDULED, manager.state());

        waitUntil(() -> table.closestPeersAt.size() == 1, 1_000);
        final long firstAt = (table.closestPeersAt.get(0) - started) / 1_000_000;
        assertTrue(firstAt >= 90, "first query after " + firstAt + " ms");

        waitUntil(() -> manager.refreshCount() == 1, 1_000);
        assertEquals(found.stream().map(PeerRecord::id).toList(), book.writes);
        assertEquals(RefreshState.WAITING, manager.state());

        Thread.sleep(200);
        assertEquals(1, table.closestPeersAt.size());

        waitUntil(() -> table.closestPeersAt.size() == 2, 1_500);
        final long gapMs = (table.closestPeersAt.get(1) - table.closestPeersAt.get(0)) / 1_000_000;
        assertTrue(gapMs >= 490, "second query " + gapMs + " ms after the first");

        assertTrue(table.lastKey != null && PeerId.fromBytes(table.lastKey).equals(SELF));
    }

    @Test
    void disabledManagerNeverQueries() throws Exception {
        final FakePeerRouter table = new FakePeerRouter("table");

        manager = new PeerRoutingRefreshManager(SELF, table, new InMemoryAddressBook(),
                new RefreshConfig(false, Duration.ofMillis(10), Duration.ofMillis(10)));
        manager.start();
        assertEquals(RefreshState.STOPPED, manager.state());

        Thread.sleep(200);
        assertTrue(table.closestPeersAt.isEmpty());
    }

    @Test
    void stopWhileWaitingPreventsFurtherQueries() throws Exception {
        final FakePeerRouter table = new FakePeerRouter("table");

        manager = new PeerRoutingRefreshManager(SELF, table, new InMemoryAddressBook(), config(0, 200));
        manager.start();

        waitUntil(() -> manager.state() == RefreshState.WAITING, 1_000);
        manager.stop();
        assertEquals(RefreshState.STOPPED, manager.state());

        Thread.sleep(400);
        assertEquals(1, table.closestPeersAt.size());
    }

    @Test
    void failedQueryIsSwallowedAndScheduleContinues() throws Exception {
        final FakePeerRouter table = new FakePeerRouter("table").failsClosestPeers(new IOException("down"));

        manager = new PeerRoutingRefreshManager(SELF, table, new InMemoryAddressBook(), config(0, 50));
        manager.start();

        waitUntil(() -> table.closestPeersAt.size() >= 3, 2_000);
        assertTrue(manager.refreshCount() >= 2);
    }

    @Test
    void stopClosesInFlightQueryAndDropsLateRecords() throws Exception {
        final FakePeerRouter inner = new FakePeerRouter("table").streams();
                final RecordingAddressBook book = new RecordingAddressBook();

        manager = new PeerRoutingRefreshManager(SELF, inner, book, config(0, 1_000));
        manager.start();

        waitUntil(() -> manager.state() == RefreshState.RUNNING && !inner.issuedStreams.isEmpty(), 1_000);
        manager.stop();

        waitUntil(() -> inner.issuedStreams.get(0).isClosed(), 1_000);
        inner.issuedStreams.get(0).offer(PeerRecord.of(PeerId.fromBytes(new byte[]{0x12, 0x20, 0x09})));
        assertTrue(book.writes.isEmpty());
        assertEquals(0, manager.refreshCount());
    }

    @Test
    void queryTimeoutEndsTheRun() throws Exception {
        final FakePeerRouter inner = new FakePeerRouter("table").streams();
        
        manager = new PeerRoutingRefreshManager(SELF, inner, new InMemoryAddressBook(),
                new RefreshConfig(true, Duration.ZERO, Duration.ofSeconds(10), Duration.ofMillis(100)));
        manager.start();

        waitUntil(() -> manager.refreshCount() == 1, 2_000);
        assertEquals(RefreshState.WAITING, manager.state());
        assertTrue(inner.issuedStreams.get(0).isClosed());
    }

    @Test
    void startTwiceIsRejectedAndStopIsIdempotent() {
        manager = new PeerRoutingRefreshManager(SELF, new FakePeerRouter("table"), new InMemoryAddressBook(),
                config(10_000, 10_000));

        manager.start();
        assertThrows(IllegalStateException.class, manager::start);

        manager.stop();
        manager.stop();
        assertEquals(RefreshState.STOPPED, manager.state());
        assertThrows(IllegalStateException.class, manager::start);
    }
}
