package io.peerroute.routing.table;

import io.peerroute.core.cursor.PeerCursor;
import io.peerroute.core.cursor.PeerCursors;
import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import io.peerroute.routing.type.QueryOptions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class StaticPeerRouterTest {

    private static List<PeerRecord> peers(final int count) {
        final List<PeerRecord> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(PeerRecord.of(PeerId.fromBytes(new byte[]{0x12, 0x20, 0x02, (byte) i}),
                    NetworkAddress.tcp("10.0.0." + (i + 1), 4001)));
        }
        return out;
    }

    @Test
    void findPeerAnswersFromTable() {
        final List<PeerRecord> known = peers(3);
        final StaticPeerRouter router = new StaticPeerRouter(known);

        assertEquals(Optional.of(known.get(1)), router.findPeer(known.get(1).id(), QueryOptions.none()).join());
        assertEquals(Optional.empty(),
                router.findPeer(PeerId.fromBytes(new byte[]{0x12, 0x20, 0x7f}), QueryOptions.none()).join());
    }

    @Test
    void putAndRemoveChangeTheTable() {
        final StaticPeerRouter router = new StaticPeerRouter(List.of());
        final PeerRecord record = peers(1).get(0);

        router.put(record);
        assertEquals(1, router.size());

        router.remove(record.id());
        assertEquals(0, router.size());
        assertEquals(Optional.empty(), router.findPeer(record.id(), QueryOptions.none()).join());
    }

    @Test
    void closestPeersAreLimitedToKAndOrderedByDistance() {
        final List<PeerRecord> known = peers(30);
        final StaticPeerRouter router = new StaticPeerRouter(5, known);
        final byte[] key = "lookup".getBytes();

        final List<PeerRecord> closest = PeerCursors.collect(router.getClosestPeers(key, QueryOptions.none())).join();
        final List<PeerRecord> all = PeerCursors.collect(
                new StaticPeerRouter(100, known).getClosestPeers(key, QueryOptions.none())).join();

        assertEquals(5, closest.size());
        assertEquals(30, all.size());
        assertEquals(all.subList(0, 5), closest);
        assertEquals(new HashSet<>(known), new HashSet<>(all));
    }

    @Test
    void closestPeersSnapshotIsTakenAtFirstPull() {
        final StaticPeerRouter router = new StaticPeerRouter(List.of());
        final PeerCursor cursor = router.getClosestPeers(new byte[]{1}, QueryOptions.none());

        router.put(peers(1).get(0));

        assertTrue(cursor.next().join().isPresent());
    }

    @Test
    void rejectsNonPositiveK() {
        assertThrows(IllegalArgumentException.class, () -> new StaticPeerRouter(0, List.of()));
    }
}
