package io.peerroute.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A routing result: a peer and the addresses a backend knows for it, in the order received.
 */
public record PeerRecord(PeerId id, List<NetworkAddress> addresses) {

    public PeerRecord {
        Objects.requireNonNull(id, "id");
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static PeerRecord of(final PeerId id, final NetworkAddress... addresses) {
        return new PeerRecord(id, List.of(addresses));
    }
}
