package io.peerroute.addressbook;

import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;

import java.util.List;
import java.util.Set;

/** Peer id to known addresses. Implementations must be safe for concurrent readers and writers. */
public interface AddressBook {

    /** Records {@code addresses} for {@code id}; repeated addresses are harmless. */
    void add(PeerId id, List<NetworkAddress> addresses);

    /** Known addresses in first-seen order, empty if the peer is unknown. */
    List<NetworkAddress> get(PeerId id);

    Set<PeerId> peers();
}
