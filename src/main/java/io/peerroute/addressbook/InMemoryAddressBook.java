package io.peerroute.addressbook;

import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Address book held in a {@link ConcurrentHashMap}. Each entry is an immutable snapshot replaced
 * atomically on write, so readers never see a half-merged set.
 */
public final class InMemoryAddressBook implements AddressBook {

    private final ConcurrentHashMap<PeerId, Set<NetworkAddress>> entries = new ConcurrentHashMap<>();

    @Override
    public void add(final PeerId id, final List<NetworkAddress> addresses) {
        if (addresses.isEmpty()) {
            entries.putIfAbsent(id, Set.of());
            return;
        }
        entries.compute(id, (k, existing) -> {
            final Set<NetworkAddress> merged = existing == null ? new LinkedHashSet<>() : new LinkedHashSet<>(existing);
            merged.addAll(addresses);
            return Collections.unmodifiableSet(merged);
        });
    }

    @Override
    public List<NetworkAddress> get(final PeerId id) {
        final Set<NetworkAddress> known = entries.get(id);
        return known == null ? List.of() : List.copyOf(known);
    }

    @Override
    public Set<PeerId> peers() {
        return Set.copyOf(entries.keySet());
    }
}
