package io.peerroute.config.impl;

import io.peerroute.config.type.ConfigLoader;
import io.peerroute.core.model.NetworkAddress;
import io.peerroute.core.model.PeerId;
import io.peerroute.core.model.PeerRecord;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable node settings loaded from node.yaml
 */
@Getter
public final class NodeConfig {

    private PeerId peerId;
    private RefreshConfig refresh = RefreshConfig.defaults();

    /* local peer table backend */
    private boolean dhtEnabled = true;
    private int dhtK = 20;
    private List<PeerRecord> dhtPeers = List.of();

    /* remote backends, in priority order after the local table */
    private List<DelegateConfig> delegates = List.of();

    private NodeConfig() {
    }

    public static NodeConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Object root = new Yaml().load(in);
            return fromMap(root, path);
        }
    }

    public static NodeConfig parse(final String yamlText) throws IOException {
        try (Reader in = new StringReader(yamlText)) {
            final Object root = new Yaml().load(in);
            return fromMap(root, "<inline>");
        }
    }

    @SuppressWarnings("unchecked")
    private static NodeConfig fromMap(final Object root, final String source) throws IOException {
        if (!(root instanceof Map)) {
            throw new IOException("Node config " + source + " is not a YAML mapping");
        }
        final Map<String, Object> m = (Map<String, Object>) root;

        try {
            final NodeConfig cfg = new NodeConfig();

            final Object peerId = m.get("peerId");
            if (peerId == null) {
                throw new IllegalArgumentException("peerId is required");
            }
            cfg.peerId = PeerId.fromBase58(peerId.toString());

            final Map<String, Object> peerRouting = (Map<String, Object>) m.getOrDefault("peerRouting", Map.of());
            final Map<String, Object> rm = (Map<String, Object>) peerRouting.getOrDefault("refreshManager", Map.of());
            cfg.refresh = new RefreshConfig(
                    (Boolean) rm.getOrDefault("enabled", Boolean.TRUE),
                    ConfigLoader.parseDuration(rm.get("bootDelay"), RefreshConfig.DEFAULT_BOOT_DELAY),
                    ConfigLoader.parseDuration(rm.get("interval"), RefreshConfig.DEFAULT_INTERVAL),
                    ConfigLoader.parseDuration(rm.get("timeout"), null));

            final Map<String, Object> dht = (Map<String, Object>) m.getOrDefault("dht", Map.of());
            cfg.dhtEnabled = (Boolean) dht.getOrDefault("enabled", Boolean.TRUE);
            cfg.dhtK = (Integer) dht.getOrDefault("k", 20);
            final List<Map<String, Object>> peers = (List<Map<String, Object>>) dht.getOrDefault("peers", List.of());
            final List<PeerRecord> records = new ArrayList<>();
            for (final Map<String, Object> p : peers) {
                final List<String> addrs = (List<String>) p.getOrDefault("addrs", List.of());
                records.add(new PeerRecord(
                        PeerId.fromBase58((String) p.get("id")),
                        addrs.stream().map(NetworkAddress::parse).toList()));
            }
            cfg.dhtPeers = List.copyOf(records);

            final List<Map<String, Object>> delegates = (List<Map<String, Object>>) m.getOrDefault("delegates", List.of());
            cfg.delegates = delegates.stream()
                    .map(d -> new DelegateConfig(
                            (String) d.get("protocol"),
                            (String) d.get("host"),
                            (Integer) d.get("port")))
                    .toList();

            return cfg;
        } catch (final ClassCastException | IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid node config " + source + ": " + e.getMessage(), e);
        }
    }

    public static Builder builder(final PeerId peerId) {
        return new Builder(peerId);
    }

    /** Programmatic construction, mainly for embedding and tests. */
    public static final class Builder {
        private final NodeConfig cfg = new NodeConfig();

        private Builder(final PeerId peerId) {
            cfg.peerId = peerId;
        }

        public Builder refresh(final RefreshConfig refresh) {
            cfg.refresh = refresh;
            return this;
        }

        public Builder dht(final boolean enabled, final int k, final List<PeerRecord> peers) {
            cfg.dhtEnabled = enabled;
            cfg.dhtK = k;
            cfg.dhtPeers = List.copyOf(peers);
            return this;
        }

        public Builder delegates(final List<DelegateConfig> delegates) {
            cfg.delegates = List.copyOf(delegates);
            return this;
        }

        public NodeConfig build() {
            return cfg;
        }
    }
}
