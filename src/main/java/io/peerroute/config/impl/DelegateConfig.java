package io.peerroute.config.impl;

import java.util.Objects;

/**
 * Address of a remote delegate node exposing the DHT HTTP API.
 */
public record DelegateConfig(String protocol, String host, int port) {

    public DelegateConfig {
        protocol = protocol == null ? "http" : protocol.toLowerCase();
        Objects.requireNonNull(host, "host");
        if (!"http".equals(protocol)) {
            throw new IllegalArgumentException("Unsupported delegate protocol: " + protocol);
        }
        if (port <= 0 || port > 65_535) {
            throw new IllegalArgumentException("Delegate port out of range: " + port);
        }
    }

    public String baseUrl() {
        return protocol + "://" + host + ":" + port;
    }
}
