package io.peerroute.config.type;

import io.peerroute.config.impl.NodeConfig;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads node configuration from a YAML file by delegating to {@link NodeConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * peerId: QmSelf...
     * peerRouting:
     *   refreshManager:
     *     enabled: true
     *     bootDelay: 10s
     *     interval: 10m
     * dht:
     *   enabled: true
     *   peers:
     *     - id: Qm...
     *       addrs: ["/ip4/10.0.0.2/tcp/4001"]
     * delegates:
     *   - protocol: http
     *     host: 127.0.0.1
     *     port: 5001
     * </pre>
     *
     * @param path the path to the node YAML configuration file
     * @return a populated {@link NodeConfig} instance
     * @throws IOException if the file cannot be read or does not match the expected structure
     */
    public static NodeConfig load(final String path) throws IOException {
        return NodeConfig.load(path);
    }

    /**
     * Reads a duration setting: a bare integer is milliseconds, otherwise a number with one of the
     * suffixes {@code ms}, {@code s}, {@code m}, {@code h}.
     *
     * @param fallback returned when {@code value} is {@code null}
     * @throws IllegalArgumentException if the value cannot be read
     */
    public static Duration parseDuration(final Object value, final Duration fallback) {
        if (value == null) return fallback;
        if (value instanceof Number n) return Duration.ofMillis(n.longValue());

        final String text = value.toString().trim().toLowerCase(Locale.ROOT);
        try {
            if (text.endsWith("ms")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            if (text.endsWith("s")) return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            if (text.endsWith("m")) return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            if (text.endsWith("h")) return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(text));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + value, e);
        }
    }
}
