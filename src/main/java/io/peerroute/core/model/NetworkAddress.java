package io.peerroute.core.model;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Set;

/**
 * Multiaddr-style transport endpoint, e.g. {@code /ip4/127.0.0.1/tcp/4001}.
 * Components after the transport (such as {@code /p2p/<id>}) are kept verbatim in {@code suffix}.
 *
 * @param transport {@code null} when the address names a host only
 * @param port      {@code -1} when {@code transport} is {@code null}
 * @param suffix    empty when there are no trailing components
 */
public record NetworkAddress(String protocol,
                             String host,
                             String transport,
                             int port,
                             String suffix) implements Comparable<NetworkAddress> {

    private static final Set<String> HOST_PROTOCOLS = Set.of("ip4", "ip6", "dns", "dns4", "dns6", "dnsaddr");
    private static final Set<String> TRANSPORTS = Set.of("tcp", "udp");

    public NetworkAddress {
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(host, "host");
        if (!HOST_PROTOCOLS.contains(protocol)) {
            throw new IllegalArgumentException("Unsupported address protocol: " + protocol);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Address host must not be empty");
        }
        if ("ip4".equals(protocol) && !isIpv4(host)) {
            throw new IllegalArgumentException("Invalid ip4 host: " + host);
        }
        if (transport != null) {
            if (!TRANSPORTS.contains(transport)) {
                throw new IllegalArgumentException("Unsupported transport: " + transport);
            }
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
        } else if (port != -1) {
            throw new IllegalArgumentException("Port given without a transport");
        }
        suffix = suffix == null ? "" : suffix;
    }

    public static NetworkAddress tcp(final String ip4, final int port) {
        return new NetworkAddress("ip4", ip4, "tcp", port, "");
    }

    /**
     * Parses the multiaddr text form.
     *
     * @throws IllegalArgumentException if the text is not a supported multiaddr
     */
    public static NetworkAddress parse(final String text) {
        Objects.requireNonNull(text, "text");
        if (!text.startsWith("/")) {
            throw new IllegalArgumentException("Multiaddr must start with '/': " + text);
        }

        final String[] parts = text.substring(1).split("/", -1);
        if (parts.length < 2) {
            throw new IllegalArgumentException("Multiaddr is missing a host: " + text);
        }

        final String protocol = parts[0];
        final String host = parts[1];
        if (parts.length == 2) {
            return new NetworkAddress(protocol, host, null, -1, "");
        }
        if (!TRANSPORTS.contains(parts[2])) {
            // not a transport, keep the rest verbatim
            return new NetworkAddress(protocol, host, null, -1, "/" + String.join("/", tail(parts, 2)));
        }
        if (parts.length < 4) {
            throw new IllegalArgumentException("Multiaddr is missing a port: " + text);
        }

        final int port;
        try {
            port = Integer.parseInt(parts[3]);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in multiaddr: " + text, e);
        }

        final String suffix = parts.length > 4 ? "/" + String.join("/", tail(parts, 4)) : "";
        return new NetworkAddress(protocol, host, parts[2], port, suffix);
    }

    public boolean hasTransport() {
        return transport != null;
    }

    /** Unresolved socket address for dialing; requires a transport. */
    public InetSocketAddress toSocketAddress() {
        if (transport == null) {
            throw new IllegalStateException("Address has no transport port: " + this);
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    @Override
    public int compareTo(final NetworkAddress o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder()
                .append('/').append(protocol)
                .append('/').append(host);
        if (transport != null) {
            sb.append('/').append(transport).append('/').append(port);
        }
        return sb.append(suffix).toString();
    }

    private static String[] tail(final String[] parts, final int from) {
        final String[] out = new String[parts.length - from];
        System.arraycopy(parts, from, out, 0, out.length);
        return out;
    }

    private static boolean isIpv4(final String host) {
        final String[] octets = host.split("\\.", -1);
        if (octets.length != 4) return false;
        for (final String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3) return false;
            for (int i = 0; i < octet.length(); i++) {
                if (!Character.isDigit(octet.charAt(i))) return false;
            }
            if (Integer.parseInt(octet) > 255) return false;
        }
        return true;
    }
}
