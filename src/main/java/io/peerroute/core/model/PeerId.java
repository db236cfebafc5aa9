package io.peerroute.core.model;

import io.peerroute.core.codec.Base58;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable peer identifier. The canonical form is the base58btc text of the peer's
 * multihash; {@link #bytes()} yields the decoded multihash, used as a lookup key.
 */
public final class PeerId implements Comparable<PeerId> {

    private final String text;
    private final byte[] bytes;

    private PeerId(final String text, final byte[] bytes) {
        this.text = text;
        this.bytes = bytes;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is empty or not valid base58
     */
    public static PeerId fromBase58(final String text) {
        Objects.requireNonNull(text, "text");
        final String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Peer id must not be empty");
        }
        final byte[] decoded = Base58.decode(trimmed);
        return new PeerId(Base58.encode(decoded), decoded);
    }

    public static PeerId fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Peer id must not be empty");
        }
        final byte[] copy = bytes.clone();
        return new PeerId(Base58.encode(copy), copy);
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String toBase58() {
        return text;
    }

    @Override
    public int compareTo(final PeerId o) {
        return text.compareTo(o.text);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerId other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return text;
    }
}
