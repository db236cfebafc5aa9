package io.peerroute.core.codec;

import lombok.experimental.UtilityClass;

import java.util.Arrays;

/** Bitcoin-alphabet base58 (base58btc), the text encoding of libp2p peer ids. */
@UtilityClass
public final class Base58 {

    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    public String encode(final byte[] input) {
        if (input.length == 0) return "";

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) zeros++;

        final byte[] digits = Arrays.copyOf(input, input.length);
        final char[] encoded = new char[input.length * 2];
        int out = encoded.length;

        int start = zeros;
        while (start < digits.length) {
            encoded[--out] = ALPHABET[divmod(digits, start, 256, 58)];
            if (digits[start] == 0) start++;
        }

        // drop leading '1's produced by the division, then add one per leading zero byte
        while (out < encoded.length && encoded[out] == ALPHABET[0]) out++;
        while (--zeros >= 0) encoded[--out] = ALPHABET[0];

        return new String(encoded, out, encoded.length - out);
    }

    /**
     * @throws IllegalArgumentException if {@code input} contains a character outside the alphabet
     */
    public byte[] decode(final String input) {
        if (input.isEmpty()) return new byte[0];

        final byte[] input58 = new byte[input.length()];
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            final int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "' at position " + i);
            }
            input58[i] = (byte) digit;
        }

        int zeros = 0;
        while (zeros < input58.length && input58[zeros] == 0) zeros++;

        final byte[] decoded = new byte[input.length()];
        int out = decoded.length;

        int start = zeros;
        while (start < input58.length) {
            decoded[--out] = divmod(input58, start, 58, 256);
            if (input58[start] == 0) start++;
        }

        while (out < decoded.length && decoded[out] == 0) out++;
        return Arrays.copyOfRange(decoded, out - zeros, decoded.length);
    }

    /* In-place long division of number[firstDigit..] (base 'base') by 'divisor'; returns the remainder. */
    private byte divmod(final byte[] number, final int firstDigit, final int base, final int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            final int digit = number[i] & 0xFF;
            final int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return (byte) remainder;
    }
}
