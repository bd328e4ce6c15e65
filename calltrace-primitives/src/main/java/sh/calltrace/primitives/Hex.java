// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.primitives;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Hex codec for the {@code 0x} convention used by receipt and trace payloads.
 *
 * <p>Two flavors are supported:
 * <ul>
 * <li><b>Data</b> - byte payloads, two lowercase hex digits per byte ({@code 0x}, {@code 0x00ff})</li>
 * <li><b>Quantities</b> - unsigned integers, minimal digits without leading zeros
 * ({@code 0x0}, {@code 0x15abd})</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert a hex string, with or without {@code 0x} prefix, into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Convert a byte array into a lowercase hex string with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string with {@code 0x} prefix; {@code "0x"} for an empty array
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[2 + bytes.length * 2];
        chars[0] = '0';
        chars[1] = 'x';
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 + i * 2] = HEX_CHARS[v >>> 4];
            chars[2 + i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Convert a byte array into a lowercase hex string without a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return hex string without {@code 0x} prefix
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Encode an unsigned 64-bit quantity, e.g. {@code 0} as {@code "0x0"} and
     * {@code 88765} as {@code "0x15abd"}.
     *
     * <p>The value is interpreted as unsigned, so {@code -1L} encodes as
     * {@code 0xffffffffffffffff}.
     *
     * @param value the quantity
     * @return minimal hex quantity with {@code 0x} prefix
     */
    public static String encodeQuantity(final long value) {
        return "0x" + Long.toHexString(value);
    }

    /**
     * Encode a non-negative arbitrary-precision quantity.
     *
     * @param value the quantity
     * @return minimal hex quantity with {@code 0x} prefix
     * @throws IllegalArgumentException if {@code value} is null or negative
     */
    public static String encodeQuantity(final BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("quantity cannot be negative: " + value);
        }
        return "0x" + value.toString(16);
    }

    /**
     * Decode a hex quantity into an unsigned 64-bit value.
     *
     * <p>Accepts {@code "0x0"}, {@code "0x15abd"} and padded forms such as {@code "0x00ff"}.
     * An empty quantity ({@code "0x"}) is rejected.
     *
     * @param quantity the quantity string
     * @return the decoded value (unsigned)
     * @throws IllegalArgumentException if the input is null, empty, not hex, or wider than 64 bits
     */
    public static long decodeQuantity(final String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("quantity cannot be null");
        }
        final String digits = cleanPrefix(quantity);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("quantity has no digits: " + quantity);
        }
        for (int i = 0; i < digits.length(); i++) {
            toNibble(digits.charAt(i), quantity);
        }
        try {
            return Long.parseUnsignedLong(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("quantity exceeds 64 bits: " + quantity, e);
        }
    }

    /**
     * Remove a {@code 0x} prefix from the given string if present.
     *
     * @param hexString the string to clean
     * @return the string without a {@code 0x} prefix
     * @throws IllegalArgumentException if {@code hexString} is {@code null}
     */
    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
