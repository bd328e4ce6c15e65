// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.types;

import java.util.regex.Pattern;

/**
 * Compiled patterns for validating {@code 0x}-prefixed hex strings.
 * <p>
 * Shared by {@link Address}, {@link Hash} and {@link HexData} so that all
 * value types agree on what well-formed hex looks like.
 *
 * @since 0.1.0
 */
public final class HexValidator {
    private static final Pattern EVEN_LENGTH = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private HexValidator() {}

    /**
     * Creates a compiled pattern that matches hex strings of exactly the specified byte length.
     *
     * @param byteLength the exact number of bytes the hex string must represent
     * @return a compiled pattern matching hex strings of the specified length
     */
    public static Pattern fixedLength(int byteLength) {
        int hexChars = byteLength * 2;
        return Pattern.compile("^0x[0-9a-fA-F]{" + hexChars + "}$");
    }

    /**
     * Pattern for arbitrary-length byte data: {@code 0x} followed by whole bytes.
     *
     * @return a compiled pattern; {@code "0x"} alone matches
     */
    public static Pattern evenLength() {
        return EVEN_LENGTH;
    }
}
