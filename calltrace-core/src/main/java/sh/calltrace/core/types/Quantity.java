// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.types;

import sh.calltrace.primitives.Hex;

/**
 * Unsigned 64-bit integer rendered in the JSON-RPC quantity form.
 * <p>
 * Gas figures, status codes, block numbers and indices all travel as
 * quantities: minimal lowercase hex with a {@code 0x} prefix, so zero is
 * {@code "0x0"} and 88765 is {@code "0x15abd"}.
 *
 * @param value the raw value, interpreted as unsigned
 * @since 0.1.0
 */
public record Quantity(long value) {

    public static final Quantity ZERO = new Quantity(0L);

    public static Quantity of(final long value) {
        return value == 0L ? ZERO : new Quantity(value);
    }

    /**
     * Parses the quantity form ({@code "0x15abd"}).
     *
     * @param hex the quantity string
     * @return the parsed quantity
     * @throws IllegalArgumentException if {@code hex} is not a valid quantity
     */
    public static Quantity fromHex(final String hex) {
        return of(Hex.decodeQuantity(hex));
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return Hex.encodeQuantity(value);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
