// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.types;

import java.util.Arrays;
import java.util.Objects;

import sh.calltrace.primitives.Hex;

/**
 * Arbitrary-length byte payload with a {@code 0x}-prefixed hex form.
 *
 * <p>
 * Used for call input (calldata), call output (return data) and log data.
 * Payloads produced by the execution engine arrive as raw bytes; the hex
 * string is generated lazily the first time it is needed and cached.
 *
 * <p>
 * <strong>Validation:</strong> a string value must start with "0x", contain
 * only hex characters and have an even number of digits. It is normalized
 * to lowercase.
 *
 * <pre>
 * {@code
 * HexData empty = HexData.EMPTY;                       // "0x"
 * HexData data = new HexData("0xA11A1F36");            // "0xa11a1f36"
 * HexData fromBytes = HexData.fromBytes(new byte[] {1}); // "0x01"
 * }</pre>
 */
public final class HexData {
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;
    private volatile String value;

    /**
     * Creates a HexData from a hex string.
     *
     * @param value the hex-encoded string with "0x" prefix
     * @throws IllegalArgumentException if {@code value} is not well-formed hex data
     */
    public HexData(String value) {
        Objects.requireNonNull(value, "hex");
        if (!HexValidator.evenLength().matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        this.raw = Hex.decode(value);
        this.value = Hex.encode(raw);
    }

    private HexData(byte[] raw) {
        this.raw = raw;
    }

    /**
     * Creates HexData from raw bytes. The array is copied.
     *
     * @param bytes the byte array, or null/empty for {@link #EMPTY}
     * @return HexData wrapping a copy of {@code bytes}
     */
    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    /**
     * Returns the hex string representation with "0x" prefix.
     *
     * @return the lowercase hex string
     */
    @com.fasterxml.jackson.annotation.JsonValue
    public String value() {
        String v = value;
        if (v == null) {
            v = Hex.encode(raw);
            value = v;
        }
        return v;
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    /**
     * Decodes this hex data into raw bytes.
     *
     * @return a copy of the underlying bytes
     */
    public byte[] toBytes() {
        return raw.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        HexData hexData = (HexData) o;
        return Arrays.equals(raw, hexData.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[" + "value=" + value() + ']';
    }
}
