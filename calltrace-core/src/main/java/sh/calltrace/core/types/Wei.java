// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.types;

import java.math.BigInteger;
import java.util.Objects;

import sh.calltrace.primitives.Hex;

/**
 * A non-negative amount of the native currency, in its smallest unit.
 * <p>
 * Carries the value transferred by an internal call. Amounts can exceed
 * 64 bits, hence {@link BigInteger}.
 */
public record Wei(BigInteger value) {

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    @com.fasterxml.jackson.annotation.JsonValue
    public String toHexString() {
        return Hex.encodeQuantity(value);
    }
}
