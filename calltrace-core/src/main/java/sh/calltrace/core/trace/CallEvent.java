// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.HexData;
import sh.calltrace.core.types.Wei;

/**
 * A call entering execution, as reported by the execution engine.
 *
 * @param depth       nesting level, 0 for the transaction's top-level call
 * @param sender      the caller
 * @param destination the callee
 * @param input       calldata passed to the callee
 * @param kind        the call-kind tag supplied by the engine
 * @param gas         gas available to the callee at entry, or {@code null} when the
 *                    engine does not track it
 * @param value       value transferred with the call
 * @since 0.1.0
 */
public record CallEvent(
        int depth,
        Address sender,
        Address destination,
        HexData input,
        CallKind kind,
        @Nullable Long gas,
        Wei value) {

    public CallEvent {
        if (depth < 0) {
            throw new IllegalArgumentException("depth cannot be negative: " + depth);
        }
        Objects.requireNonNull(sender, "sender cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        value = value == null ? Wei.ZERO : value;
    }

    /**
     * Creates an event without entry gas or transferred value.
     */
    public static CallEvent of(
            final int depth,
            final Address sender,
            final Address destination,
            final HexData input,
            final CallKind kind) {
        return new CallEvent(depth, sender, destination, input, kind, null, Wei.ZERO);
    }

    public boolean hasGas() {
        return gas != null;
    }
}
