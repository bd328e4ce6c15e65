// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.error;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Raised when a transaction's call and return events cannot describe a
 * well-nested call tree.
 *
 * <p>
 * Reconstruction is aborted when this is thrown; no partial tree is ever
 * returned. {@link #eventIndex()} points at the call event being processed when
 * the inconsistency surfaced, or is {@code -1} when the problem concerns the
 * trace as a whole (for example mismatched sequence lengths).
 *
 * <p>
 * The trace layer does not know which transaction it is reconstructing; callers
 * that do attach it with {@link #forTransaction(String)}.
 *
 * @since 0.1.0
 */
public final class MalformedTraceException extends CallTraceException {

    private final int eventIndex;
    private final @Nullable String transactionHash;

    public MalformedTraceException(final String message) {
        this(message, -1);
    }

    public MalformedTraceException(final String message, final int eventIndex) {
        super(eventIndex < 0 ? message : message + " (call event #" + eventIndex + ")");
        this.eventIndex = eventIndex;
        this.transactionHash = null;
    }

    private MalformedTraceException(final String transactionHash, final MalformedTraceException cause) {
        super("malformed trace in transaction " + transactionHash + ": " + cause.getMessage(), cause);
        this.eventIndex = cause.eventIndex;
        this.transactionHash = transactionHash;
    }

    /**
     * Returns a copy of this exception tagged with the transaction it concerns.
     * The original exception becomes the cause.
     *
     * @param transactionHash hash of the transaction whose trace is malformed
     * @return the tagged exception
     */
    public MalformedTraceException forTransaction(final String transactionHash) {
        return new MalformedTraceException(Objects.requireNonNull(transactionHash, "transactionHash"), this);
    }

    public int eventIndex() {
        return eventIndex;
    }

    /**
     * @return the transaction hash, or {@code null} if the exception was raised
     *         without transaction context
     */
    public @Nullable String transactionHash() {
        return transactionHash;
    }
}
