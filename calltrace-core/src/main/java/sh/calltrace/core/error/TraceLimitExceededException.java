// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.error;

/**
 * Raised before reconstruction when a trace is wider or deeper than the caller
 * is willing to process.
 *
 * @since 0.1.0
 */
public final class TraceLimitExceededException extends CallTraceException {

    private final String limit;
    private final long actual;
    private final long allowed;

    public TraceLimitExceededException(final String limit, final long actual, final long allowed) {
        super("trace exceeds " + limit + " limit: " + actual + " > " + allowed);
        this.limit = limit;
        this.actual = actual;
        this.allowed = allowed;
    }

    /**
     * @return the name of the violated limit ({@code "call count"} or {@code "depth"})
     */
    public String limit() {
        return limit;
    }

    public long actual() {
        return actual;
    }

    public long allowed() {
        return allowed;
    }
}
