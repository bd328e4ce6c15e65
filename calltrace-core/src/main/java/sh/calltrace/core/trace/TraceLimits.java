// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import sh.calltrace.core.DebugLogger;
import sh.calltrace.core.LogFormatter;
import sh.calltrace.core.error.TraceLimitExceededException;

/**
 * Upper bounds on the traces a caller is willing to reconstruct.
 * <p>
 * Call count and depth are influenced by whoever submits the transaction, so
 * a caller serving receipts should check them before building a tree.
 *
 * <pre>{@code
 * TraceLimits limits = new TraceLimits(50_000, 1024);
 * limits.check(trace);   // throws TraceLimitExceededException when exceeded
 * }</pre>
 *
 * @param maxCalls maximum number of call events per transaction
 * @param maxDepth maximum call depth (the top-level call has depth 0)
 * @since 0.1.0
 */
public record TraceLimits(int maxCalls, int maxDepth) {

    /** EVM call-depth limit. */
    public static final int EVM_MAX_DEPTH = 1024;

    public static final TraceLimits DEFAULTS = new TraceLimits(10_000, EVM_MAX_DEPTH);

    public static final TraceLimits UNLIMITED = new TraceLimits(Integer.MAX_VALUE, Integer.MAX_VALUE);

    public TraceLimits {
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be positive: " + maxCalls);
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    /**
     * Verifies that a trace is within these limits.
     *
     * @param trace the trace to inspect
     * @throws TraceLimitExceededException if the trace has too many calls or is too deep
     */
    public void check(final TransactionTrace trace) {
        if (trace.callCount() > maxCalls) {
            throw exceeded("call count", trace.callCount(), maxCalls);
        }
        if (trace.returns().size() > maxCalls) {
            throw exceeded("call count", trace.returns().size(), maxCalls);
        }
        final int depth = trace.maxDepth();
        if (depth > maxDepth) {
            throw exceeded("depth", depth, maxDepth);
        }
    }

    private static TraceLimitExceededException exceeded(final String limit, final long actual, final long allowed) {
        DebugLogger.logTrace(LogFormatter.formatTraceLimit(limit, actual, allowed));
        return new TraceLimitExceededException(limit, actual, allowed);
    }
}
