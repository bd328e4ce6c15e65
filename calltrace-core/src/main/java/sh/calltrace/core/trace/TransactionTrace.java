// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.List;
import java.util.Objects;

/**
 * The internal-call trace of one transaction: call events and return events,
 * each in execution order.
 * <p>
 * A well-formed trace has one return per call. The record itself does not
 * enforce this; {@link CallTreeBuilder} reports violations.
 *
 * @param calls   call-enter events in the order calls started
 * @param returns call-return events in the order calls completed
 * @since 0.1.0
 */
public record TransactionTrace(List<CallEvent> calls, List<ReturnEvent> returns) {

    /** Trace of a transaction that made no calls. */
    public static final TransactionTrace EMPTY = new TransactionTrace(List.of(), List.of());

    public TransactionTrace {
        Objects.requireNonNull(calls, "calls cannot be null");
        Objects.requireNonNull(returns, "returns cannot be null");
        calls = List.copyOf(calls);
        returns = List.copyOf(returns);
    }

    public boolean isEmpty() {
        return calls.isEmpty() && returns.isEmpty();
    }

    public int callCount() {
        return calls.size();
    }

    /**
     * @return the largest depth among the call events, or -1 for an empty trace
     */
    public int maxDepth() {
        int max = -1;
        for (CallEvent call : calls) {
            max = Math.max(max, call.depth());
        }
        return max;
    }
}
