// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.calltrace.core.DebugLogger;
import sh.calltrace.core.LogFormatter;
import sh.calltrace.core.error.MalformedTraceException;

/**
 * Rebuilds the nested call tree of a transaction from its flat trace.
 *
 * <p>
 * The builder keeps an explicit stack of calls that are still open. Each call
 * event is compared with the depth of the call on top of the stack:
 * <ul>
 * <li>one level deeper: the event is a nested call of the top, which becomes
 * its parent;</li>
 * <li>same depth or shallower: calls on the stack have finished. They are
 * popped, each taking the next return event, until the top is the new call's
 * parent;</li>
 * <li>more than one level deeper: the trace is malformed.</li>
 * </ul>
 * Once all call events are consumed the remaining stack is drained the same
 * way. Because calls complete in reverse order of opening, the n-th return
 * event always belongs to the n-th call to be popped.
 *
 * <p>
 * The builder never recurses, so trace depth does not consume Java stack. It
 * holds no state between invocations and is safe for concurrent use.
 *
 * <pre>{@code
 * Optional<CallNode> root = CallTreeBuilder.build(trace);
 * root.ifPresent(r -> System.out.println(r.size() + " calls"));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class CallTreeBuilder {

    private CallTreeBuilder() {
    }

    /**
     * Builds the call tree for one transaction.
     *
     * @param trace the transaction's call and return events
     * @return the root call, or empty if the transaction made no calls
     * @throws MalformedTraceException if the events do not describe a single well-nested tree
     */
    public static Optional<CallNode> build(final TransactionTrace trace) {
        Objects.requireNonNull(trace, "trace");
        final long start = System.nanoTime();
        try {
            final Optional<CallNode> root = buildTree(trace.calls(), trace.returns());
            DebugLogger.logTrace(LogFormatter.formatTraceBuilt(
                    trace.callCount(), trace.maxDepth(), (System.nanoTime() - start) / 1_000L));
            return root;
        } catch (MalformedTraceException e) {
            DebugLogger.logTrace(LogFormatter.formatTraceMalformed(
                    trace.callCount(), trace.returns().size(), e.getMessage()));
            throw e;
        }
    }

    private static Optional<CallNode> buildTree(final List<CallEvent> calls, final List<ReturnEvent> returns) {
        if (calls.size() != returns.size()) {
            throw new MalformedTraceException(
                    "trace has " + calls.size() + " call events but " + returns.size() + " return events");
        }
        if (calls.isEmpty()) {
            return Optional.empty();
        }

        final CallEvent first = calls.get(0);
        if (first.depth() != 0) {
            throw new MalformedTraceException("top-level call must be at depth 0, got " + first.depth(), 0);
        }

        final ReturnQueue returnQueue = new ReturnQueue(returns);
        final Deque<CallNode> open = new ArrayDeque<>();
        final CallNode root = new CallNode(first);
        open.push(root);

        for (int i = 1; i < calls.size(); i++) {
            final CallEvent event = calls.get(i);
            CallNode top = open.peek();

            if (event.depth() > top.depth() + 1) {
                throw new MalformedTraceException(
                        "call depth jumps from " + top.depth() + " to " + event.depth(), i);
            }

            // Calls at or below the new depth have completed.
            while (top.depth() >= event.depth()) {
                open.pop().resolve(returnQueue.next(i));
                top = open.peek();
                if (top == null) {
                    throw new MalformedTraceException("second top-level call in one transaction", i);
                }
            }

            final CallNode node = new CallNode(event);
            top.addChild(node);
            open.push(node);
        }

        while (!open.isEmpty()) {
            open.pop().resolve(returnQueue.next(-1));
        }
        if (returnQueue.remaining() > 0) {
            throw new MalformedTraceException(
                    returnQueue.remaining() + " return events left after all calls returned");
        }
        return Optional.of(root);
    }

    /**
     * FIFO cursor over the return events, consumed as calls close.
     */
    private static final class ReturnQueue {
        private final List<ReturnEvent> returns;
        private int position;

        ReturnQueue(final List<ReturnEvent> returns) {
            this.returns = returns;
        }

        ReturnEvent next(final int eventIndex) {
            if (position >= returns.size()) {
                throw new MalformedTraceException("ran out of return events with calls still open", eventIndex);
            }
            return returns.get(position++);
        }

        int remaining() {
            return returns.size() - position;
        }
    }
}
