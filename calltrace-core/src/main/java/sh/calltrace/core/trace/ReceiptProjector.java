// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.calltrace.core.types.Quantity;

/**
 * Flattens labeled call trees into receipt records.
 *
 * <p>
 * Records follow the labeling order (pre-order). {@code gasUsed} is the gas
 * available at entry minus the gas left at return; when the engine did not
 * report entry gas, {@code gas} is omitted and {@code gasUsed} is zero.
 *
 * <pre>{@code
 * List<InternalTransaction> internalTxs = ReceiptProjector.project(trace);
 * Optional<CallStackView> nested = ReceiptProjector.callStack(trace);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ReceiptProjector {

    private ReceiptProjector() {
    }

    /**
     * Builds, labels and flattens the call tree of a trace.
     *
     * @param trace the transaction's call and return events
     * @return the flattened calls in pre-order; empty if the transaction made no calls
     * @throws sh.calltrace.core.error.MalformedTraceException if the trace is malformed
     */
    public static List<InternalTransaction> project(final TransactionTrace trace) {
        return CallTreeBuilder.build(trace)
                .map(root -> project(CallPathLabeler.label(root)))
                .orElse(List.of());
    }

    /**
     * Builds the nested view of a trace.
     *
     * @param trace the transaction's call and return events
     * @return the nested view, or empty if the transaction made no calls
     * @throws sh.calltrace.core.error.MalformedTraceException if the trace is malformed
     */
    public static Optional<CallStackView> callStack(final TransactionTrace trace) {
        return CallTreeBuilder.build(trace).map(CallStackView::of);
    }

    /**
     * Flattens already labeled calls, keeping their order.
     *
     * @param labeled output of {@link CallPathLabeler#label(CallNode)}
     * @return one record per call
     */
    public static List<InternalTransaction> project(final List<LabeledCall> labeled) {
        Objects.requireNonNull(labeled, "labeled");
        final List<InternalTransaction> records = new ArrayList<>(labeled.size());
        for (LabeledCall call : labeled) {
            records.add(toRecord(call));
        }
        return List.copyOf(records);
    }

    static InternalTransaction toRecord(final LabeledCall labeled) {
        final CallNode node = labeled.node();
        final CallEvent call = node.call();
        final ReturnEvent result = node.result();

        final Quantity gas = call.hasGas() ? Quantity.of(call.gas()) : null;
        return new InternalTransaction(
                labeled.path(),
                call.sender(),
                call.destination(),
                gas,
                call.value(),
                call.input(),
                Quantity.of(Integer.toUnsignedLong(result.statusCode())),
                Quantity.of(gasUsed(call, result)),
                result.output());
    }

    /**
     * Entry gas minus gas left, or 0 when entry gas is unknown. A return
     * reporting more gas than the call started with also yields 0.
     */
    static long gasUsed(final CallEvent call, final ReturnEvent result) {
        if (!call.hasGas()) {
            return 0L;
        }
        final long entry = call.gas();
        final long left = result.gasLeft();
        return Long.compareUnsigned(entry, left) >= 0 ? entry - left : 0L;
    }
}
