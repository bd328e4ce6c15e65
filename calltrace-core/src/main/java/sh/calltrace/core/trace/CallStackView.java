// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.HexData;

/**
 * Nested, JSON-ready view of a call tree, used for inspection.
 * <p>
 * Addresses and payloads serialize as {@code 0x} hex, {@code StatusCode} and
 * {@code GasLeft} as plain numbers, and {@code Calls} as {@code null} for a
 * call that made no nested calls.
 *
 * @param from       the caller
 * @param to         the callee
 * @param input      calldata
 * @param output     return data
 * @param statusCode engine status code
 * @param gasLeft    gas remaining at return
 * @param calls      nested calls in execution order, or {@code null} for a leaf
 * @since 0.1.0
 */
@JsonPropertyOrder({"From", "To", "Input", "Output", "StatusCode", "GasLeft", "Calls"})
public record CallStackView(
        @JsonProperty("From") Address from,
        @JsonProperty("To") Address to,
        @JsonProperty("Input") HexData input,
        @JsonProperty("Output") HexData output,
        @JsonProperty("StatusCode") int statusCode,
        @JsonProperty("GasLeft") long gasLeft,
        @JsonProperty("Calls") @Nullable List<CallStackView> calls) {

    public CallStackView {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(output, "output cannot be null");
        if (calls != null) {
            calls = calls.isEmpty() ? null : List.copyOf(calls);
        }
    }

    /**
     * Converts a resolved call tree into its nested view.
     * <p>
     * Children are converted before their parents by walking the pre-order in
     * reverse, so no recursion is involved.
     *
     * @param root the top-level call
     * @return the view of the whole tree
     * @throws IllegalStateException if a call in the tree has not been resolved
     */
    public static CallStackView of(final CallNode root) {
        Objects.requireNonNull(root, "root");
        final List<CallNode> preOrder = new ArrayList<>();
        final Deque<CallNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            final CallNode node = pending.pop();
            preOrder.add(node);
            final List<CallNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }

        final Map<CallNode, CallStackView> views = new IdentityHashMap<>();
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            final CallNode node = preOrder.get(i);
            List<CallStackView> calls = null;
            if (!node.children().isEmpty()) {
                calls = new ArrayList<>(node.children().size());
                for (CallNode child : node.children()) {
                    calls.add(views.remove(child));
                }
            }
            final ReturnEvent result = node.result();
            views.put(node, new CallStackView(
                    node.sender(),
                    node.destination(),
                    node.input(),
                    result.output(),
                    result.statusCode(),
                    result.gasLeft(),
                    calls));
        }
        return views.get(root);
    }

    /**
     * @return the number of calls in this view, itself included
     */
    public int size() {
        int count = 0;
        final Deque<CallStackView> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            final CallStackView view = pending.pop();
            count++;
            if (view.calls != null) {
                view.calls.forEach(pending::push);
            }
        }
        return count;
    }
}
