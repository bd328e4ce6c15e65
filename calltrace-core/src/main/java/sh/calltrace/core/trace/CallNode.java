// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.HexData;

/**
 * One call in a reconstructed call tree.
 * <p>
 * A node is owned by its parent and lists its own children in execution
 * order; it holds no reference back to the parent. Nodes are created and
 * completed only by {@link CallTreeBuilder}, so a tree handed out by the
 * builder is fully resolved and no longer changes.
 *
 * @since 0.1.0
 */
public final class CallNode {

    private final CallEvent call;
    private final List<CallNode> children = new ArrayList<>();
    private @Nullable ReturnEvent result;

    CallNode(final CallEvent call) {
        this.call = Objects.requireNonNull(call, "call");
    }

    public CallEvent call() {
        return call;
    }

    public int depth() {
        return call.depth();
    }

    public Address sender() {
        return call.sender();
    }

    public Address destination() {
        return call.destination();
    }

    public HexData input() {
        return call.input();
    }

    public CallKind kind() {
        return call.kind();
    }

    /**
     * @return the nested calls in the order they were made; read-only view
     */
    public List<CallNode> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isResolved() {
        return result != null;
    }

    /**
     * @return the return event matched to this call
     * @throws IllegalStateException if the node has not been resolved
     */
    public ReturnEvent result() {
        if (result == null) {
            throw new IllegalStateException("call at depth " + call.depth() + " has not returned");
        }
        return result;
    }

    /**
     * Counts this node and all of its descendants.
     *
     * @return the number of calls in the subtree rooted here
     */
    public int size() {
        int count = 0;
        final Deque<CallNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            final CallNode node = pending.pop();
            count++;
            for (CallNode child : node.children) {
                pending.push(child);
            }
        }
        return count;
    }

    void addChild(final CallNode child) {
        children.add(child);
    }

    void resolve(final ReturnEvent returnEvent) {
        if (result != null) {
            throw new IllegalStateException("call at depth " + call.depth() + " already returned");
        }
        result = Objects.requireNonNull(returnEvent, "returnEvent");
    }

    @Override
    public String toString() {
        return "CallNode{"
                + "depth=" + call.depth()
                + ", kind=" + call.kind()
                + ", from=" + call.sender()
                + ", to=" + call.destination()
                + ", children=" + children.size()
                + ", resolved=" + (result != null)
                + "}";
    }
}
