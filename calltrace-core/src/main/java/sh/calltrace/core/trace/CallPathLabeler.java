// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Assigns a {@link CallPath} to every call of a tree.
 *
 * <p>
 * The tree is walked in pre-order (a call before its nested calls, siblings in
 * execution order), which is also the order in which the calls started. The
 * root is labeled {@code call_0}; a nested call at ordinal {@code i} below a
 * call labeled {@code P} gets {@code <kind>_<ordinals of P>_<i>}.
 *
 * <p>
 * Labels depend only on tree shape and call kinds, so labeling the same tree
 * twice yields the same result. The walk is iterative.
 *
 * @since 0.1.0
 */
public final class CallPathLabeler {

    private CallPathLabeler() {
    }

    /**
     * Labels a resolved call tree.
     *
     * @param root the top-level call
     * @return every call of the tree with its path, in pre-order
     */
    public static List<LabeledCall> label(final CallNode root) {
        Objects.requireNonNull(root, "root");
        final List<LabeledCall> labeled = new ArrayList<>();
        final Deque<LabeledCall> pending = new ArrayDeque<>();
        pending.push(new LabeledCall(CallPath.root(), root));

        while (!pending.isEmpty()) {
            final LabeledCall current = pending.pop();
            labeled.add(current);

            final List<CallNode> children = current.node().children();
            // Pushed last-to-first so the first child is visited next.
            for (int i = children.size() - 1; i >= 0; i--) {
                final CallNode child = children.get(i);
                pending.push(new LabeledCall(current.path().child(child.kind(), i), child));
            }
        }
        return labeled;
    }
}
