// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.Objects;

/**
 * A call paired with the path assigned to it by {@link CallPathLabeler}.
 *
 * @param path the call's canonical path
 * @param node the call
 * @since 0.1.0
 */
public record LabeledCall(CallPath path, CallNode node) {

    public LabeledCall {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(node, "node cannot be null");
    }
}
