// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical label of a call's position and kind within its transaction.
 * <p>
 * A path is a kind prefix followed by the chain of sibling ordinals from the
 * root down to the call: {@code call_0} is the top-level call,
 * {@code call_0_1} its second nested call, and {@code staticcall_0_1_0} a
 * read-only call made first by {@code call_0_1}. Only the call's own kind
 * contributes a prefix; ancestors contribute ordinals.
 *
 * @param value the path string
 * @since 0.1.0
 */
public record CallPath(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final Pattern FORMAT = Pattern.compile("^[a-z][a-z0-9]*_0(_(0|[1-9][0-9]*))*$");

    static final String MUTATING_PREFIX = "call";
    static final String READ_ONLY_PREFIX = "staticcall";

    private static final CallPath ROOT = new CallPath(MUTATING_PREFIX + "_0");

    public CallPath {
        Objects.requireNonNull(value, "value");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid call path: " + value);
        }
    }

    /**
     * @return {@code call_0}; the top-level call is always labeled as mutating
     */
    public static CallPath root() {
        return ROOT;
    }

    /**
     * Derives the path of a nested call made by the call at this path.
     *
     * @param kind    the nested call's kind
     * @param ordinal the nested call's 0-based position among its siblings
     * @return the child's path
     */
    public CallPath child(final CallKind kind, final int ordinal) {
        Objects.requireNonNull(kind, "kind");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal cannot be negative: " + ordinal);
        }
        final String prefix = kind.isReadOnly() ? READ_ONLY_PREFIX : MUTATING_PREFIX;
        return new CallPath(prefix + "_" + ordinalChain() + "_" + ordinal);
    }

    /**
     * @return the kind prefix, {@code "call"} or {@code "staticcall"}
     */
    public String prefix() {
        return value.substring(0, value.indexOf('_'));
    }

    /**
     * @return the path without its prefix, e.g. {@code "0_1_0"}
     */
    public String ordinalChain() {
        return value.substring(value.indexOf('_') + 1);
    }

    public List<Integer> ordinals() {
        final String[] parts = ordinalChain().split("_");
        final List<Integer> ordinals = new ArrayList<>(parts.length);
        for (String part : parts) {
            ordinals.add(Integer.parseInt(part));
        }
        return Collections.unmodifiableList(ordinals);
    }

    /**
     * @return the nesting depth of the labeled call, 0 for the top-level call
     */
    public int depth() {
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == '_') {
                depth++;
            }
        }
        return depth - 1;
    }

    public boolean isRoot() {
        return depth() == 0;
    }

    public boolean isReadOnly() {
        return READ_ONLY_PREFIX.equals(prefix());
    }

    /**
     * @return the position of the labeled call among its siblings
     */
    public int ordinal() {
        return Integer.parseInt(value.substring(value.lastIndexOf('_') + 1));
    }

    /**
     * Checks whether the call at this path was made directly by the call at
     * {@code parent}, whatever the parent's kind.
     *
     * @param parent the candidate parent path
     * @return true if this path is one level below {@code parent}
     */
    public boolean isChildOf(final CallPath parent) {
        Objects.requireNonNull(parent, "parent");
        if (isRoot()) {
            return false;
        }
        final String chain = ordinalChain();
        return chain.substring(0, chain.lastIndexOf('_')).equals(parent.ordinalChain());
    }

    @Override
    public String toString() {
        return value;
    }
}
