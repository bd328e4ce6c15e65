// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The call-kind tag attached to a call by the execution engine.
 * <p>
 * The tag is carried verbatim (lowercased); the engine decides which call
 * instruction produced the call. Constants exist for the EVM call and create
 * instructions, but any other engine-defined tag is accepted. A tag starts
 * with a letter and may contain digits, {@code _} and {@code -}.
 * <p>
 * Only {@link #STATICCALL} is read-only. Every other kind may mutate state
 * and is labeled as a plain {@code call} in call paths.
 *
 * @param tag the lowercase tag, e.g. {@code "staticcall"}
 * @since 0.1.0
 */
public record CallKind(@com.fasterxml.jackson.annotation.JsonValue String tag) {
    private static final Pattern TAG = Pattern.compile("^[a-z][a-z0-9_-]*$");

    public static final CallKind CALL = new CallKind("call");
    public static final CallKind STATICCALL = new CallKind("staticcall");
    public static final CallKind DELEGATECALL = new CallKind("delegatecall");
    public static final CallKind CALLCODE = new CallKind("callcode");
    public static final CallKind CREATE = new CallKind("create");
    public static final CallKind CREATE2 = new CallKind("create2");

    public CallKind {
        Objects.requireNonNull(tag, "tag");
        tag = tag.toLowerCase(Locale.ROOT);
        if (!TAG.matcher(tag).matches()) {
            throw new IllegalArgumentException("Invalid call kind: " + tag);
        }
    }

    public static CallKind of(final String tag) {
        return new CallKind(tag);
    }

    public boolean isReadOnly() {
        return STATICCALL.tag.equals(tag);
    }

    @Override
    public String toString() {
        return tag;
    }
}
