// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

/**
 * What a receipt lookup does when a transaction's trace cannot be turned into a
 * call tree.
 */
public enum MalformedTracePolicy {
    /** The lookup fails with {@link sh.calltrace.core.error.MalformedTraceException}. */
    FAIL,
    /** The receipt is returned with no internal transactions and a warning is logged. */
    OMIT
}
