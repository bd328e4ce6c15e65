// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core;

import static sh.calltrace.core.AnsiColors.*;

import java.util.Locale;

/**
 * Formats debug log lines for trace reconstruction and receipt RPC dispatch.
 *
 * <p>
 * Every line uses a bracketed {@code [OPERATION]} tag, with status symbols
 * (✓ ✗ ○) for success, failure and pending/limited states. Hashes are
 * shortened to {@code 0xabcd...ef12}.
 *
 * <pre>{@code
 * DebugLogger.logTrace(LogFormatter.formatTraceBuilt(7, 2, 41));
 * // ✓ [TRACE-BUILT] calls=7 maxDepth=2 duration=0.04ms
 *
 * DebugLogger.logRpc(LogFormatter.formatRpcError("eth_getTransactionReceipt", -32000, "malformed trace", 950));
 * // ✗ [RPC-ERROR] method=eth_getTransactionReceipt code=-32000 message=malformed trace duration=0.95ms
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of shortened hashes, including "0x". */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of shortened hashes. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [TRACE-BUILT] calls=7 maxDepth=2 duration=0.04ms
     */
    public static String formatTraceBuilt(int calls, int maxDepth, long durationMicros) {
        return String.format(
                "%s✓%s %s[TRACE-BUILT]%s calls=%d maxDepth=%d %s",
                TEAL, RESET,
                LAVENDER, RESET,
                calls,
                maxDepth,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [TRACE-MALFORMED] calls=2 returns=2 reason=depth jumps from 0 to 2
     */
    public static String formatTraceMalformed(int calls, int returns, String reason) {
        return String.format(
                "%s✗%s %s[TRACE-MALFORMED]%s calls=%d returns=%d reason=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                calls,
                returns,
                CORAL, reason, RESET);
    }

    /**
     * Format: ○ [TRACE-LIMIT] limit=depth actual=1100 allowed=1024
     */
    public static String formatTraceLimit(String limit, long actual, long allowed) {
        return String.format(
                "%s○%s %s[TRACE-LIMIT]%s limit=%s actual=%d allowed=%d",
                AMBER, RESET,
                AMBER, RESET,
                limit,
                actual,
                allowed);
    }

    /**
     * Format: [RPC] method=eth_getTransactionReceipt duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s %s",
                INDIGO, RESET,
                method,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=eth_getTransactionReceipt code=-32000 message=error duration=1.5ms
     */
    public static String formatRpcError(String method, int code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%d message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [RECEIPT] hash=0x1234...5678 block=100 internalCalls=7
     */
    public static String formatReceipt(String hash, long block, int internalCalls) {
        return String.format(
                "%s✓%s %s[RECEIPT]%s hash=%s block=%d internalCalls=%d",
                TEAL, RESET,
                TEAL, RESET,
                shortenHash(hash),
                block,
                internalCalls);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
