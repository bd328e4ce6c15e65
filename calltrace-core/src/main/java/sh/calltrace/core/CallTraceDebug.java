// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core;

/**
 * Global toggle for verbose debug logging across calltrace modules.
 *
 * <p>Two independent switches exist: one for trace reconstruction (builder,
 * labeler, projector) and one for receipt RPC dispatch. The flags are volatile;
 * the compound check in {@link #isEnabled()} is not atomic, which only matters
 * for best-effort logging.
 */
public final class CallTraceDebug {

    private static volatile boolean traceLogging = false;
    private static volatile boolean rpcLogging = false;

    private CallTraceDebug() {
    }

    /**
     * @return true if either trace or RPC logging is enabled
     */
    public static boolean isEnabled() {
        return traceLogging || rpcLogging;
    }

    public static void setEnabled(final boolean enabled) {
        traceLogging = enabled;
        rpcLogging = enabled;
    }

    public static void setTraceLogging(final boolean enabled) {
        traceLogging = enabled;
    }

    public static boolean isTraceLoggingEnabled() {
        return traceLogging;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }
}
