// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger, gated by {@link CallTraceDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.calltrace.debug");

    private DebugLogger() {
    }

    public static void logTrace(final String message, final Object... args) {
        if (!CallTraceDebug.isTraceLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logRpc(final String message, final Object... args) {
        if (!CallTraceDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Direct output to stdout for colored logs in TTY environments.
     * Falls back to SLF4J otherwise. Always sanitized.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
