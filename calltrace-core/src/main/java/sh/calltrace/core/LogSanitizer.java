// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core;

/**
 * Bounds the size of debug log payloads.
 *
 * <p>
 * Call inputs and outputs are attacker-controlled and can be arbitrarily
 * large. Long hex runs are shortened in place and the whole message is
 * truncated past {@value #MAX_LOG_LENGTH} characters.
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    static final int MAX_LOG_LENGTH = 2000;

    /** Hex runs longer than this many digits are elided. */
    static final int MAX_HEX_DIGITS = 64;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input.contains("0x") ? elideLongHex(input) : input;

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    private static String elideLongHex(final String input) {
        final StringBuilder out = new StringBuilder(Math.min(input.length(), MAX_LOG_LENGTH + 64));
        int i = 0;
        while (i < input.length()) {
            if (input.startsWith("0x", i)) {
                int end = i + 2;
                while (end < input.length() && Character.digit(input.charAt(end), 16) >= 0) {
                    end++;
                }
                final int digits = end - i - 2;
                if (digits > MAX_HEX_DIGITS) {
                    out.append(input, i, i + 2 + 8)
                            .append("...[")
                            .append(digits / 2)
                            .append(" bytes]");
                } else {
                    out.append(input, i, end);
                }
                i = end;
            } else {
                out.append(input.charAt(i));
                i++;
            }
        }
        return out.toString();
    }
}
