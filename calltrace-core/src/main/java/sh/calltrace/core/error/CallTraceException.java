// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.error;

/**
 * Base runtime exception for all calltrace failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CallTraceException
 * ├── {@link MalformedTraceException} - trace cannot be turned into a call tree
 * ├── {@link TraceLimitExceededException} - trace is larger than the caller accepts
 * └── {@link RpcException} - JSON-RPC level failures of the receipt API
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     api.getTransactionReceipt(hash);
 * } catch (MalformedTraceException e) {
 *     // The engine produced an inconsistent trace for this transaction
 * } catch (CallTraceException e) {
 *     // Any other calltrace error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class CallTraceException extends RuntimeException
        permits MalformedTraceException,
        TraceLimitExceededException,
        RpcException {

    public CallTraceException(final String message) {
        super(message);
    }

    public CallTraceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
