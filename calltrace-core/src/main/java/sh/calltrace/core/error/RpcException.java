// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.error;

/**
 * Exception carrying a JSON-RPC error for the receipt API.
 *
 * <p>
 * <strong>Codes used:</strong>
 * <ul>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32000</strong>: Malformed internal-call trace</li>
 * <li><strong>-32005</strong>: Trace exceeds configured limits</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends CallTraceException {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int MALFORMED_TRACE = -32000;
    public static final int LIMIT_EXCEEDED = -32005;

    private final int code;
    private final String data;

    public RpcException(final int code, final String message, final String data, final Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public RpcException(final int code, final String message) {
        this(code, message, null, null);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + "}";
    }
}
