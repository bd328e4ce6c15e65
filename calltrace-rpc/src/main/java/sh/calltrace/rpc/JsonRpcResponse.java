// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import static sh.calltrace.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response produced by {@link ReceiptRpcHandler}.
 * <p>
 * Holds either a result or an error; use {@link #hasError()} to check which is
 * present. A successful lookup of an unknown transaction has a {@code null}
 * result and no error.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result  the result object if successful, or {@code null}
 * @param error   the error object if failed, or {@code null} if successful
 * @param id      the request ID that this response corresponds to, as sent
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable JsonRpcError error,
        @Nullable Object id) {

    static final String VERSION = "2.0";

    static JsonRpcResponse success(final @Nullable Object id, final @Nullable Object result) {
        return new JsonRpcResponse(VERSION, result, null, id);
    }

    static JsonRpcResponse failure(final @Nullable Object id, final JsonRpcError error) {
        return new JsonRpcResponse(VERSION, null, error, id);
    }

    /**
     * Checks if this response contains an error.
     *
     * @return {@code true} if the response has an error, {@code false} otherwise
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * Converts the result to the specified type using Jackson.
     *
     * @param type the target class type
     * @param <T>  the target type
     * @return the result converted to the specified type, or {@code null} if result is null
     * @throws IllegalArgumentException if the result cannot be converted to the target type
     */
    public <T> @Nullable T resultAs(Class<T> type) {
        if (result == null) {
            return null;
        }
        return MAPPER.convertValue(result, type);
    }
}
