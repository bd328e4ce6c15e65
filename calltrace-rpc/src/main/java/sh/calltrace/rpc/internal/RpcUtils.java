// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc.internal;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;

import sh.calltrace.core.error.RpcException;
import sh.calltrace.core.types.Hash;
import sh.calltrace.rpc.BlockTag;

/**
 * Internal helpers for JSON-RPC parameter decoding.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Reads a transaction hash from a positional parameter.
     *
     * @throws RpcException with {@link RpcException#INVALID_PARAMS} if the parameter is missing or invalid
     */
    public static Hash hashParam(final List<?> params, final int index) {
        final Object value = param(params, index);
        if (!(value instanceof String s)) {
            throw invalidParams("parameter " + index + " must be a transaction hash string");
        }
        try {
            return new Hash(s);
        } catch (IllegalArgumentException e) {
            throw invalidParams(e.getMessage());
        }
    }

    /**
     * Reads a block tag from a positional parameter. Accepts the string forms
     * understood by {@link BlockTag#parse(String)} and non-negative JSON integers.
     *
     * @throws RpcException with {@link RpcException#INVALID_PARAMS} if the parameter is missing or invalid
     */
    public static BlockTag blockTagParam(final List<?> params, final int index) {
        final Object value = param(params, index);
        try {
            if (value instanceof String s) {
                return BlockTag.parse(s);
            }
            if (value instanceof Integer || value instanceof Long) {
                return BlockTag.of(((Number) value).longValue());
            }
        } catch (IllegalArgumentException e) {
            throw invalidParams(e.getMessage());
        }
        throw invalidParams("parameter " + index + " must be a block tag");
    }

    private static Object param(final List<?> params, final int index) {
        if (params == null || params.size() <= index || params.get(index) == null) {
            throw invalidParams("missing parameter " + index);
        }
        return params.get(index);
    }

    private static RpcException invalidParams(final String message) {
        return new RpcException(RpcException.INVALID_PARAMS, "invalid params: " + message);
    }
}
