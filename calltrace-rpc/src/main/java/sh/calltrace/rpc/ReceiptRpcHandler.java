// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import static sh.calltrace.rpc.internal.RpcUtils.MAPPER;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.calltrace.core.DebugLogger;
import sh.calltrace.core.LogFormatter;
import sh.calltrace.core.error.MalformedTraceException;
import sh.calltrace.core.error.RpcException;
import sh.calltrace.core.error.TraceLimitExceededException;
import sh.calltrace.rpc.internal.RpcUtils;

/**
 * Dispatches JSON-RPC 2.0 requests to a {@link ReceiptApi}.
 *
 * <p>
 * <strong>Methods:</strong>
 * <ul>
 * <li>{@code eth_getTransactionReceipt [hash]}: the receipt with its
 * {@code internalTransactions}, or {@code null} for an unknown hash</li>
 * <li>{@code sbch_getTxListByHeight [blockTag]}: receipts of every transaction in the block</li>
 * <li>{@code debug_getInternalCallStack [hash]}: the nested call stack, or {@code null}</li>
 * </ul>
 *
 * <p>
 * Failures never escape as exceptions; they are returned as error responses
 * with the codes listed in {@link RpcException}. A malformed trace reports the
 * transaction hash as the error {@code data}.
 *
 * @since 0.1.0
 */
public final class ReceiptRpcHandler {

    public static final String GET_TRANSACTION_RECEIPT = "eth_getTransactionReceipt";
    public static final String GET_TX_LIST_BY_HEIGHT = "sbch_getTxListByHeight";
    public static final String GET_INTERNAL_CALL_STACK = "debug_getInternalCallStack";

    private static final Logger log = LoggerFactory.getLogger(ReceiptRpcHandler.class);

    private final ReceiptApi api;

    public ReceiptRpcHandler(final ReceiptApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    /**
     * Handles a typed request.
     *
     * @param request the request
     * @return the response; never {@code null}
     */
    public JsonRpcResponse handle(final JsonRpcRequest request) {
        Objects.requireNonNull(request, "request");
        final long start = System.nanoTime();
        final String method = request.method();
        try {
            if (!JsonRpcResponse.VERSION.equals(request.jsonrpc()) || method == null) {
                throw new RpcException(RpcException.INVALID_REQUEST, "invalid request");
            }
            final Object result = dispatch(method, request);
            DebugLogger.logRpc(LogFormatter.formatRpc(method, micros(start)));
            return JsonRpcResponse.success(request.id(), result);
        } catch (RuntimeException e) {
            final JsonRpcError error = toError(e);
            if (error.code() == RpcException.INTERNAL_ERROR) {
                log.warn("{} failed", method, e);
            } else {
                log.debug("{} failed: {}", method, e.getMessage());
            }
            DebugLogger.logRpc(LogFormatter.formatRpcError(
                    String.valueOf(method), error.code(), error.message(), micros(start)));
            return JsonRpcResponse.failure(request.id(), error);
        }
    }

    /**
     * Handles a request in JSON text form.
     *
     * <p>
     * A body that is not JSON is a parse error. A body that is JSON but not a
     * request object is an invalid request, and {@code params} that are not an
     * array are invalid params; the request id is echoed whenever one was sent.
     *
     * @param json the request body
     * @return the response body
     */
    public String handle(final String json) {
        final JsonNode body;
        try {
            body = MAPPER.readTree(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("unparseable request: {}", e.getMessage());
            return write(JsonRpcResponse.failure(null,
                    new JsonRpcError(RpcException.PARSE_ERROR, "parse error", null)));
        }
        if (body == null || body.isMissingNode()) {
            return write(JsonRpcResponse.failure(null,
                    new JsonRpcError(RpcException.PARSE_ERROR, "parse error", null)));
        }
        if (!body.isObject()) {
            return write(JsonRpcResponse.failure(null,
                    new JsonRpcError(RpcException.INVALID_REQUEST, "invalid request", null)));
        }
        final Object id = idOf(body);
        final JsonNode params = body.get("params");
        if (params != null && !params.isNull() && !params.isArray()) {
            return write(JsonRpcResponse.failure(id,
                    new JsonRpcError(RpcException.INVALID_PARAMS, "invalid params: params must be an array", null)));
        }
        final JsonRpcRequest request;
        try {
            request = MAPPER.treeToValue(body, JsonRpcRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("invalid request: {}", e.getMessage());
            return write(JsonRpcResponse.failure(id,
                    new JsonRpcError(RpcException.INVALID_REQUEST, "invalid request", null)));
        }
        return write(handle(request));
    }

    private static @Nullable Object idOf(final JsonNode body) {
        final JsonNode id = body.get("id");
        if (id == null || id.isNull()) {
            return null;
        }
        return MAPPER.convertValue(id, Object.class);
    }

    private @Nullable Object dispatch(final String method, final JsonRpcRequest request) {
        switch (method) {
            case GET_TRANSACTION_RECEIPT:
                return api.getTransactionReceipt(RpcUtils.hashParam(request.params(), 0)).orElse(null);
            case GET_TX_LIST_BY_HEIGHT:
                return api.getTxListByHeight(RpcUtils.blockTagParam(request.params(), 0));
            case GET_INTERNAL_CALL_STACK:
                return api.getInternalCallStack(RpcUtils.hashParam(request.params(), 0)).orElse(null);
            default:
                throw new RpcException(RpcException.METHOD_NOT_FOUND, "method not found: " + method);
        }
    }

    private static JsonRpcError toError(final RuntimeException e) {
        if (e instanceof RpcException rpc) {
            return new JsonRpcError(rpc.code(), rpc.getMessage(), rpc.data());
        }
        if (e instanceof MalformedTraceException malformed) {
            return new JsonRpcError(RpcException.MALFORMED_TRACE, malformed.getMessage(), malformed.transactionHash());
        }
        if (e instanceof TraceLimitExceededException limit) {
            return new JsonRpcError(RpcException.LIMIT_EXCEEDED, limit.getMessage(), null);
        }
        return new JsonRpcError(RpcException.INTERNAL_ERROR, "internal error", null);
    }

    private static String write(final JsonRpcResponse response) {
        final ObjectNode node = MAPPER.valueToTree(response);
        // JSON-RPC forbids "result" next to "error"; a successful null result keeps it.
        if (response.hasError()) {
            node.remove("result");
        }
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize JSON-RPC response", e);
        }
    }

    private static long micros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }
}
