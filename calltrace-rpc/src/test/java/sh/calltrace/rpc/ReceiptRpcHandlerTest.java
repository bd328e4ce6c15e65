// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.calltrace.core.error.RpcException;
import sh.calltrace.core.model.TransactionReceipt;
import sh.calltrace.core.trace.ReceiptProjector;
import sh.calltrace.core.trace.TraceLimits;

/**
 * Unit tests for {@link ReceiptRpcHandler} over a {@link DefaultReceiptApi} with a mock backend.
 */
@ExtendWith(MockitoExtension.class)
class ReceiptRpcHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private TransactionBackend backend;

    private ReceiptRpcHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ReceiptRpcHandler(new DefaultReceiptApi(backend));
    }

    private static JsonRpcRequest request(String method, Object... params) {
        return new JsonRpcRequest("2.0", method, List.of(params), "1");
    }

    private static String json(String method, String params) {
        return "{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"" + method + "\",\"params\":" + params + "}";
    }

    // ==================== eth_getTransactionReceipt ====================

    @Test
    void receiptIncludesInternalTransactions() throws Exception {
        // Given
        when(backend.findTransaction(TestTransactions.FAN_OUT_HASH))
                .thenReturn(Optional.of(TestTransactions.FAN_OUT));

        // When
        String response = handler.handle(json(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT,
                "[\"" + TestTransactions.FAN_OUT_HASH.value() + "\"]"));

        // Then
        JsonNode node = mapper.readTree(response);
        assertEquals("2.0", node.get("jsonrpc").asText());
        assertTrue(node.get("id").isInt());
        assertEquals(7, node.get("id").asInt());
        assertFalse(node.has("error"));
        JsonNode internal = node.get("result").get("internalTransactions");
        assertEquals(mapper.valueToTree(ReceiptProjector.project(TestTransactions.fanOutTrace())), internal);
        assertEquals("staticcall_0_1_1", internal.get(6).get("callPath").asText());
        assertEquals("0x24d", internal.get(6).get("gasUsed").asText());
    }

    @Test
    void unknownHashReturnsNullResult() throws Exception {
        // Given
        when(backend.findTransaction(TestTransactions.UNKNOWN_HASH)).thenReturn(Optional.empty());

        // When
        String response = handler.handle(json(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT,
                "[\"" + TestTransactions.UNKNOWN_HASH.value() + "\"]"));

        // Then
        JsonNode node = mapper.readTree(response);
        assertTrue(node.has("result"));
        assertTrue(node.get("result").isNull());
        assertFalse(node.has("error"));
    }

    @Test
    void echoesRequestIdUnchanged() throws Exception {
        // Given
        when(backend.findTransaction(TestTransactions.UNKNOWN_HASH)).thenReturn(Optional.empty());
        String params = "[\"" + TestTransactions.UNKNOWN_HASH.value() + "\"]";

        // When
        String numeric = handler.handle("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\""
                + ReceiptRpcHandler.GET_TRANSACTION_RECEIPT + "\",\"params\":" + params + "}");
        String text = handler.handle("{\"jsonrpc\":\"2.0\",\"id\":\"abc\",\"method\":\""
                + ReceiptRpcHandler.GET_TRANSACTION_RECEIPT + "\",\"params\":" + params + "}");

        // Then
        assertTrue(numeric.contains("\"id\":1"));
        assertEquals(mapper.readTree("1"), mapper.readTree(numeric).get("id"));
        assertEquals(mapper.readTree("\"abc\""), mapper.readTree(text).get("id"));
    }

    @Test
    void typedRequestReturnsTypedResult() {
        // Given
        when(backend.findTransaction(TestTransactions.FAN_OUT_HASH))
                .thenReturn(Optional.of(TestTransactions.FAN_OUT));

        // When
        JsonRpcResponse response = handler.handle(
                request(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, TestTransactions.FAN_OUT_HASH.value()));

        // Then
        assertFalse(response.hasError());
        TransactionReceipt receipt = (TransactionReceipt) response.result();
        assertEquals(7, receipt.internalTransactions().size());
        assertEquals("1", response.id());
        JsonNode json = response.resultAs(JsonNode.class);
        assertEquals("call_0_1", json.get("internalTransactions").get(4).get("callPath").asText());
    }

    // ==================== sbch_getTxListByHeight ====================

    @Test
    void listsBlockReceipts() throws Exception {
        // Given
        when(backend.transactionsAtHeight(TestTransactions.HEIGHT))
                .thenReturn(List.of(TestTransactions.FAN_OUT, TestTransactions.TRANSFER));

        // When
        String response = handler.handle(json(ReceiptRpcHandler.GET_TX_LIST_BY_HEIGHT, "[\"0x1a\"]"));

        // Then
        JsonNode result = mapper.readTree(response).get("result");
        assertEquals(2, result.size());
        assertEquals(7, result.get(0).get("internalTransactions").size());
        assertEquals(0, result.get(1).get("internalTransactions").size());
        assertEquals(TestTransactions.TRANSFER_HASH.value(), result.get(1).get("transactionHash").asText());
    }

    @Test
    void acceptsNumericHeightAndLatest() {
        // Given
        when(backend.latestHeight()).thenReturn(TestTransactions.HEIGHT);
        when(backend.transactionsAtHeight(TestTransactions.HEIGHT)).thenReturn(List.of(TestTransactions.TRANSFER));

        // When
        JsonRpcResponse byNumber = handler.handle(request(ReceiptRpcHandler.GET_TX_LIST_BY_HEIGHT, 26));
        JsonRpcResponse byLatest = handler.handle(request(ReceiptRpcHandler.GET_TX_LIST_BY_HEIGHT, "latest"));

        // Then
        assertFalse(byNumber.hasError());
        assertEquals(byNumber.result(), byLatest.result());
    }

    // ==================== debug_getInternalCallStack ====================

    @Test
    void callStackUsesNestedShape() throws Exception {
        // Given
        when(backend.findTransaction(TestTransactions.FAN_OUT_HASH))
                .thenReturn(Optional.of(TestTransactions.FAN_OUT));

        // When
        String response = handler.handle(json(ReceiptRpcHandler.GET_INTERNAL_CALL_STACK,
                "[\"" + TestTransactions.FAN_OUT_HASH.value() + "\"]"));

        // Then
        JsonNode root = mapper.readTree(response).get("result");
        assertEquals(TestTransactions.EOA.value(), root.get("From").asText());
        assertEquals(890031L, root.get("GasLeft").asLong());
        JsonNode leaf = root.get("Calls").get(1).get("Calls").get(1);
        assertEquals(863291L, leaf.get("GasLeft").asLong());
        assertTrue(leaf.get("Calls").isNull());
    }

    // ==================== errors ====================

    @Test
    void malformedTraceReportsTransactionHash() throws Exception {
        // Given
        when(backend.findTransaction(TestTransactions.MALFORMED_HASH))
                .thenReturn(Optional.of(TestTransactions.MALFORMED));

        // When
        String response = handler.handle(json(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT,
                "[\"" + TestTransactions.MALFORMED_HASH.value() + "\"]"));

        // Then
        JsonNode node = mapper.readTree(response);
        assertFalse(node.has("result"));
        assertEquals(RpcException.MALFORMED_TRACE, node.get("error").get("code").asInt());
        assertEquals(TestTransactions.MALFORMED_HASH.value(), node.get("error").get("data").asText());
    }

    @Test
    void traceOverLimitsMapsToLimitCode() {
        // Given
        handler = new ReceiptRpcHandler(new DefaultReceiptApi(backend,
                ReceiptApiConfig.builder().limits(new TraceLimits(100, 1)).build()));
        when(backend.findTransaction(TestTransactions.FAN_OUT_HASH))
                .thenReturn(Optional.of(TestTransactions.FAN_OUT));

        // When
        JsonRpcResponse response = handler.handle(
                request(ReceiptRpcHandler.GET_INTERNAL_CALL_STACK, TestTransactions.FAN_OUT_HASH.value()));

        // Then
        assertTrue(response.hasError());
        assertEquals(RpcException.LIMIT_EXCEEDED, response.error().code());
    }

    @Test
    void unknownMethodIsMethodNotFound() {
        JsonRpcResponse response = handler.handle(request("eth_getBalance", TestTransactions.EOA.value()));

        assertEquals(RpcException.METHOD_NOT_FOUND, response.error().code());
        assertEquals("1", response.id());
    }

    @Test
    void badParamsAreInvalidParams() {
        assertEquals(RpcException.INVALID_PARAMS,
                handler.handle(request(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT)).error().code());
        assertEquals(RpcException.INVALID_PARAMS,
                handler.handle(request(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, "0x1234")).error().code());
        assertEquals(RpcException.INVALID_PARAMS,
                handler.handle(request(ReceiptRpcHandler.GET_TX_LIST_BY_HEIGHT, "pending")).error().code());
        assertEquals(RpcException.INVALID_PARAMS,
                handler.handle(request(ReceiptRpcHandler.GET_TX_LIST_BY_HEIGHT, true)).error().code());
    }

    @Test
    void wrongVersionIsInvalidRequest() {
        JsonRpcResponse response = handler.handle(
                new JsonRpcRequest("1.0", ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, List.of(), "1"));

        assertEquals(RpcException.INVALID_REQUEST, response.error().code());
    }

    @Test
    void unparseableJsonIsParseError() throws Exception {
        JsonNode node = mapper.readTree(handler.handle("{not json"));

        assertEquals(RpcException.PARSE_ERROR, node.get("error").get("code").asInt());
        assertTrue(node.get("id").isNull());
    }

    @Test
    void nonObjectBodyIsInvalidRequest() throws Exception {
        for (String body : List.of("null", "[]", "42", "\"eth_getTransactionReceipt\"")) {
            String response = assertDoesNotThrow(() -> handler.handle(body));

            JsonNode node = mapper.readTree(response);
            assertEquals(RpcException.INVALID_REQUEST, node.get("error").get("code").asInt(), body);
            assertTrue(node.get("id").isNull(), body);
            assertFalse(node.has("result"), body);
        }
    }

    @Test
    void emptyBodyIsParseError() throws Exception {
        JsonNode node = mapper.readTree(handler.handle(""));

        assertEquals(RpcException.PARSE_ERROR, node.get("error").get("code").asInt());
    }

    @Test
    void nonArrayParamsAreInvalidParams() throws Exception {
        for (String params : List.of(
                "{\"hash\":\"" + TestTransactions.FAN_OUT_HASH.value() + "\"}",
                "\"" + TestTransactions.FAN_OUT_HASH.value() + "\"",
                "5")) {
            JsonNode node = mapper.readTree(handler.handle(json(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, params)));

            assertEquals(RpcException.INVALID_PARAMS, node.get("error").get("code").asInt(), params);
            assertEquals(7, node.get("id").asInt(), params);
        }
    }

    @Test
    void nullParamsAreTreatedAsEmpty() throws Exception {
        JsonNode node = mapper.readTree(handler.handle(json(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, "null")));

        assertEquals(RpcException.INVALID_PARAMS, node.get("error").get("code").asInt());
        assertTrue(node.get("error").get("message").asText().contains("missing parameter 0"));
    }

    @Test
    void unexpectedFailureIsInternalError(@Mock ReceiptApi api) {
        // Given
        when(api.getTransactionReceipt(any())).thenThrow(new IllegalStateException("storage offline"));
        handler = new ReceiptRpcHandler(api);

        // When
        JsonRpcResponse response = handler.handle(
                request(ReceiptRpcHandler.GET_TRANSACTION_RECEIPT, TestTransactions.FAN_OUT_HASH.value()));

        // Then
        assertEquals(RpcException.INTERNAL_ERROR, response.error().code());
        assertEquals("internal error", response.error().message());
    }
}
