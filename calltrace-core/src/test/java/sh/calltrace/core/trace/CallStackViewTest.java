// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import sh.calltrace.core.types.HexData;

class CallStackViewTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void rendersFixtureAsNestedCallStack() throws Exception {
        CallStackView view = ReceiptProjector.callStack(InternalCallsFixture.trace()).orElseThrow();

        JsonNode expected = mapper.readTree(InternalCallsFixture.CALL_STACK_JSON);
        assertEquals(expected, mapper.valueToTree(view));
        assertEquals(7, view.size());
    }

    @Test
    void leavesSerializeCallsAsNull() {
        CallStackView view = ReceiptProjector.callStack(InternalCallsFixture.ofDepths(0)).orElseThrow();

        JsonNode json = mapper.valueToTree(view);

        assertTrue(json.has("Calls"));
        assertTrue(json.get("Calls").isNull());
        assertEquals(0, json.get("StatusCode").asInt());
        assertTrue(json.get("GasLeft").isNumber());
    }

    @Test
    void emptyCallListIsNormalizedToNull() {
        CallStackView view = new CallStackView(InternalCallsFixture.EOA, InternalCallsFixture.CONTRACT1,
                HexData.EMPTY, HexData.EMPTY, 0, 0L, List.of());

        assertNull(view.calls());
    }

    @Test
    void viewOfDeepChainDoesNotRecurse() {
        CallNode root = CallTreeBuilder.build(InternalCallsFixture.ofDepths(chain(20_000))).orElseThrow();

        assertEquals(20_000, CallStackView.of(root).size());
    }

    private static int[] chain(int length) {
        int[] depths = new int[length];
        for (int i = 0; i < length; i++) {
            depths[i] = i;
        }
        return depths;
    }
}
