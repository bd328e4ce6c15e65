// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.calltrace.core.error.MalformedTraceException;
import sh.calltrace.core.types.HexData;

class CallTreeBuilderTest {

    @Nested
    @DisplayName("well-formed traces")
    class WellFormed {

        @Test
        void emptyTraceHasNoRoot() {
            assertEquals(Optional.empty(), CallTreeBuilder.build(TransactionTrace.EMPTY));
        }

        @Test
        void singleCallIsALeafRoot() {
            CallNode root = CallTreeBuilder.build(InternalCallsFixture.ofDepths(0)).orElseThrow();

            assertEquals(0, root.depth());
            assertTrue(root.children().isEmpty());
            assertTrue(root.isResolved());
            assertEquals(HexData.fromBytes(new byte[] {0}), root.result().output());
        }

        @Test
        void rebuildsTwoByTwoFanOut() {
            TransactionTrace trace = InternalCallsFixture.trace();

            CallNode root = CallTreeBuilder.build(trace).orElseThrow();

            assertEquals(7, root.size());
            assertEquals(InternalCallsFixture.EOA, root.sender());
            assertEquals(InternalCallsFixture.CONTRACT1, root.destination());
            assertEquals(2, root.children().size());
            for (CallNode middle : root.children()) {
                assertEquals(1, middle.depth());
                assertEquals(InternalCallsFixture.CONTRACT2, middle.destination());
                assertEquals(2, middle.children().size());
                assertEquals(CallKind.CALL, middle.children().get(0).kind());
                assertEquals(CallKind.STATICCALL, middle.children().get(1).kind());
                for (CallNode leaf : middle.children()) {
                    assertTrue(leaf.children().isEmpty());
                    assertEquals(InternalCallsFixture.CONTRACT3, leaf.destination());
                }
            }
        }

        @Test
        @DisplayName("returns are matched in completion order")
        void matchesReturnsToCallsInCompletionOrder() {
            CallNode root = CallTreeBuilder.build(InternalCallsFixture.trace()).orElseThrow();

            assertEquals(890031L, root.result().gasLeft());
            CallNode first = root.children().get(0);
            CallNode second = root.children().get(1);
            assertEquals(890032L, first.result().gasLeft());
            assertEquals(879854L, first.children().get(0).result().gasLeft());
            assertEquals(876640L, first.children().get(1).result().gasLeft());
            assertEquals(876471L, second.result().gasLeft());
            assertEquals(866805L, second.children().get(0).result().gasLeft());
            assertEquals(863291L, second.children().get(1).result().gasLeft());
        }

        @Test
        void preOrderMatchesCallEventOrder() {
            TransactionTrace trace = InternalCallsFixture.trace();

            CallNode root = CallTreeBuilder.build(trace).orElseThrow();

            List<CallEvent> visited = new ArrayList<>();
            Deque<CallNode> pending = new ArrayDeque<>();
            pending.push(root);
            while (!pending.isEmpty()) {
                CallNode node = pending.pop();
                visited.add(node.call());
                for (int i = node.children().size() - 1; i >= 0; i--) {
                    pending.push(node.children().get(i));
                }
            }
            assertEquals(trace.calls(), visited);
        }

        @Test
        void everyChildIsOneLevelBelowItsParent() {
            CallNode root = CallTreeBuilder.build(InternalCallsFixture.ofDepths(0, 1, 2, 3, 1, 2, 1)).orElseThrow();

            Deque<CallNode> pending = new ArrayDeque<>();
            pending.push(root);
            while (!pending.isEmpty()) {
                CallNode node = pending.pop();
                assertTrue(node.isResolved());
                for (CallNode child : node.children()) {
                    assertEquals(node.depth() + 1, child.depth());
                    pending.push(child);
                }
            }
            assertEquals(7, root.size());
        }

        @Test
        void handlesChainsDeeperThanTheJavaStack() {
            TransactionTrace trace = deepChain(50_000);

            CallNode root = CallTreeBuilder.build(trace).orElseThrow();

            assertEquals(50_000, root.size());
            assertEquals(49_999, trace.maxDepth());
        }

        private TransactionTrace deepChain(int length) {
            List<CallEvent> calls = new ArrayList<>(length);
            List<ReturnEvent> returns = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                calls.add(CallEvent.of(i, InternalCallsFixture.CONTRACT1, InternalCallsFixture.CONTRACT2,
                        HexData.EMPTY, CallKind.CALL));
                returns.add(new ReturnEvent(HexData.EMPTY, 0, 0L));
            }
            return new TransactionTrace(calls, returns);
        }
    }

    @Nested
    @DisplayName("malformed traces")
    class Malformed {

        @Test
        void rejectsDepthJump() {
            MalformedTraceException ex = assertThrows(MalformedTraceException.class,
                    () -> CallTreeBuilder.build(InternalCallsFixture.ofDepths(0, 2)));

            assertEquals(1, ex.eventIndex());
            assertTrue(ex.getMessage().contains("depth jumps from 0 to 2"));
        }

        @Test
        void rejectsDepthJumpBelowANestedCall() {
            MalformedTraceException ex = assertThrows(MalformedTraceException.class,
                    () -> CallTreeBuilder.build(InternalCallsFixture.ofDepths(0, 1, 1, 3)));

            assertEquals(3, ex.eventIndex());
        }

        @Test
        void rejectsNonZeroFirstDepth() {
            MalformedTraceException ex = assertThrows(MalformedTraceException.class,
                    () -> CallTreeBuilder.build(InternalCallsFixture.ofDepths(1, 2)));

            assertEquals(0, ex.eventIndex());
        }

        @Test
        void rejectsSecondTopLevelCall() {
            MalformedTraceException ex = assertThrows(MalformedTraceException.class,
                    () -> CallTreeBuilder.build(InternalCallsFixture.ofDepths(0, 1, 0)));

            assertEquals(2, ex.eventIndex());
            assertTrue(ex.getMessage().contains("second top-level call"));
        }

        @Test
        void rejectsMissingReturn() {
            TransactionTrace full = InternalCallsFixture.trace();
            TransactionTrace trace = new TransactionTrace(full.calls(), full.returns().subList(0, 6));

            MalformedTraceException ex = assertThrows(MalformedTraceException.class,
                    () -> CallTreeBuilder.build(trace));

            assertEquals(-1, ex.eventIndex());
            assertTrue(ex.getMessage().contains("7 call events but 6 return events"));
        }

        @Test
        void rejectsReturnsWithoutCalls() {
            TransactionTrace trace = new TransactionTrace(
                    List.of(), List.of(new ReturnEvent(HexData.EMPTY, 0, 0L)));

            assertThrows(MalformedTraceException.class, () -> CallTreeBuilder.build(trace));
        }
    }
}
