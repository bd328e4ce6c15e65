// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    @Test
    void shortensHashes() {
        assertEquals("0x9e1a...2817",
                LogFormatter.shortenHash("0x9e1a7c3b3a3b7d1f0d1e6c5b4a39281706f5e4d3c2b1a09f8e7d6c5b4a392817"));
        assertEquals("0x1234", LogFormatter.shortenHash("0x1234"));
    }

    @Test
    void formatsTraceAndRpcLines() {
        assertTrue(LogFormatter.formatTraceBuilt(7, 2, 41).contains("calls=7 maxDepth=2"));
        assertTrue(LogFormatter.formatTraceLimit("depth", 1100, 1024).contains("limit=depth actual=1100 allowed=1024"));
        assertTrue(LogFormatter.formatRpc("eth_getTransactionReceipt", 1_500_000).contains("duration=1.50s"));
        String error = LogFormatter.formatRpcError("debug_getInternalCallStack", -32000, "malformed", 950);
        assertTrue(error.contains("code=-32000"), error);
        assertTrue(error.contains("duration=0.95ms"), error);
    }
}
