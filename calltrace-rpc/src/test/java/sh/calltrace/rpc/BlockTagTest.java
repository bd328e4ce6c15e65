// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class BlockTagTest {

    @Test
    void parsesNamedTags() {
        assertEquals(BlockTag.LATEST, BlockTag.parse("latest"));
        assertEquals(BlockTag.EARLIEST, BlockTag.parse("EARLIEST"));
    }

    @Test
    void parsesHexNumbers() {
        assertEquals(BlockTag.of(26L), BlockTag.parse("0x1a"));
        assertEquals(BlockTag.of(0L), BlockTag.parse("0x0"));
        assertEquals("0x1a", BlockTag.of(26L).toRpcValue());
        assertEquals("latest", BlockTag.LATEST.toRpcValue());
    }

    @Test
    void rejectsUnsupportedValues() {
        assertThrows(IllegalArgumentException.class, () -> BlockTag.parse("pending"));
        assertThrows(IllegalArgumentException.class, () -> BlockTag.parse(""));
        assertThrows(IllegalArgumentException.class, () -> BlockTag.parse(null));
        assertThrows(IllegalArgumentException.class, () -> BlockTag.parse("0x"));
        assertThrows(IllegalArgumentException.class, () -> BlockTag.parse("0xffffffffffffffff"));
        assertThrows(IllegalArgumentException.class, () -> BlockTag.of(-1L));
    }
}
