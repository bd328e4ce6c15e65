// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class QuantityTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void usesMinimalHex() {
        assertEquals("0x0", Quantity.ZERO.toHexString());
        assertEquals("0x15abd", Quantity.of(88765L).toHexString());
        assertEquals(Quantity.of(88765L), Quantity.fromHex("0x015abd"));
        assertSame(Quantity.ZERO, Quantity.of(0L));
    }

    @Test
    void serializesAsQuantityString() throws Exception {
        assertEquals("\"0xeef6c\"", mapper.writeValueAsString(Quantity.of(0xeef6cL)));
        assertEquals("\"0x0\"", mapper.writeValueAsString(Wei.ZERO));
    }

    @Test
    void weiSupportsValuesBeyondLong() {
        Wei wei = Wei.of(BigInteger.ONE.shiftLeft(80));

        assertEquals("0x100000000000000000000", wei.toHexString());
        assertEquals("0x3e8", Wei.of(1000L).toHexString());
    }

    @Test
    void weiRejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> Wei.of(-1L));
    }
}
