// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.calltrace.core.trace.TraceLimits;

class ReceiptApiConfigTest {

    @Test
    void defaultsFailOnMalformedTraces() {
        ReceiptApiConfig config = ReceiptApiConfig.defaults();

        assertEquals(TraceLimits.DEFAULTS, config.limits());
        assertEquals(MalformedTracePolicy.FAIL, config.malformedTracePolicy());
        assertEquals(config, ReceiptApiConfig.builder().build());
    }

    @Test
    void builderOverridesDefaults() {
        TraceLimits limits = new TraceLimits(50_000, 512);

        ReceiptApiConfig config = ReceiptApiConfig.builder()
                .limits(limits)
                .malformedTracePolicy(MalformedTracePolicy.OMIT)
                .build();

        assertEquals(limits, config.limits());
        assertEquals(MalformedTracePolicy.OMIT, config.malformedTracePolicy());
    }

    @Test
    void nullComponentsFallBackToDefaults() {
        assertEquals(ReceiptApiConfig.defaults(), new ReceiptApiConfig(null, null));
    }
}
