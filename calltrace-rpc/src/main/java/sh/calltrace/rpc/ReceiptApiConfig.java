// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import sh.calltrace.core.trace.TraceLimits;

/**
 * Configuration for {@link DefaultReceiptApi}.
 * <p>
 * A {@code null} component falls back to its default:
 * {@link TraceLimits#DEFAULTS} and {@link MalformedTracePolicy#FAIL}.
 *
 * <pre>{@code
 * ReceiptApiConfig config = ReceiptApiConfig.builder()
 *         .limits(new TraceLimits(50_000, 1024))
 *         .malformedTracePolicy(MalformedTracePolicy.OMIT)
 *         .build();
 * }</pre>
 *
 * @param limits               bounds checked before any call tree is built
 * @param malformedTracePolicy receipt behavior for malformed traces
 * @since 0.1.0
 */
public record ReceiptApiConfig(TraceLimits limits, MalformedTracePolicy malformedTracePolicy) {

    private static final ReceiptApiConfig DEFAULTS =
            new ReceiptApiConfig(TraceLimits.DEFAULTS, MalformedTracePolicy.FAIL);

    public ReceiptApiConfig {
        limits = limits == null ? TraceLimits.DEFAULTS : limits;
        malformedTracePolicy = malformedTracePolicy == null ? MalformedTracePolicy.FAIL : malformedTracePolicy;
    }

    public static ReceiptApiConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ReceiptApiConfig}.
     */
    public static final class Builder {
        private TraceLimits limits;
        private MalformedTracePolicy malformedTracePolicy;

        private Builder() {
        }

        /**
         * Sets the trace limits. Default: {@link TraceLimits#DEFAULTS}.
         */
        public Builder limits(TraceLimits limits) {
            this.limits = limits;
            return this;
        }

        /**
         * Sets the malformed-trace policy. Default: {@link MalformedTracePolicy#FAIL}.
         */
        public Builder malformedTracePolicy(MalformedTracePolicy policy) {
            this.malformedTracePolicy = policy;
            return this;
        }

        public ReceiptApiConfig build() {
            return new ReceiptApiConfig(limits, malformedTracePolicy);
        }
    }
}
