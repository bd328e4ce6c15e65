// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.Objects;

import sh.calltrace.core.types.HexData;

/**
 * A call completing, as reported by the execution engine.
 * <p>
 * Return events carry no reference to their call. They are matched to calls
 * purely by completion order.
 *
 * @param output     return data
 * @param statusCode 0 for success, anything else for failure
 * @param gasLeft    gas remaining when the call returned
 * @since 0.1.0
 */
public record ReturnEvent(HexData output, int statusCode, long gasLeft) {

    public ReturnEvent {
        Objects.requireNonNull(output, "output cannot be null");
    }

    public boolean isSuccess() {
        return statusCode == 0;
    }
}
