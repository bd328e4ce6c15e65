// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.trace;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.HexData;
import sh.calltrace.core.types.Quantity;
import sh.calltrace.core.types.Wei;

/**
 * One entry of a receipt's {@code internalTransactions} list.
 * <p>
 * Serializes to
 * <pre>{@code
 * {
 *   "callPath": "staticcall_0_0_1",
 *   "from": "0xa8115c4df61f9fb1e686d1692cd53fa4d4ced237",
 *   "to": "0x0eefec15be847ced628df09459cb9b8492337210",
 *   "gas": "0xd62ad",
 *   "value": "0x0",
 *   "input": "0x09010e93...",
 *   "status": "0x0",
 *   "gasUsed": "0x24d",
 *   "output": "0x...0103..."
 * }
 * }</pre>
 * with {@code gas} left out when the engine did not report entry gas.
 *
 * @param callPath the call's canonical path
 * @param from     the caller
 * @param to       the callee
 * @param gas      gas available at entry, or {@code null} if not tracked
 * @param value    value transferred
 * @param input    calldata
 * @param status   engine status code, 0 for success
 * @param gasUsed  gas consumed by the call, 0 when entry gas is not tracked
 * @param output   return data
 * @since 0.1.0
 */
@JsonPropertyOrder({"callPath", "from", "to", "gas", "value", "input", "status", "gasUsed", "output"})
public record InternalTransaction(
        CallPath callPath,
        Address from,
        Address to,
        @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Quantity gas,
        Wei value,
        HexData input,
        Quantity status,
        Quantity gasUsed,
        HexData output) {

    public InternalTransaction {
        Objects.requireNonNull(callPath, "callPath cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(gasUsed, "gasUsed cannot be null");
        Objects.requireNonNull(output, "output cannot be null");
    }
}
