// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.calltrace.core.trace.TransactionTrace;
import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.Hash;

/**
 * A transaction as recorded after execution: where it landed, how it ended,
 * and the internal-call trace reported by the execution engine.
 * <p>
 * This is what a storage backend hands to the receipt API. The call tree is
 * not stored; it is rebuilt from {@link #trace()} whenever a receipt is served.
 *
 * @param hash              transaction hash
 * @param blockHash         hash of the containing block
 * @param blockNumber       height of the containing block
 * @param transactionIndex  position within the block
 * @param from              sender
 * @param to                recipient, or {@code null} for contract creation
 * @param contractAddress   created contract, or {@code null} if none was created
 * @param status            true if execution succeeded
 * @param gasUsed           gas used by this transaction
 * @param cumulativeGasUsed gas used by the block up to and including this transaction
 * @param logs              emitted logs
 * @param trace             internal call and return events
 * @since 0.1.0
 */
public record ExecutedTransaction(
        Hash hash,
        Hash blockHash,
        long blockNumber,
        int transactionIndex,
        Address from,
        @Nullable Address to,
        @Nullable Address contractAddress,
        boolean status,
        long gasUsed,
        long cumulativeGasUsed,
        List<LogEntry> logs,
        TransactionTrace trace) {

    public ExecutedTransaction {
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber cannot be negative: " + blockNumber);
        }
        if (transactionIndex < 0) {
            throw new IllegalArgumentException("transactionIndex cannot be negative: " + transactionIndex);
        }
        logs = logs == null ? List.of() : List.copyOf(logs);
        trace = trace == null ? TransactionTrace.EMPTY : trace;
    }
}
