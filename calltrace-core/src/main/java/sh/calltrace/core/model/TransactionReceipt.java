// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import sh.calltrace.core.trace.InternalTransaction;
import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.Hash;
import sh.calltrace.core.types.Quantity;

/**
 * Receipt of an executed transaction, as returned by the receipt-lookup API.
 *
 * <p>
 * Besides the usual receipt fields it carries {@code internalTransactions},
 * the flattened internal-call tree of the transaction (empty when the
 * transaction made no calls).
 *
 * <p>
 * <strong>Status interpretation:</strong> {@code 0x1} for success,
 * {@code 0x0} for a reverted transaction. Internal calls report the engine's
 * own status codes instead (0 = success).
 *
 * @param transactionHash      hash of the transaction
 * @param transactionIndex     position within the block
 * @param blockHash            hash of the containing block
 * @param blockNumber          height of the containing block
 * @param from                 sender
 * @param to                   recipient, or null for contract creation
 * @param gasUsed              gas used by this transaction
 * @param cumulativeGasUsed    gas used by the block up to this transaction
 * @param contractAddress      created contract, or null
 * @param logs                 emitted logs
 * @param status               {@code 0x1} on success, {@code 0x0} on failure
 * @param internalTransactions flattened internal calls in pre-order
 * @since 0.1.0
 */
@JsonPropertyOrder({
        "transactionHash", "transactionIndex", "blockHash", "blockNumber", "from", "to",
        "gasUsed", "cumulativeGasUsed", "contractAddress", "logs", "status", "internalTransactions"})
public record TransactionReceipt(
        Hash transactionHash,
        Quantity transactionIndex,
        Hash blockHash,
        Quantity blockNumber,
        Address from,
        @Nullable Address to,
        Quantity gasUsed,
        Quantity cumulativeGasUsed,
        @Nullable Address contractAddress,
        List<LogEntry> logs,
        Quantity status,
        List<InternalTransaction> internalTransactions) {

    private static final Quantity SUCCESS = Quantity.of(1L);

    public TransactionReceipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(transactionIndex, "transactionIndex cannot be null");
        Objects.requireNonNull(blockHash, "blockHash cannot be null");
        Objects.requireNonNull(blockNumber, "blockNumber cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(gasUsed, "gasUsed cannot be null");
        Objects.requireNonNull(cumulativeGasUsed, "cumulativeGasUsed cannot be null");
        Objects.requireNonNull(logs, "logs cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(internalTransactions, "internalTransactions cannot be null");
        logs = List.copyOf(logs);
        internalTransactions = List.copyOf(internalTransactions);
    }

    /**
     * Assembles the receipt of an executed transaction.
     *
     * @param tx                   the executed transaction
     * @param internalTransactions its flattened internal calls
     * @return the receipt
     */
    public static TransactionReceipt of(
            final ExecutedTransaction tx,
            final List<InternalTransaction> internalTransactions) {
        Objects.requireNonNull(tx, "tx");
        return new TransactionReceipt(
                tx.hash(),
                Quantity.of(tx.transactionIndex()),
                tx.blockHash(),
                Quantity.of(tx.blockNumber()),
                tx.from(),
                tx.to(),
                Quantity.of(tx.gasUsed()),
                Quantity.of(tx.cumulativeGasUsed()),
                tx.contractAddress(),
                tx.logs(),
                tx.status() ? SUCCESS : Quantity.ZERO,
                internalTransactions);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
