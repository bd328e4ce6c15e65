// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.core.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import sh.calltrace.core.types.Address;
import sh.calltrace.core.types.Hash;
import sh.calltrace.core.types.HexData;
import sh.calltrace.core.types.Quantity;

/**
 * An event log emitted while executing a transaction.
 *
 * @param address         the contract that emitted the log
 * @param topics          the indexed topics (topic[0] is usually the event signature)
 * @param data            the non-indexed data, may be empty
 * @param blockHash       hash of the containing block, {@code null} while pending
 * @param transactionHash hash of the emitting transaction
 * @param logIndex        position of the log within the block
 * @param removed         true if the log was removed by a reorganization
 */
@JsonPropertyOrder({"address", "topics", "data", "blockHash", "transactionHash", "logIndex", "removed"})
public record LogEntry(
        Address address,
        List<Hash> topics,
        HexData data,
        @Nullable Hash blockHash,
        Hash transactionHash,
        Quantity logIndex,
        boolean removed) {

    public LogEntry {
        Objects.requireNonNull(address, "address cannot be null");
        Objects.requireNonNull(topics, "topics cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(logIndex, "logIndex cannot be null");
        topics = List.copyOf(topics);
    }
}
