// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import java.util.List;
import java.util.Optional;

import sh.calltrace.core.model.ExecutedTransaction;
import sh.calltrace.core.types.Hash;

/**
 * Read access to executed transactions held by the node's storage layer.
 * <p>
 * Implementations are expected to be thread-safe; the receipt API calls them
 * from request threads without additional synchronization.
 *
 * @since 0.1.0
 */
public interface TransactionBackend {

    /**
     * Looks up an executed transaction by hash.
     *
     * @param hash the transaction hash
     * @return the transaction, or empty if it is unknown
     */
    Optional<ExecutedTransaction> findTransaction(Hash hash);

    /**
     * Lists the transactions of one block in block order.
     *
     * @param height the block number
     * @return the block's transactions; empty if the block has none or does not exist
     */
    List<ExecutedTransaction> transactionsAtHeight(long height);

    /**
     * @return the number of the most recent block
     */
    long latestHeight();
}
