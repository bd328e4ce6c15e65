// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import java.util.List;
import java.util.Optional;

import sh.calltrace.core.model.TransactionReceipt;
import sh.calltrace.core.trace.CallStackView;
import sh.calltrace.core.types.Hash;

/**
 * Receipt lookups enriched with each transaction's internal calls.
 * <p>
 * Every receipt carries {@code internalTransactions}, the flattened call tree
 * of the transaction. A receipt returned by {@link #getTxListByHeight(BlockTag)}
 * is equal to the one {@link #getTransactionReceipt(Hash)} returns for the same
 * transaction.
 *
 * <pre>{@code
 * ReceiptApi api = new DefaultReceiptApi(backend);
 * api.getTransactionReceipt(hash)
 *         .ifPresent(r -> r.internalTransactions().forEach(System.out::println));
 * }</pre>
 *
 * @since 0.1.0
 */
public interface ReceiptApi {

    /**
     * @param hash the transaction hash
     * @return the receipt, or empty if the transaction is unknown
     * @throws sh.calltrace.core.error.MalformedTraceException      if the trace is malformed and the
     *                                                             policy is {@link MalformedTracePolicy#FAIL}
     * @throws sh.calltrace.core.error.TraceLimitExceededException if the trace exceeds the configured limits
     */
    Optional<TransactionReceipt> getTransactionReceipt(Hash hash);

    /**
     * @param block the block to list
     * @return the receipts of every transaction in the block, in block order
     * @throws sh.calltrace.core.error.MalformedTraceException      if a trace is malformed and the
     *                                                             policy is {@link MalformedTracePolicy#FAIL}
     * @throws sh.calltrace.core.error.TraceLimitExceededException if a trace exceeds the configured limits
     */
    List<TransactionReceipt> getTxListByHeight(BlockTag block);

    /**
     * Returns the nested call stack of a transaction, for inspection.
     *
     * @param hash the transaction hash
     * @return the call stack, or empty if the transaction is unknown or made no calls
     * @throws sh.calltrace.core.error.MalformedTraceException      if the trace is malformed, whatever
     *                                                             the policy
     * @throws sh.calltrace.core.error.TraceLimitExceededException if the trace exceeds the configured limits
     */
    Optional<CallStackView> getInternalCallStack(Hash hash);
}
