// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.calltrace.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.calltrace.core.DebugLogger;
import sh.calltrace.core.LogFormatter;
import sh.calltrace.core.error.MalformedTraceException;
import sh.calltrace.core.model.ExecutedTransaction;
import sh.calltrace.core.model.TransactionReceipt;
import sh.calltrace.core.trace.CallStackView;
import sh.calltrace.core.trace.InternalTransaction;
import sh.calltrace.core.trace.ReceiptProjector;
import sh.calltrace.core.types.Hash;

/**
 * {@link ReceiptApi} over a {@link TransactionBackend}.
 * <p>
 * Each lookup checks the trace against the configured {@link sh.calltrace.core.trace.TraceLimits},
 * rebuilds the call tree, projects it and discards it. Nothing is cached, so
 * receipts for the same transaction are always rebuilt identically.
 *
 * @since 0.1.0
 */
public final class DefaultReceiptApi implements ReceiptApi {

    private static final Logger log = LoggerFactory.getLogger(DefaultReceiptApi.class);

    private final TransactionBackend backend;
    private final ReceiptApiConfig config;

    public DefaultReceiptApi(final TransactionBackend backend) {
        this(backend, ReceiptApiConfig.defaults());
    }

    public DefaultReceiptApi(final TransactionBackend backend, final ReceiptApiConfig config) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public Optional<TransactionReceipt> getTransactionReceipt(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        final Optional<ExecutedTransaction> tx = backend.findTransaction(hash);
        if (tx.isEmpty()) {
            log.debug("no transaction {}", hash);
            return Optional.empty();
        }
        return Optional.of(toReceipt(tx.get()));
    }

    @Override
    public List<TransactionReceipt> getTxListByHeight(final BlockTag block) {
        Objects.requireNonNull(block, "block");
        final long height = resolveHeight(block);
        final List<ExecutedTransaction> txs = backend.transactionsAtHeight(height);
        log.debug("block {} has {} transactions", height, txs.size());

        final List<TransactionReceipt> receipts = new ArrayList<>(txs.size());
        for (ExecutedTransaction tx : txs) {
            receipts.add(toReceipt(tx));
        }
        return List.copyOf(receipts);
    }

    @Override
    public Optional<CallStackView> getInternalCallStack(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        final Optional<ExecutedTransaction> tx = backend.findTransaction(hash);
        if (tx.isEmpty()) {
            log.debug("no transaction {}", hash);
            return Optional.empty();
        }
        config.limits().check(tx.get().trace());
        try {
            return ReceiptProjector.callStack(tx.get().trace());
        } catch (MalformedTraceException e) {
            throw e.forTransaction(hash.value());
        }
    }

    private long resolveHeight(final BlockTag block) {
        if (block instanceof BlockTag.Number number) {
            return number.blockNumber();
        }
        return BlockTag.EARLIEST.equals(block) ? 0L : backend.latestHeight();
    }

    private TransactionReceipt toReceipt(final ExecutedTransaction tx) {
        config.limits().check(tx.trace());

        List<InternalTransaction> internalTransactions;
        try {
            internalTransactions = ReceiptProjector.project(tx.trace());
        } catch (MalformedTraceException e) {
            if (config.malformedTracePolicy() != MalformedTracePolicy.OMIT) {
                throw e.forTransaction(tx.hash().value());
            }
            log.warn("omitting internal transactions of {}: {}", tx.hash(), e.getMessage());
            internalTransactions = List.of();
        }

        DebugLogger.logRpc(LogFormatter.formatReceipt(
                tx.hash().value(), tx.blockNumber(), internalTransactions.size()));
        return TransactionReceipt.of(tx, internalTransactions);
    }
}
