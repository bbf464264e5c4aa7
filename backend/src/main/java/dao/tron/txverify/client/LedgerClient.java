package dao.tron.txverify.client;

import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.Hash32;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the ledger where batch roots are anchored.
 *
 * Implementations signal failures with {@link dao.tron.txverify.exception.TransientCollaboratorException}
 * (worth retrying) or {@link dao.tron.txverify.exception.CollaboratorException} (not).
 */
public interface LedgerClient {

    /**
     * Batches matching {@code filter}, most recent first, at most {@code filter.limit()} of them.
     */
    List<BatchDescriptor> queryBatchIndex(BatchIndexFilter filter);

    /**
     * Root anchored for {@code batchId}; empty when the ledger has no such batch.
     */
    Optional<Hash32> getBatchRoot(String batchId);

    long countBatches();

    String getNetwork();

    String getContractAddress();
}
