package dao.tron.txverify.client;

import dao.tron.txverify.model.BatchContents;
import dao.tron.txverify.model.BatchDescriptor;

/**
 * Source of full batch payloads (leaf digests and optional stored proofs).
 */
public interface BatchContentStore {

    /**
     * @throws dao.tron.txverify.exception.CollaboratorException when the payload is missing or malformed
     * @throws dao.tron.txverify.exception.TransientCollaboratorException when the store is unreachable
     */
    BatchContents fetchBatchContents(BatchDescriptor batch);
}
