package dao.tron.txverify.client;

import dao.tron.txverify.exception.CollaboratorException;
import dao.tron.txverify.model.BatchContents;
import dao.tron.txverify.model.BatchDescriptor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Batch payloads kept in process memory, keyed by batch id. Selected with {@code storage.mode=in-memory}.
 */
@Repository
@ConditionalOnProperty(prefix = "storage", name = "mode", havingValue = "in-memory")
public class InMemoryBatchContentStore implements BatchContentStore {

    private final Map<String, BatchContents> contentsByBatchId = new ConcurrentHashMap<>();

    private final AtomicLong fetches = new AtomicLong();

    public void save(BatchContents contents) {
        contentsByBatchId.put(contents.batchId(), contents);
    }

    public long getFetchCount() {
        return fetches.get();
    }

    @Override
    public BatchContents fetchBatchContents(BatchDescriptor batch) {
        fetches.incrementAndGet();
        BatchContents contents = contentsByBatchId.get(batch.batchId());
        if (contents == null) {
            throw new CollaboratorException("No stored contents for batch " + batch.batchId());
        }
        return contents;
    }
}
