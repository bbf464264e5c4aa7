package dao.tron.txverify.client;

import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.Hash32;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Ledger kept in process memory. Selected with {@code ledger.mode=in-memory}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "in-memory")
public class InMemoryLedgerClient implements LedgerClient {

    private static final Comparator<BatchDescriptor> NEWEST_FIRST =
            Comparator.comparing(BatchDescriptor::createdAt)
                    .thenComparing(BatchDescriptor::batchId)
                    .reversed();

    // key: batchId
    private final Map<String, BatchDescriptor> batchesById = new ConcurrentHashMap<>();

    private final AtomicLong indexQueries = new AtomicLong();

    public void save(BatchDescriptor batch) {
        batchesById.put(batch.batchId(), batch);
    }

    public void clear() {
        batchesById.clear();
    }

    /** Index queries served so far. */
    public long getIndexQueryCount() {
        return indexQueries.get();
    }

    @Override
    public List<BatchDescriptor> queryBatchIndex(BatchIndexFilter filter) {
        indexQueries.incrementAndGet();
        Stream<BatchDescriptor> matching = batchesById.values().stream()
                .filter(filter::matches)
                .sorted(NEWEST_FIRST);
        if (filter.limit() > 0) {
            matching = matching.limit(filter.limit());
        }
        List<BatchDescriptor> result = matching.toList();
        log.debug("In-memory index query {} -> {} batches", filter, result.size());
        return result;
    }

    @Override
    public Optional<Hash32> getBatchRoot(String batchId) {
        return Optional.ofNullable(batchesById.get(batchId)).map(BatchDescriptor::merkleRoot);
    }

    @Override
    public long countBatches() {
        return batchesById.size();
    }

    @Override
    public String getNetwork() {
        return "in-memory";
    }

    @Override
    public String getContractAddress() {
        return "in-memory";
    }
}
