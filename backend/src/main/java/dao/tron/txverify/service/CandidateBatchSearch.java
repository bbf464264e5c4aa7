package dao.tron.txverify.service;

import dao.tron.txverify.client.LedgerClient;
import dao.tron.txverify.config.VerifierProperties;
import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchIndexFilter;
import dao.tron.txverify.model.BatchListQuery;
import dao.tron.txverify.model.BatchPage;
import dao.tron.txverify.model.CandidateSet;
import dao.tron.txverify.model.ResolvedConstraint;
import dao.tron.txverify.model.ScoredCandidate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds and ranks the batches that may hold a transaction.
 *
 * The index is asked for the most recent {@code maxCandidates + 1} matching batches; only the
 * first {@code maxCandidates} are ranked. Truncating by recency before ranking keeps the
 * candidate count monotone: a narrower constraint never yields more candidates, and a batch
 * that matches it is never pushed out by one that doesn't.
 */
@Slf4j
@Service
public class CandidateBatchSearch {

    static final int DATABASE_EXACT = 40;
    static final int DATABASE_IGNORE_CASE = 30;
    static final int TABLE_SOLE_EXACT = 30;
    static final int TABLE_CONTAINED_EXACT = 25;
    static final int TABLE_CONTAINED_IGNORE_CASE = 20;
    static final int IN_TIME_WINDOW = 10;
    static final int OPERATION_DECLARED = 20;
    static final int OPERATION_PLAUSIBLE = 10;

    static final Comparator<BatchDescriptor> MOST_RECENT_FIRST =
            Comparator.comparing(BatchDescriptor::createdAt, Comparator.reverseOrder())
                    .thenComparing(BatchDescriptor::batchId, Comparator.reverseOrder());

    private static final Comparator<ScoredCandidate> RANK =
            Comparator.comparingInt(ScoredCandidate::score).reversed()
                    .thenComparing(ScoredCandidate::batch, MOST_RECENT_FIRST);

    private final LedgerClient ledger;
    private final BatchMetadataCache cache;
    private final RetryPolicy retryPolicy;
    private final VerifierProperties.SearchConfig config;

    public CandidateBatchSearch(LedgerClient ledger,
                                BatchMetadataCache cache,
                                RetryPolicy retryPolicy,
                                VerifierProperties properties) {
        this.ledger = ledger;
        this.cache = cache;
        this.retryPolicy = retryPolicy;
        this.config = properties.getSearch();
    }

    public CandidateSet search(ResolvedConstraint constraint) {
        return search(constraint, config.getMaxCandidates());
    }

    /**
     * @param maxCandidates most-recent matching batches to rank; more sets {@code possiblyIncomplete}
     */
    public CandidateSet search(ResolvedConstraint constraint, int maxCandidates) {
        if (constraint.isDirect()) {
            return directLookup(constraint);
        }

        int limit = Math.max(1, maxCandidates);
        BatchIndexFilter filter = constraint.toIndexFilter(limit + 1);
        List<BatchDescriptor> found = retryPolicy.call("queryBatchIndex",
                () -> ledger.queryBatchIndex(filter));

        List<BatchDescriptor> matching = dedupe(found, filter);
        matching.sort(MOST_RECENT_FIRST);
        boolean incomplete = matching.size() > limit;
        if (incomplete) {
            matching = matching.subList(0, limit);
        }

        List<ScoredCandidate> ranked = new ArrayList<>(matching.size());
        for (BatchDescriptor batch : matching) {
            cache.remember(batch);
            ranked.add(score(batch, constraint));
        }
        ranked.sort(RANK);

        log.debug("Search {} -> {} candidates{}", filter, ranked.size(), incomplete ? " (truncated)" : "");
        return new CandidateSet(ranked, incomplete, false);
    }

    private CandidateSet directLookup(ResolvedConstraint constraint) {
        String batchId = constraint.batchId().value();
        Optional<BatchDescriptor> batch = cache.get(batchId);
        if (batch.isEmpty()) {
            log.debug("Direct lookup: batch {} not on ledger", batchId);
            return CandidateSet.empty(true);
        }
        ScoredCandidate scored = score(batch.get(), constraint);
        List<String> reasons = new ArrayList<>();
        reasons.add("batch id match");
        reasons.addAll(scored.matchReasons());
        return new CandidateSet(List.of(new ScoredCandidate(batch.get(), scored.score(), reasons)), false, true);
    }

    /**
     * Integer relevance of {@code batch} under {@code constraint}, with the reasons that earned points.
     */
    ScoredCandidate score(BatchDescriptor batch, ResolvedConstraint constraint) {
        int score = 0;
        List<String> reasons = new ArrayList<>();

        String db = constraint.databaseName();
        if (db != null) {
            if (db.equals(batch.databaseName())) {
                score += DATABASE_EXACT;
                reasons.add("database exact match");
            } else if (db.equalsIgnoreCase(batch.databaseName())) {
                score += DATABASE_IGNORE_CASE;
                reasons.add("database match (case-insensitive)");
            }
        }

        String table = constraint.tableName();
        if (table != null) {
            List<String> tables = batch.tableNames();
            if (tables.size() == 1 && table.equals(tables.get(0))) {
                score += TABLE_SOLE_EXACT;
                reasons.add("only table in batch");
            } else if (tables.contains(table)) {
                score += TABLE_CONTAINED_EXACT;
                reasons.add("table contained in batch");
            } else if (tables.stream().anyMatch(table::equalsIgnoreCase)) {
                score += TABLE_CONTAINED_IGNORE_CASE;
                reasons.add("table contained (case-insensitive)");
            }
        }

        if (constraint.timeRange() != null && constraint.timeRange().contains(batch.createdAt())) {
            score += IN_TIME_WINDOW;
            reasons.add("created inside time window");
        }

        if (constraint.expectedOperation() != null) {
            if (batch.hasOperationCounts()) {
                if (batch.operationCount(constraint.expectedOperation()) > 0) {
                    score += OPERATION_DECLARED;
                    reasons.add("declares " + constraint.expectedOperation() + " operations");
                }
            } else if (batch.transactionCount() > 0) {
                score += OPERATION_PLAUSIBLE;
                reasons.add("operation counts unknown");
            }
        }

        return new ScoredCandidate(batch, score, reasons);
    }

    /**
     * Browses the index: filter, order, then page.
     */
    public BatchPage list(BatchListQuery query) {
        BatchIndexFilter filter = query.filter().withLimit(0);
        List<BatchDescriptor> all = dedupe(
                retryPolicy.call("queryBatchIndex", () -> ledger.queryBatchIndex(filter)), filter);
        all.sort(query.order().comparator());

        int total = all.size();
        int from = Math.min(query.offset(), total);
        int to = Math.min(from + query.limit(), total);
        List<BatchDescriptor> page = all.subList(from, to);
        page.forEach(cache::remember);
        return new BatchPage(page, total, query.offset(), query.limit(), to < total);
    }

    private static List<BatchDescriptor> dedupe(List<BatchDescriptor> found, BatchIndexFilter filter) {
        Map<String, BatchDescriptor> byId = new LinkedHashMap<>();
        for (BatchDescriptor batch : found) {
            // the index is a collaborator; its answer is re-checked
            if (batch != null && filter.matches(batch)) {
                byId.putIfAbsent(batch.batchId(), batch);
            }
        }
        return new ArrayList<>(byId.values());
    }
}
