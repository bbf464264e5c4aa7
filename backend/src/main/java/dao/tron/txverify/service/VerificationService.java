package dao.tron.txverify.service;

import dao.tron.txverify.client.BatchContentStore;
import dao.tron.txverify.client.LedgerClient;
import dao.tron.txverify.config.LedgerProperties;
import dao.tron.txverify.config.StorageProperties;
import dao.tron.txverify.config.VerifierProperties;
import dao.tron.txverify.exception.InvalidHintException;
import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.BatchListQuery;
import dao.tron.txverify.model.BatchPage;
import dao.tron.txverify.model.BatchSearchCriteria;
import dao.tron.txverify.model.BatchVerificationReport;
import dao.tron.txverify.model.CandidateSet;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.LedgerInfo;
import dao.tron.txverify.model.ResolvedConstraint;
import dao.tron.txverify.model.ScoredCandidate;
import dao.tron.txverify.model.SearchMatch;
import dao.tron.txverify.model.SearchResults;
import dao.tron.txverify.model.TransactionRecord;
import dao.tron.txverify.model.VerificationHint;
import dao.tron.txverify.model.VerificationItem;
import dao.tron.txverify.model.VerificationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class VerificationService {

    private final HintResolver hintResolver;
    private final CandidateBatchSearch search;
    private final BatchMetadataCache cache;
    private final BatchVerificationOrchestrator orchestrator;
    private final LedgerClient ledger;
    private final BatchContentStore contentStore;
    private final RetryPolicy retryPolicy;
    private final LedgerProperties ledgerProps;
    private final StorageProperties storageProps;
    private final VerifierProperties verifierProps;
    private final Clock clock;

    public VerificationService(HintResolver hintResolver,
                               CandidateBatchSearch search,
                               BatchMetadataCache cache,
                               BatchVerificationOrchestrator orchestrator,
                               LedgerClient ledger,
                               BatchContentStore contentStore,
                               RetryPolicy retryPolicy,
                               LedgerProperties ledgerProps,
                               StorageProperties storageProps,
                               VerifierProperties verifierProps,
                               Clock clock) {
        this.hintResolver = hintResolver;
        this.search = search;
        this.cache = cache;
        this.orchestrator = orchestrator;
        this.ledger = ledger;
        this.contentStore = contentStore;
        this.retryPolicy = retryPolicy;
        this.ledgerProps = ledgerProps;
        this.storageProps = storageProps;
        this.verifierProps = verifierProps;
        this.clock = clock;
    }

    /**
     * Verifies one record under a deadline.
     *
     * @param timeout null for the configured transaction timeout
     * @throws InvalidHintException before any lookup when the hint is malformed
     */
    public VerificationVerdict verifyTransaction(TransactionRecord record, VerificationHint hint, Duration timeout) {
        hintResolver.resolve(hint);
        Duration deadline = timeout != null
                ? timeout
                : Duration.ofSeconds(verifierProps.getOrchestrator().getTransactionTimeoutSeconds());
        VerificationVerdict verdict = orchestrator
                .verifyMany(List.of(new VerificationItem(record, hint)), deadline, false)
                .get(0);
        log.info("verify_transaction {}.{} {} -> {} (batch={})",
                record.getDatabaseName(), record.getTableName(), record.getOperation(),
                verdict.outcome(), verdict.batchId());
        return verdict;
    }

    /**
     * Verifies many records; per-item hint problems are reported in that item's verdict.
     *
     * @param timeout null for the configured batch timeout
     */
    public BatchVerificationReport verifyBatch(List<VerificationItem> items, Duration timeout,
                                               boolean failFast, boolean parallel) {
        Instant startedAt = clock.instant();
        long startedNanos = System.nanoTime();
        Duration deadline = timeout != null
                ? timeout
                : Duration.ofSeconds(verifierProps.getOrchestrator().getBatchTimeoutSeconds());

        List<VerificationVerdict> verdicts = orchestrator.verifyMany(items, deadline, failFast, parallel);
        BatchVerificationReport report = BatchVerificationReport.of(verdicts, startedAt,
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos), failFast, parallel);
        log.info("verify_batch: {} items, {} verified, {} ms", report.totalTransactions(),
                report.verifiedCount(), report.processingTimeMs());
        return report;
    }

    public Optional<BatchDescriptor> getBatch(String batchId) {
        return cache.get(batchId);
    }

    public BatchPage listBatches(BatchListQuery query) {
        return search.list(query);
    }

    /**
     * Ranked batch search with browsing filters applied on top of the candidate search.
     */
    public SearchResults searchBatches(BatchSearchCriteria criteria) {
        long startedNanos = System.nanoTime();
        ResolvedConstraint constraint = hintResolver.resolve(criteria.toHint());
        int maxResults = criteria.effectiveMaxResults();

        CandidateSet candidates = search.search(constraint,
                Math.max(maxResults, verifierProps.getSearch().getMaxCandidates()));

        Hash32 root = parseHash(criteria.getMerkleRoot(), "merkle_root");
        Hash32 leaf = parseHash(criteria.getTransactionHash(), "transaction_hash");
        String pattern = criteria.getBatchIdPattern() == null || criteria.getBatchIdPattern().isBlank()
                ? null
                : criteria.getBatchIdPattern().trim().toLowerCase(Locale.ROOT);

        List<SearchMatch> matches = new ArrayList<>();
        for (ScoredCandidate candidate : candidates.candidates()) {
            BatchDescriptor batch = candidate.batch();
            List<String> reasons = new ArrayList<>(candidate.matchReasons());
            if (root != null) {
                if (!root.equals(batch.merkleRoot())) continue;
                reasons.add("merkle root match");
            }
            if (criteria.getMinTransactionCount() != null
                    && batch.transactionCount() < criteria.getMinTransactionCount()) {
                continue;
            }
            if (pattern != null) {
                if (!batch.batchId().toLowerCase(Locale.ROOT).contains(pattern)) continue;
                reasons.add("batch id contains '" + pattern + "'");
            }
            if (leaf != null) {
                boolean contains = retryPolicy.call("fetchBatchContents " + batch.batchId(),
                        () -> contentStore.fetchBatchContents(batch)).containsLeaf(leaf);
                if (!contains) continue;
                reasons.add("contains transaction hash");
            }
            matches.add(new SearchMatch(batch, reasons, candidate.score()));
        }

        int total = matches.size();
        List<SearchMatch> page = matches.subList(0, Math.min(maxResults, total));
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        List<String> suggestions = page.isEmpty() ? suggestionsFor(criteria) : List.of();
        log.info("search_batches -> {} matches in {} ms", total, elapsed);
        return new SearchResults(page, total, candidates.possiblyIncomplete(), elapsed, suggestions);
    }

    public LedgerInfo ledgerInfo() {
        long total = retryPolicy.call("countBatches", ledger::countBatches);
        return new LedgerInfo(ledger.getNetwork(), ledger.getContractAddress(), total);
    }

    /**
     * Effective configuration with secrets left out.
     */
    public Map<String, Object> configView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("ledger_mode", ledgerProps.getMode());
        view.put("network", ledger.getNetwork());
        view.put("contract_address", ledger.getContractAddress());
        view.put("private_key_configured", ledgerProps.getPrivateKey() != null && !ledgerProps.getPrivateKey().isBlank());
        view.put("storage_mode", storageProps.getMode());
        view.put("storage_base_url", storageProps.getBaseUrl());
        view.put("storage_region", storageProps.getRegion());
        view.put("hash_algorithm", verifierProps.getHashAlgorithm());
        view.put("cache_ttl_seconds", verifierProps.getCache().getTtlSeconds());
        view.put("cache_max_entries", verifierProps.getCache().getMaxEntries());
        view.put("cache_size", cache.size());
        view.put("max_candidates", verifierProps.getSearch().getMaxCandidates());
        view.put("max_inspected", verifierProps.getSearch().getMaxInspected());
        view.put("tie_margin", verifierProps.getSearch().getTieMargin());
        view.put("workers", orchestrator.getWorkers());
        view.put("batch_timeout_seconds", verifierProps.getOrchestrator().getBatchTimeoutSeconds());
        view.put("transaction_timeout_seconds", verifierProps.getOrchestrator().getTransactionTimeoutSeconds());
        view.put("retry_max_attempts", retryPolicy.getMaxAttempts());
        return view;
    }

    private static Hash32 parseHash(String hex, String field) {
        if (hex == null || hex.isBlank()) return null;
        try {
            return Hash32.fromHex(hex.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidHintException(List.of(new InvalidHintException.Violation(field, e.getMessage())));
        }
    }

    private static List<String> suggestionsFor(BatchSearchCriteria criteria) {
        List<String> suggestions = new ArrayList<>();
        if (criteria.getTableName() != null) {
            suggestions.add("Drop table_name; batches may record the table under a different name");
        }
        if (criteria.getTimeStart() != null) {
            suggestions.add("Widen the time range; batch timestamps are assigned by the ledger in UTC");
        }
        if (criteria.getDatabaseName() != null) {
            suggestions.add("Check the database_name spelling");
        }
        if (criteria.getTransactionHash() != null) {
            suggestions.add("Verify the record directly; the hash may belong to a batch outside the searched range");
        }
        suggestions.add("Use GET /api/batches to browse recent batches");
        return suggestions;
    }
}
