package dao.tron.txverify.service;

import dao.tron.txverify.client.BatchContentStore;
import dao.tron.txverify.client.LedgerClient;
import dao.tron.txverify.config.VerifierProperties;
import dao.tron.txverify.exception.CollaboratorException;
import dao.tron.txverify.exception.EncodingException;
import dao.tron.txverify.exception.InvalidHintException;
import dao.tron.txverify.exception.VerificationCancelledException;
import dao.tron.txverify.model.BatchContents;
import dao.tron.txverify.model.BatchDescriptor;
import dao.tron.txverify.model.CandidateSet;
import dao.tron.txverify.model.ErrorKind;
import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.LeafEntry;
import dao.tron.txverify.model.MerkleProof;
import dao.tron.txverify.model.ResolvedConstraint;
import dao.tron.txverify.model.ScoredCandidate;
import dao.tron.txverify.model.TransactionRecord;
import dao.tron.txverify.model.VerdictOutcome;
import dao.tron.txverify.model.VerificationHint;
import dao.tron.txverify.model.VerificationVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Verifies one transaction record: resolve hints, find candidate batches, locate the record's
 * leaf in stored contents and check its proof against the ledger root.
 *
 * Apart from {@link InvalidHintException} (raised before any work starts) every outcome,
 * failures included, comes back as a {@link VerificationVerdict}.
 */
@Slf4j
@Service
public class TransactionVerifier {

    enum State {
        START,
        HINTS_RESOLVED,
        CANDIDATES_FOUND,
        BATCH_FETCHED,
        PROOF_CHECKED,
        DONE
    }

    private final CanonicalHasher hasher;
    private final HintResolver hintResolver;
    private final CandidateBatchSearch search;
    private final BatchMetadataCache cache;
    private final LedgerClient ledger;
    private final BatchContentStore contentStore;
    private final MerkleProofVerifier proofVerifier;
    private final MerkleTreeBuilder treeBuilder;
    private final RetryPolicy retryPolicy;
    private final VerifierProperties.SearchConfig searchConfig;

    public TransactionVerifier(CanonicalHasher hasher,
                               HintResolver hintResolver,
                               CandidateBatchSearch search,
                               BatchMetadataCache cache,
                               LedgerClient ledger,
                               BatchContentStore contentStore,
                               MerkleProofVerifier proofVerifier,
                               MerkleTreeBuilder treeBuilder,
                               RetryPolicy retryPolicy,
                               VerifierProperties properties) {
        this.hasher = hasher;
        this.hintResolver = hintResolver;
        this.search = search;
        this.cache = cache;
        this.ledger = ledger;
        this.contentStore = contentStore;
        this.proofVerifier = proofVerifier;
        this.treeBuilder = treeBuilder;
        this.retryPolicy = retryPolicy;
        this.searchConfig = properties.getSearch();
    }

    /**
     * @throws InvalidHintException if the hint is malformed; nothing has been looked up yet
     */
    public VerificationVerdict verify(TransactionRecord record, VerificationHint hint) {
        long startedNanos = System.nanoTime();
        Progress progress = new Progress();

        ResolvedConstraint constraint = hintResolver.resolve(hint);
        progress.advance(State.HINTS_RESOLVED);

        VerificationVerdict verdict;
        Hash32 leaf = null;
        try {
            leaf = hasher.digest(record);
            verdict = locateAndProve(record, leaf, constraint, progress);
        } catch (EncodingException e) {
            verdict = VerificationVerdict.error(ErrorKind.ENCODING, e.getMessage(), false);
        } catch (VerificationCancelledException e) {
            verdict = VerificationVerdict.cancelled(e.getMessage());
        } catch (CollaboratorException e) {
            log.warn("Verification of {}.{} failed on a collaborator: {}",
                    record.getDatabaseName(), record.getTableName(), e.getMessage());
            verdict = VerificationVerdict.error(ErrorKind.COLLABORATOR, e.getMessage(), e.isTransient());
        } catch (RuntimeException e) {
            log.error("Unexpected verification failure for {}.{}", record.getDatabaseName(), record.getTableName(), e);
            verdict = VerificationVerdict.error(ErrorKind.INTERNAL, "internal error: " + e.getMessage(), false);
        }
        progress.advance(State.DONE);

        return verdict.toBuilder()
                .leafHash(verdict.leafHash() != null ? verdict.leafHash() : leaf)
                .processingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos))
                .build();
    }

    private VerificationVerdict locateAndProve(TransactionRecord record,
                                               Hash32 leaf,
                                               ResolvedConstraint constraint,
                                               Progress progress) {
        CandidateSet candidates = search.search(constraint);
        progress.advance(State.CANDIDATES_FOUND);

        if (candidates.isEmpty()) {
            String reason = constraint.isDirect()
                    ? "batch " + constraint.batchId() + " is not on the ledger"
                    : "no batch matches the given hints";
            return notFound(leaf, candidates, reason);
        }

        List<Hit> hits = inspect(leaf, candidates);
        progress.advance(State.BATCH_FETCHED);

        if (hits.isEmpty()) {
            int inspected = Math.min(candidates.size(), inspectLimit());
            StringBuilder reason = new StringBuilder("no leaf matches the record digest in ")
                    .append(inspected).append(" inspected candidate batch(es)");
            if (inspected < candidates.size()) {
                reason.append("; ").append(candidates.size() - inspected).append(" lower-ranked candidate(s) not inspected");
            }
            if (candidates.possiblyIncomplete()) {
                reason.append("; search was truncated, results possibly incomplete");
            }
            return notFound(leaf, candidates, reason.toString());
        }

        if (hits.size() > 1 && !constraint.isDirect()) {
            List<String> tied = hits.stream().map(h -> h.candidate.batchId()).toList();
            return VerificationVerdict.builder()
                    .outcome(VerdictOutcome.AMBIGUOUS)
                    .leafHash(leaf)
                    .candidates(tied)
                    .possiblyIncomplete(candidates.possiblyIncomplete())
                    .reason("record found in " + tied.size() + " equally ranked batches " + tied
                            + "; add a batch_id or narrower hints")
                    .build();
        }

        Hit hit = hits.get(0);
        VerificationVerdict verdict = prove(record, leaf, hit, candidates);
        progress.advance(State.PROOF_CHECKED);
        return verdict;
    }

    /**
     * Opens candidates in rank order and collects those holding {@code leaf}. Stops once the
     * next candidate ranks below the first hit by more than the tie margin.
     */
    private List<Hit> inspect(Hash32 leaf, CandidateSet candidates) {
        int tieMargin = Math.max(0, searchConfig.getTieMargin());
        int limit = Math.min(candidates.size(), inspectLimit());
        List<Hit> hits = new ArrayList<>();

        for (int i = 0; i < limit; i++) {
            ScoredCandidate candidate = candidates.candidates().get(i);
            if (!hits.isEmpty() && candidate.score() < hits.get(0).candidate.score() - tieMargin) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new VerificationCancelledException("interrupted while inspecting candidates");
            }
            BatchDescriptor batch = candidate.batch();
            BatchContents contents = retryPolicy.call("fetchBatchContents " + batch.batchId(),
                    () -> contentStore.fetchBatchContents(batch));
            Optional<LeafEntry> entry = contents.findLeaf(leaf);
            if (entry.isPresent()) {
                log.debug("Leaf {} found in batch {} at index {}", leaf, batch.batchId(), entry.get().index());
                hits.add(new Hit(candidate, contents, entry.get()));
            }
        }
        return hits;
    }

    private VerificationVerdict prove(TransactionRecord record, Hash32 leaf, Hit hit, CandidateSet candidates) {
        BatchDescriptor batch = hit.candidate.batch();
        MerkleProof proof = proofFor(hit);
        Hash32 root = batch.merkleRoot();
        boolean valid = proofVerifier.verify(leaf, proof, root);

        if (!valid) {
            // the descriptor may be stale: only the ledger's current answer decides
            Optional<Hash32> ledgerRoot = retryPolicy.call("getBatchRoot " + batch.batchId(),
                    () -> ledger.getBatchRoot(batch.batchId()));
            if (ledgerRoot.isPresent() && !ledgerRoot.get().equals(root)) {
                log.warn("Root of batch {} changed on ledger ({} -> {}), re-verifying",
                        batch.batchId(), root, ledgerRoot.get());
                cache.invalidate(batch.batchId());
                root = ledgerRoot.get();
                valid = proofVerifier.verify(leaf, proof, root);
            } else if (ledgerRoot.isEmpty()) {
                log.warn("Batch {} no longer resolvable on ledger", batch.batchId());
            }
        }

        VerificationVerdict.VerificationVerdictBuilder verdict = VerificationVerdict.builder()
                .batchId(batch.batchId())
                .leafHash(leaf)
                .expectedRoot(root)
                .candidates(candidates.ids())
                .possiblyIncomplete(candidates.possiblyIncomplete())
                .batchTimestamp(batch.createdAt())
                .operation(hit.leaf.operation() != null ? hit.leaf.operation() : record.getOperation());

        if (valid) {
            return verdict.outcome(VerdictOutcome.VERIFIED)
                    .proof(proof)
                    .reason("leaf " + hit.leaf.index() + " of batch " + batch.batchId() + " proves to the ledger root")
                    .build();
        }
        log.warn("Batch {} holds leaf {} but its proof does not reach the ledger root {}",
                batch.batchId(), leaf, root);
        return verdict.outcome(VerdictOutcome.TAMPERED)
                .reason("record digest present in batch " + batch.batchId()
                        + " but its Merkle proof does not match the ledger root")
                .build();
    }

    private MerkleProof proofFor(Hit hit) {
        if (hit.leaf.proof() != null) {
            return hit.leaf.proof();
        }
        try {
            int position = hit.contents.leaves().indexOf(hit.leaf);
            return treeBuilder.buildProof(hit.contents.leafHashes(), position);
        } catch (IllegalArgumentException e) {
            throw new CollaboratorException("Stored contents of batch " + hit.candidate.batchId()
                    + " cannot be rebuilt into a tree: " + e.getMessage(), e);
        }
    }

    private int inspectLimit() {
        return Math.max(1, searchConfig.getMaxInspected());
    }

    private static VerificationVerdict notFound(Hash32 leaf, CandidateSet candidates, String reason) {
        return VerificationVerdict.builder()
                .outcome(VerdictOutcome.NOT_FOUND)
                .leafHash(leaf)
                .candidates(candidates.ids())
                .possiblyIncomplete(candidates.possiblyIncomplete())
                .reason(reason)
                .build();
    }

    private record Hit(ScoredCandidate candidate, BatchContents contents, LeafEntry leaf) {}

    /**
     * Forward-only progress through {@link State}; states may be skipped, never revisited.
     */
    static final class Progress {
        private State state = State.START;

        void advance(State next) {
            if (next.ordinal() <= state.ordinal()) {
                throw new IllegalStateException("Illegal verification transition " + state + " -> " + next);
            }
            log.debug("Verification state {} -> {}", state, next);
            state = next;
        }

        State current() {
            return state;
        }
    }
}
