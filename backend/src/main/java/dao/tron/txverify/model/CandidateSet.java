package dao.tron.txverify.model;

import java.util.List;

/**
 * Ranked, deduplicated search result.
 *
 * @param possiblyIncomplete more batches matched than the search was allowed to rank
 * @param directLookup       produced by the batch-id fast path
 */
public record CandidateSet(List<ScoredCandidate> candidates, boolean possiblyIncomplete, boolean directLookup) {

    public CandidateSet {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static CandidateSet empty(boolean directLookup) {
        return new CandidateSet(List.of(), false, directLookup);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }

    public List<String> ids() {
        return candidates.stream().map(ScoredCandidate::batchId).toList();
    }
}
