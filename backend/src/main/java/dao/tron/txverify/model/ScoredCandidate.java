package dao.tron.txverify.model;

import java.util.List;

/**
 * A batch that may hold the transaction, with its relevance score and the reasons behind it.
 */
public record ScoredCandidate(BatchDescriptor batch, int score, List<String> matchReasons) {

    public ScoredCandidate {
        matchReasons = matchReasons == null ? List.of() : List.copyOf(matchReasons);
    }

    public String batchId() {
        return batch.batchId();
    }
}
