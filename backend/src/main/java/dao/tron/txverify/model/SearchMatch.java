package dao.tron.txverify.model;

import java.util.List;

public record SearchMatch(BatchDescriptor batch, List<String> matchReasons, int relevanceScore) {

    public SearchMatch {
        matchReasons = matchReasons == null ? List.of() : List.copyOf(matchReasons);
    }
}
