package dao.tron.txverify.model;

import java.util.List;

public record SearchResults(
        List<SearchMatch> matches,
        int totalMatches,
        boolean possiblyIncomplete,
        long searchTimeMs,
        List<String> suggestions
) {

    public SearchResults {
        matches = matches == null ? List.of() : List.copyOf(matches);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
