package dao.tron.txverify.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised before any verification work when a hint is malformed. Lists every offending field;
 * invalid hints are never dropped silently.
 */
@Getter
public class InvalidHintException extends RuntimeException {

    private final List<Violation> violations;

    public InvalidHintException(List<Violation> violations) {
        super("Invalid hint: " + violations.stream()
                .map(v -> v.field() + " (" + v.message() + ")")
                .collect(Collectors.joining(", ")));
        this.violations = List.copyOf(violations);
    }

    public record Violation(String field, String message) {}
}
