package dao.tron.txverify.service;

import dao.tron.txverify.exception.InvalidHintException;
import dao.tron.txverify.exception.InvalidHintException.Violation;
import dao.tron.txverify.model.BatchId;
import dao.tron.txverify.model.OperationKind;
import dao.tron.txverify.model.ResolvedConstraint;
import dao.tron.txverify.model.TimeRange;
import dao.tron.txverify.model.VerificationHint;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw hints and normalizes them into a {@link ResolvedConstraint}.
 * All problems are reported together; a bad hint is never silently dropped.
 */
@Service
public class HintResolver {

    public ResolvedConstraint resolve(VerificationHint hint) {
        if (hint == null || hint.isEmpty()) {
            return ResolvedConstraint.UNCONSTRAINED;
        }

        List<Violation> violations = new ArrayList<>();

        BatchId batchId = null;
        if (hint.getBatchId() != null) {
            batchId = BatchId.tryParse(hint.getBatchId()).orElse(null);
            if (batchId == null) {
                violations.add(new Violation("batch_id",
                        "expected BATCH-YYYY-MM-DD-<suffix> with a valid date, got '" + hint.getBatchId() + "'"));
            }
        }

        String databaseName = name(hint.getDatabaseName(), "database_name", violations);
        String tableName = name(hint.getTableName(), "table_name", violations);

        OperationKind operation = null;
        if (hint.getExpectedOperation() != null) {
            operation = OperationKind.parse(hint.getExpectedOperation()).orElse(null);
            if (operation == null) {
                violations.add(new Violation("expected_operation",
                        "must be INSERT, UPDATE or DELETE, got '" + hint.getExpectedOperation() + "'"));
            }
        }

        TimeRange range = timeRange(hint.getTimeStart(), hint.getTimeEnd(), violations);

        if (!violations.isEmpty()) {
            throw new InvalidHintException(violations);
        }
        return new ResolvedConstraint(batchId, databaseName, tableName, range, operation);
    }

    /**
     * Parses a single optional time bound (list filters allow one-sided ranges).
     *
     * @throws InvalidHintException when the value is naive or not ISO-8601
     */
    public Instant parseBound(String field, String raw) {
        if (raw == null || raw.isBlank()) return null;
        List<Violation> violations = new ArrayList<>();
        Instant instant = instant(raw, field, violations);
        if (!violations.isEmpty()) {
            throw new InvalidHintException(violations);
        }
        return instant;
    }

    private static String name(String value, String field, List<Violation> violations) {
        if (value == null) return null;
        if (value.isBlank()) {
            violations.add(new Violation(field, "must not be blank"));
            return null;
        }
        return value.trim();
    }

    private static TimeRange timeRange(String rawStart, String rawEnd, List<Violation> violations) {
        if (rawStart == null && rawEnd == null) return null;
        if (rawStart == null || rawEnd == null) {
            violations.add(new Violation(rawStart == null ? "time_start" : "time_end",
                    "time_start and time_end must be given together"));
        }
        Instant start = rawStart == null ? null : instant(rawStart, "time_start", violations);
        Instant end = rawEnd == null ? null : instant(rawEnd, "time_end", violations);
        if (start == null || end == null) return null;
        if (!start.isBefore(end)) {
            violations.add(new Violation("time_end", "must be after time_start (" + rawStart + ")"));
            return null;
        }
        return TimeRange.between(start, end);
    }

    private static Instant instant(String raw, String field, List<Violation> violations) {
        String value = raw.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            violations.add(new Violation(field, isNaive(value)
                    ? "timestamp '" + raw + "' has no UTC offset; append Z or +hh:mm"
                    : "not an ISO-8601 timestamp: '" + raw + "'"));
            return null;
        }
    }

    private static boolean isNaive(String value) {
        try {
            LocalDateTime.parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
