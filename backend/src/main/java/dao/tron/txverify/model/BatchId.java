package dao.tron.txverify.model;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Batch identifier of the form {@code BATCH-YYYY-MM-DD-<suffix>}.
 * Identifiers sort lexicographically by creation date.
 */
public record BatchId(String value, LocalDate date) {

    private static final Pattern SHAPE = Pattern.compile("^BATCH-(\\d{4})-(\\d{2})-(\\d{2})-([A-Za-z0-9_]+)$");

    public static Optional<BatchId> tryParse(String raw) {
        if (raw == null) return Optional.empty();
        String value = raw.trim();
        Matcher m = SHAPE.matcher(value);
        if (!m.matches()) return Optional.empty();
        try {
            LocalDate date = LocalDate.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
            return Optional.of(new BatchId(value, date));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static BatchId parse(String raw) {
        return tryParse(raw).orElseThrow(() -> new IllegalArgumentException("Malformed batch id: " + raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
