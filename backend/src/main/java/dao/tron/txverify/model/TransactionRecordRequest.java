package dao.tron.txverify.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A record as posted over REST.
 *
 * Plain JSON column values hash as what Jackson reads them as: integers as INT, fractions as
 * FLOAT, strings as STRING. Values whose anchored form is a decimal or a timestamp must be sent
 * in the typed form {@code {"type": "decimal", "value": "10.50"}} or
 * {@code {"type": "timestamp", "value": "2025-07-01T09:55:00Z"}}. Also accepted as types:
 * {@code integer}, {@code float}, {@code string}, {@code boolean}.
 */
@Data
public class TransactionRecordRequest {

    @NotBlank
    private String databaseName;

    @NotBlank
    private String tableName;

    /** INSERT, UPDATE or DELETE; falls back to the hint's expected_operation when absent. */
    private String operation;

    @NotNull
    private Map<String, Object> columns;

    /** ISO-8601 with offset; informational only. */
    private String localTimestamp;

    /**
     * @param hint consulted for the operation when the record carries none
     * @throws IllegalArgumentException when the operation is missing or unknown, or a typed column
     *                                  value does not parse
     */
    public TransactionRecord toRecord(VerificationHint hint) {
        String op = operation != null ? operation : (hint == null ? null : hint.getExpectedOperation());
        OperationKind kind = OperationKind.parse(op).orElseThrow(() -> new IllegalArgumentException(
                "record.operation must be INSERT, UPDATE or DELETE, got '" + op + "'"));
        return TransactionRecord.builder()
                .databaseName(databaseName)
                .tableName(tableName)
                .operation(kind)
                .columns(typedColumns())
                .localTimestamp(parseLocalTimestamp())
                .build();
    }

    private Map<String, Object> typedColumns() {
        Map<String, Object> typed = new LinkedHashMap<>();
        columns.forEach((name, value) -> typed.put(name, columnValue(name, value)));
        return typed;
    }

    static Object columnValue(String column, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        Map<?, ?> typed = value instanceof Map ? (Map<?, ?>) value : Map.of();
        if (typed.size() != 2 || !typed.containsKey("type") || !typed.containsKey("value")) {
            throw new IllegalArgumentException("record.columns." + column
                    + " must be a scalar or {\"type\": ..., \"value\": ...}");
        }
        String type = String.valueOf(typed.get("type")).toLowerCase(Locale.ROOT);
        Object raw = typed.get("value");
        if (raw == null) return null;
        String text = raw.toString().trim();
        try {
            switch (type) {
                case "decimal":
                    return new BigDecimal(text);
                case "timestamp":
                    return OffsetDateTime.parse(text).toInstant();
                case "integer":
                    return new BigInteger(text);
                case "float":
                    return Double.valueOf(text);
                case "string":
                    return raw.toString();
                case "boolean":
                    if (text.equals("true") || text.equals("false")) return Boolean.valueOf(text);
                    throw new IllegalArgumentException("record.columns." + column + ": '" + raw + "' is not a boolean");
                default:
                    throw new IllegalArgumentException("record.columns." + column + ": unknown type '" + type
                            + "', expected decimal, timestamp, integer, float, string or boolean");
            }
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("record.columns." + column + ": '" + raw + "' is not a valid "
                    + type + (type.equals("timestamp") ? " (ISO-8601 with offset)" : ""), e);
        }
    }

    private Instant parseLocalTimestamp() {
        if (localTimestamp == null || localTimestamp.isBlank()) return null;
        try {
            return OffsetDateTime.parse(localTimestamp.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("record.local_timestamp must be ISO-8601 with offset: " + localTimestamp);
        }
    }
}
