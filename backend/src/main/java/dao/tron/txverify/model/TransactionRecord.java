package dao.tron.txverify.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A database change as recorded by the audit pipeline.
 *
 * Columns are held sorted by name, so two records built from the same values in a different
 * order are equal and hash identically. The local timestamp is informational and not hashed.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TransactionRecord {

    private final String databaseName;
    private final String tableName;
    private final OperationKind operation;
    private final SortedMap<String, Object> columns;
    private final Instant localTimestamp;

    private TransactionRecord(Builder b) {
        this.databaseName = b.databaseName;
        this.tableName = b.tableName;
        this.operation = b.operation;
        this.columns = Collections.unmodifiableSortedMap(new TreeMap<>(b.columns));
        this.localTimestamp = b.localTimestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String databaseName;
        private String tableName;
        private OperationKind operation;
        private final Map<String, Object> columns = new TreeMap<>();
        private Instant localTimestamp;

        private Builder() {}

        public Builder databaseName(String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder operation(OperationKind operation) {
            this.operation = operation;
            return this;
        }

        public Builder column(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Column name must not be blank");
            }
            columns.put(name, value);
            return this;
        }

        public Builder columns(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::column);
            }
            return this;
        }

        public Builder localTimestamp(Instant localTimestamp) {
            this.localTimestamp = localTimestamp;
            return this;
        }

        public TransactionRecord build() {
            if (databaseName == null || databaseName.isBlank()) {
                throw new IllegalArgumentException("Transaction record needs a database name");
            }
            if (tableName == null || tableName.isBlank()) {
                throw new IllegalArgumentException("Transaction record needs a table name");
            }
            if (operation == null) {
                throw new IllegalArgumentException("Transaction record needs an operation (INSERT, UPDATE or DELETE)");
            }
            return new TransactionRecord(this);
        }
    }
}
