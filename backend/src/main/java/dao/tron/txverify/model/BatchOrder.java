package dao.tron.txverify.model;

import java.util.Comparator;
import java.util.Locale;

public enum BatchOrder {
    TIMESTAMP_DESC(Comparator.comparing(BatchDescriptor::createdAt).reversed()),
    TIMESTAMP_ASC(Comparator.comparing(BatchDescriptor::createdAt)),
    COUNT_DESC(Comparator.comparingInt(BatchDescriptor::transactionCount).reversed()),
    COUNT_ASC(Comparator.comparingInt(BatchDescriptor::transactionCount));

    private final Comparator<BatchDescriptor> comparator;

    BatchOrder(Comparator<BatchDescriptor> primary) {
        // batch id as the final key keeps pages stable
        this.comparator = primary.thenComparing(BatchDescriptor::batchId, Comparator.reverseOrder());
    }

    public Comparator<BatchDescriptor> comparator() {
        return comparator;
    }

    /**
     * Parses the wire form ({@code timestamp_desc}, ...). Null means the default, newest first.
     */
    public static BatchOrder fromParam(String value) {
        if (value == null || value.isBlank()) return TIMESTAMP_DESC;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown order_by: " + value
                    + " (expected timestamp_desc, timestamp_asc, count_desc or count_asc)");
        }
    }
}
