package dao.tron.txverify.model;

import java.util.Locale;
import java.util.Optional;

public enum OperationKind {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Case-insensitive lookup; blank or unknown input yields empty.
     */
    public static Optional<OperationKind> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
