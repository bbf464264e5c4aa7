package dao.tron.txverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied search hints, as received. Every field is optional; validation happens in
 * {@link dao.tron.txverify.service.HintResolver}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationHint {

    /** Direct batch lookup, e.g. BATCH-2025-06-14-abc123. Other hints become advisory. */
    private String batchId;

    /** ISO-8601 with offset, e.g. 2025-06-14T00:00:00Z. Inclusive. */
    private String timeStart;

    /** ISO-8601 with offset. Exclusive. */
    private String timeEnd;

    private String databaseName;

    private String tableName;

    /** INSERT, UPDATE or DELETE. */
    private String expectedOperation;

    public static VerificationHint empty() {
        return new VerificationHint();
    }

    public boolean isEmpty() {
        return batchId == null && timeStart == null && timeEnd == null
                && databaseName == null && tableName == null && expectedOperation == null;
    }
}
