package dao.tron.txverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Batch search request. Combines the verification hint fields with filters that only make
 * sense when browsing (root, size, id pattern, contained leaf).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSearchCriteria {

    public static final int DEFAULT_MAX_RESULTS = 50;
    public static final int MAX_RESULTS_CAP = 200;

    /** Leaf digest (hex) that the batch must contain; checked against stored contents. */
    private String transactionHash;

    private String databaseName;

    private String tableName;

    private String timeStart;

    private String timeEnd;

    private String expectedOperation;

    /** Exact Merkle root (hex). */
    private String merkleRoot;

    private Integer minTransactionCount;

    /** Case-insensitive substring of the batch id. */
    private String batchIdPattern;

    private Integer maxResults;

    public VerificationHint toHint() {
        return VerificationHint.builder()
                .databaseName(databaseName)
                .tableName(tableName)
                .timeStart(timeStart)
                .timeEnd(timeEnd)
                .expectedOperation(expectedOperation)
                .build();
    }

    public int effectiveMaxResults() {
        if (maxResults == null || maxResults <= 0) return DEFAULT_MAX_RESULTS;
        return Math.min(maxResults, MAX_RESULTS_CAP);
    }
}
