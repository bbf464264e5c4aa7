package dao.tron.txverify.model;

/**
 * Validated, normalized form of a {@link VerificationHint}.
 *
 * With a batch id present the search takes the direct path and the remaining fields are advisory.
 */
public record ResolvedConstraint(
        BatchId batchId,
        String databaseName,
        String tableName,
        TimeRange timeRange,
        OperationKind expectedOperation
) {

    public static final ResolvedConstraint UNCONSTRAINED = new ResolvedConstraint(null, null, null, null, null);

    public boolean isDirect() {
        return batchId != null;
    }

    public boolean isUnconstrained() {
        return batchId == null && databaseName == null && tableName == null
                && timeRange == null && expectedOperation == null;
    }

    public BatchIndexFilter toIndexFilter(int limit) {
        return new BatchIndexFilter(null, databaseName, tableName, timeRange, null, null, limit);
    }
}
