package dao.tron.txverify.model;

import java.util.Locale;

/**
 * Filter handed to the ledger's batch index. Name matching is case-insensitive; a batch matches
 * the table filter when any of its tables does.
 *
 * @param limit maximum number of most-recent matches to return; 0 means no limit
 */
public record BatchIndexFilter(
        String batchId,
        String databaseName,
        String tableName,
        TimeRange timeRange,
        Integer minTransactionCount,
        Integer maxTransactionCount,
        int limit
) {

    public static BatchIndexFilter forBatchId(String batchId) {
        return new BatchIndexFilter(batchId, null, null, null, null, null, 1);
    }

    public static BatchIndexFilter all() {
        return new BatchIndexFilter(null, null, null, null, null, null, 0);
    }

    public BatchIndexFilter withLimit(int newLimit) {
        return new BatchIndexFilter(batchId, databaseName, tableName, timeRange,
                minTransactionCount, maxTransactionCount, newLimit);
    }

    public boolean matches(BatchDescriptor batch) {
        if (batchId != null && !batchId.equals(batch.batchId())) return false;
        if (databaseName != null && !databaseName.equalsIgnoreCase(batch.databaseName())) return false;
        if (tableName != null && batch.tableNames().stream().noneMatch(tableName::equalsIgnoreCase)) return false;
        if (timeRange != null && !timeRange.contains(batch.createdAt())) return false;
        if (minTransactionCount != null && batch.transactionCount() < minTransactionCount) return false;
        return maxTransactionCount == null || batch.transactionCount() <= maxTransactionCount;
    }

    /** True when nothing narrows the scan except the limit. */
    public boolean isOpen() {
        return batchId == null && databaseName == null && tableName == null
                && (timeRange == null || timeRange.isUnbounded())
                && minTransactionCount == null && maxTransactionCount == null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BatchIndexFilter{");
        if (batchId != null) sb.append("batchId=").append(batchId).append(' ');
        if (databaseName != null) sb.append("db=").append(databaseName.toLowerCase(Locale.ROOT)).append(' ');
        if (tableName != null) sb.append("table=").append(tableName.toLowerCase(Locale.ROOT)).append(' ');
        if (timeRange != null) sb.append("range=").append(timeRange.start()).append("..").append(timeRange.end()).append(' ');
        if (minTransactionCount != null) sb.append("minTx=").append(minTransactionCount).append(' ');
        if (maxTransactionCount != null) sb.append("maxTx=").append(maxTransactionCount).append(' ');
        return sb.append("limit=").append(limit).append('}').toString();
    }
}
