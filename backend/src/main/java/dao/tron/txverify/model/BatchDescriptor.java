package dao.tron.txverify.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger view of an anchored batch. Immutable once anchored; the Merkle root is the trust anchor.
 *
 * @param operationCounts declared per-kind transaction counts; empty when the ledger does not record them
 */
public record BatchDescriptor(
        String batchId,
        Hash32 merkleRoot,
        Instant createdAt,
        String databaseName,
        List<String> tableNames,
        int transactionCount,
        String storageRef,
        Map<OperationKind, Integer> operationCounts
) {

    public BatchDescriptor {
        tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
        operationCounts = operationCounts == null || operationCounts.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(operationCounts));
    }

    public boolean hasOperationCounts() {
        return !operationCounts.isEmpty();
    }

    public int operationCount(OperationKind kind) {
        return operationCounts.getOrDefault(kind, 0);
    }
}
