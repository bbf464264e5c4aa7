package dao.tron.txverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One leaf of a stored batch. Operation, table and proof are optional in the stored payload.
 */
public record LeafEntry(
        @JsonProperty("index") int index,
        @JsonProperty("hash") Hash32 leafHash,
        @JsonProperty("operation") OperationKind operation,
        @JsonProperty("table") String tableName,
        @JsonProperty("proof") MerkleProof proof
) {}
