package dao.tron.txverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Full batch payload as kept in object storage.
 *
 * {@code claimedRoot} is whatever the payload says; it is informational only; the ledger root
 * on the {@link BatchDescriptor} is the one proofs are checked against.
 */
public record BatchContents(
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("merkle_root") Hash32 claimedRoot,
        @JsonProperty("leaves") List<LeafEntry> leaves
) {

    public BatchContents {
        leaves = leaves == null
                ? List.of()
                : leaves.stream().sorted(Comparator.comparingInt(LeafEntry::index)).toList();
    }

    public List<Hash32> leafHashes() {
        return leaves.stream().map(LeafEntry::leafHash).toList();
    }

    /** First leaf (lowest index) carrying the given digest. */
    public Optional<LeafEntry> findLeaf(Hash32 leafHash) {
        return leaves.stream().filter(l -> leafHash.equals(l.leafHash())).findFirst();
    }

    public boolean containsLeaf(Hash32 leafHash) {
        return findLeaf(leafHash).isPresent();
    }
}
