package dao.tron.txverify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sibling path from a leaf to the root, bottom-up.
 * Only meaningful together with the batch whose root it claims to reach.
 */
public record MerkleProof(
        @JsonProperty("leaf_index") int leafIndex,
        @JsonProperty("steps") List<ProofStep> steps
) {

    public MerkleProof {
        // nulls are kept so that a malformed stored proof reaches the verifier intact
        steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public int depth() {
        return steps.size();
    }
}
