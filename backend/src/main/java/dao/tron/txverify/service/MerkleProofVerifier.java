package dao.tron.txverify.service;

import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.MerkleProof;
import dao.tron.txverify.model.ProofStep;
import dao.tron.txverify.model.Side;
import org.bouncycastle.util.Arrays;
import org.springframework.stereotype.Service;

/**
 * Checks that a leaf digest folds up to an expected root along a sided proof.
 *
 * Fails closed: any structural problem with the proof yields {@code false}, never an exception.
 * The final comparison is constant-time.
 */
@Service
public class MerkleProofVerifier {

    private final HashAlgorithm algorithm;

    public MerkleProofVerifier(HashAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public boolean verify(Hash32 leaf, MerkleProof proof, Hash32 expectedRoot) {
        if (leaf == null || proof == null || expectedRoot == null) return false;
        if (proof.leafIndex() < 0) return false;
        // a lone leaf is its own root and must sit at index 0
        if (proof.steps().isEmpty() && proof.leafIndex() != 0) return false;

        byte[] running = leaf.toBytes();
        for (ProofStep step : proof.steps()) {
            if (step == null) return false;
            byte[] sibling = step.getSibling();
            if (sibling == null || sibling.length != Hash32.LENGTH || step.getSide() == null) {
                return false;
            }
            running = step.getSide() == Side.LEFT
                    ? algorithm.digest(sibling, running)
                    : algorithm.digest(running, sibling);
        }
        return Arrays.constantTimeAreEqual(running, expectedRoot.toBytes());
    }
}
