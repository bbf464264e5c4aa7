package dao.tron.txverify.service;

import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.MerkleProof;
import dao.tron.txverify.model.ProofStep;
import dao.tron.txverify.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static dao.tron.txverify.service.MerkleTreeBuilderTest.leaves;
import static org.junit.jupiter.api.Assertions.*;

class MerkleProofVerifierTest {

    private MerkleTreeBuilder builder;
    private MerkleProofVerifier verifier;

    @BeforeEach
    void setUp() {
        builder = new MerkleTreeBuilder(HashAlgorithm.SHA256);
        verifier = new MerkleProofVerifier(HashAlgorithm.SHA256);
    }

    @Test
    @DisplayName("Every leaf proves to the root for tree sizes 1..17")
    void testSoundForAllPositions() {
        for (int size = 1; size <= 17; size++) {
            List<Hash32> leaves = leaves(size);
            Hash32 root = builder.computeRoot(leaves);
            for (int i = 0; i < size; i++) {
                MerkleProof proof = builder.buildProof(leaves, i);
                assertTrue(verifier.verify(leaves.get(i), proof, root), "size " + size + " index " + i);
            }
        }
    }

    @Test
    @DisplayName("Promoted leaf proves with fewer steps than its index bits")
    void testPromotedLeafShortProof() {
        // leaf 4 of 5 is promoted twice and meets the rest only at the top
        List<Hash32> leaves = leaves(5);
        Hash32 root = builder.computeRoot(leaves);

        MerkleProof proof = builder.buildProof(leaves, 4);

        assertEquals(1, proof.depth());
        assertEquals(Side.LEFT, proof.steps().get(0).getSide());
        assertTrue(verifier.verify(leaves.get(4), proof, root));
    }

    @Test
    @DisplayName("A flipped bit in leaf, sibling or root fails verification")
    void testBitFlipsRejected() {
        // Arrange
        List<Hash32> leaves = leaves(6);
        Hash32 root = builder.computeRoot(leaves);
        Hash32 leaf = leaves.get(3);
        MerkleProof proof = builder.buildProof(leaves, 3);

        for (int bit = 0; bit < 256; bit += 37) {
            // Act + Assert: leaf and root
            assertFalse(verifier.verify(leaf.flipBit(bit), proof, root), "leaf bit " + bit);
            assertFalse(verifier.verify(leaf, proof, root.flipBit(bit)), "root bit " + bit);

            // sibling of each step
            for (int s = 0; s < proof.depth(); s++) {
                assertFalse(verifier.verify(leaf, withSibling(proof, s, bit), root), "step " + s + " bit " + bit);
            }
        }
    }

    @Test
    @DisplayName("Swapping a step's side fails verification")
    void testWrongSideRejected() {
        List<Hash32> leaves = leaves(4);
        Hash32 root = builder.computeRoot(leaves);
        MerkleProof proof = builder.buildProof(leaves, 1);

        List<ProofStep> steps = new ArrayList<>(proof.steps());
        ProofStep first = steps.get(0);
        steps.set(0, new ProofStep(first.getSibling(), first.getSide() == Side.LEFT ? Side.RIGHT : Side.LEFT));

        assertFalse(verifier.verify(leaves.get(1), new MerkleProof(1, steps), root));
    }

    @Test
    @DisplayName("Malformed proofs fail closed without throwing")
    void testMalformedProofsFailClosed() {
        List<Hash32> leaves = leaves(4);
        Hash32 root = builder.computeRoot(leaves);
        Hash32 leaf = leaves.get(0);
        MerkleProof good = builder.buildProof(leaves, 0);

        List<ProofStep> withNullStep = new ArrayList<>(good.steps());
        withNullStep.set(0, null);
        List<ProofStep> shortSibling = new ArrayList<>(good.steps());
        shortSibling.set(0, new ProofStep(new byte[31], Side.RIGHT));
        List<ProofStep> noSide = new ArrayList<>(good.steps());
        noSide.set(0, new ProofStep(good.steps().get(0).getSibling(), null));

        assertFalse(verifier.verify(null, good, root));
        assertFalse(verifier.verify(leaf, null, root));
        assertFalse(verifier.verify(leaf, good, null));
        assertFalse(verifier.verify(leaf, new MerkleProof(-1, good.steps()), root));
        assertFalse(verifier.verify(leaf, new MerkleProof(0, withNullStep), root));
        assertFalse(verifier.verify(leaf, new MerkleProof(0, shortSibling), root));
        assertFalse(verifier.verify(leaf, new MerkleProof(0, noSide), root));
    }

    @Test
    @DisplayName("Empty proof only verifies a lone leaf at index 0")
    void testEmptyProof() {
        Hash32 only = leaves(1).get(0);

        assertTrue(verifier.verify(only, new MerkleProof(0, List.of()), only));
        assertFalse(verifier.verify(only, new MerkleProof(1, List.of()), only));
        assertFalse(verifier.verify(only, new MerkleProof(0, List.of()), leaves(2).get(1)));
    }

    private static MerkleProof withSibling(MerkleProof proof, int stepIndex, int bit) {
        List<ProofStep> steps = new ArrayList<>(proof.steps());
        ProofStep step = steps.get(stepIndex);
        byte[] sibling = Arrays.copyOf(step.getSibling(), Hash32.LENGTH);
        sibling[bit / 8] ^= (byte) (1 << (bit % 8));
        steps.set(stepIndex, new ProofStep(sibling, step.getSide()));
        return new MerkleProof(proof.leafIndex(), steps);
    }
}
