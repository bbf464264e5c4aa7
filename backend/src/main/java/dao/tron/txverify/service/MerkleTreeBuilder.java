package dao.tron.txverify.service;

import dao.tron.txverify.model.Hash32;
import dao.tron.txverify.model.MerkleProof;
import dao.tron.txverify.model.ProofStep;
import dao.tron.txverify.model.Side;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds roots and sided proofs over an ordered list of leaf digests.
 *
 * Node hash is H(left || right) with position preserved (no sorting). A node without a
 * partner on its level is promoted unchanged, matching the batch recorder.
 */
@Service
public class MerkleTreeBuilder {

    private final HashAlgorithm algorithm;

    public MerkleTreeBuilder(HashAlgorithm algorithm) {
        this.algorithm = algorithm;
    }

    public Hash32 computeRoot(List<Hash32> leaves) {
        List<List<byte[]>> layers = buildLayers(leaves);
        return Hash32.of(layers.get(layers.size() - 1).get(0));
    }

    /**
     * Proof for the leaf at {@code index}, bottom-up. Promoted levels contribute no step.
     */
    public MerkleProof buildProof(List<Hash32> leaves, int index) {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }
        if (index < 0 || index >= leaves.size()) {
            throw new IndexOutOfBoundsException("Invalid leaf index: " + index);
        }

        List<List<byte[]>> layers = buildLayers(leaves);
        List<ProofStep> steps = new ArrayList<>();
        int idx = index;

        for (int layerIdx = 0; layerIdx < layers.size() - 1; layerIdx++) {
            List<byte[]> layer = layers.get(layerIdx);
            if (idx % 2 == 0) {
                if (idx + 1 < layer.size()) {
                    steps.add(new ProofStep(layer.get(idx + 1), Side.RIGHT));
                }
                // else: promoted, nothing to record
            } else {
                steps.add(new ProofStep(layer.get(idx - 1), Side.LEFT));
            }
            idx = idx / 2;
        }

        return new MerkleProof(index, steps);
    }

    private List<List<byte[]>> buildLayers(List<Hash32> leaves) {
        if (leaves == null || leaves.isEmpty()) {
            throw new IllegalArgumentException("No leaves");
        }

        List<List<byte[]>> layers = new ArrayList<>();
        List<byte[]> current = new ArrayList<>(leaves.size());
        for (Hash32 leaf : leaves) {
            if (leaf == null) {
                throw new IllegalArgumentException("Leaf must not be null");
            }
            current.add(leaf.toBytes());
        }
        layers.add(current);

        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>((current.size() + 1) / 2);
            for (int i = 0; i < current.size(); i += 2) {
                byte[] left = current.get(i);
                if (i + 1 < current.size()) {
                    next.add(algorithm.digest(left, current.get(i + 1)));
                } else {
                    next.add(left);
                }
            }
            layers.add(next);
            current = next;
        }
        return layers;
    }
}
