package dao.tron.txverify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dao.tron.txverify.util.HexUtil;

import java.util.Arrays;
import java.util.Objects;

/**
 * One sibling on the leaf-to-root path.
 *
 * The sibling bytes are kept raw: a stored proof may carry a sibling of the wrong length,
 * and the verifier has to be able to see (and reject) it.
 */
public final class ProofStep {

    private final byte[] sibling;
    private final Side side;

    public ProofStep(byte[] sibling, Side side) {
        this.sibling = sibling == null ? null : sibling.clone();
        this.side = side;
    }

    @JsonCreator
    public static ProofStep fromJson(@JsonProperty("hash") String hash, @JsonProperty("side") Side side) {
        return new ProofStep(hash == null ? null : HexUtil.fromHex(hash), side);
    }

    public static ProofStep of(Hash32 sibling, Side side) {
        return new ProofStep(sibling.toBytes(), side);
    }

    @JsonIgnore
    public byte[] getSibling() {
        return sibling == null ? null : sibling.clone();
    }

    @JsonProperty("hash")
    public String getHash() {
        return sibling == null ? null : HexUtil.toHex0x(sibling);
    }

    @JsonProperty("side")
    public Side getSide() {
        return side;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProofStep)) return false;
        ProofStep that = (ProofStep) o;
        return Arrays.equals(sibling, that.sibling) && side == that.side;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(sibling) + Objects.hashCode(side);
    }

    @Override
    public String toString() {
        return side + ":" + getHash();
    }
}
