package dao.tron.txverify.service;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Hash function shared by record digests and Merkle nodes. Both produce 32 bytes.
 */
public enum HashAlgorithm {

    SHA256 {
        @Override
        Digest newDigest() {
            return new SHA256Digest();
        }
    },

    /** Ethereum/TRON flavour of SHA-3 (pre-standard padding). */
    KECCAK256 {
        @Override
        Digest newDigest() {
            return new KeccakDigest(256);
        }
    };

    abstract Digest newDigest();

    /**
     * Hashes the concatenation of {@code parts}.
     */
    public byte[] digest(byte[]... parts) {
        Digest d = newDigest();
        for (byte[] part : parts) {
            d.update(part, 0, part.length);
        }
        byte[] out = new byte[d.getDigestSize()];
        d.doFinal(out, 0);
        return out;
    }
}
