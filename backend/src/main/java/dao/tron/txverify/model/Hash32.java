package dao.tron.txverify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dao.tron.txverify.util.HexUtil;

import java.util.Arrays;

/**
 * A 32-byte digest: leaf hashes, Merkle roots and intermediate nodes.
 */
public final class Hash32 {

    public static final int LENGTH = 32;

    private final byte[] bytes;

    private Hash32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Hash32 of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Digest must be " + LENGTH + " bytes, got "
                    + (bytes == null ? "null" : bytes.length));
        }
        return new Hash32(bytes.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Hash32 fromHex(String hex) {
        return of(HexUtil.fromHex(hex));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    /** Returns a copy with one bit inverted. */
    public Hash32 flipBit(int bitIndex) {
        byte[] copy = bytes.clone();
        copy[bitIndex / 8] ^= (byte) (1 << (bitIndex % 8));
        return new Hash32(copy);
    }

    @JsonValue
    public String toHex() {
        return HexUtil.toHex0x(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash32)) return false;
        return Arrays.equals(bytes, ((Hash32) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
