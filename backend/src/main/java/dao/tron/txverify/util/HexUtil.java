package dao.tron.txverify.util;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Hex helpers behind {@link dao.tron.txverify.model.Hash32} and proof siblings.
 *
 * All output is lowercase and 0x-prefixed; input accepts either case, with or without the prefix.
 */
public final class HexUtil {
    private HexUtil() {}

    public static String toHex0x(byte[] bytes) {
        return "0x" + toHexNoPrefix(bytes);
    }

    public static String toHexNoPrefix(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    public static String strip0x(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    /**
     * Strict decode: unlike Trident's {@code Numeric}, odd lengths are not left-padded.
     *
     * @throws IllegalArgumentException on odd length or a non-hex character
     */
    public static byte[] fromHex(String hex) {
        String clean = strip0x(hex == null ? "" : hex.trim());
        try {
            return Hex.decodeStrict(clean);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string '" + hex + "': " + e.getMessage(), e);
        }
    }
}
