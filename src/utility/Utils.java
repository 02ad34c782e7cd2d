package utility;

import java.math.BigInteger;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.Pack;
import org.bouncycastle.util.Strings;
import org.bouncycastle.util.encoders.Hex;

/**
 *
 * @author Nakamoteam
 */
public final class Utils {

    private static final int SHORT_HEX_DIGITS = 12;

    private Utils() {
    }

    /**
     * @brief Fiat-Shamir challenge: SHA-256 over the identity and the given
     * group elements, read as a non-negative integer and reduced mod modulus.
     * Every field is length-prefixed so that no two transcripts share an
     * encoding.
     * @param modulus exponent modulus of the group
     * @param identity identity the transcript is bound to
     * @param values group elements of the transcript, in protocol order
     */
    public static BigInteger challenge(BigInteger modulus, String identity, BigInteger... values) {
        SHA256Digest digest = new SHA256Digest();
        for (BigInteger value : values) {
            update(digest, BigIntegers.asUnsignedByteArray(value));
        }
        update(digest, Strings.toUTF8ByteArray(identity));

        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        return new BigInteger(1, hash).mod(modulus);
    }

    private static void update(SHA256Digest digest, byte[] field) {
        digest.update(Pack.intToBigEndian(field.length), 0, 4);
        digest.update(field, 0, field.length);
    }

    /**
     * @return the leading hex digits of value, for log lines
     */
    public static String shortHex(BigInteger value) {
        if (value == null) {
            return "null";
        }
        String hex = Hex.toHexString(BigIntegers.asUnsignedByteArray(value));
        return hex.length() <= SHORT_HEX_DIGITS ? hex : hex.substring(0, SHORT_HEX_DIGITS) + "..";
    }

    public static String toHex(BigInteger value) {
        return Hex.toHexString(BigIntegers.asUnsignedByteArray(value));
    }

    public static BigInteger fromHex(String hex) {
        return new BigInteger(hex.replaceAll("\\s+", ""), 16);
    }
}
