package utility;

import java.math.BigInteger;
import java.security.SecureRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fiat-Shamir Schnorr proof of knowledge of a discrete logarithm.
 * <p>
 * Prover: pick v, gv = g^v, c = H(g, gv, pk, identity), r = v - x*c mod n.
 * <p>
 * Verifier: recompute c and check gv = g^r * pk^c mod p.
 * <p>
 * The identity is part of the hash, so a proof made by one voter does not
 * verify under another voter's identity.
 *
 * @author Nakamoteam
 */
public final class Schnorr {

    private static final Logger logger = LoggerFactory.getLogger(Schnorr.class);

    private Schnorr() {
    }

    /**
     * @brief Builds the registration proof for the secret x
     * @param group field parameters
     * @param x secret exponent, pk = g^x
     * @param identity identity of the prover, bound into the challenge
     * @param random source of the nonce v
     * @return (pk, gv, r)
     */
    public static SchnorrProof prove(GroupParameters group, BigInteger x, String identity, SecureRandom random) {
        BigInteger n = group.getExponentModulus();
        BigInteger pk = group.exp(x);

        BigInteger v = group.randomExponent(random);
        BigInteger gv = group.exp(v);
        BigInteger c = challenge(group, gv, pk, identity);
        BigInteger r = ModularArithmetic.subMod(v, x.multiply(c), n);

        return new SchnorrProof(pk, gv, r);
    }

    /**
     * @brief Checks the proof against the claimed identity. Never needs x or v.
     * @return true iff gv = g^r * pk^c mod p
     */
    public static boolean verify(GroupParameters group, SchnorrProof proof, String identity) {
        BigInteger p = group.getP();
        if (!group.isElement(proof.getPk()) || !group.isElement(proof.getGv())) {
            logger.debug("Proof of {} rejected: pk or gv outside the field", identity);
            return false;
        }
        if (proof.getR().signum() < 0) {
            logger.debug("Proof of {} rejected: negative response", identity);
            return false;
        }

        BigInteger c = challenge(group, proof.getGv(), proof.getPk(), identity);
        BigInteger expected = ModularArithmetic.mulMod(
                group.exp(proof.getR()),
                ModularArithmetic.power(proof.getPk(), c, p),
                p);

        if (!expected.equals(proof.getGv())) {
            logger.debug("Proof of {} rejected: gv != g^r * pk^c", identity);
            return false;
        }
        return true;
    }

    private static BigInteger challenge(GroupParameters group, BigInteger gv, BigInteger pk, String identity) {
        return Utils.challenge(group.getExponentModulus(), identity, group.getG(), gv, pk);
    }
}
