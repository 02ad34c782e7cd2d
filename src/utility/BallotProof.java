package utility;

import java.io.Serializable;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Disjunctive Chaum-Pedersen proof (Cramer, Damgard, Schoenmakers) that a
 * ballot B encodes exactly one candidate slot.
 * <p>
 * For candidate k let t_k = B / g^(2^(k*m)). The voter proves that for some
 * k both pk = g^x and t_k = Y^x hold, where Y is the voter's reconstructed
 * key, without revealing which k.
 * <p>
 * Branch k carries (a_k, b_k, c_k, r_k) with a_k = g^r_k * pk^c_k and
 * b_k = Y^r_k * t_k^c_k. The branch challenges must add up to
 * c = H(identity, pk, Y, B, a_0, b_0, ...) mod n. Only the real branch is
 * computed from x; all others are simulated.
 *
 * @author Nakamoteam
 */
public class BallotProof implements Serializable {

    private static final Logger logger = LoggerFactory.getLogger(BallotProof.class);

    private final List<BigInteger> a, b, c, r;

    public BallotProof(List<BigInteger> a, List<BigInteger> b, List<BigInteger> c, List<BigInteger> r) {
        this.a = copyOf(a, "a");
        this.b = copyOf(b, "b");
        this.c = copyOf(c, "c");
        this.r = copyOf(r, "r");
    }

    private static List<BigInteger> copyOf(List<BigInteger> values, String name) {
        List<BigInteger> copy = new ArrayList<>(Objects.requireNonNull(values, name));
        for (int k = 0; k < copy.size(); k++) {
            Objects.requireNonNull(copy.get(k), name + "[" + k + "]");
        }
        return Collections.unmodifiableList(copy);
    }

    public List<BigInteger> getA() {
        return a;
    }

    public List<BigInteger> getB() {
        return b;
    }

    public List<BigInteger> getC() {
        return c;
    }

    public List<BigInteger> getR() {
        return r;
    }

    public int branches() {
        return a.size();
    }

    /**
     * @brief Builds the proof for a ballot cast for candidateIndex
     * @param group field parameters
     * @param identity voter identity, bound into the challenge
     * @param x voter secret
     * @param reconstructedKey Y of the voter
     * @param ballot B = Y^x * g^(2^(candidateIndex*m))
     * @param candidateIndex the slot actually voted for
     * @param candidateCount number of candidates on the ballot
     * @param slotWidth m
     * @param random source of the simulated branches and of the real nonce
     */
    public static BallotProof build(GroupParameters group, String identity, BigInteger x, BigInteger reconstructedKey,
            BigInteger ballot, int candidateIndex, int candidateCount, int slotWidth, SecureRandom random) {
        if (candidateIndex < 0 || candidateIndex >= candidateCount) {
            throw new IllegalArgumentException("candidate index " + candidateIndex + " out of " + candidateCount);
        }
        BigInteger p = group.getP();
        BigInteger n = group.getExponentModulus();
        BigInteger pk = group.exp(x);

        BigInteger[] a = new BigInteger[candidateCount];
        BigInteger[] b = new BigInteger[candidateCount];
        BigInteger[] c = new BigInteger[candidateCount];
        BigInteger[] r = new BigInteger[candidateCount];

        BigInteger w = group.randomExponent(random);
        BigInteger simulatedSum = BigInteger.ZERO;
        for (int k = 0; k < candidateCount; k++) {
            if (k == candidateIndex) {
                a[k] = group.exp(w);
                b[k] = ModularArithmetic.power(reconstructedKey, w, p);
            } else {
                c[k] = group.randomExponent(random);
                r[k] = group.randomExponent(random);
                BigInteger t = slotTarget(group, ballot, k, slotWidth);
                a[k] = ModularArithmetic.mulMod(group.exp(r[k]), ModularArithmetic.power(pk, c[k], p), p);
                b[k] = ModularArithmetic.mulMod(ModularArithmetic.power(reconstructedKey, r[k], p),
                        ModularArithmetic.power(t, c[k], p), p);
                simulatedSum = ModularArithmetic.addMod(simulatedSum, c[k], n);
            }
        }

        BigInteger challenge = challenge(group, identity, pk, reconstructedKey, ballot, a, b);
        c[candidateIndex] = ModularArithmetic.subMod(challenge, simulatedSum, n);
        r[candidateIndex] = ModularArithmetic.subMod(w, x.multiply(c[candidateIndex]), n);

        return new BallotProof(Arrays.asList(a), Arrays.asList(b), Arrays.asList(c), Arrays.asList(r));
    }

    /**
     * @brief Checks that ballot encodes one of candidateCount slots under the
     * voter's pk and reconstructed key
     */
    public static boolean verify(GroupParameters group, String identity, BigInteger pk, BigInteger reconstructedKey,
            BigInteger ballot, int candidateCount, int slotWidth, BallotProof proof) {
        if (proof.branches() != candidateCount || proof.b.size() != candidateCount
                || proof.c.size() != candidateCount || proof.r.size() != candidateCount) {
            logger.debug("Ballot proof of {} rejected: expected {} branches", identity, candidateCount);
            return false;
        }
        if (!group.isElement(ballot)) {
            logger.debug("Ballot of {} rejected: value outside the field", identity);
            return false;
        }
        BigInteger p = group.getP();
        BigInteger n = group.getExponentModulus();

        BigInteger sum = BigInteger.ZERO;
        for (int k = 0; k < candidateCount; k++) {
            BigInteger ak = proof.a.get(k);
            BigInteger bk = proof.b.get(k);
            BigInteger ck = proof.c.get(k);
            BigInteger rk = proof.r.get(k);
            if (!group.isElement(ak) || !group.isElement(bk) || ck == null || rk == null
                    || ck.signum() < 0 || rk.signum() < 0) {
                logger.debug("Ballot proof of {} rejected: branch {} malformed", identity, k);
                return false;
            }
            BigInteger t = slotTarget(group, ballot, k, slotWidth);
            BigInteger left = ModularArithmetic.mulMod(group.exp(rk), ModularArithmetic.power(pk, ck, p), p);
            BigInteger right = ModularArithmetic.mulMod(ModularArithmetic.power(reconstructedKey, rk, p),
                    ModularArithmetic.power(t, ck, p), p);
            if (!left.equals(ak) || !right.equals(bk)) {
                logger.debug("Ballot proof of {} rejected: branch {} does not verify", identity, k);
                return false;
            }
            sum = ModularArithmetic.addMod(sum, ck, n);
        }

        BigInteger challenge = challenge(group, identity, pk, reconstructedKey, ballot,
                proof.a.toArray(new BigInteger[0]), proof.b.toArray(new BigInteger[0]));
        if (!sum.equals(challenge)) {
            logger.debug("Ballot proof of {} rejected: challenges do not add up", identity);
            return false;
        }
        return true;
    }

    // t_k = B * (g^(2^(k*m)))^-1 mod p
    private static BigInteger slotTarget(GroupParameters group, BigInteger ballot, int k, int slotWidth) {
        BigInteger slot = VoteAggregator.encodeVote(group, k, slotWidth);
        return ModularArithmetic.mulMod(ballot, ModularArithmetic.inverse(slot, group.getP()), group.getP());
    }

    private static BigInteger challenge(GroupParameters group, String identity, BigInteger pk, BigInteger y,
            BigInteger ballot, BigInteger[] a, BigInteger[] b) {
        BigInteger[] transcript = new BigInteger[3 + 2 * a.length];
        transcript[0] = pk;
        transcript[1] = y;
        transcript[2] = ballot;
        for (int k = 0; k < a.length; k++) {
            transcript[3 + 2 * k] = a[k];
            transcript[4 + 2 * k] = b[k];
        }
        return Utils.challenge(group.getExponentModulus(), identity, transcript);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final BallotProof other = (BallotProof) obj;
        return a.equals(other.a) && b.equals(other.b) && c.equals(other.c) && r.equals(other.r);
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, c, r);
    }

    @Override
    public String toString() {
        return "BallotProof{" + "branches=" + a.size() + '}';
    }

}
