package utility;

import java.math.BigInteger;

/**
 *
 * @author Nakamoteam
 */
public final class VoteAggregator {

    private VoteAggregator() {
    }

    /**
     * @brief Homomorphic fold: if current = g^a and encryptedVote = g^b then
     * the result is g^(a+b). Associative and commutative, so arrival order
     * does not matter.
     */
    public static BigInteger fold(BigInteger current, BigInteger encryptedVote, BigInteger p) {
        return ModularArithmetic.mulMod(current, encryptedVote, p);
    }

    public static BigInteger foldAll(Iterable<BigInteger> encryptedVotes, BigInteger p) {
        BigInteger aggregate = BigInteger.ONE;
        for (BigInteger vote : encryptedVotes) {
            aggregate = fold(aggregate, vote, p);
        }
        return aggregate;
    }

    /**
     * @return 2^(candidateIndex * slotWidth), the exponent of one vote for
     * the candidate
     */
    public static BigInteger slotExponent(int candidateIndex, int slotWidth) {
        if (candidateIndex < 0) {
            throw new IllegalArgumentException("negative candidate index: " + candidateIndex);
        }
        return BigInteger.ONE.shiftLeft(candidateIndex * slotWidth);
    }

    /**
     * @return g^(2^(candidateIndex * slotWidth)) mod p, an unblinded vote
     */
    public static BigInteger encodeVote(GroupParameters group, int candidateIndex, int slotWidth) {
        return group.exp(slotExponent(candidateIndex, slotWidth));
    }
}
