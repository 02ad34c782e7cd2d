package utility;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Checks a claimed count vector against the aggregate of all ballots, and
 * finds that vector by a bounded search when nobody has claimed one yet.
 * <p>
 * The aggregate encodes the counts as g^(sum_i counts[i] * 2^(i*m)), so a
 * claim is checked with one exponentiation.
 *
 * @author Nakamoteam
 */
public final class TallyResolver {

    private TallyResolver() {
    }

    /**
     * @return sum_i counts[i] * 2^(i*slotWidth) mod modulus, built with
     * addMod/mulMod
     */
    public static BigInteger expectedExponent(List<BigInteger> counts, int slotWidth, BigInteger modulus) {
        BigInteger exponent = BigInteger.ZERO;
        for (int i = 0; i < counts.size(); i++) {
            BigInteger weighted = ModularArithmetic.mulMod(counts.get(i), VoteAggregator.slotExponent(i, slotWidth), modulus);
            exponent = ModularArithmetic.addMod(exponent, weighted, modulus);
        }
        return exponent;
    }

    /**
     * @return true iff aggregate = g^expectedExponent(counts) mod p
     */
    public static boolean matches(GroupParameters group, BigInteger aggregate, List<BigInteger> counts, int slotWidth) {
        BigInteger v = expectedExponent(counts, slotWidth, group.getExponentModulus());
        return group.exp(v).equals(aggregate.mod(group.getP()));
    }

    /**
     * @brief Winner = first candidate with the strictly greatest count; a
     * later candidate only replaces it with a larger count, so ties go to the
     * earliest position.
     * @return index of the winner, empty when every count is zero
     */
    public static Optional<Integer> selectWinner(List<BigInteger> counts) {
        int winner = -1;
        BigInteger best = BigInteger.ZERO;
        for (int i = 0; i < counts.size(); i++) {
            if (best.compareTo(counts.get(i)) < 0) {
                best = counts.get(i);
                winner = i;
            }
        }
        return winner < 0 ? Optional.empty() : Optional.of(winner);
    }

    /**
     * @brief Bounded discrete-log search: tries every way of splitting
     * ballotCount votes over candidateCount candidates and returns the first
     * split whose encoding matches the aggregate. The search space is
     * C(ballotCount + candidateCount - 1, candidateCount - 1) vectors, which
     * is small for the roster sizes this protocol targets.
     * @return the count vector, or empty if no split matches (malformed
     * ballots were folded in)
     */
    public static Optional<List<BigInteger>> recoverCounts(GroupParameters group, BigInteger aggregate,
            int candidateCount, int slotWidth, int ballotCount) {
        if (candidateCount <= 0 || ballotCount < 0) {
            throw new IllegalArgumentException("candidateCount=" + candidateCount + ", ballotCount=" + ballotCount);
        }
        BigInteger target = aggregate.mod(group.getP());
        int[] counts = new int[candidateCount];
        return search(group, target, slotWidth, counts, 0, ballotCount);
    }

    private static Optional<List<BigInteger>> search(GroupParameters group, BigInteger target, int slotWidth,
            int[] counts, int index, int remaining) {
        if (index == counts.length - 1) {
            counts[index] = remaining;
            List<BigInteger> candidate = toList(counts);
            if (matches(group, target, candidate, slotWidth)) {
                return Optional.of(candidate);
            }
            return Optional.empty();
        }
        for (int c = remaining; c >= 0; c--) {
            counts[index] = c;
            Optional<List<BigInteger>> found = search(group, target, slotWidth, counts, index + 1, remaining - c);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private static List<BigInteger> toList(int[] counts) {
        List<BigInteger> list = new ArrayList<>(counts.length);
        for (int count : counts) {
            list.add(BigInteger.valueOf(count));
        }
        return Collections.unmodifiableList(list);
    }
}
