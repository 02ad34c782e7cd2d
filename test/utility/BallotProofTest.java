package utility;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class BallotProofTest {

    private static final int CANDIDATES = 3;
    private static final int SLOT_WIDTH = 2;

    private final GroupParameters group = GroupParameters.rfc3526();
    private final SecureRandom random = new SecureRandom();

    private final BigInteger x = group.randomExponent(random);
    private final BigInteger pk = group.exp(x);
    private final BigInteger y = group.exp(group.randomExponent(random)); // stands in for the reconstructed key

    private BigInteger ballotFor(int candidate) {
        return ModularArithmetic.mulMod(ModularArithmetic.power(y, x, group.getP()),
                VoteAggregator.encodeVote(group, candidate, SLOT_WIDTH), group.getP());
    }

    @Test
    public void testProofVerifiesForEveryCandidate() {
        for (int k = 0; k < CANDIDATES; k++) {
            BigInteger ballot = ballotFor(k);
            BallotProof proof = BallotProof.build(group, "alice", x, y, ballot, k, CANDIDATES, SLOT_WIDTH, random);
            assertEquals(CANDIDATES, proof.branches());
            assertTrue("Proof for candidate " + k + " must verify",
                    BallotProof.verify(group, "alice", pk, y, ballot, CANDIDATES, SLOT_WIDTH, proof));
        }
    }

    @Test
    public void testBallotOutsideTheSlotsIsRejected() {
        // counts three times for candidate 0: exponent 3 is not a slot value
        BigInteger stuffed = ModularArithmetic.mulMod(ModularArithmetic.power(y, x, group.getP()),
                group.exp(BigInteger.valueOf(3)), group.getP());
        for (int k = 0; k < CANDIDATES; k++) {
            BallotProof proof = BallotProof.build(group, "alice", x, y, stuffed, k, CANDIDATES, SLOT_WIDTH, random);
            assertFalse("Stuffed ballot must not verify via branch " + k,
                    BallotProof.verify(group, "alice", pk, y, stuffed, CANDIDATES, SLOT_WIDTH, proof));
        }
    }

    @Test
    public void testProofIsBoundToIdentity() {
        BigInteger ballot = ballotFor(1);
        BallotProof proof = BallotProof.build(group, "alice", x, y, ballot, 1, CANDIDATES, SLOT_WIDTH, random);
        assertFalse(BallotProof.verify(group, "mallory", pk, y, ballot, CANDIDATES, SLOT_WIDTH, proof));
    }

    @Test
    public void testProofDoesNotTransferToAnotherBallot() {
        BallotProof proof = BallotProof.build(group, "alice", x, y, ballotFor(1), 1, CANDIDATES, SLOT_WIDTH, random);
        assertFalse(BallotProof.verify(group, "alice", pk, y, ballotFor(2), CANDIDATES, SLOT_WIDTH, proof));
    }

    @Test
    public void testTamperedChallengeIsRejected() {
        BigInteger ballot = ballotFor(0);
        BallotProof proof = BallotProof.build(group, "alice", x, y, ballot, 0, CANDIDATES, SLOT_WIDTH, random);
        List<BigInteger> c = new ArrayList<>(proof.getC());
        c.set(2, c.get(2).add(BigInteger.ONE));
        BallotProof tampered = new BallotProof(proof.getA(), proof.getB(), c, proof.getR());
        assertFalse(BallotProof.verify(group, "alice", pk, y, ballot, CANDIDATES, SLOT_WIDTH, tampered));
    }

    @Test
    public void testWrongNumberOfBranchesIsRejected() {
        BigInteger ballot = ballotFor(0);
        BallotProof proof = BallotProof.build(group, "alice", x, y, ballot, 0, 2, SLOT_WIDTH, random);
        assertFalse(BallotProof.verify(group, "alice", pk, y, ballot, CANDIDATES, SLOT_WIDTH, proof));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCandidateIndexOutOfRange() {
        BallotProof.build(group, "alice", x, y, ballotFor(0), CANDIDATES, CANDIDATES, SLOT_WIDTH, random);
    }
}
