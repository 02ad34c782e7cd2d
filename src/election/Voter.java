package election;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Objects;
import utility.Ballot;
import utility.BallotProof;
import utility.GroupParameters;
import utility.ModularArithmetic;
import utility.Schnorr;
import utility.SchnorrProof;
import utility.VoteAggregator;

/**
 * Voter side of the protocol. Keeps the secret x, which never leaves this
 * object.
 *
 * @author Nakamoteam
 */
public class Voter {

    private final String identity;
    private final GroupParameters group;
    private final SecureRandom random;
    private final BigInteger secret;
    private final BigInteger publicKey;

    public Voter(String identity, GroupParameters group, SecureRandom random) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.group = Objects.requireNonNull(group, "group");
        this.random = Objects.requireNonNull(random, "random");
        this.secret = group.randomExponent(random);
        this.publicKey = group.exp(secret);
    }

    public Voter(String identity, GroupParameters group) {
        this(identity, group, new SecureRandom());
    }

    public String getIdentity() {
        return identity;
    }

    public BigInteger getPublicKey() {
        return publicKey;
    }

    /**
     * @brief Proof that this voter knows the secret behind its public key,
     * bound to its identity
     */
    public SchnorrProof registrationProof() {
        return Schnorr.prove(group, secret, identity, random);
    }

    /**
     * @brief Sends the registration proof to the election
     */
    public ElectionResult<Round> register(Election election) {
        return election.submitPublicKey(identity, registrationProof());
    }

    /**
     * @brief Blinded ballot Y^x * g^(2^(candidateIndex*m))
     * @param candidateIndex position of the chosen candidate
     * @param reconstructedKey Y published by the election for this voter
     * @param candidateCount number of candidates on the ballot
     * @param slotWidth m
     * @param withProof attach the proof that the ballot encodes one slot
     */
    public Ballot castBallot(int candidateIndex, BigInteger reconstructedKey, int candidateCount, int slotWidth,
            boolean withProof) {
        if (candidateIndex < 0 || candidateIndex >= candidateCount) {
            throw new IllegalArgumentException("candidate index " + candidateIndex + " out of " + candidateCount);
        }
        BigInteger p = group.getP();
        BigInteger blinding = ModularArithmetic.power(reconstructedKey, secret, p);
        BigInteger vote = ModularArithmetic.mulMod(blinding, VoteAggregator.encodeVote(group, candidateIndex, slotWidth), p);

        BallotProof proof = null;
        if (withProof) {
            proof = BallotProof.build(group, identity, secret, reconstructedKey, vote, candidateIndex, candidateCount,
                    slotWidth, random);
        }
        return new Ballot(vote, proof);
    }

    /**
     * @brief Casts a blinded ballot for the named candidate, with a validity
     * proof when the election asks for one
     */
    public ElectionResult<Round> vote(Election election, String candidate) {
        int index = election.getCandidates().indexOf(candidate);
        if (index < 0) {
            return ElectionResult.failure(ElectionError.UNKNOWN_CANDIDATE, candidate + " is not on the ballot");
        }
        ElectionResult<BigInteger> key = election.getReconstructedKey(identity);
        if (!key.isSuccess()) {
            return key.castFailure();
        }
        ElectionConfig config = election.getConfig();
        Ballot ballot = castBallot(index, key.getValue(), config.getCandidates().size(), config.getSlotWidth(),
                config.isBallotProofRequired());
        return election.submitVote(identity, ballot);
    }

    @Override
    public String toString() {
        return "Voter{" + identity + '}';
    }
}
