package election;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utility.Ballot;
import utility.BallotProof;
import utility.GroupParameters;
import utility.Schnorr;
import utility.SchnorrProof;
import utility.TallyResolver;
import utility.Utils;
import utility.VoteAggregator;

/**
 * One self-tallying election: registration of proven public keys, one
 * ballot per voter folded into a running product, then a public tally that
 * anyone can check against that product.
 * <p>
 * Every mutating operation checks all of its preconditions before it writes
 * anything, under a single write lock, so a failure leaves the election
 * exactly as it was. Queries take the read lock and return immutable values.
 *
 * @author Nakamoteam
 */
public class Election {

    private static final Logger logger = LoggerFactory.getLogger(Election.class);

    private static final int PRIME_CERTAINTY = 64;

    private final ElectionConfig config;
    private final GroupParameters group;
    private final VoterRegistry registry;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Round round;
    private int registrationCount;
    private int voteCount;
    private BigInteger aggregate;
    private TallyResult result;

    private Election(ElectionConfig config) {
        this.config = config;
        this.group = config.getGroup();
        this.registry = new VoterRegistry(config.getVoters());
        this.round = Round.REGISTRATION;
        this.registrationCount = 0;
        this.voteCount = 0;
        this.aggregate = BigInteger.ONE;
        this.result = null;
    }

    /**
     * @brief Validates the initializer's parameters and opens the
     * registration round
     * @return the new election, or INVALID_CONFIGURATION
     */
    public static ElectionResult<Election> create(ElectionConfig config) {
        if (config == null) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "no configuration");
        }
        List<String> candidates = config.getCandidates();
        if (candidates.isEmpty()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "no candidates");
        }
        if (candidates.contains(null) || new HashSet<>(candidates).size() != candidates.size()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "candidate names must be distinct and non-null");
        }
        List<String> voters = config.getVoters();
        if (voters.isEmpty()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "empty roster");
        }
        if (voters.contains(null) || new HashSet<>(voters).size() != voters.size()) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "voter identities are not distinct");
        }

        GroupParameters group = config.getGroup();
        if (group == null) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "no group parameters");
        }
        BigInteger p = group.getP();
        if (p.compareTo(BigInteger.valueOf(5)) < 0 || !p.isProbablePrime(PRIME_CERTAINTY)) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "modulus is not a prime");
        }
        BigInteger g = group.getG();
        if (g.compareTo(BigInteger.ONE) <= 0 || g.compareTo(p.subtract(BigInteger.ONE)) >= 0) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION, "generator must lie in (1, p-1)");
        }

        int m = config.getSlotWidth();
        if (m != ElectionConfig.slotWidthFor(candidates.size())) {
            return ElectionResult.failure(ElectionError.INVALID_CONFIGURATION,
                    "slot width " + m + " does not satisfy 2^m > " + candidates.size() + " >= 2^(m-1)");
        }

        Election election = new Election(config);
        logger.info("Election opened: {} candidates, {} voters, {}, ballot proofs {}", candidates.size(),
                voters.size(), group, config.isBallotProofRequired() ? "required" : "not required");
        return ElectionResult.success(election);
    }

    /**
     * @brief Registration round: binds pk to voterId once the Schnorr proof
     * checks out. The last registration opens the voting round.
     * @param voterId caller identity, supplied by the hosting environment
     * @param proof (pk, gv, r)
     * @return the round after the call
     */
    public ElectionResult<Round> submitPublicKey(String voterId, SchnorrProof proof) {
        lock.writeLock().lock();
        try {
            if (round != Round.REGISTRATION) {
                return reject(ElectionError.WRONG_ROUND, "public keys are accepted only during REGISTRATION, not " + round);
            }
            if (!registry.contains(voterId)) {
                return reject(ElectionError.UNAUTHORIZED, voterId + " is not on the roster");
            }
            if (registry.isRegistered(voterId)) {
                return reject(ElectionError.UNAUTHORIZED, voterId + " has already registered a key");
            }
            if (proof == null) {
                return reject(ElectionError.INVALID_PROOF, "no proof from " + voterId);
            }
            String owner = registry.ownerOf(proof.getPk());
            if (owner != null) {
                return reject(ElectionError.DUPLICATE_KEY, "key of " + voterId + " is already bound to " + owner);
            }
            if (!Schnorr.verify(group, proof, voterId)) {
                return reject(ElectionError.INVALID_PROOF, "proof of knowledge from " + voterId + " does not verify");
            }

            registry.bindKey(voterId, proof.getPk());
            registrationCount++;
            logger.debug("Registered {} with key {}", voterId, Utils.shortHex(proof.getPk()));

            if (registrationCount == registry.size()) {
                registry.computeReconstructedKeys(group);
                advance(Round.VOTING);
            }
            return ElectionResult.success(round);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @brief Voting round, unblinded or blinded value without a validity
     * proof
     */
    public ElectionResult<Round> submitVote(String voterId, BigInteger encryptedVote) {
        if (encryptedVote == null) {
            return reject(ElectionError.INVALID_BALLOT, "no ballot from " + voterId);
        }
        return submitVote(voterId, new Ballot(encryptedVote));
    }

    /**
     * @brief Voting round: folds the ballot into the aggregate and spends the
     * voter's eligibility. The last ballot moves the election to
     * TALLY_PENDING.
     * @return the round after the call
     */
    public ElectionResult<Round> submitVote(String voterId, Ballot ballot) {
        lock.writeLock().lock();
        try {
            if (round != Round.VOTING) {
                return reject(ElectionError.WRONG_ROUND, "ballots are accepted only during VOTING, not " + round);
            }
            if (!registry.contains(voterId)) {
                return reject(ElectionError.UNAUTHORIZED, voterId + " is not on the roster");
            }
            if (!registry.isEligible(voterId)) {
                return reject(ElectionError.UNAUTHORIZED, voterId + " has already voted");
            }
            if (ballot == null || !group.isElement(ballot.getEncryptedVote())) {
                return reject(ElectionError.INVALID_BALLOT, "ballot of " + voterId + " is not a field element");
            }
            if (config.isBallotProofRequired()) {
                if (!ballot.hasProof()) {
                    return reject(ElectionError.INVALID_BALLOT, "ballot of " + voterId + " carries no validity proof");
                }
                if (!BallotProof.verify(group, voterId, registry.getPublicKey(voterId), registry.getReconstructedKey(voterId),
                        ballot.getEncryptedVote(), config.getCandidates().size(), config.getSlotWidth(), ballot.getProof())) {
                    return reject(ElectionError.INVALID_BALLOT, "validity proof of " + voterId + " does not verify");
                }
            }

            registry.consumeEligibility(voterId);
            aggregate = VoteAggregator.fold(aggregate, ballot.getEncryptedVote(), group.getP());
            voteCount++;
            logger.debug("Ballot from {} folded ({} of {})", voterId, voteCount, registry.size());

            if (voteCount == registry.size()) {
                advance(Round.TALLY_PENDING);
            }
            return ElectionResult.success(round);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @brief Tally round, open to anyone: accepts the claimed counts iff
     * g^(sum_i counts[i] * 2^(i*m)) equals the aggregate, then closes the
     * election
     * @param claimedCounts one count per candidate, in ballot order
     */
    public ElectionResult<TallyResult> resolveTally(List<BigInteger> claimedCounts) {
        lock.writeLock().lock();
        try {
            if (round != Round.TALLY_PENDING) {
                return reject(ElectionError.WRONG_ROUND, "tally is accepted only during TALLY_PENDING, not " + round);
            }
            List<String> candidates = config.getCandidates();
            if (claimedCounts == null || claimedCounts.size() != candidates.size()) {
                return reject(ElectionError.INVALID_TALLY, "expected " + candidates.size() + " counts, got "
                        + (claimedCounts == null ? 0 : claimedCounts.size()));
            }
            BigInteger total = BigInteger.ZERO;
            for (BigInteger count : claimedCounts) {
                if (count == null || count.signum() < 0) {
                    return reject(ElectionError.INVALID_TALLY, "counts must be non-negative: " + claimedCounts);
                }
                total = total.add(count);
            }
            // exponents are compared mod p-1, so only vectors summing to the ballots cast are unambiguous
            if (!total.equals(BigInteger.valueOf(voteCount))) {
                return reject(ElectionError.INVALID_TALLY, "counts add up to " + total + " but " + voteCount + " ballots were cast");
            }
            if (!TallyResolver.matches(group, aggregate, claimedCounts, config.getSlotWidth())) {
                return reject(ElectionError.TALLY_MISMATCH, "counts " + claimedCounts + " do not reproduce the aggregate");
            }

            result = new TallyResult(candidates, new ArrayList<>(claimedCounts));
            advance(Round.CLOSED);
            logger.info("Tally accepted: {}", result);
            return ElectionResult.success(result);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> getCandidates() {
        return config.getCandidates();
    }

    public Round getRound() {
        lock.readLock().lock();
        try {
            return round;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ElectionResult<BigInteger> getCandidateVotes(String name) {
        lock.readLock().lock();
        try {
            if (round != Round.CLOSED) {
                return ElectionResult.failure(ElectionError.NOT_YET_FINALIZED, "election is in " + round);
            }
            BigInteger count = result.getCounts().get(name);
            if (count == null) {
                return ElectionResult.failure(ElectionError.UNKNOWN_CANDIDATE, name + " is not on the ballot");
            }
            return ElectionResult.success(count);
        } finally {
            lock.readLock().unlock();
        }
    }

    public ElectionResult<String> getWinner() {
        lock.readLock().lock();
        try {
            if (round != Round.CLOSED) {
                return ElectionResult.failure(ElectionError.NOT_YET_FINALIZED, "election is in " + round);
            }
            Optional<String> winner = result.getWinner();
            if (!winner.isPresent()) {
                return ElectionResult.failure(ElectionError.NO_WINNER, "every candidate has zero votes");
            }
            return ElectionResult.success(winner.get());
        } finally {
            lock.readLock().unlock();
        }
    }

    public ElectionResult<TallyResult> getResult() {
        lock.readLock().lock();
        try {
            if (round != Round.CLOSED) {
                return ElectionResult.failure(ElectionError.NOT_YET_FINALIZED, "election is in " + round);
            }
            return ElectionResult.success(result);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the product of all ballots, public once every voter has voted
     */
    public ElectionResult<BigInteger> getAggregate() {
        lock.readLock().lock();
        try {
            if (round.isBefore(Round.TALLY_PENDING)) {
                return ElectionResult.failure(ElectionError.WRONG_ROUND, "aggregate is published after VOTING, election is in " + round);
            }
            return ElectionResult.success(aggregate);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return Y for voterId, the base its ballot is blinded with
     */
    public ElectionResult<BigInteger> getReconstructedKey(String voterId) {
        lock.readLock().lock();
        try {
            if (round == Round.REGISTRATION) {
                return ElectionResult.failure(ElectionError.WRONG_ROUND, "keys are reconstructed when REGISTRATION ends");
            }
            if (!registry.contains(voterId)) {
                return ElectionResult.failure(ElectionError.UNAUTHORIZED, voterId + " is not on the roster");
            }
            return ElectionResult.success(registry.getReconstructedKey(voterId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BigInteger> getPublicKey(String voterId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(registry.getPublicKey(voterId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return registered public keys in roster order, null for voters that
     * have not registered yet
     */
    public Map<String, BigInteger> getPublicKeys() {
        lock.readLock().lock();
        try {
            return registry.publicKeys();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getRegistrationCount() {
        lock.readLock().lock();
        try {
            return registrationCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getVoteCount() {
        lock.readLock().lock();
        try {
            return voteCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ElectionConfig getConfig() {
        return config;
    }

    private void advance(Round next) {
        logger.info("Round {} -> {}", round, next);
        round = next;
    }

    private static <T> ElectionResult<T> reject(ElectionError error, String reason) {
        logger.warn("{}: {}", error, reason);
        return ElectionResult.failure(error, reason);
    }
}
