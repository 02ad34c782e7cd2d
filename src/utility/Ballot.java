package utility;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Objects;

/**
 *
 * @author Nakamoteam
 */
public class Ballot implements Serializable {

    // encrypted vote, optionally with the proof that it encodes one candidate slot

    private final BigInteger encryptedVote;
    private final BallotProof proof; // null when the election does not ask for one

    public Ballot(BigInteger encryptedVote, BallotProof proof) {
        this.encryptedVote = Objects.requireNonNull(encryptedVote, "encryptedVote");
        this.proof = proof;
    }

    public Ballot(BigInteger encryptedVote) {
        this(encryptedVote, null);
    }

    public BigInteger getEncryptedVote() {
        return encryptedVote;
    }

    public BallotProof getProof() {
        return proof;
    }

    public boolean hasProof() {
        return proof != null;
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
        final Ballot other = (Ballot) obj;
        if (!Objects.equals(this.encryptedVote, other.encryptedVote)) {
            return false;
        }
        return Objects.equals(this.proof, other.proof);
    }

    @Override
    public int hashCode() {
        return Objects.hash(encryptedVote, proof);
    }

    @Override
    public String toString() {
        return "Ballot{" + "vote=" + Utils.shortHex(encryptedVote) + ", proof=" + (proof != null) + '}';
    }

}
