package election;

/**
 *
 * @author Nakamoteam
 */
public enum ElectionError {
    INVALID_CONFIGURATION,
    UNAUTHORIZED,
    WRONG_ROUND,
    INVALID_PROOF,
    DUPLICATE_KEY,
    INVALID_BALLOT,
    INVALID_TALLY,
    TALLY_MISMATCH,
    NOT_YET_FINALIZED,
    UNKNOWN_CANDIDATE,
    NO_WINNER
}
