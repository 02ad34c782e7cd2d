package election;

/**
 * Protocol phases. Transitions only move forward.
 *
 * @author Nakamoteam
 */
public enum Round {
    REGISTRATION,
    VOTING,
    TALLY_PENDING,
    CLOSED;

    public boolean isBefore(Round other) {
        return ordinal() < other.ordinal();
    }
}
