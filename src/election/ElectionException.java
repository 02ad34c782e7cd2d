package election;

/**
 *
 * @author Nakamoteam
 */
public class ElectionException extends Exception {

    private final ElectionError error;

    public ElectionException(ElectionError error, String reason) {
        super(error + ": " + reason);
        this.error = error;
    }

    public ElectionError getError() {
        return error;
    }
}
