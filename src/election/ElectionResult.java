package election;

import java.util.Objects;

/**
 * Outcome of an election operation: either a value, or the error kind with a
 * readable reason. A failed operation has changed nothing.
 *
 * @author Nakamoteam
 * @param <T> type of the value on success
 */
public final class ElectionResult<T> {

    private final T value;
    private final ElectionError error;
    private final String reason;

    private ElectionResult(T value, ElectionError error, String reason) {
        this.value = value;
        this.error = error;
        this.reason = reason;
    }

    public static <T> ElectionResult<T> success(T value) {
        return new ElectionResult<>(value, null, null);
    }

    public static <T> ElectionResult<T> failure(ElectionError error, String reason) {
        return new ElectionResult<>(null, Objects.requireNonNull(error, "error"), reason);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if the operation failed
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("no value, operation failed with " + error + ": " + reason);
        }
        return value;
    }

    /**
     * @return the error kind, or null on success
     */
    public ElectionError getError() {
        return error;
    }

    public String getReason() {
        return reason;
    }

    public T orElseThrow() throws ElectionException {
        if (error != null) {
            throw new ElectionException(error, reason);
        }
        return value;
    }

    /**
     * @return a failure of another value type with the same error and reason
     */
    public <U> ElectionResult<U> castFailure() {
        if (error == null) {
            throw new IllegalStateException("not a failure");
        }
        return failure(error, reason);
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS(" + value + ")" : error + "(" + reason + ")";
    }
}
