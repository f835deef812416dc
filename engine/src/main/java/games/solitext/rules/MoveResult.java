package games.solitext.rules;

import java.util.Objects;

/**
 * Outcome of validating or performing a move.
 * <p>
 * Rejected moves are an ordinary part of play, so they are reported through this value rather
 * than thrown. A failed result carries the {@link MoveError} kind and a message suitable for
 * the status line (e.g., "Foundation requires same suit and one rank higher starting with Ace.").
 */
public final class MoveResult {
    private static final MoveResult OK = new MoveResult(true, null, "move OK");

    private final boolean success;
    private final MoveError error;
    private final String message;

    private MoveResult(boolean success, MoveError error, String message) {
        this.success = success;
        this.error = error;
        this.message = message;
    }

    /**
     * Returns the shared success result.
     */
    public static MoveResult ok() {
        return OK;
    }

    /**
     * Creates a rule rejection.
     */
    public static MoveResult invalid(String message) {
        return new MoveResult(false, MoveError.INVALID_MOVE, Objects.requireNonNull(message, "message"));
    }

    /**
     * Creates a transfer failure.
     */
    public static MoveResult transferFailed(String message) {
        return new MoveResult(false, MoveError.COLLECTION_TRANSFER_FAILED, Objects.requireNonNull(message, "message"));
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Returns the failure kind, or {@code null} on success.
     */
    public MoveError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return success ? "Ok(" + message + ")" : "Err(" + error + ": " + message + ")";
    }
}
