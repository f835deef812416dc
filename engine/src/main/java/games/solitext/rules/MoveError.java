package games.solitext.rules;

/**
 * Why a move attempt was rejected.
 */
public enum MoveError {
    /** The source and destination pair breaks a Solitaire rule. */
    INVALID_MOVE,
    /** The piles could not give or accept the requested number of cards. */
    COLLECTION_TRANSFER_FAILED
}
