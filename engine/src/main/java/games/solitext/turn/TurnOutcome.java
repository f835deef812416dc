package games.solitext.turn;

/**
 * Whether play goes on after a turn.
 */
public enum TurnOutcome {
    CONTINUE,
    VICTORY
}
