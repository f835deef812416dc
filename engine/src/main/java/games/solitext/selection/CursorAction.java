package games.solitext.selection;

import games.solitext.game.GameState;

/**
 * Cursor movements a player can make without touching any cards.
 */
public enum CursorAction {
    MOVE_LEFT,
    MOVE_RIGHT,
    EXTEND_UP,
    EXTEND_DOWN,
    JUMP_TO_DECK,
    JUMP_TO_LAST_PILE;

    /**
     * Applies this action to {@code selection}.
     *
     * @param selection the current cursor
     * @param state the layout, needed when entering a column
     * @return the new cursor
     */
    public Selection apply(Selection selection, GameState state) {
        return switch (this) {
            case MOVE_LEFT -> selection.moveLeft(state);
            case MOVE_RIGHT -> selection.moveRight(state);
            case EXTEND_UP -> selection.selectUp();
            case EXTEND_DOWN -> selection.selectDown();
            case JUMP_TO_DECK -> Selection.deck();
            case JUMP_TO_LAST_PILE -> Selection.pile(0);
        };
    }
}
