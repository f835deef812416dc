package games.solitext.unit.ui;

import static games.solitext.unit.helpers.SeededDeal.card;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.solitext.game.GameMode;
import games.solitext.game.GameState;
import games.solitext.selection.CursorState;
import games.solitext.selection.Selection;
import games.solitext.ui.BoardFormatter;
import games.solitext.unit.helpers.SeededDeal;
import org.junit.jupiter.api.Test;

/**
 * Rendering of the three board sections and the selection marks.
 */
class BoardFormatterTest {

    @Test
    void rendersAllSections() {
        GameState state = SeededDeal.builder().deal(GameMode.DRAW_ONE);

        String board = new BoardFormatter(state, new CursorState()).format();

        assertTrue(board.contains("FOUNDATION"));
        assertTrue(board.contains("TABLEAU"));
        assertTrue(board.contains("DECK & WASTE"));
        assertTrue(board.contains("C7 [6]"), "face-down count per column");
        assertTrue(board.contains("##"), "face-down cards are hidden");
        assertTrue(board.contains("select: Select/Move cards"));
    }

    @Test
    void marksCursorAndPickedUpCards() {
        GameState state = SeededDeal.builder().columnTop(2, card("K♠")).deal(GameMode.DRAW_ONE);
        CursorState cursorState = new CursorState();
        cursorState.setSelected(Selection.column(2, 1));
        cursorState.setCursor(Selection.column(2, 1));

        String board = new BoardFormatter(state, cursorState).format();

        assertTrue(board.contains("*>K♠"), board);
    }

    @Test
    void emptyPilesHavePlaceholders() {
        GameState state = GameState.victory();

        String board = new BoardFormatter(state).format();

        assertTrue(board.contains("(empty)"));
        assertTrue(board.contains("( O )"));
        assertTrue(board.contains("K♠"));
    }

    @Test
    void cardsOnlyViewHasNoMarksOrMessages() {
        GameState state = SeededDeal.builder().deal(GameMode.DRAW_ONE);

        String board = new BoardFormatter(state).format();

        assertFalse(board.contains(">"));
        assertFalse(board.contains("select:"));
    }

    @Test
    void debugModeShowsCursorAndStatus() {
        GameState state = SeededDeal.builder().deal(GameMode.DRAW_ONE);
        CursorState cursorState = new CursorState(true);
        cursorState.setStatusMessage("move OK");

        String board = new BoardFormatter(state, cursorState).format();

        assertTrue(board.contains("[debug] cursor=Deck selected=-"));
        assertTrue(board.contains("[debug] move OK"));
    }
}
