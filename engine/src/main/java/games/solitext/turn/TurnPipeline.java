package games.solitext.turn;

import games.solitext.game.GameState;
import games.solitext.selection.CursorState;
import games.solitext.selection.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores the layout's invariants after every player action.
 * <p>
 * Steps, always in this order:
 * <ol>
 *   <li>Turn the top card of every non-empty column face-up.</li>
 *   <li>Auto-draw a batch if enabled, the waste pile is empty and the deck is not.</li>
 *   <li>Clamp the cursor and the picked-up selection to what may be selected.</li>
 *   <li>Derive the context help line from the cursor.</li>
 *   <li>Check for victory.</li>
 * </ol>
 * None of the steps can fail.
 */
public class TurnPipeline {
    private static final Logger log = LoggerFactory.getLogger(TurnPipeline.class);

    static final String DECK_HELP = "Enter: Hit";
    static final String COLUMN_HELP = "Enter: Try to Move to Stack";
    static final String VICTORY_MESSAGE = "Victory";

    private final boolean autoDraw;

    /**
     * @param autoDraw whether step 2 draws when the waste pile runs empty
     */
    public TurnPipeline(boolean autoDraw) {
        this.autoDraw = autoDraw;
    }

    /**
     * Runs the pipeline once.
     *
     * @param state the layout to repair
     * @param cursorState the player's selections, clamped and annotated in place
     * @return {@link TurnOutcome#VICTORY} if every foundation is complete
     */
    public TurnOutcome run(GameState state, CursorState cursorState) {
        int turned = state.faceUpOnColumns();
        if (turned > 0) {
            log.debug("Turned {} column top card(s) face-up", turned);
        }

        if (autoDraw && state.autoDraw()) {
            log.debug("Auto-drew into empty waste pile; deck now {}", state.getDeck().size());
        }

        cursorState.clamp(state);
        cursorState.setContextHelp(contextHelp(cursorState.getCursor()));

        if (state.isVictory()) {
            cursorState.setStatusMessage(VICTORY_MESSAGE);
            return TurnOutcome.VICTORY;
        }
        return TurnOutcome.CONTINUE;
    }

    /**
     * Returns the help line for the Enter key at the cursor's position.
     */
    static String contextHelp(Selection cursor) {
        switch (cursor.kind()) {
            case DECK:
                return DECK_HELP;
            case COLUMN:
                return COLUMN_HELP;
            default:
                return "";
        }
    }
}
