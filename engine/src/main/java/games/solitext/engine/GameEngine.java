package games.solitext.engine;

import games.solitext.config.AutoDrawProperties;
import games.solitext.game.Card;
import games.solitext.game.Deck;
import games.solitext.game.GameMode;
import games.solitext.game.GameState;
import games.solitext.rules.MoveResult;
import games.solitext.rules.MoveValidator;
import games.solitext.selection.CursorAction;
import games.solitext.selection.CursorState;
import games.solitext.selection.Selection;
import games.solitext.turn.TurnOutcome;
import games.solitext.turn.TurnPipeline;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Entry point into the rules engine for whatever drives the game (console, tests).
 * <p>
 * Every operation works on a {@link GameState} passed in by the caller; the engine itself only
 * holds the random generator used for new deals and the turn pipeline settings. Moves are
 * validated with {@link MoveValidator} before any pile is touched, so a rejected move leaves
 * the layout exactly as it was.
 */
@Component
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Random random;
    private final TurnPipeline turnPipeline;

    @Autowired
    public GameEngine(Random random, AutoDrawProperties autoDraw) {
        this(random, new TurnPipeline(autoDraw.isEnabled()));
    }

    public GameEngine(Random random, TurnPipeline turnPipeline) {
        this.random = Objects.requireNonNull(random, "random");
        this.turnPipeline = Objects.requireNonNull(turnPipeline, "turnPipeline");
    }

    /**
     * Deals a new game from a freshly shuffled deck.
     */
    public GameState newGame(GameMode mode) {
        GameState state = new GameState(Deck.shuffled(random), mode);
        log.info("New {} game dealt", mode);
        return state;
    }

    /**
     * Deals a game from a previously captured deck ordering.
     *
     * @param seedDeck the ordering, bottom first, as returned by {@link GameState#getOriginalDeckOrder()}
     * @param mode the draw mode
     */
    public GameState restartGame(List<Card> seedDeck, GameMode mode) {
        GameState state = new GameState(new Deck(seedDeck), mode);
        log.info("Restarted {} game from captured deck", mode);
        return state;
    }

    /**
     * Deals {@code current}'s game again from the start.
     */
    public GameState restartGame(GameState current) {
        return restartGame(current.getOriginalDeckOrder(), current.getGameMode());
    }

    public Selection applyCursorAction(CursorAction action, GameState state, Selection selection) {
        return action.apply(selection, state);
    }

    /**
     * Validates and performs a move.
     *
     * @return success, {@code INVALID_MOVE} if a rule forbids it, or
     *         {@code COLLECTION_TRANSFER_FAILED} if the piles could not complete the transfer
     */
    public MoveResult attemptMove(Selection from, Selection to, GameState state) {
        MoveResult validation = MoveValidator.validMove(from, to, state);
        if (!validation.isSuccess()) {
            if (log.isDebugEnabled()) {
                log.debug("Rejected move {} -> {}: {}", from, to, validation.getMessage());
            }
            return validation;
        }
        return transfer(from, to, state);
    }

    /**
     * Reports whether a move would be legal without performing it.
     */
    public MoveResult checkMove(Selection from, Selection to, GameState state) {
        return MoveValidator.validMove(from, to, state);
    }

    /**
     * Moves cards without checking Solitaire rules. Pile shape rules and the same-pile check
     * still apply. Debug mode only.
     */
    public MoveResult moveUnchecked(Selection from, Selection to, GameState state) {
        return transfer(from, to, state);
    }

    private MoveResult transfer(Selection from, Selection to, GameState state) {
        if (!state.transfer(from, to)) {
            if (log.isDebugEnabled()) {
                log.debug("Transfer {} -> {} failed", from, to);
            }
            return MoveResult.transferFailed("move attempt failed");
        }
        if (log.isDebugEnabled()) {
            log.debug("Moved {} card(s) {} -> {}", from.cardCount(), from, to);
        }
        return MoveResult.ok();
    }

    /**
     * Draws from the deck, or recycles the waste pile when the deck is empty.
     */
    public GameState.DrawOutcome drawFromDeck(GameState state) {
        GameState.DrawOutcome outcome = state.drawFromDeck();
        if (log.isDebugEnabled()) {
            log.debug("Draw: {} (deck={}, waste={})", outcome, state.getDeck().size(), state.getWaste().size());
        }
        return outcome;
    }

    /**
     * Moves the top card of a column to the first foundation that accepts it.
     *
     * @param columnIndex the column, 0..6
     * @return success, or {@code INVALID_MOVE} if no foundation accepts the card
     */
    public MoveResult autoPlaceToFoundation(int columnIndex, GameState state) {
        Selection from = Selection.column(columnIndex, 1);
        for (int i = 0; i < GameState.FOUNDATION_COUNT; i++) {
            Selection to = Selection.pile(i);
            if (MoveValidator.validMove(from, to, state).isSuccess()) {
                return transfer(from, to, state);
            }
        }
        return MoveResult.invalid("No foundation accepts the top card of column " + (columnIndex + 1) + ".");
    }

    public TurnOutcome runTurnPipeline(GameState state, CursorState cursorState) {
        TurnOutcome outcome = turnPipeline.run(state, cursorState);
        if (outcome == TurnOutcome.VICTORY) {
            log.info("Victory: all foundations complete");
        }
        return outcome;
    }
}
