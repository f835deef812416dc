package games.solitext.rules;

import games.solitext.game.Card;
import games.solitext.game.CardCollection;
import games.solitext.game.CardColumn;
import games.solitext.game.FoundationPile;
import games.solitext.game.GameState;
import games.solitext.game.Rank;
import games.solitext.selection.Selection;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether moving the cards of one selection onto another is legal.
 * <p>
 * Validation never mutates the layout; it only peeks at the piles involved. Rules by pair:
 * <ul>
 *   <li><strong>Waste → Foundation, Column → Foundation:</strong> a single card of the
 *       foundation's suit, Ace on an empty pile or one rank above the top.</li>
 *   <li><strong>Waste → Column, Foundation → Column, Column → Column:</strong> the bottom card
 *       of the moved run must be a King on an empty column, or of opposite colour and one rank
 *       below the column's top card.</li>
 *   <li><strong>Anything → Deck, Foundation → Foundation:</strong> never legal.</li>
 * </ul>
 * A selection on an empty pile, and a move within one collection, are always rejected.
 */
public final class MoveValidator {
    private static final String TABLEAU_RULE = "Tableau requires alternating color and one rank lower, or a King on an empty column.";
    private static final String FOUNDATION_RULE = "Foundation requires same suit and one rank higher starting with Ace.";

    private MoveValidator() {
    }

    /**
     * Validates moving {@code from} onto {@code to}.
     *
     * @param from the cards being moved
     * @param to the destination
     * @param state the current layout
     * @return {@link MoveResult#ok()} if legal; otherwise an {@link MoveError#INVALID_MOVE} result
     */
    public static MoveResult validMove(Selection from, Selection to, GameState state) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(state, "state");

        if (from.sameCollection(to)) {
            return MoveResult.invalid("Source and destination are the same pile.");
        }
        if (to.isDeck()) {
            return MoveResult.invalid("Cards cannot be moved onto the deck.");
        }
        if (from.isPile() && to.isPile()) {
            return MoveResult.invalid("Cards cannot be moved between foundations.");
        }

        Card moving = movingCard(from, state);
        if (moving == null) {
            return MoveResult.invalid("Nothing to move from " + from + ".");
        }

        if (to.isPile()) {
            if (from.cardCount() != 1) {
                return MoveResult.invalid("Foundation only accepts a single card, not a stack.");
            }
            return canPlaceOnFoundation(moving, state.getFoundation(to.index()))
                    ? MoveResult.ok()
                    : MoveResult.invalid("Cannot place " + moving.shortName() + " on foundation " + (to.index() + 1) + ". " + FOUNDATION_RULE);
        }
        return canPlaceOnColumn(moving, state.getColumn(to.index()))
                ? MoveResult.ok()
                : MoveResult.invalid("Cannot place " + moving.shortName() + " on column " + (to.index() + 1) + ". " + TABLEAU_RULE);
    }

    /**
     * Returns the card that would land on the destination: the bottom card of a column run, or
     * the top card of the waste pile or a foundation. {@code null} when there is nothing legal
     * to move.
     */
    private static Card movingCard(Selection from, GameState state) {
        CardCollection source = state.collection(from);
        if (from.isColumn()) {
            CardColumn column = (CardColumn) source;
            int count = from.cardCount();
            if (count < 1 || count > column.faceUpCards()) {
                return null;
            }
            List<Card> run = column.peekN(count);
            return run == null ? null : run.get(0);
        }
        return source.peek();
    }

    /**
     * Checks the card-onto-column rule.
     *
     * @param moving the bottom card of the run being moved
     * @param column the destination column
     * @return {@code true} for a King on an empty column, or an opposite-colour card one rank
     *         below the column's top card
     */
    public static boolean canPlaceOnColumn(Card moving, CardColumn column) {
        if (moving == null) {
            return false;
        }
        Card target = column.peek();
        if (target == null) {
            return moving.getRank() == Rank.KING;
        }
        return moving.getSuit().isOppositeColour(target.getSuit())
                && target.getRank().isOneAbove(moving.getRank());
    }

    /**
     * Checks the card-onto-foundation rule.
     */
    public static boolean canPlaceOnFoundation(Card moving, FoundationPile pile) {
        return pile.accepts(moving);
    }
}
