package games.solitext.selection;

import games.solitext.game.CardColumn;
import games.solitext.game.GameState;
import java.util.Objects;

/**
 * A location on the layout: the waste pile, a run of cards in a column, or a foundation.
 * <p>
 * Selections are immutable values. Every navigation method returns a new selection.
 * <ul>
 *   <li>{@link Kind#DECK}: the top waste card (the deck itself is never a source of moves).</li>
 *   <li>{@link Kind#COLUMN}: the top {@code cardCount} cards of column {@code index} (0..6).</li>
 *   <li>{@link Kind#PILE}: the top card of foundation {@code index} (0..3).</li>
 * </ul>
 * The layout reads left to right as deck, columns 0..6, foundations. Horizontal navigation
 * stops at both ends instead of wrapping.
 */
public final class Selection {

    public enum Kind {
        DECK,
        COLUMN,
        PILE
    }

    private static final Selection DECK = new Selection(Kind.DECK, -1, 1);

    private final Kind kind;
    private final int index;
    private final int cardCount;

    private Selection(Kind kind, int index, int cardCount) {
        this.kind = kind;
        this.index = index;
        this.cardCount = cardCount;
    }

    public static Selection deck() {
        return DECK;
    }

    /**
     * Creates a column selection.
     *
     * @param index column index, 0..6
     * @param cardCount number of top cards selected, at least 0
     * @throws IllegalArgumentException if index or cardCount is out of range
     */
    public static Selection column(int index, int cardCount) {
        if (index < 0 || index >= GameState.COLUMN_COUNT) {
            throw new IllegalArgumentException("Invalid column index " + index);
        }
        if (cardCount < 0) {
            throw new IllegalArgumentException("Negative card count " + cardCount);
        }
        return new Selection(Kind.COLUMN, index, cardCount);
    }

    /**
     * Creates a foundation selection.
     *
     * @param index foundation index, 0..3
     * @throws IllegalArgumentException if index is out of range
     */
    public static Selection pile(int index) {
        if (index < 0 || index >= GameState.FOUNDATION_COUNT) {
            throw new IllegalArgumentException("Invalid pile index " + index);
        }
        return new Selection(Kind.PILE, index, 1);
    }

    /**
     * Selects the top card of column {@code index}, or nothing if that column is empty.
     */
    static Selection enterColumn(int index, GameState state) {
        return column(index, state.columnIsEmpty(index) ? 0 : 1);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the column or foundation index; -1 for the deck.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the number of cards selected: the run length for columns, always 1 otherwise.
     */
    public int cardCount() {
        return cardCount;
    }

    public boolean isDeck() {
        return kind == Kind.DECK;
    }

    public boolean isColumn() {
        return kind == Kind.COLUMN;
    }

    public boolean isPile() {
        return kind == Kind.PILE;
    }

    /**
     * Checks whether this selection and {@code other} point at the same collection, ignoring
     * how many cards are selected.
     *
     * @param other the selection to compare with
     * @return {@code true} if both have the same kind and, for columns and piles, the same index
     */
    public boolean sameCollection(Selection other) {
        return other != null && kind == other.kind && index == other.index;
    }

    /** Left key. */
    public Selection moveLeft(GameState state) {
        switch (kind) {
            case DECK:
                return this;
            case COLUMN:
                return index > 0 ? enterColumn(index - 1, state) : DECK;
            case PILE:
                return enterColumn(GameState.COLUMN_COUNT - 1, state);
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    /** Right key. */
    public Selection moveRight(GameState state) {
        switch (kind) {
            case DECK:
                return enterColumn(0, state);
            case COLUMN:
                return index < GameState.COLUMN_COUNT - 1 ? enterColumn(index + 1, state) : pile(0);
            case PILE:
                return this;
            default:
                throw new IllegalStateException("Unknown kind " + kind);
        }
    }

    /**
     * Up key: selects one more card of a column, or the foundation above.
     * <p>
     * The column count is not bounded here; {@link #applyColumnSelectionRules(GameState, boolean)}
     * clamps it to what the column allows.
     */
    public Selection selectUp() {
        switch (kind) {
            case COLUMN:
                return new Selection(Kind.COLUMN, index, cardCount + 1);
            case PILE:
                return index > 0 ? pile(index - 1) : this;
            default:
                return this;
        }
    }

    /**
     * Down key: selects one card fewer of a column (never below zero), or the foundation below.
     */
    public Selection selectDown() {
        switch (kind) {
            case COLUMN:
                return cardCount > 0 ? new Selection(Kind.COLUMN, index, cardCount - 1) : this;
            case PILE:
                return index < GameState.FOUNDATION_COUNT - 1 ? pile(index + 1) : this;
            default:
                return this;
        }
    }

    /**
     * Clamps a column selection to the cards that may currently be selected.
     * <p>
     * Normally only the face-up run can be selected; in debug mode the whole column can, so that
     * face-down cards can be inspected. A non-empty column always has at least one card
     * selected. Applying the rules twice gives the same result as applying them once. Deck and
     * foundation selections are returned unchanged.
     *
     * @param state the current layout
     * @param debugMode whether face-down cards are selectable
     * @return the clamped selection
     */
    public Selection applyColumnSelectionRules(GameState state, boolean debugMode) {
        if (kind != Kind.COLUMN) {
            return this;
        }
        CardColumn column = state.getColumn(index);
        int max = debugMode ? column.size() : column.faceUpCards();
        int clamped = Math.min(cardCount, max);
        if (!column.isEmpty() && clamped == 0) {
            clamped = 1;
        }
        return clamped == cardCount ? this : new Selection(Kind.COLUMN, index, clamped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Selection)) {
            return false;
        }
        Selection other = (Selection) o;
        return kind == other.kind && index == other.index && cardCount == other.cardCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index, cardCount);
    }

    @Override
    public String toString() {
        switch (kind) {
            case COLUMN:
                return "Column{index=" + index + ", cardCount=" + cardCount + "}";
            case PILE:
                return "Pile{index=" + index + "}";
            default:
                return "Deck";
        }
    }
}
