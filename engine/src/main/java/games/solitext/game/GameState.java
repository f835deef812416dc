package games.solitext.game;

import games.solitext.selection.Selection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The complete layout of one Klondike game and the single owner of its 52 cards.
 * <p>
 * <strong>Layout:</strong>
 * <ul>
 *   <li><strong>Deck:</strong> face-down draw source; its top is the last element.</li>
 *   <li><strong>Waste:</strong> face-up pile fed by draws ({@link WastePile}).</li>
 *   <li><strong>Columns 0–6:</strong> the tableau ({@link CardColumn}).</li>
 *   <li><strong>Foundations 0–3:</strong> one per suit in {@link Suit} order ({@link FoundationPile}).</li>
 * </ul>
 * Every card belongs to exactly one of these twelve collections at any time. Cards only change
 * collection through {@link #transfer(Selection, Selection)} and {@link #drawFromDeck()}, so the
 * total is always {@link Deck#SIZE}.
 * <p>
 * The deck ordering the game was dealt from is kept, so {@link #redeal()} reproduces the deal
 * exactly.
 */
public class GameState {
    /** Number of tableau columns. */
    public static final int COLUMN_COUNT = 7;
    /** Number of foundation piles. */
    public static final int FOUNDATION_COUNT = 4;

    /** Result of a draw action. */
    public enum DrawOutcome {
        /** At least one card moved from the deck to the waste pile. */
        DREW,
        /** The deck was empty, so the waste pile was turned back into the deck. */
        RECYCLED,
        /** Deck and waste were both empty; nothing happened. */
        NOTHING_TO_DRAW
    }

    private final List<Card> deck = new ArrayList<>();
    private final WastePile waste = new WastePile();
    private final List<CardColumn> columns = new ArrayList<>(COLUMN_COUNT);
    private final List<FoundationPile> foundations = new ArrayList<>(FOUNDATION_COUNT);
    private final GameMode gameMode;
    private final List<Card> originalDeckOrder;

    /**
     * Deals a new game from {@code source}.
     * <p>
     * Cards are drawn from the top (end) of the source. Column {@code i} receives {@code i + 1}
     * cards, all face-down except its top card. The remaining 24 cards become the deck in
     * their source order.
     *
     * @param source the deck to deal from; must hold 52 cards
     * @param gameMode the draw mode; must not be null
     * @throws IllegalArgumentException if the source does not hold a full deck
     */
    public GameState(Deck source, GameMode gameMode) {
        Objects.requireNonNull(source, "source");
        this.gameMode = Objects.requireNonNull(gameMode, "gameMode");
        if (source.size() != Deck.SIZE) {
            throw new IllegalArgumentException("Deal requires " + Deck.SIZE + " cards but got " + source.size());
        }
        this.originalDeckOrder = source.originalOrder();
        initializePiles();
        for (int i = 0; i < COLUMN_COUNT; i++) {
            CardColumn column = columns.get(i);
            for (int j = 0; j <= i; j++) {
                column.add(source.draw(), j == i ? CardState.FACE_UP : CardState.FACE_DOWN);
            }
        }
        deck.addAll(source.drain());
    }

    private GameState(GameMode gameMode) {
        this.gameMode = gameMode;
        this.originalDeckOrder = Deck.orderedCards();
        initializePiles();
    }

    /**
     * Returns a won layout: every foundation holds its suit from Ace to King, all other piles
     * are empty.
     */
    public static GameState victory() {
        GameState state = new GameState(GameMode.DRAW_ONE);
        for (FoundationPile pile : state.foundations) {
            for (Rank rank : Rank.values()) {
                pile.receive(Collections.singletonList(new Card(rank, pile.getSuit())));
            }
        }
        return state;
    }

    /**
     * Returns a layout one move short of victory: the King of Hearts has been moved off its
     * complete foundation onto the first tableau column.
     */
    public static GameState almostVictory() {
        GameState state = victory();
        List<Card> king = state.foundations.get(0).take(1);
        state.columns.get(0).receive(king);
        return state;
    }

    /**
     * Deals a fresh game from the same deck ordering and mode as this one.
     *
     * @return a new state identical to this game's initial deal
     */
    public GameState redeal() {
        return new GameState(new Deck(originalDeckOrder), gameMode);
    }

    private void initializePiles() {
        for (int i = 0; i < COLUMN_COUNT; i++) {
            columns.add(new CardColumn());
        }
        for (int i = 0; i < FOUNDATION_COUNT; i++) {
            foundations.add(new FoundationPile(Suit.fromIndex(i)));
        }
    }

    /**
     * Resolves a selection to the collection it points at.
     *
     * @param selection the selection; must not be null
     * @return the waste pile, column or foundation addressed by the selection
     */
    public CardCollection collection(Selection selection) {
        Objects.requireNonNull(selection, "selection");
        switch (selection.kind()) {
            case DECK:
                return waste;
            case COLUMN:
                return getColumn(selection.index());
            case PILE:
                return getFoundation(selection.index());
            default:
                throw new IllegalStateException("Unknown selection kind: " + selection.kind());
        }
    }

    /**
     * Moves the selected cards of {@code from} onto {@code to} without checking game rules.
     * <p>
     * The transfer happens only when it can complete: the two selections address different
     * collections, the source holds {@code from.cardCount()} cards and the destination accepts
     * that many in one receive. Otherwise nothing changes.
     *
     * @param from the source selection
     * @param to the destination selection
     * @return {@code true} if the cards were moved
     */
    public boolean transfer(Selection from, Selection to) {
        if (from.sameCollection(to)) {
            return false;
        }
        CardCollection source = collection(from);
        CardCollection destination = collection(to);
        int count = from.cardCount();
        if (source.peekN(count) == null || !destination.canReceive(count)) {
            return false;
        }
        List<Card> cards = source.take(count);
        return cards != null && destination.receive(cards);
    }

    /**
     * Performs one draw action.
     * <p>
     * With cards in the deck, moves up to {@link GameMode#drawCount()} of them to the waste
     * pile, one at a time from the deck's top. With an empty deck and a non-empty waste pile,
     * turns the waste pile over to become the deck (top waste card ends up at the bottom) and
     * draws nothing.
     *
     * @return what the draw did
     */
    public DrawOutcome drawFromDeck() {
        if (deck.isEmpty()) {
            if (waste.isEmpty()) {
                return DrawOutcome.NOTHING_TO_DRAW;
            }
            List<Card> recycled = waste.drain();
            Collections.reverse(recycled);
            deck.addAll(recycled);
            return DrawOutcome.RECYCLED;
        }
        for (int i = 0; i < gameMode.drawCount() && !deck.isEmpty(); i++) {
            waste.push(deck.remove(deck.size() - 1));
        }
        return DrawOutcome.DREW;
    }

    /**
     * Draws one batch if the waste pile is empty and the deck is not.
     *
     * @return {@code true} if cards were drawn
     */
    public boolean autoDraw() {
        if (!deck.isEmpty() && waste.isEmpty()) {
            return drawFromDeck() == DrawOutcome.DREW;
        }
        return false;
    }

    /**
     * Turns the top card of every non-empty column face-up.
     *
     * @return the number of cards turned
     */
    public int faceUpOnColumns() {
        int turned = 0;
        for (CardColumn column : columns) {
            if (column.turnTopFaceUp()) {
                turned++;
            }
        }
        return turned;
    }

    /**
     * Checks whether every foundation is topped by a King.
     */
    public boolean isVictory() {
        for (FoundationPile pile : foundations) {
            if (!pile.isComplete()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Counts the cards across all twelve collections.
     */
    public int totalCards() {
        int total = deck.size() + waste.size();
        for (CardColumn column : columns) {
            total += column.size();
        }
        for (FoundationPile pile : foundations) {
            total += pile.size();
        }
        return total;
    }

    public boolean columnIsEmpty(int index) {
        return getColumn(index).isEmpty();
    }

    /**
     * Returns the face-down deck, bottom first (the last element is drawn next).
     */
    public List<Card> getDeck() {
        return Collections.unmodifiableList(deck);
    }

    public WastePile getWaste() {
        return waste;
    }

    /**
     * Returns the waste cards currently exposed by the game mode, bottom first.
     */
    public List<Card> getVisibleWaste() {
        return waste.topCards(gameMode.visibleWasteCards());
    }

    /**
     * Returns the tableau column at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is outside 0..6
     */
    public CardColumn getColumn(int index) {
        return columns.get(index);
    }

    /**
     * Returns the foundation pile at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is outside 0..3
     */
    public FoundationPile getFoundation(int index) {
        return foundations.get(index);
    }

    public GameMode getGameMode() {
        return gameMode;
    }

    /**
     * Returns the deck ordering this game was dealt from.
     */
    public List<Card> getOriginalDeckOrder() {
        return originalDeckOrder;
    }

    @Override
    public String toString() {
        return "GameState(mode=" + gameMode + ", deck=" + deck.size() + ", waste=" + waste.size() + ")";
    }
}
