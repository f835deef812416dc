package games.solitext.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * An ordering of the 52 cards that a game is dealt from.
 * <p>
 * The top of the deck is the <em>last</em> card of the ordering: {@link #draw()} removes from
 * the end. A {@code Deck} keeps the ordering it was created with so that a game can be dealt
 * again from exactly the same cards ({@link #originalOrder()}), which is how a restart replays
 * the current deal.
 */
public class Deck {
    /** Number of cards in a standard deck. */
    public static final int SIZE = 52;

    private final List<Card> cards;
    private final List<Card> originalOrder;

    /**
     * Constructs a deck with the given ordering.
     *
     * @param cards the ordering, bottom first; must not be null
     * @throws NullPointerException if cards is null
     */
    public Deck(List<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        this.cards = new ArrayList<>(cards);
        this.originalOrder = Collections.unmodifiableList(new ArrayList<>(cards));
    }

    /**
     * Returns the 52 cards in suit-major, rank-ascending order.
     * <p>
     * Suits follow {@link Suit} declaration order (Hearts, Spades, Diamonds, Clubs); within a
     * suit, ranks run Ace to King.
     *
     * @return a new mutable list of 52 distinct cards
     */
    public static List<Card> orderedCards() {
        List<Card> ordered = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                ordered.add(new Card(rank, suit));
            }
        }
        return ordered;
    }

    /**
     * Returns a deck in {@link #orderedCards()} order.
     */
    public static Deck ordered() {
        return new Deck(orderedCards());
    }

    /**
     * Returns a uniformly shuffled deck.
     *
     * @param random the generator consumed by the shuffle; must not be null
     * @return a deck holding a random permutation of the ordered cards
     */
    public static Deck shuffled(Random random) {
        Objects.requireNonNull(random, "random");
        List<Card> cards = orderedCards();
        Collections.shuffle(cards, random);
        return new Deck(cards);
    }

    /**
     * Draws and removes the top card.
     *
     * @return the top card, or {@code null} if the deck is empty
     */
    public Card draw() {
        if (cards.isEmpty()) {
            return null;
        }
        return cards.remove(cards.size() - 1);
    }

    /**
     * Removes and returns every remaining card, bottom first.
     */
    public List<Card> drain() {
        List<Card> remaining = new ArrayList<>(cards);
        cards.clear();
        return remaining;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns the ordering this deck was created with, regardless of cards drawn since.
     *
     * @return an unmodifiable copy of the initial ordering, bottom first
     */
    public List<Card> originalOrder() {
        return originalOrder;
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
