package games.solitext.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One of the four foundation piles, built upwards from Ace to King in a single suit.
 * <p>
 * A foundation only ever gives or accepts one card at a time. It does not check rank or suit
 * itself; {@link #accepts(Card)} states the rule for callers that validate first.
 */
public class FoundationPile implements CardCollection {
    private final Suit suit;
    private final List<Card> cards = new ArrayList<>();

    /**
     * Constructs an empty foundation for {@code suit}.
     *
     * @param suit the suit this pile collects; must not be null
     */
    public FoundationPile(Suit suit) {
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Checks whether {@code card} may be placed here under foundation rules.
     * <p>
     * The card must match this pile's suit and be an Ace on an empty pile, or exactly one rank
     * above the current top card.
     *
     * @param card the candidate card (may be null)
     * @return {@code true} if the placement is legal
     */
    public boolean accepts(Card card) {
        if (card == null || card.getSuit() != suit) {
            return false;
        }
        Card top = peek();
        if (top == null) {
            return card.getRank() == Rank.ACE;
        }
        return card.getRank().isOneAbove(top.getRank());
    }

    /**
     * Returns whether this pile holds its suit's King (and therefore all 13 cards).
     */
    public boolean isComplete() {
        Card top = peek();
        return top != null && top.getRank() == Rank.KING;
    }

    @Override
    public List<Card> take(int count) {
        if (count != 1 || cards.isEmpty()) {
            return null;
        }
        List<Card> taken = new ArrayList<>(1);
        taken.add(cards.remove(cards.size() - 1));
        return taken;
    }

    @Override
    public boolean receive(List<Card> incoming) {
        if (incoming == null || !canReceive(incoming.size())) {
            return false;
        }
        cards.add(incoming.get(0));
        return true;
    }

    @Override
    public boolean canReceive(int count) {
        return count == 1;
    }

    @Override
    public Card peek() {
        return cards.isEmpty() ? null : cards.get(cards.size() - 1);
    }

    @Override
    public List<Card> peekN(int count) {
        if (count < 1 || count > cards.size()) {
            return null;
        }
        return new ArrayList<>(cards.subList(cards.size() - count, cards.size()));
    }

    @Override
    public int size() {
        return cards.size();
    }

    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "FoundationPile(" + suit.name() + ", size=" + cards.size() + ")";
    }
}
