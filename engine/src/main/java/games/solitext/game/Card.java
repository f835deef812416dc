package games.solitext.game;

import java.util.Objects;

/**
 * A single playing card: an immutable (rank, suit) value.
 * <p>
 * Cards carry no identity beyond their rank and suit, so two instances with the same pair are
 * equal and interchangeable. Whether a card is face-up is a property of the column holding it
 * ({@link CardState}), never of the card itself.
 */
public final class Card {
    private final Rank rank;
    private final Suit suit;

    /**
     * Constructs a card.
     *
     * @param rank the rank (must not be null)
     * @param suit the suit (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns whether this card is red (Hearts or Diamonds).
     */
    public boolean isRed() {
        return suit.isRed();
    }

    /**
     * Returns the uncoloured short name, rank label followed by suit symbol (e.g., "Q♠", "10♦").
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.getLabel() + suit.getSymbol();
    }

    /**
     * Returns the short name, coloured red for red suits.
     */
    @Override
    public String toString() {
        return Suit.colouriseIfRed(suit, shortName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
