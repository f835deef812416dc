package games.solitext.game;

/**
 * The four suits of a standard deck.
 * <p>
 * Declaration order is significant: it fixes the suit-major order of {@link Deck#orderedCards()}
 * and the suit each foundation pile collects (foundation {@code i} holds {@code Suit.values()[i]}).
 * Hearts and Diamonds are red; Spades and Clubs are black. Tableau columns alternate colours.
 */
public enum Suit {
    /** Hearts, a red suit (♥). Collected by foundation 0. */
    HEARTS("♥", true),
    /** Spades, a black suit (♠). Collected by foundation 1. */
    SPADES("♠", false),
    /** Diamonds, a red suit (♦). Collected by foundation 2. */
    DIAMONDS("♦", true),
    /** Clubs, a black suit (♣). Collected by foundation 3. */
    CLUBS("♣", false);

    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_RESET = "\u001B[0m";

    private final String symbol;
    private final boolean red;

    Suit(String symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    /**
     * Returns the suit collected by the foundation pile at {@code index}.
     *
     * @param index foundation index, 0..3
     * @return the suit for that foundation
     * @throws IllegalArgumentException if the index is outside 0..3
     */
    public static Suit fromIndex(int index) {
        Suit[] suits = values();
        if (index < 0 || index >= suits.length) {
            throw new IllegalArgumentException("No foundation suit for index " + index);
        }
        return suits[index];
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Checks whether this suit is red.
     *
     * @return {@code true} for Hearts and Diamonds; {@code false} for Spades and Clubs
     */
    public boolean isRed() {
        return red;
    }

    /**
     * Checks whether this suit and {@code other} have different colours.
     *
     * @param other the suit to compare with
     * @return {@code true} if one suit is red and the other black
     */
    public boolean isOppositeColour(Suit other) {
        return other != null && red != other.red;
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * Wraps {@code value} in ANSI red codes if {@code suit} is red.
     *
     * @param suit the suit deciding the colour (may be null)
     * @param value the text to colourise
     * @return the coloured text for red suits; otherwise {@code value} unchanged
     */
    public static String colouriseIfRed(Suit suit, String value) {
        if (suit != null && suit.isRed()) {
            return ANSI_RED + value + ANSI_RESET;
        }
        return value;
    }
}
