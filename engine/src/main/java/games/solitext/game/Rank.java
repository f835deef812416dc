package games.solitext.game;

/**
 * The 13 ranks of a standard deck, valued 1 (Ace) to 13 (King).
 * <p>
 * Foundations build upwards one rank at a time from {@link #ACE}; tableau columns build
 * downwards and only a {@link #KING} may start an empty column.
 */
public enum Rank {
    ACE(1, "A"),
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    JACK(11, "J"),
    QUEEN(12, "Q"),
    KING(13, "K");

    private final int value;
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the short display label.
     *
     * @return the label (e.g., "A", "10", "K")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Checks whether this rank is exactly one above {@code lower}.
     *
     * @param lower the rank expected directly beneath this one
     * @return {@code true} if {@code this.value == lower.value + 1}
     */
    public boolean isOneAbove(Rank lower) {
        return lower != null && value == lower.value + 1;
    }

    @Override
    public String toString() {
        return label;
    }
}
