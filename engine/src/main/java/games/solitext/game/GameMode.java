package games.solitext.game;

/**
 * How many cards each draw turns from the deck onto the waste pile.
 * <p>
 * The mode also sets how many of the waste pile's top cards are shown at once. Only the very
 * top waste card is ever playable, whichever mode is in effect.
 */
public enum GameMode {
    DRAW_ONE(1, "Draw One"),
    DRAW_THREE(3, "Draw Three");

    private final int drawCount;
    private final String label;

    GameMode(int drawCount, String label) {
        this.drawCount = drawCount;
        this.label = label;
    }

    /**
     * Returns the number of cards moved from deck to waste per draw (fewer if the deck runs out).
     */
    public int drawCount() {
        return drawCount;
    }

    /**
     * Returns how many top waste cards are exposed for display.
     */
    public int visibleWasteCards() {
        return drawCount;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
