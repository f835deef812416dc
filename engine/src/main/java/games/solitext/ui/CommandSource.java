package games.solitext.ui;

/**
 * Supplies the console driver with lines of player input.
 */
public interface CommandSource {

    /**
     * Shows {@code prompt} and returns the next line of input.
     *
     * @param prompt text shown before reading (may be empty)
     * @return the raw line, or {@code null} when input is closed and the game should exit
     */
    String nextLine(String prompt);
}
