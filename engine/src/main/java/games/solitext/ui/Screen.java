package games.solitext.ui;

/**
 * The screens of the console driver.
 * <p>
 * {@code START → GAME ⇄ GAME_MENU}, {@code GAME ⇄ HELP}, {@code GAME → VICTORY},
 * and any of them may end in {@code QUIT}.
 */
public enum Screen {
    START,
    GAME,
    GAME_MENU,
    HELP,
    VICTORY,
    QUIT
}
