package games.solitext.ui;

import games.solitext.engine.GameEngine;
import games.solitext.game.GameMode;
import games.solitext.game.GameState;
import games.solitext.rules.MoveError;
import games.solitext.rules.MoveResult;
import games.solitext.selection.CursorAction;
import games.solitext.selection.CursorState;
import games.solitext.selection.Selection;
import games.solitext.turn.TurnOutcome;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The console driver: moves between screens and turns input lines into engine calls.
 *
 * <p>The in-game loop is structured in clearly separated phases, once per input line:
 * <ol>
 *     <li>Run the turn pipeline (face-up repair, auto-draw, selection clamp, victory check).</li>
 *     <li>Render the board.</li>
 *     <li>Read the next command.</li>
 *     <li>Apply it to the cursor or the game.</li>
 * </ol>
 * A won game stops taking turns; only a new game or quitting leaves the victory screen.
 */
public class ScreenFlow {
    private static final Logger log = LoggerFactory.getLogger(ScreenFlow.class);

    static final String START_TEXT = String.join("\n",
            "Solitext    ♥ ♠ ♦ ♣",
            "",
            "1: New Game (Draw One)",
            "3: New Game (Draw Three)",
            "q: Quit");

    static final String MENU_TEXT = String.join("\n",
            "1: New Game (Draw One)",
            "3: New Game (Draw Three)",
            "r: Restart current game",
            "q: Quit",
            "esc: Return to game");

    static final String HELP_TEXT = String.join("\n",
            "Controls:",
            "",
            " left, right, up, down (or a, d, w, s), home, end: Move cursor",
            " enter: Hit/move card to stack",
            " select: Select/move cards",
            " clear: Clear selection",
            " debug: Toggle debug mode (check, force)",
            " menu: Game menu",
            " quit: Quit",
            "",
            "Press enter to return to the game.");

    static final String VICTORY_TEXT = String.join("\n",
            "YOU WIN",
            "",
            "Play again? (y/n)");

    private final GameEngine engine;
    private final CommandSource input;
    private final PrintStream out;
    private final CursorState cursorState;

    private Screen screen = Screen.START;
    private GameState state;

    public ScreenFlow(GameEngine engine, CommandSource input, PrintStream out, boolean debugMode) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.input = Objects.requireNonNull(input, "input");
        this.out = Objects.requireNonNull(out, "out");
        this.cursorState = new CursorState(debugMode);
    }

    /**
     * Runs screens until the player quits or input runs out.
     */
    public void run() {
        while (screen != Screen.QUIT) {
            switch (screen) {
                case START -> runStart();
                case GAME -> runGameTurn();
                case GAME_MENU -> runMenu();
                case HELP -> runHelp();
                case VICTORY -> runVictory();
                default -> screen = Screen.QUIT;
            }
        }
        out.println("Thanks for playing.");
    }

    private void runStart() {
        out.println(START_TEXT);
        String line = input.nextLine("> ");
        if (line == null) {
            screen = Screen.QUIT;
            return;
        }
        switch (line.trim().toLowerCase(Locale.ROOT)) {
            case "1" -> startNewGame(GameMode.DRAW_ONE);
            case "3" -> startNewGame(GameMode.DRAW_THREE);
            case "q", "quit", "esc" -> screen = Screen.QUIT;
            default -> {
                // stay on the start screen
            }
        }
    }

    private void runMenu() {
        out.println(new BoardFormatter(state).format());
        out.println(MENU_TEXT);
        String line = input.nextLine("> ");
        if (line == null) {
            screen = Screen.QUIT;
            return;
        }
        switch (line.trim().toLowerCase(Locale.ROOT)) {
            case "1" -> startNewGame(GameMode.DRAW_ONE);
            case "3" -> startNewGame(GameMode.DRAW_THREE);
            case "r", "restart" -> restartGame();
            case "q", "quit" -> screen = Screen.QUIT;
            case "esc", "menu", "" -> screen = Screen.GAME;
            default -> {
                // stay in the menu
            }
        }
    }

    private void runHelp() {
        out.println(new BoardFormatter(state).format());
        out.println(HELP_TEXT);
        screen = input.nextLine("") == null ? Screen.QUIT : Screen.GAME;
    }

    private void runVictory() {
        out.println(new BoardFormatter(state).format());
        out.println(VICTORY_TEXT);
        String line = input.nextLine("> ");
        if (line == null) {
            screen = Screen.QUIT;
            return;
        }
        switch (line.trim().toLowerCase(Locale.ROOT)) {
            case "y", "yes" -> startNewGame(state.getGameMode());
            case "n", "no", "q", "quit", "esc" -> screen = Screen.QUIT;
            default -> {
                // ask again
            }
        }
    }

    private void startNewGame(GameMode mode) {
        state = engine.newGame(mode);
        cursorState.reset();
        screen = Screen.GAME;
    }

    private void restartGame() {
        state = engine.restartGame(state);
        cursorState.reset();
        screen = Screen.GAME;
    }

    /**
     * Runs the pipeline, renders, then reads and applies one command.
     */
    private void runGameTurn() {
        if (engine.runTurnPipeline(state, cursorState) == TurnOutcome.VICTORY) {
            screen = Screen.VICTORY;
            return;
        }
        out.println(new BoardFormatter(state, cursorState).format());

        String line = input.nextLine("> ");
        if (line == null) {
            log.debug("Input closed; quitting");
            screen = Screen.QUIT;
            return;
        }
        Command command = Command.parse(line);
        if (command == null) {
            if (!line.isBlank()) {
                cursorState.setStatusMessage("Unknown command: " + line.trim() + " (h for help)");
            }
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("Command: {}", command.token());
        }
        handle(command);
    }

    void handle(Command command) {
        switch (command) {
            case LEFT -> moveCursor(CursorAction.MOVE_LEFT);
            case RIGHT -> moveCursor(CursorAction.MOVE_RIGHT);
            case UP -> moveCursor(CursorAction.EXTEND_UP);
            case DOWN -> moveCursor(CursorAction.EXTEND_DOWN);
            case HOME -> moveCursor(CursorAction.JUMP_TO_DECK);
            case END -> moveCursor(CursorAction.JUMP_TO_LAST_PILE);
            case SELECT -> cardsAction();
            case ENTER -> enterAction();
            case CLEAR -> cursorState.clearSelected();
            case DEBUG -> cursorState.toggleDebugMode();
            case CHECK -> {
                if (cursorState.isDebugMode()) {
                    debugCheckValid();
                }
            }
            case FORCE -> {
                if (cursorState.isDebugMode()) {
                    debugUncheckedCardsAction();
                }
            }
            case HELP -> screen = Screen.HELP;
            case MENU -> screen = Screen.GAME_MENU;
            case QUIT -> screen = Screen.QUIT;
        }
    }

    private void moveCursor(CursorAction action) {
        cursorState.setCursor(engine.applyCursorAction(action, state, cursorState.getCursor()));
    }

    /**
     * Picks up the cards under the cursor, or drops the picked-up cards at the cursor.
     */
    private void cardsAction() {
        Selection cursor = cursorState.getCursor();
        if (cursorState.hasSelected()) {
            Selection from = cursorState.getSelected();
            cursorState.clearSelected();
            MoveResult result = engine.attemptMove(from, cursor, state);
            cursorState.setStatusMessage(statusFor(result));
        } else if (cursor.cardCount() > 0) {
            cursorState.setSelected(cursor);
        }
    }

    /**
     * Deck: draw. Column: send the top card to a foundation.
     */
    private void enterAction() {
        Selection cursor = cursorState.getCursor();
        if (cursor.isDeck()) {
            engine.drawFromDeck(state);
        } else if (cursor.isColumn()) {
            MoveResult result = engine.autoPlaceToFoundation(cursor.index(), state);
            cursorState.setStatusMessage(statusFor(result));
        }
    }

    private void debugCheckValid() {
        if (cursorState.hasSelected()) {
            cursorState.setStatusMessage(engine.checkMove(cursorState.getSelected(), cursorState.getCursor(), state).toString());
        } else {
            cursorState.setStatusMessage("");
        }
    }

    private void debugUncheckedCardsAction() {
        if (cursorState.hasSelected()) {
            Selection from = cursorState.getSelected();
            cursorState.clearSelected();
            cursorState.setStatusMessage(statusFor(engine.moveUnchecked(from, cursorState.getCursor(), state)));
        } else {
            cursorState.setSelected(cursorState.getCursor());
        }
    }

    private static String statusFor(MoveResult result) {
        if (result.isSuccess()) {
            return "move OK";
        }
        return result.getError() == MoveError.INVALID_MOVE ? "invalid move" : "move attempt failed";
    }

    public Screen getScreen() {
        return screen;
    }

    public GameState getState() {
        return state;
    }

    public CursorState getCursorState() {
        return cursorState;
    }
}
