package games.solitext.unit.ui;

import static games.solitext.unit.helpers.SeededDeal.card;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.solitext.engine.GameEngine;
import games.solitext.game.Card;
import games.solitext.game.GameMode;
import games.solitext.game.GameState;
import games.solitext.selection.Selection;
import games.solitext.turn.TurnPipeline;
import games.solitext.ui.CommandSource;
import games.solitext.ui.Screen;
import games.solitext.ui.ScreenFlow;
import games.solitext.unit.helpers.SeededDeal;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Drives the console screens with scripted input.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>Screens</b> - Start, menu, help and quit transitions, including closed input</li>
 *   <li><b>Play</b> - Select/drop moves, Enter on deck and columns, status messages</li>
 *   <li><b>DebugCommands</b> - check and force only act in debug mode</li>
 *   <li><b>Victory</b> - Winning shows the victory screen; y plays again, n quits</li>
 * </ul>
 */
class ScreenFlowTest {

    /** Replays fixed lines, then reports closed input. */
    private static final class ScriptedInput implements CommandSource {
        private final Deque<String> lines;

        ScriptedInput(String... lines) {
            this.lines = new ArrayDeque<>(Arrays.asList(lines));
        }

        @Override
        public String nextLine(String prompt) {
            return lines.poll();
        }
    }

    /** An engine whose new games all come from {@code deal}. */
    private static GameEngine engineDealing(Supplier<GameState> deal) {
        return new GameEngine(new Random(1), new TurnPipeline(true)) {
            @Override
            public GameState newGame(GameMode mode) {
                return deal.get();
            }
        };
    }

    private static GameEngine engineDealing(List<Card> seed) {
        return new GameEngine(new Random(1), new TurnPipeline(true)) {
            @Override
            public GameState newGame(GameMode mode) {
                return restartGame(seed, mode);
            }
        };
    }

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ScreenFlow run(GameEngine engine, String... lines) {
        ScreenFlow flow = new ScreenFlow(engine, new ScriptedInput(lines),
                new PrintStream(output, true, StandardCharsets.UTF_8), false);
        flow.run();
        return flow;
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Screens")
    class Screens {

        @Test
        void quitFromStart() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "q");

            assertEquals(Screen.QUIT, flow.getScreen());
            assertNull(flow.getState());
            assertTrue(printed().contains("Thanks for playing."));
        }

        @Test
        void closedInputQuits() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1");

            assertEquals(Screen.QUIT, flow.getScreen());
            assertEquals(GameMode.DRAW_ONE, flow.getState().getGameMode());
        }

        @Test
        void unknownStartInputIsIgnored() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "7", "3", "quit");

            assertEquals(GameMode.DRAW_THREE, flow.getState().getGameMode());
        }

        @Test
        void menuStartsNewGameInOtherMode() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "esc", "3", "quit");

            assertEquals(GameMode.DRAW_THREE, flow.getState().getGameMode());
        }

        @Test
        void menuRestartRedealsSameGame() {
            List<Card> seed = SeededDeal.builder().columnTop(0, card("Q♣")).seedDeck();
            ScreenFlow flow = run(engineDealing(seed), "1", "enter", "enter", "menu", "r", "quit");

            GameState state = flow.getState();
            assertEquals(card("Q♣"), state.getColumn(0).peek());
            assertEquals(1, state.getWaste().size(), "only the restart's auto-draw");
        }

        @Test
        void menuEscReturnsToGame() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "menu", "esc", "d", "quit");

            assertEquals(Selection.column(0, 1), flow.getCursorState().getCursor());
        }

        @Test
        void helpReturnsToGameOnAnyLine() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "h", "", "d", "quit");

            assertTrue(printed().contains("Controls:"));
            assertEquals(Selection.column(0, 1), flow.getCursorState().getCursor());
        }

        @Test
        void unknownCommandSetsStatus() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "jump", "quit");

            assertEquals("Unknown command: jump (h for help)", flow.getCursorState().getStatusMessage());
        }
    }

    @Nested
    @DisplayName("Play")
    class Play {

        @Test
        void selectWasteAndDropOnFoundation() {
            List<Card> seed = SeededDeal.builder().stockTop(card("A♥")).seedDeck();

            ScreenFlow flow = run(engineDealing(seed), "1", "select", "end", "select", "quit");

            assertEquals(card("A♥"), flow.getState().getFoundation(0).peek());
            assertEquals("move OK", flow.getCursorState().getStatusMessage());
            assertFalse(flow.getCursorState().hasSelected());
        }

        @Test
        void dropOnWrongFoundationIsInvalid() {
            List<Card> seed = SeededDeal.builder().stockTop(card("A♥")).seedDeck();

            ScreenFlow flow = run(engineDealing(seed), "1", "select", "end", "s", "select", "quit");

            assertEquals("invalid move", flow.getCursorState().getStatusMessage());
            assertTrue(flow.getState().getFoundation(1).isEmpty());
            assertFalse(flow.getCursorState().hasSelected());
        }

        @Test
        void enterOnColumnPlacesAce() {
            List<Card> seed = SeededDeal.builder().columnTop(0, card("A♠")).seedDeck();

            ScreenFlow flow = run(engineDealing(seed), "1", "d", "enter", "quit");

            assertEquals(card("A♠"), flow.getState().getFoundation(1).peek());
            assertEquals("move OK", flow.getCursorState().getStatusMessage());
            assertEquals(Selection.column(0, 0), flow.getCursorState().getCursor());
        }

        @Test
        void enterOnDeckDraws() {
            List<Card> seed = SeededDeal.builder().stockTop(card("4♦"), card("9♠")).seedDeck();

            ScreenFlow flow = run(engineDealing(seed), "1", "enter", "quit");

            assertEquals(card("9♠"), flow.getState().getWaste().peek());
            assertEquals(22, flow.getState().getDeck().size());
        }

        @Test
        void clearDropsSelection() {
            ScreenFlow flow = run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "d", "select", "clear", "quit");

            assertFalse(flow.getCursorState().hasSelected());
        }

        @Test
        void boardShowsCursorAndPickedUpMarks() {
            run(new GameEngine(new Random(1), new TurnPipeline(true)), "1", "select", "quit");

            assertTrue(printed().contains("FOUNDATION"));
            assertTrue(printed().contains("TABLEAU"));
            assertTrue(printed().contains("*>"));
            assertTrue(printed().contains("Enter: Hit"));
        }
    }

    @Nested
    @DisplayName("DebugCommands")
    class DebugCommands {

        private List<Card> seed() {
            return SeededDeal.builder().columnTop(1, card("J♥")).columnTop(2, card("Q♦")).seedDeck();
        }

        @Test
        void forceIgnoredOutsideDebugMode() {
            ScreenFlow flow = run(engineDealing(seed()), "1", "d", "d", "force", "quit");

            assertFalse(flow.getCursorState().hasSelected());
        }

        @Test
        void checkThenForceAnIllegalMove() {
            ScreenFlow flow = run(engineDealing(seed()),
                    "1", "debug", "d", "d", "force", "d", "check", "force", "quit");

            assertTrue(flow.getCursorState().isDebugMode());
            assertEquals("move OK", flow.getCursorState().getStatusMessage());
            assertEquals(card("J♥"), flow.getState().getColumn(2).peek());
            assertTrue(printed().contains("Err(INVALID_MOVE"));
        }
    }

    @Nested
    @DisplayName("Victory")
    class Victory {

        @Test
        void winningShowsVictoryScreenAndNQuits() {
            ScreenFlow flow = run(engineDealing(GameState::almostVictory), "1", "d", "enter", "n");

            assertEquals(Screen.QUIT, flow.getScreen());
            assertTrue(flow.getState().isVictory());
            assertTrue(printed().contains("YOU WIN"));
        }

        @Test
        void yesStartsAnotherGame() {
            ScreenFlow flow = run(engineDealing(GameState::almostVictory), "1", "d", "enter", "y", "quit");

            assertFalse(flow.getState().isVictory());
            assertEquals("", flow.getCursorState().getStatusMessage());
        }
    }
}
