package games.solitext.unit.ui;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.solitext.ui.Command;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CommandTest {

    @Test
    void parsesPrimaryTokensAndAliases() {
        assertEquals(Command.LEFT, Command.parse("left"));
        assertEquals(Command.LEFT, Command.parse("a"));
        assertEquals(Command.ENTER, Command.parse("hit"));
        assertEquals(Command.MENU, Command.parse("esc"));
        assertEquals(Command.HELP, Command.parse("?"));
    }

    @Test
    void ignoresCaseAndSurroundingSpace() {
        assertEquals(Command.SELECT, Command.parse("  SELECT "));
        assertEquals(Command.QUIT, Command.parse("Q"));
    }

    @Test
    void blankOrUnknownIsNull() {
        assertNull(Command.parse(null));
        assertNull(Command.parse("   "));
        assertNull(Command.parse("teleport"));
    }

    @Test
    void primaryTokensAreUniqueAndRoundTrip() {
        Set<String> seen = new HashSet<>();
        for (Command command : Command.values()) {
            assertEquals(command, Command.parse(command.token()));
            assertTrue(seen.add(command.token()), command.token());
        }
    }
}
