package games.solitext.ui;

import java.util.Locale;

/**
 * In-game console commands, one per line of input.
 * <p>
 * Each command stands in for a key of the full-screen interface (arrow keys, Space, Enter,
 * Home, End, Esc). Parsing is case-insensitive; WASD work as arrow keys.
 */
public enum Command {
    LEFT("left", "a"),
    RIGHT("right", "d"),
    UP("up", "w"),
    DOWN("down", "s"),
    HOME("home"),
    END("end"),
    SELECT("select", "space"),
    ENTER("enter", "hit", "e"),
    CLEAR("clear", "x"),
    DEBUG("debug"),
    CHECK("check", "z"),
    FORCE("force", "c"),
    HELP("help", "h", "?"),
    MENU("menu", "esc"),
    QUIT("quit", "q");

    private final String[] tokens;

    Command(String... tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses one input line.
     *
     * @param input the raw line (may be null)
     * @return the command, or {@code null} if the line is blank or not recognised
     */
    public static Command parse(String input) {
        if (input == null) {
            return null;
        }
        String normalized = input.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return null;
        }
        for (Command command : values()) {
            for (String token : command.tokens) {
                if (token.equals(normalized)) {
                    return command;
                }
            }
        }
        return null;
    }

    /**
     * Returns the primary spelling of this command.
     */
    public String token() {
        return tokens[0];
    }
}
