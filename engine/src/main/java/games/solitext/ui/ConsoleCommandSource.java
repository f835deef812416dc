package games.solitext.ui;

import java.util.Scanner;
import org.springframework.stereotype.Component;

/**
 * Reads player input from stdin.
 */
@Component
public class ConsoleCommandSource implements CommandSource {
    private final Scanner scanner = new Scanner(System.in);

    @Override
    public String nextLine(String prompt) {
        System.out.print(prompt);
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }
}
