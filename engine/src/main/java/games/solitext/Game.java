package games.solitext;

import games.solitext.config.DebugModeProperties;
import games.solitext.engine.GameEngine;
import games.solitext.ui.CommandSource;
import games.solitext.ui.ScreenFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final GameEngine engine;
    private final CommandSource commandSource;
    private final DebugModeProperties debugMode;

    public Game(GameEngine engine, CommandSource commandSource, DebugModeProperties debugMode) {
        this.engine = engine;
        this.commandSource = commandSource;
        this.debugMode = debugMode;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        log.debug("Starting console session (debug mode {})", debugMode.isEnabled());
        new ScreenFlow(engine, commandSource, System.out, debugMode.isEnabled()).run();
    }
}
