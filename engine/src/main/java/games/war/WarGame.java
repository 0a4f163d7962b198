package games.war;

import games.war.config.WarProperties;
import games.war.game.Deck;
import games.war.game.GameResult;
import games.war.game.War;
import games.war.io.DeckLoadException;
import games.war.io.DeckReader;
import games.war.io.RoundLogException;
import games.war.io.RoundLogWriter;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WarGame implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(WarGame.class);

    static final String USAGE = "Usage: war_game <input.csv> <output.csv>";

    private final WarProperties properties;
    private final DeckReader deckReader;
    private int exitCode;

    public WarGame(WarProperties properties, DeckReader deckReader) {
        this.properties = properties;
        this.deckReader = deckReader;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(WarGame.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Loads the deck, plays one game and writes the round log.
     *
     * <p>Arguments starting with {@code --} are Spring options (e.g. {@code --war.max-rounds=50})
     * and are ignored here; exactly two others must remain: the input deck and the output CSV.
     *
     * @return 0 on success, 1 on a usage, input or output error
     */
    int execute(String... args) {
        List<String> files = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                files.add(arg);
            }
        }
        if (files.size() != 2) {
            log.error(USAGE);
            return 1;
        }
        try {
            Path input = Path.of(files.get(0));
            Path output = Path.of(files.get(1));
            Deck deck = deckReader.read(input);
            War war = War.deal(deck, properties);
            war.addListener(new ConsoleReporter(properties));
            GameResult result;
            try (RoundLogWriter roundLog = RoundLogWriter.open(output)) {
                war.addListener(roundLog);
                result = war.play();
            }
            if (log.isDebugEnabled()) {
                log.debug("Finished after {} rounds; winner {}", result.getRounds(),
                        result.getWinner().map(Object::toString).orElse("none"));
            }
            return 0;
        } catch (DeckLoadException e) {
            log.error("Error: {}", e.getMessage());
            if (log.isDebugEnabled()) {
                log.debug("Deck load failed ({})", e.getReason(), e);
            }
            return 1;
        } catch (RoundLogException | InvalidPathException e) {
            log.error("Error: {}", e.getMessage());
            return 1;
        }
    }
}
