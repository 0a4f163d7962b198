package games.war.io;

import games.war.game.Deck;
import games.war.game.RoundListener;
import games.war.game.RoundResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes one CSV record per round to an output file.
 * <p>
 * The file is truncated when the writer is opened and starts with the header
 * {@value #HEADER}. Each round then appends
 * <pre>
 *   &lt;round&gt;,&lt;countA&gt;,&lt;countB&gt;,"&lt;deck A&gt;","&lt;deck B&gt;"
 * </pre>
 * where the deck fields are {@link Deck#render()} wrapped in quotes. Quotes inside a rendering
 * are doubled.
 */
public class RoundLogWriter implements RoundListener, AutoCloseable {
    public static final String HEADER = "Round,PlayerA_Count,PlayerB_Count,PlayerA_Cards,PlayerB_Cards";

    private final Path path;
    private final BufferedWriter writer;

    private RoundLogWriter(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens (and truncates) the round log and writes its header.
     *
     * @param path output file
     * @return an open writer; close it when the game is over
     * @throws RoundLogException if the file cannot be opened or the header cannot be written
     */
    public static RoundLogWriter open(Path path) {
        Objects.requireNonNull(path, "path");
        BufferedWriter writer;
        try {
            writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RoundLogException("Failed to open output CSV: " + path, e);
        }
        RoundLogWriter roundLog = new RoundLogWriter(path, writer);
        roundLog.writeLine(HEADER);
        return roundLog;
    }

    /**
     * Appends the record for one round.
     *
     * @param round   1-based round number
     * @param playerA Player A's deck after the round
     * @param playerB Player B's deck after the round
     */
    public void writeRound(int round, Deck playerA, Deck playerB) {
        writeLine(round + "," + playerA.size() + "," + playerB.size() + ","
                + quote(playerA.render()) + "," + quote(playerB.render()));
    }

    @Override
    public void onRoundEnd(RoundResult result, Deck playerA, Deck playerB) {
        writeRound(result.getRound(), playerA, playerB);
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new RoundLogException("Failed to close output CSV: " + path, e);
        }
    }

    private void writeLine(String line) {
        try {
            writer.write(line);
            writer.write('\n');
        } catch (IOException e) {
            throw new RoundLogException("Failed to write output CSV: " + path, e);
        }
    }

    private static String quote(String field) {
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
