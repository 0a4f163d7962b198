package games.war.io;

import static games.war.helpers.DeckFactory.card;
import static games.war.helpers.DeckFactory.deckOf;
import static games.war.helpers.DeckFactory.joker;
import static org.junit.jupiter.api.Assertions.*;

import games.war.game.Deck;
import games.war.game.RoundResult;
import games.war.game.Side;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RoundLogWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesHeaderEvenWithoutRounds() throws Exception {
        Path file = dir.resolve("rounds.csv");
        try (RoundLogWriter ignored = RoundLogWriter.open(file)) {
            // header only
        }
        assertEquals(List.of(RoundLogWriter.HEADER), Files.readAllLines(file));
    }

    @Test
    void writesOneQuotedRecordPerRound() throws Exception {
        Path file = dir.resolve("rounds.csv");
        Deck a = deckOf(card("Hearts", 2), joker("Red"));
        Deck b = deckOf(card("Clubs", 12));

        try (RoundLogWriter roundLog = RoundLogWriter.open(file)) {
            roundLog.writeRound(1, a, b);
            roundLog.onRoundEnd(new RoundResult(2, Side.A, 0, 2), a, new Deck());
        }

        assertEquals(List.of(
                "Round,PlayerA_Count,PlayerB_Count,PlayerA_Cards,PlayerB_Cards",
                "1,2,1,\"Hearts:2 Joker:Red\",\"Clubs:Queen\"",
                "2,2,0,\"Hearts:2 Joker:Red\",\"\""), Files.readAllLines(file));
    }

    @Test
    void doublesEmbeddedQuotes() throws Exception {
        Path file = dir.resolve("rounds.csv");
        try (RoundLogWriter roundLog = RoundLogWriter.open(file)) {
            roundLog.writeRound(1, deckOf(joker("\"Red\"")), new Deck());
        }
        assertEquals("1,1,0,\"Joker:\"\"Red\"\"\",\"\"", Files.readAllLines(file).get(1));
    }

    @Test
    void truncatesExistingFile() throws Exception {
        Path file = dir.resolve("rounds.csv");
        Files.writeString(file, "old contents\nmore\n");
        try (RoundLogWriter ignored = RoundLogWriter.open(file)) {
            // header only
        }
        assertEquals(List.of(RoundLogWriter.HEADER), Files.readAllLines(file));
    }

    @Test
    void unwritableTargetFails() {
        RoundLogException e = assertThrows(RoundLogException.class,
                () -> RoundLogWriter.open(dir.resolve("missing").resolve("rounds.csv")));
        assertTrue(e.getMessage().startsWith("Failed to open output CSV"));
    }
}
