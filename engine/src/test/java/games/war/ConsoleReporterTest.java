package games.war;

import static games.war.helpers.DeckFactory.card;
import static games.war.helpers.DeckFactory.deckOf;
import static games.war.helpers.DeckFactory.hearts;
import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import games.war.config.WarProperties;
import games.war.game.Deck;
import games.war.game.War;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Console narration of a game, captured from the reporter's logger.
 */
class ConsoleReporterTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(ConsoleReporter.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final WarProperties properties = new WarProperties();

    @BeforeEach
    void attachAppender() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
        appender.stop();
    }

    private List<String> messages() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    private void play(War war) {
        war.addListener(new ConsoleReporter(properties));
        war.play();
    }

    private static Deck spades(int... ranks) {
        Deck deck = new Deck();
        for (int rank : ranks) {
            deck.addToBottom(card("Spades", rank));
        }
        return deck;
    }

    @Test
    void narratesADecidedGame() {
        play(War.deal(deckOf(card("Hearts", 1), card("Spades", 2)), properties));

        assertEquals(List.of(
                "Starting War with 2 cards (1 for Player A, 1 for Player B)",
                "Round 1",
                "Player A plays Hearts:1",
                "Player B plays Spades:2",
                "Player B wins the round and takes 2 cards",
                "Cards left: Player A 0, Player B 2",
                "Game Over after 1 rounds",
                "Player B wins! (0 to 2)"), messages());
    }

    @Test
    void narratesATieAtTheRoundCap() {
        properties.setMaxRounds(2);
        play(new War(hearts(5, 2), spades(3, 9), properties));

        List<String> messages = messages();
        assertTrue(messages.contains("Round 2"));
        assertTrue(messages.contains("Player A wins the round and takes 2 cards"));
        assertTrue(messages.contains("Player B wins the round and takes 2 cards"));
        assertEquals(List.of(
                "Game Over after 2 rounds",
                "Round limit reached",
                "It's a tie! (2 cards each)"), messages.subList(messages.size() - 3, messages.size()));
    }

    @Test
    void narratesAWar() {
        properties.setWarCards(1);
        play(new War(hearts(7, 2, 10), spades(7, 3, 4), properties));

        assertEquals(List.of(
                "Starting War with 6 cards (3 for Player A, 3 for Player B)",
                "Round 1",
                "Player A plays Hearts:7",
                "Player B plays Spades:7",
                "War! Player A puts 1 card(s) face down, Player B puts 1",
                "Player A plays Hearts:10",
                "Player B plays Spades:4",
                "Player A wins the round and takes 6 cards",
                "Cards left: Player A 6, Player B 0",
                "Game Over after 1 rounds",
                "Player A wins! (6 to 0)"), messages());
    }

    @Test
    void narratesAReturnedPot() {
        play(new War(hearts(7), spades(7), properties));

        List<String> messages = messages();
        assertTrue(messages.contains("Both players ran out of cards during the war; the pot is returned"));
        assertEquals("It's a tie! (1 cards each)", messages.get(messages.size() - 1));
    }

    @Test
    void colourisesRedSuitsWhenEnabled() {
        properties.setAnsiColour(true);
        play(War.deal(deckOf(card("Hearts", 1), card("Spades", 2)), properties));

        List<String> messages = messages();
        assertTrue(messages.contains("Player A plays \u001B[31mHearts:1\u001B[0m"));
        assertTrue(messages.contains("Player B plays Spades:2"));
    }
}
