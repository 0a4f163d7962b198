package games.war;

import games.war.config.WarProperties;
import games.war.game.Card;
import games.war.game.Deck;
import games.war.game.GameResult;
import games.war.game.RoundListener;
import games.war.game.RoundResult;
import games.war.game.Side;
import games.war.game.Suit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Narrates a game on the console through the application log.
 */
public class ConsoleReporter implements RoundListener {
    private static final Logger log = LoggerFactory.getLogger(ConsoleReporter.class);

    private final boolean colour;

    public ConsoleReporter(WarProperties properties) {
        this.colour = properties.isAnsiColour();
    }

    @Override
    public void onGameStart(Deck playerA, Deck playerB) {
        log.info("Starting War with {} cards ({} for {}, {} for {})",
                playerA.size() + playerB.size(), playerA.size(), Side.A, playerB.size(), Side.B);
    }

    @Override
    public void onRoundStart(int round) {
        log.info("Round {}", round);
    }

    @Override
    public void onCardsPlayed(int round, Card cardA, Card cardB) {
        log.info("{} plays {}", Side.A, display(cardA));
        log.info("{} plays {}", Side.B, display(cardB));
    }

    @Override
    public void onWar(int round, int faceDownA, int faceDownB) {
        log.info("War! {} puts {} card(s) face down, {} puts {}", Side.A, faceDownA, Side.B, faceDownB);
    }

    @Override
    public void onRoundEnd(RoundResult result, Deck playerA, Deck playerB) {
        if (result.getWinner().isPresent()) {
            log.info("{} wins the round and takes {} cards", result.getWinner().get(), result.getPotSize());
        } else {
            log.info("Both players ran out of cards during the war; the pot is returned");
        }
        log.info("Cards left: {} {}, {} {}", Side.A, playerA.size(), Side.B, playerB.size());
    }

    @Override
    public void onGameEnd(GameResult result) {
        log.info("Game Over after {} rounds", result.getRounds());
        if (result.isRoundCapReached()) {
            log.info("Round limit reached");
        }
        if (result.isTie()) {
            log.info("It's a tie! ({} cards each)", result.getCardsA());
        } else {
            log.info("{} wins! ({} to {})", result.getWinner().get(), result.getCardsA(), result.getCardsB());
        }
    }

    private String display(Card card) {
        return colour ? Suit.colourise(card) : card.render();
    }
}
