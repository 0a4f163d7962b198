package games.war.game;

import games.war.config.WarProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A game of War between Player A and Player B.
 *
 * <p>Each round both players turn up their top card and the higher card takes the pot.
 * On a tie ("war") each player adds up to {@code warCards} face-down cards to the pot,
 * always keeping one card back, and turns up a new card; this repeats until the tie is
 * broken. A player with no card left to turn up loses the round. If both run out together
 * the pot goes back to its owners and the game stops.
 *
 * <p>The round winner puts the pot at the bottom of their deck: their own cards first,
 * then the loser's, each in the order they were played.
 *
 * <p>The game ends when a player starts a round with no cards or after {@code maxRounds}
 * rounds. On the round cap, or when a round could not be decided, the player holding more
 * cards wins and equal counts are a tie.
 */
public class War {
    private static final Logger log = LoggerFactory.getLogger(War.class);

    private final Deck playerA;
    private final Deck playerB;
    private final int maxRounds;
    private final int warCards;
    private final List<RoundListener> listeners = new ArrayList<>();
    private int round;

    public War(Deck playerA, Deck playerB, int maxRounds, int warCards) {
        this.playerA = Objects.requireNonNull(playerA, "playerA");
        this.playerB = Objects.requireNonNull(playerB, "playerB");
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        }
        if (warCards < 0) {
            throw new IllegalArgumentException("warCards must not be negative: " + warCards);
        }
        this.maxRounds = maxRounds;
        this.warCards = warCards;
    }

    public War(Deck playerA, Deck playerB, WarProperties properties) {
        this(playerA, playerB, properties.getMaxRounds(), properties.getWarCards());
    }

    /**
     * Deals the source deck alternately to both players, starting with Player A, and sets up
     * a game with the configured rules. The source deck is empty afterwards.
     *
     * @param source     the full deck to deal
     * @param properties round cap and war size
     * @return a game ready to {@link #play()}
     */
    public static War deal(Deck source, WarProperties properties) {
        Deck playerA = new Deck();
        Deck playerB = new Deck();
        boolean toA = true;
        while (!source.isEmpty()) {
            (toA ? playerA : playerB).addToBottom(source.drawFromTop());
            toA = !toA;
        }
        return new War(playerA, playerB, properties);
    }

    public void addListener(RoundListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public Deck getPlayerA() {
        return playerA;
    }

    public Deck getPlayerB() {
        return playerB;
    }

    /**
     * Plays rounds until the game is over.
     *
     * @return summary of the finished game
     */
    public GameResult play() {
        for (RoundListener listener : listeners) {
            listener.onGameStart(playerA, playerB);
        }
        boolean capped = false;
        while (!playerA.isEmpty() && !playerB.isEmpty()) {
            if (round >= maxRounds) {
                capped = true;
                if (log.isDebugEnabled()) {
                    log.debug("Round cap of {} reached; stopping with {} vs {} cards",
                            maxRounds, playerA.size(), playerB.size());
                }
                break;
            }
            RoundResult result = playRound();
            if (result.getWinner().isEmpty()) {
                break;
            }
        }
        GameResult result = new GameResult(decideWinner(), round, capped, playerA.size(), playerB.size());
        for (RoundListener listener : listeners) {
            listener.onGameEnd(result);
        }
        return result;
    }

    /**
     * Plays a single round, including any wars it triggers.
     *
     * @return the outcome of the round
     * @throws EmptyDeckException if either player has no card to start the round with
     */
    public RoundResult playRound() {
        if (playerA.isEmpty() || playerB.isEmpty()) {
            throw new EmptyDeckException();
        }
        round++;
        for (RoundListener listener : listeners) {
            listener.onRoundStart(round);
        }
        List<Card> potA = new ArrayList<>();
        List<Card> potB = new ArrayList<>();
        Card cardA = turnUp(playerA, potA);
        Card cardB = turnUp(playerB, potB);
        firePlayed(cardA, cardB);

        int wars = 0;
        Side winner;
        while (true) {
            int cmp = cardA.compareTo(cardB);
            if (cmp > 0) {
                winner = Side.A;
                break;
            }
            if (cmp < 0) {
                winner = Side.B;
                break;
            }
            wars++;
            int downA = layFaceDown(playerA, potA);
            int downB = layFaceDown(playerB, potB);
            for (RoundListener listener : listeners) {
                listener.onWar(round, downA, downB);
            }
            if (playerA.isEmpty() && playerB.isEmpty()) {
                winner = null;
                break;
            }
            if (playerA.isEmpty()) {
                winner = Side.B;
                break;
            }
            if (playerB.isEmpty()) {
                winner = Side.A;
                break;
            }
            cardA = turnUp(playerA, potA);
            cardB = turnUp(playerB, potB);
            firePlayed(cardA, cardB);
        }

        if (winner == null) {
            potA.forEach(playerA::addToBottom);
            potB.forEach(playerB::addToBottom);
        } else if (winner == Side.A) {
            potA.forEach(playerA::addToBottom);
            potB.forEach(playerA::addToBottom);
        } else {
            potB.forEach(playerB::addToBottom);
            potA.forEach(playerB::addToBottom);
        }
        int potSize = potA.size() + potB.size();
        if (log.isDebugEnabled()) {
            log.debug("Round {} won by {} ({} cards, {} wars)", round, winner, potSize, wars);
        }

        RoundResult result = new RoundResult(round, winner, wars, potSize);
        for (RoundListener listener : listeners) {
            listener.onRoundEnd(result, playerA, playerB);
        }
        return result;
    }

    private Side decideWinner() {
        if (playerA.size() > playerB.size()) {
            return Side.A;
        }
        if (playerB.size() > playerA.size()) {
            return Side.B;
        }
        return null;
    }

    private static Card turnUp(Deck deck, List<Card> pot) {
        Card card = deck.drawFromTop();
        pot.add(card);
        return card;
    }

    /** Moves up to {@code warCards} cards into the pot, keeping at least one card in the deck. */
    private int layFaceDown(Deck deck, List<Card> pot) {
        int count = Math.max(0, Math.min(warCards, deck.size() - 1));
        for (int i = 0; i < count; i++) {
            pot.add(deck.drawFromTop());
        }
        return count;
    }

    private void firePlayed(Card cardA, Card cardB) {
        for (RoundListener listener : listeners) {
            listener.onCardsPlayed(round, cardA, cardB);
        }
    }
}
