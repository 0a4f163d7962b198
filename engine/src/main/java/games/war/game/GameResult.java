package games.war.game;

import java.util.Optional;

/**
 * Lightweight summary of a finished game.
 */
public final class GameResult {
    private final Side winner;
    private final int rounds;
    private final boolean roundCapReached;
    private final int cardsA;
    private final int cardsB;

    public GameResult(Side winner, int rounds, boolean roundCapReached, int cardsA, int cardsB) {
        this.winner = winner;
        this.rounds = rounds;
        this.roundCapReached = roundCapReached;
        this.cardsA = cardsA;
        this.cardsB = cardsB;
    }

    /**
     * Returns the winning side.
     *
     * @return the winner, or empty for a tie
     */
    public Optional<Side> getWinner() {
        return Optional.ofNullable(winner);
    }

    public boolean isTie() {
        return winner == null;
    }

    public int getRounds() {
        return rounds;
    }

    /** True when play stopped because the configured round cap was hit. */
    public boolean isRoundCapReached() {
        return roundCapReached;
    }

    public int getCardsA() {
        return cardsA;
    }

    public int getCardsB() {
        return cardsB;
    }
}
