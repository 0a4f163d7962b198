package games.war.game;

import java.util.Optional;

/**
 * Outcome of a single round.
 */
public final class RoundResult {
    private final int round;
    private final Side winner;
    private final int wars;
    private final int potSize;

    public RoundResult(int round, Side winner, int wars, int potSize) {
        this.round = round;
        this.winner = winner;
        this.wars = wars;
        this.potSize = potSize;
    }

    public int getRound() {
        return round;
    }

    /**
     * Returns the side that collected the pot.
     *
     * @return the winner, or empty if both players ran out of cards during a war and the
     *         pot went back to its owners
     */
    public Optional<Side> getWinner() {
        return Optional.ofNullable(winner);
    }

    /** Number of wars (ties) fought within this round. */
    public int getWars() {
        return wars;
    }

    /** Total cards that changed hands or were returned at the end of the round. */
    public int getPotSize() {
        return potSize;
    }
}
