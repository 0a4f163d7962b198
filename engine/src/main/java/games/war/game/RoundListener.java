package games.war.game;

/**
 * Observer of a {@link War} game.
 * <p>
 * Callbacks arrive in order: one {@link #onGameStart}, then for each round one
 * {@link #onRoundStart}, one or more {@link #onCardsPlayed} (a further one after each
 * {@link #onWar}) and one {@link #onRoundEnd}, and finally one {@link #onGameEnd}.
 * Decks passed in reflect the state at the time of the callback and must not be modified.
 */
public interface RoundListener {

    default void onGameStart(Deck playerA, Deck playerB) {
    }

    default void onRoundStart(int round) {
    }

    /**
     * Called each time both players turn up a card.
     *
     * @param round 1-based round number
     * @param cardA card turned up by Player A
     * @param cardB card turned up by Player B
     */
    default void onCardsPlayed(int round, Card cardA, Card cardB) {
    }

    /**
     * Called when the face-up cards tie and each player adds face-down cards to the pot.
     *
     * @param round 1-based round number
     * @param faceDownA face-down cards added by Player A
     * @param faceDownB face-down cards added by Player B
     */
    default void onWar(int round, int faceDownA, int faceDownB) {
    }

    /**
     * Called once the winner of a round has collected the pot.
     *
     * @param result  outcome of the round
     * @param playerA Player A's deck after the round
     * @param playerB Player B's deck after the round
     */
    void onRoundEnd(RoundResult result, Deck playerA, Deck playerB);

    default void onGameEnd(GameResult result) {
    }
}
