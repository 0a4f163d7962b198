package games.war.game;

import java.util.Objects;

/**
 * A numbered card (Ace through Ten) of some suit.
 * <p>
 * The rank is not re-validated here; callers construct standard cards only with ranks 1–10.
 */
public final class StandardCard extends Card {
    private final String suit;
    private final int rank;

    public StandardCard(String suit, int rank) {
        this.suit = Objects.requireNonNull(suit, "suit");
        this.rank = rank;
    }

    public String getSuit() {
        return suit;
    }

    @Override
    public int value() {
        return rank;
    }

    @Override
    public String render() {
        return suit + ":" + rank;
    }
}
