package games.war.game;

import java.util.Objects;

/**
 * A Jack, Queen or King of some suit.
 * <p>
 * Compares exactly like a {@link StandardCard} of the same rank; the only difference is
 * that the face is rendered by name (e.g., "Clubs:Queen").
 */
public final class FaceCard extends Card {
    private final String suit;
    private final int rank;

    public FaceCard(String suit, int rank) {
        this.suit = Objects.requireNonNull(suit, "suit");
        this.rank = rank;
    }

    public String getSuit() {
        return suit;
    }

    /**
     * Returns the face rank of this card.
     *
     * @return {@link Rank#JACK}, {@link Rank#QUEEN} or {@link Rank#KING}
     */
    public Rank getFace() {
        return Rank.fromValue(rank);
    }

    @Override
    public int value() {
        return rank;
    }

    @Override
    public String render() {
        return suit + ":" + getFace().getName();
    }
}
