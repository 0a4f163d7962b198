package games.war.game;

/**
 * A card in play: one of {@link StandardCard}, {@link FaceCard} or {@link JokerCard}.
 * <p>
 * Every card exposes a numeric {@link #value()} that drives all comparisons. Ordering
 * and equality are defined purely in terms of that value, so two cards of the same
 * rank in different suits compare as equal; suit is never a tie-break. {@link #hashCode()}
 * is consistent with this notion of equality.
 * <p>
 * The set of variants is closed: the constructor is package-private. Cards are immutable.
 */
public abstract class Card implements Comparable<Card> {

    /** Value of every joker; beats any suited card. */
    public static final int JOKER_VALUE = Rank.MAX_VALUE + 1;

    Card() {
    }

    /**
     * Returns the comparison key of this card.
     *
     * @return the rank value for suited cards, or {@link #JOKER_VALUE} for jokers
     */
    public abstract int value();

    /**
     * Returns the textual form of this card (e.g., "Hearts:7", "Clubs:Queen", "Joker:Red").
     * <p>
     * Used both for console display and for the serialized deck contents in the round log.
     *
     * @return the rendering; never {@code null}
     */
    public abstract String render();

    /**
     * Returns whether this card beats the given card.
     *
     * @param other the card to compare against
     * @return {@code true} if this card has a strictly higher value
     */
    public boolean beats(Card other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Card other) {
        return Integer.compare(value(), other.value());
    }

    /**
     * Two cards are equal when their values are equal, regardless of variant or suit.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        return value() == ((Card) o).value();
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value());
    }

    @Override
    public String toString() {
        return render();
    }
}
