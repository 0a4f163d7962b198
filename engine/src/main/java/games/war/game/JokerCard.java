package games.war.game;

import java.util.Objects;

/**
 * A joker, identified by a free-form label such as a colour ("Red", "Black").
 * <p>
 * Every joker has value {@link Card#JOKER_VALUE} and so beats any suited card.
 * Two jokers tie with each other.
 */
public final class JokerCard extends Card {
    /** Token that marks a joker in the suit position of the deck source, and its render prefix. */
    public static final String JOKER = "Joker";

    private final String label;

    public JokerCard(String label) {
        this.label = Objects.requireNonNull(label, "label");
    }

    public String getLabel() {
        return label;
    }

    @Override
    public int value() {
        return JOKER_VALUE;
    }

    @Override
    public String render() {
        return JOKER + ":" + label;
    }
}
