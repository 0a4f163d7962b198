package games.war.game;

/**
 * Thrown by {@link Deck#drawFromTop()} when the deck has no cards.
 * <p>
 * Drawing from an empty deck is a caller error; check {@link Deck#isEmpty()} first.
 */
public class EmptyDeckException extends IllegalStateException {
    public EmptyDeckException() {
        super("Cannot draw from an empty deck");
    }
}
