package games.war.game;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered pile of cards with a top (drawn first) and a bottom (where cards are added).
 * <p>
 * The deck owns the cards it holds. {@link #drawFromTop()} hands a card over to the caller,
 * who is expected to pass it on to exactly one other deck (or back to this one) with
 * {@link #addToBottom(Card)}. A card is never held by two decks at once. Both operations
 * run in constant time.
 * <p>
 * An empty deck is a legal state. Decks are not thread-safe.
 */
public class Deck {
    /** Separator between card renderings in {@link #render()}. */
    public static final String RENDER_SEPARATOR = " ";

    /** First element is the top of the deck. */
    private final Deque<Card> cards = new ArrayDeque<>();

    /**
     * Appends a card at the bottom of the deck.
     *
     * @param card the card to add (must not be null)
     * @throws NullPointerException if card is null
     */
    public void addToBottom(Card card) {
        cards.addLast(Objects.requireNonNull(card, "card"));
    }

    /**
     * Removes and returns the top card.
     * <p>
     * If the deck is empty it is left untouched and an exception is thrown.
     *
     * @return the former top card
     * @throws EmptyDeckException if the deck has no cards
     */
    public Card drawFromTop() {
        if (cards.isEmpty()) {
            throw new EmptyDeckException();
        }
        return cards.removeFirst();
    }

    /**
     * Returns the number of cards in the deck.
     *
     * @return the card count
     */
    public int size() {
        return cards.size();
    }

    /**
     * Checks whether the deck is empty.
     *
     * @return {@code true} if no cards remain
     */
    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns a snapshot of the cards from top to bottom.
     * <p>
     * The returned list is immutable and does not follow later changes to the deck.
     *
     * @return the cards in deck order
     */
    public List<Card> asList() {
        return List.copyOf(cards);
    }

    /**
     * Renders the full contents of the deck, top to bottom, separated by single spaces.
     * <p>
     * Does not modify the deck; the same contents in the same order always render the same way.
     *
     * @return the rendered contents, or an empty string for an empty deck
     */
    public String render() {
        return cards.stream().map(Card::render).collect(Collectors.joining(RENDER_SEPARATOR));
    }

    /**
     * Returns a short description of the deck.
     *
     * @return a string showing the deck size (e.g., "Deck(size=26)")
     */
    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
