package games.war.game;

import java.util.Optional;

/**
 * The four suits of a standard deck, used only for console display.
 * <p>
 * Suit names in a deck source are free-form text and are never validated against this
 * enum; a card whose suit matches one of these names (case-insensitively) can be given
 * ANSI colouring in the terminal when the suit is red. Unknown suits render as-is.
 */
public enum Suit {
    /** Clubs – a black suit. */
    CLUBS("Clubs", false),
    /** Diamonds – a red suit. */
    DIAMONDS("Diamonds", true),
    /** Hearts – a red suit. */
    HEARTS("Hearts", true),
    /** Spades – a black suit. */
    SPADES("Spades", false);

    /** ANSI escape code for red text output in terminals. */
    private static final String ANSI_RED = "\u001B[31m";
    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    private final String displayName;
    private final boolean red;

    Suit(String displayName, boolean red) {
        this.displayName = displayName;
        this.red = red;
    }

    public boolean isRed() {
        return red;
    }

    /**
     * Finds the suit whose display name matches the given text, ignoring case.
     *
     * @param name suit text as it appeared in the deck source (may be null)
     * @return the matching suit, or empty if the text names no standard suit
     */
    public static Optional<Suit> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Suit suit : values()) {
            if (suit.displayName.equalsIgnoreCase(name)) {
                return Optional.of(suit);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the console form of a card: its rendering, wrapped in ANSI red codes when
     * the card belongs to a red suit. Jokers and unknown suits are returned unchanged.
     *
     * @param card the card to display
     * @return the possibly coloured rendering
     */
    public static String colourise(Card card) {
        String value = card.render();
        Optional<Suit> suit = suitOf(card);
        if (suit.isPresent() && suit.get().isRed()) {
            return ANSI_RED + value + ANSI_RESET;
        }
        return value;
    }

    private static Optional<Suit> suitOf(Card card) {
        if (card instanceof StandardCard) {
            return fromName(((StandardCard) card).getSuit());
        }
        if (card instanceof FaceCard) {
            return fromName(((FaceCard) card).getSuit());
        }
        return Optional.empty();
    }
}
