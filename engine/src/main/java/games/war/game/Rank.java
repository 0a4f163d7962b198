package games.war.game;

/**
 * Enumeration of the 13 ranks a suited card may carry.
 * <p>
 * Each rank has the numeric value used for comparisons (1–13) and a display name.
 * Ace is low. Only the face ranks (Jack, Queen, King) are rendered by name; the
 * others are rendered by their number.
 */
public enum Rank {
    /** Ace – the lowest rank (value 1). */
    ACE(1, "Ace"),
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    /** Jack – the lowest face rank (value 11). */
    JACK(11, "Jack"),
    /** Queen – face rank value 12. */
    QUEEN(12, "Queen"),
    /** King – the highest rank (value 13). */
    KING(13, "King");

    /** Lowest legal rank value. */
    public static final int MIN_VALUE = 1;
    /** Highest legal rank value. */
    public static final int MAX_VALUE = 13;
    /** Ranks at or above this value are face cards. */
    public static final int MIN_FACE_VALUE = 11;

    private final int value;
    private final String name;

    Rank(int value, String name) {
        this.value = value;
        this.name = name;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the rank value (1 for Ace, 13 for King)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the display name of this rank (e.g., "Queen", "7").
     *
     * @return the display name
     */
    public String getName() {
        return name;
    }

    /**
     * Checks whether this is a face rank (Jack, Queen or King).
     *
     * @return {@code true} for face ranks
     */
    public boolean isFace() {
        return value >= MIN_FACE_VALUE;
    }

    /**
     * Checks whether the given value lies in the legal rank range.
     *
     * @param value the candidate value
     * @return {@code true} if {@code 1 <= value <= 13}
     */
    public static boolean isValid(int value) {
        return value >= MIN_VALUE && value <= MAX_VALUE;
    }

    /**
     * Looks up the rank with the given numeric value.
     *
     * @param value the rank value (1–13)
     * @return the matching rank
     * @throws IllegalArgumentException if the value is out of range
     */
    public static Rank fromValue(int value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Rank out of range: " + value);
        }
        return values()[value - 1];
    }

    @Override
    public String toString() {
        return name;
    }
}
