package games.war.io;

/**
 * Thrown when a deck source cannot be turned into a deck.
 * <p>
 * Every failure is reported with exactly one {@link Reason}. Malformed input aborts the
 * whole load; there is no partially loaded deck.
 */
public class DeckLoadException extends Exception {

    /** Why a deck source was rejected. */
    public enum Reason {
        /** The source could not be opened or read. */
        UNREADABLE_SOURCE,
        /** A line failed structural or range validation. */
        MALFORMED_INPUT,
        /** The source was read completely but contained no cards. */
        EMPTY_SOURCE
    }

    private final Reason reason;
    /** 1-based line of the offending record, or 0 when the failure is not tied to a line. */
    private final int lineNumber;

    public DeckLoadException(Reason reason, String message) {
        this(reason, message, 0, null);
    }

    public DeckLoadException(Reason reason, String message, Throwable cause) {
        this(reason, message, 0, cause);
    }

    public DeckLoadException(Reason reason, String message, int lineNumber, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.lineNumber = lineNumber;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns the line that caused the failure.
     *
     * @return the 1-based line number, or 0 if no particular line is at fault
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
