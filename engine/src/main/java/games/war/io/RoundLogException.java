package games.war.io;

/**
 * Thrown when the round log cannot be opened or written.
 */
public class RoundLogException extends RuntimeException {
    public RoundLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
