package games.war.io;

import games.war.game.Card;
import games.war.game.Deck;
import games.war.game.FaceCard;
import games.war.game.JokerCard;
import games.war.game.Rank;
import games.war.game.StandardCard;
import games.war.io.DeckLoadException.Reason;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads a {@link Deck} from line-oriented text, one card per line.
 * <p>
 * Format:
 * <pre>
 *   &lt;Suit&gt;,&lt;Rank&gt;     e.g. Hearts,7
 *   Joker,&lt;Label&gt;     e.g. Joker,Red
 * </pre>
 * Each line is split on its first comma. Zero-length lines are skipped; every other line must
 * be a valid record. Fields are never trimmed, so a line of spaces, {@code " 5"} or {@code "5 "}
 * is rejected. The suit token {@code Joker} is matched case-sensitively; {@code joker,5} is a
 * five of the suit "joker". Ranks are unsigned base-10 integers from 1 to 13.
 * <p>
 * The first invalid line rejects the whole source. Cards are appended to the bottom of the
 * deck in source order.
 */
@Component
public class DeckReader {
    private static final Logger log = LoggerFactory.getLogger(DeckReader.class);

    private static final String MALFORMED = "Malformed CSV input";

    /**
     * Reads a deck from a file. The file is opened, fully consumed and closed within this call.
     *
     * @param path the deck file
     * @return the loaded deck, never empty
     * @throws DeckLoadException with {@link Reason#UNREADABLE_SOURCE} if the file cannot be
     *         opened or read, {@link Reason#MALFORMED_INPUT} on the first invalid line, or
     *         {@link Reason#EMPTY_SOURCE} if the file holds no cards
     */
    public Deck read(Path path) throws DeckLoadException {
        Objects.requireNonNull(path, "path");
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DeckLoadException(Reason.UNREADABLE_SOURCE, "Failed to open input deck: " + path, e);
        }
        try (reader) {
            Deck deck = read(reader);
            if (log.isDebugEnabled()) {
                log.debug("Loaded {} cards from {}", deck.size(), path);
            }
            return deck;
        } catch (IOException e) {
            // Raised only by close(); read(BufferedReader) maps its own I/O failures.
            throw new DeckLoadException(Reason.UNREADABLE_SOURCE, "Failed to read input deck: " + path, e);
        }
    }

    /**
     * Reads a deck from an open reader, consuming it to the end. The caller closes the reader.
     *
     * @param reader source of deck lines
     * @return the loaded deck, never empty
     * @throws DeckLoadException if the source is unreadable, malformed or empty
     */
    public Deck read(BufferedReader reader) throws DeckLoadException {
        Objects.requireNonNull(reader, "reader");
        Deck deck = new Deck();
        int lineNumber = 0;
        while (true) {
            String line;
            try {
                line = reader.readLine();
            } catch (CharacterCodingException e) {
                throw new DeckLoadException(Reason.MALFORMED_INPUT, MALFORMED + " at line " + (lineNumber + 1), lineNumber + 1, e);
            } catch (IOException e) {
                throw new DeckLoadException(Reason.UNREADABLE_SOURCE, "Failed to read input deck: " + e.getMessage(), e);
            }
            if (line == null) {
                break;
            }
            lineNumber++;
            addLine(deck, line, lineNumber);
        }
        return requireCards(deck);
    }

    /**
     * Parses deck lines that are already in memory.
     *
     * @param lines the source lines, without line terminators
     * @return the loaded deck, never empty
     * @throws DeckLoadException if a line is malformed or no line holds a card
     * @throws NullPointerException if any line is null
     */
    public Deck parse(Iterable<String> lines) throws DeckLoadException {
        Objects.requireNonNull(lines, "lines");
        Deck deck = new Deck();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            addLine(deck, line, lineNumber);
        }
        return requireCards(deck);
    }

    /**
     * Parses a single record into a card.
     *
     * @param line the record, e.g. {@code Hearts,7}
     * @return the card it describes
     * @throws IllegalArgumentException if the record is malformed
     */
    public static Card parseCard(String line) {
        int comma = line.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("missing comma");
        }
        String suit = line.substring(0, comma);
        String value = line.substring(comma + 1);
        if (suit.isEmpty() || value.isEmpty()) {
            throw new IllegalArgumentException("empty field");
        }
        if (JokerCard.JOKER.equals(suit)) {
            return new JokerCard(value);
        }
        int rank = parseRank(value);
        if (!Rank.isValid(rank)) {
            throw new IllegalArgumentException("rank out of range: " + rank);
        }
        if (rank >= Rank.MIN_FACE_VALUE) {
            return new FaceCard(suit, rank);
        }
        return new StandardCard(suit, rank);
    }

    private static int parseRank(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("rank is not a number: " + value);
            }
        }
        // Overflow surfaces as NumberFormatException.
        return Integer.parseInt(value);
    }

    private static void addLine(Deck deck, String line, int lineNumber) throws DeckLoadException {
        Objects.requireNonNull(line, () -> "line " + lineNumber);
        if (line.isEmpty()) {
            return;
        }
        Card card;
        try {
            card = parseCard(line);
        } catch (RuntimeException e) {
            throw new DeckLoadException(Reason.MALFORMED_INPUT, MALFORMED + " at line " + lineNumber, lineNumber, e);
        }
        deck.addToBottom(card);
    }

    private static Deck requireCards(Deck deck) throws DeckLoadException {
        if (deck.isEmpty()) {
            throw new DeckLoadException(Reason.EMPTY_SOURCE, "Empty or invalid CSV deck");
        }
        return deck;
    }
}
