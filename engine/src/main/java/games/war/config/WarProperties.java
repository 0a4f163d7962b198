package games.war.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the War rules and console output.
 *
 * Usage:
 * {@code java -jar war_game.jar deck.csv rounds.csv --war.max-rounds=500 --war.war-cards=1}
 */
@Component
@ConfigurationProperties(prefix = "war")
public class WarProperties {
  /** Default round cap; keeps games that cycle forever finite. */
  public static final int DEFAULT_MAX_ROUNDS = 1000;
  /** Default number of face-down cards each player adds to the pot during a war. */
  public static final int DEFAULT_WAR_CARDS = 3;

  private int maxRounds = DEFAULT_MAX_ROUNDS;
  private int warCards = DEFAULT_WAR_CARDS;
  private boolean ansiColour = false;

  /**
   * Returns the maximum number of rounds before the game is stopped.
   * @return a positive round cap
   */
  public int getMaxRounds() {
    return maxRounds;
  }

  /**
   * Sets the round cap.
   * @param maxRounds a positive number of rounds
   * @throws IllegalArgumentException if maxRounds is not positive
   */
  public void setMaxRounds(int maxRounds) {
    if (maxRounds <= 0) {
      throw new IllegalArgumentException("war.max-rounds must be positive: " + maxRounds);
    }
    this.maxRounds = maxRounds;
  }

  /**
   * Returns how many face-down cards each player puts into the pot on a tie.
   * @return zero or more cards
   */
  public int getWarCards() {
    return warCards;
  }

  /**
   * Sets the face-down card count used during a war.
   * @param warCards zero or more cards
   * @throws IllegalArgumentException if warCards is negative
   */
  public void setWarCards(int warCards) {
    if (warCards < 0) {
      throw new IllegalArgumentException("war.war-cards must not be negative: " + warCards);
    }
    this.warCards = warCards;
  }

  /**
   * Returns whether red-suited cards are coloured in console output.
   * @return true to emit ANSI colour codes
   */
  public boolean isAnsiColour() {
    return ansiColour;
  }

  public void setAnsiColour(boolean ansiColour) {
    this.ansiColour = ansiColour;
  }
}
