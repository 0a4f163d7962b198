package games.war;

import static org.junit.jupiter.api.Assertions.*;

import games.war.config.WarProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Boots the application context with no command-line arguments, which is a usage error
 * rather than a startup failure.
 */
@SpringBootTest(properties = "war.war-cards=1")
class WarGameContextTest {

    @Autowired
    private WarProperties properties;

    @Autowired
    private WarGame game;

    @Test
    void bindsWarProperties() {
        assertEquals(WarProperties.DEFAULT_MAX_ROUNDS, properties.getMaxRounds());
        assertEquals(1, properties.getWarCards());
        assertFalse(properties.isAnsiColour());
    }

    @Test
    void runWithoutArgumentsReportsUsageExitCode() {
        assertEquals(1, game.getExitCode());
    }
}
