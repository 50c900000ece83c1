package movepick;

import movepick.engine.search.SearchConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @AfterEach
    public void clearProperties() {
        System.clearProperty("search.start");
        System.clearProperty("search.depth");
        System.clearProperty("search.movetime");
    }

    @Test
    public void defaultsWithoutProperties() {
        SearchConfig cfg = Main.configFromProperties();

        assertEquals(2, cfg.startDepth);
        assertEquals(101, cfg.maxDepth);
        assertEquals(-1, cfg.moveTimeMs);
    }

    @Test
    public void malformedNumberIsAnArgumentError() {
        System.setProperty("search.depth", "deep");

        // Caught by main and reported as usage
        assertThrows(IllegalArgumentException.class, Main::configFromProperties);
    }

    @Test
    public void outOfRangeValueIsAnArgumentError() {
        System.setProperty("search.start", "5");
        System.setProperty("search.depth", "3");

        assertThrows(IllegalArgumentException.class, Main::configFromProperties);
    }
}
