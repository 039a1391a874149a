package loadsim.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SimulationConfigTests {

    @Test
    @DisplayName("valid config keeps its values")
    void testValid() {
        SimulationConfig cfg = new SimulationConfig(100, 90.0, 4, 42L);
        assertEquals(100, cfg.getTrials());
        assertEquals(90.0, cfg.getPercentile());
        assertEquals(4, cfg.getThreads());
        assertEquals(42L, cfg.getSeed());
    }

    @Test
    @DisplayName("non-positive trials are rejected")
    void testTrials() {
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(0, 90.0, 1, 1L));
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(-5, 90.0, 1, 1L));
    }

    @Test
    @DisplayName("percentile must be strictly inside (0, 100)")
    void testPercentile() {
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, 0.0, 1, 1L));
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, 100.0, 1, 1L));
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, -1.0, 1, 1L));
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, 150.0, 1, 1L));
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, Double.NaN, 1, 1L));
        assertDoesNotThrow(() -> new SimulationConfig(10, 0.5, 1, 1L));
        assertDoesNotThrow(() -> new SimulationConfig(10, 99.9, 1, 1L));
    }

    @Test
    @DisplayName("non-positive thread count is rejected")
    void testThreads() {
        assertThrows(ConfigurationException.class, () -> new SimulationConfig(10, 50.0, 0, 1L));
    }

    @Test
    @DisplayName("withSeed changes only the seed")
    void testWithSeed() {
        SimulationConfig cfg = new SimulationConfig(7, 95.0, 2, 1L).withSeed(99L);
        assertEquals(7, cfg.getTrials());
        assertEquals(95.0, cfg.getPercentile());
        assertEquals(2, cfg.getThreads());
        assertEquals(99L, cfg.getSeed());
    }
}
