package loadsim.engine;

import loadsim.model.CatalogFixtures;
import loadsim.model.DeviceCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class MonteCarloRunnerTests {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MonteCarloRunner runner(DeviceCatalog catalog, ExecutorService ex) {
        return new MonteCarloRunner(ex, new SystemLoadAggregator(catalog, new DeviceSampler()));
    }

    @Test
    @DisplayName("ensemble is always 24 x trials")
    void testShape() throws Exception {
        MonteCarloRunner r = runner(CatalogFixtures.mixed(), executor);
        for (int trials : new int[]{1, 2, 7, 33}) {
            MonthEnsemble e = r.runMonth(4, trials, 1L);
            assertEquals(24, e.getHours());
            assertEquals(trials, e.getTrials());
            assertEquals(4, e.getMonth());
        }
    }

    @Test
    @DisplayName("p = 1 gives exactly owned x power / 1000 in every trial")
    void testDeterministicScenario() throws Exception {
        MonthEnsemble e = runner(CatalogFixtures.single(10, 100.0, 1.0), executor).runMonth(0, 50, 123L);
        for (int t = 0; t < 50; t++) {
            assertEquals(1.0, e.get(0, t));
        }
    }

    @Test
    @DisplayName("result does not depend on thread count")
    void testThreadIndependence() throws Exception {
        ExecutorService single = Executors.newFixedThreadPool(1);
        try {
            MonthEnsemble a = runner(CatalogFixtures.mixed(), single).runMonth(6, 40, 999L);
            MonthEnsemble b = runner(CatalogFixtures.mixed(), executor).runMonth(6, 40, 999L);
            for (int h = 0; h < 24; h++) {
                assertArrayEquals(a.getHour(h), b.getHour(h));
            }
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    @DisplayName("different seeds give different realizations")
    void testSeedMatters() throws Exception {
        MonteCarloRunner r = runner(CatalogFixtures.mixed(), executor);
        MonthEnsemble a = r.runMonth(1, 20, 1L);
        MonthEnsemble b = r.runMonth(1, 20, 2L);
        boolean differs = false;
        for (int h = 0; h < 24 && !differs; h++) {
            differs = !Arrays.equals(a.getHour(h), b.getHour(h));
        }
        assertTrue(differs);
    }

    @Test
    @DisplayName("empirical mean converges to the analytic expectation")
    void testConvergence() throws Exception {
        // 10 x 100 W x 0.3 + 5 x 60 W x 0.8 = 0.54 kW; tv unavailable
        MonthEnsemble e = runner(CatalogFixtures.mixed(), executor).runMonth(0, 2000, 2024L);
        for (int h = 0; h < 24; h++) {
            assertEquals(0.54, EnsembleStatistics.mean(e.getHour(h)), 0.03, "hour " + h);
        }
    }

    @Test
    @DisplayName("invalid month or trials are rejected")
    void testArguments() {
        MonteCarloRunner r = runner(CatalogFixtures.mixed(), executor);
        assertThrows(IllegalArgumentException.class, () -> r.runMonth(12, 5, 1L));
        assertThrows(IllegalArgumentException.class, () -> r.runMonth(-1, 5, 1L));
        assertThrows(IllegalArgumentException.class, () -> r.runMonth(0, 0, 1L));
    }

    @Test
    @DisplayName("daily totals sum the 24 hours of each trial")
    void testDailyTotals() throws Exception {
        MonthEnsemble e = runner(CatalogFixtures.mixed(), executor).runMonth(2, 10, 5L);
        double[] totals = e.dailyTotalsKwh();
        assertEquals(10, totals.length);
        for (int t = 0; t < 10; t++) {
            double s = 0.0;
            for (double v : e.getTrial(t)) s += v;
            assertEquals(s, totals[t], 1e-9);
        }
    }

    @Test
    @DisplayName("random streams of different months never coincide, whatever the trial index")
    void testStreamsDistinctAcrossMonths() {
        assertFalse(Arrays.equals(MonteCarloRunner.seedFor(42L, 0, 1_000_000), MonteCarloRunner.seedFor(42L, 1, 0)));
        assertFalse(Arrays.equals(MonteCarloRunner.seedFor(42L, 0, 1), MonteCarloRunner.seedFor(43L, 0, 0)));

        SystemLoadAggregator agg = new SystemLoadAggregator(CatalogFixtures.mixed(), new DeviceSampler());
        double[] a = agg.aggregate(0, MonteCarloRunner.randomFor(42L, 0, 1_000_000));
        double[] b = agg.aggregate(0, MonteCarloRunner.randomFor(42L, 1, 0));
        assertFalse(Arrays.equals(a, b));
    }
}
