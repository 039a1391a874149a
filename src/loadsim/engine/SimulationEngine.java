package loadsim.engine;

import loadsim.config.SimulationConfig;
import loadsim.config.SimulationConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * Годовой прогон: 12 независимых месячных ансамблей -> статистика по часам.
 * Ансамбль месяца живёт только до подсчёта статистики, сохраняется лишь суточное потребление.
 */
public class SimulationEngine {

    private final MonteCarloRunner runner;

    public SimulationEngine(MonteCarloRunner runner) {
        this.runner = runner;
    }

    public MonthEnsemble runMonth(SimulationConfig config, int month)
            throws InterruptedException, ExecutionException {
        return runner.runMonth(month, config.getTrials(), config.getSeed());
    }

    public MonthlySummary summarizeMonth(SimulationConfig config, int month)
            throws InterruptedException, ExecutionException {
        return EnsembleStatistics.summarize(runMonth(config, month), config.getPercentile());
    }

    public YearlySummary runYear(SimulationConfig config)
            throws InterruptedException, ExecutionException {

        int months = SimulationConstants.MONTHS_PER_YEAR;
        List<MonthlySummary> summaries = new ArrayList<>(months);
        double[][] dailyTotals = new double[months][];

        for (int m = 0; m < months; m++) {
            MonthEnsemble ensemble = runMonth(config, m);
            summaries.add(EnsembleStatistics.summarize(ensemble, config.getPercentile()));
            dailyTotals[m] = ensemble.dailyTotalsKwh();
        }

        return new YearlySummary(config.getPercentile(), config.getTrials(), summaries, dailyTotals);
    }
}
