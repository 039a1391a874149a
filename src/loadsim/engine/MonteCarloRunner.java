// File: loadsim/engine/MonteCarloRunner.java
package loadsim.engine;

import loadsim.config.SimulationConstants;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Monte Carlo по испытаниям одного месяца.
 * <p>
 * ВАЖНО:
 * - каждое испытание получает СВОЙ генератор, зерно зависит только от (месяц, испытание);
 * - испытания режутся на чанки и считаются в пуле, результат кладётся по индексу испытания,
 *   поэтому число потоков и порядок завершения на результат не влияют.
 */
public final class MonteCarloRunner {

    private final ExecutorService executor;
    private final SystemLoadAggregator aggregator;

    public MonteCarloRunner(ExecutorService executor, SystemLoadAggregator aggregator) {
        this.executor = executor;
        this.aggregator = aggregator;
    }

    public MonthEnsemble runMonth(int month, int trials, long baseSeed)
            throws InterruptedException, ExecutionException {

        if (month < 0 || month >= SimulationConstants.MONTHS_PER_YEAR) {
            throw new IllegalArgumentException("month must be in [0, 11], got " + month);
        }
        if (trials <= 0) {
            throw new IllegalArgumentException("trials must be > 0");
        }

        MonthEnsemble ensemble = new MonthEnsemble(month, trials);

        if (trials == 1) {
            ensemble.setTrial(0, runTrial(month, 0, baseSeed));
            return ensemble;
        }

        int parallelism = estimateParallelism(executor);
        int chunks = Math.min(trials, Math.max(1, parallelism * 2));
        int chunkSize = (int) Math.ceil(trials / (double) chunks);

        List<Future<ChunkResult>> futures = new ArrayList<>(chunks);

        for (int c = 0; c < chunks; c++) {
            int from = c * chunkSize;
            int to = Math.min(trials, from + chunkSize);
            if (from >= to) break;

            futures.add(executor.submit(() -> runChunk(month, baseSeed, from, to)));
        }

        for (Future<ChunkResult> f : futures) {
            ChunkResult r = f.get();
            for (int k = 0; k < r.trialLoads.length; k++) {
                ensemble.setTrial(r.offset + k, r.trialLoads[k]);
            }
        }
        return ensemble;
    }

    private ChunkResult runChunk(int month, long baseSeed, int fromInclusive, int toExclusive) {
        double[][] loads = new double[toExclusive - fromInclusive][];
        for (int t = fromInclusive; t < toExclusive; t++) {
            loads[t - fromInclusive] = runTrial(month, t, baseSeed);
        }
        return new ChunkResult(fromInclusive, loads);
    }

    private double[] runTrial(int month, int trial, long baseSeed) {
        return aggregator.aggregate(month, randomFor(baseSeed, month, trial));
    }

    /**
     * Генератор испытания (месяц, испытание). Тот же, что использует детальный вывод.
     */
    static RandomGenerator randomFor(long baseSeed, int month, int trial) {
        return new MersenneTwister(seedFor(baseSeed, month, trial));
    }

    /**
     * Зерно - массив (seed hi, seed lo, месяц, испытание): разные тройки не пересекаются
     * ни при каком числе испытаний.
     */
    static int[] seedFor(long baseSeed, int month, int trial) {
        return new int[]{(int) (baseSeed >>> 32), (int) baseSeed, month, trial};
    }

    private static final class ChunkResult {
        final int offset;
        final double[][] trialLoads;

        ChunkResult(int offset, double[][] trialLoads) {
            this.offset = offset;
            this.trialLoads = trialLoads;
        }
    }

    private static int estimateParallelism(ExecutorService executor) {
        if (executor instanceof ForkJoinPool fjp) return Math.max(1, fjp.getParallelism());
        if (executor instanceof ThreadPoolExecutor tpe) return Math.max(1, tpe.getMaximumPoolSize());
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
