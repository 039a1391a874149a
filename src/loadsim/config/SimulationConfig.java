package loadsim.config;

/**
 * Конфигурация запуска Monte Carlo-симуляции нагрузки.
 * Неизменяемая, проверяется в конструкторе.
 */
public final class SimulationConfig {

    /** Количество испытаний Monte Carlo на каждый месяц. */
    private final int trials;

    /** Перцентиль, (0;100). */
    private final double percentile;

    /** Количество потоков для параллельного запуска. */
    private final int threads;

    /** Базовое зерно генераторов. */
    private final long seed;

    public SimulationConfig(int trials, double percentile, int threads, long seed) {
        if (trials <= 0) {
            throw new ConfigurationException("trials must be > 0, got " + trials);
        }
        if (Double.isNaN(percentile) || percentile <= 0.0 || percentile >= 100.0) {
            throw new ConfigurationException("percentile must be in (0, 100), got " + percentile);
        }
        if (threads <= 0) {
            throw new ConfigurationException("threads must be > 0, got " + threads);
        }
        this.trials = trials;
        this.percentile = percentile;
        this.threads = threads;
        this.seed = seed;
    }

    public SimulationConfig(int trials, double percentile, long seed) {
        this(trials, percentile, Runtime.getRuntime().availableProcessors(), seed);
    }

    public int getTrials() {
        return trials;
    }

    public double getPercentile() {
        return percentile;
    }

    public int getThreads() {
        return threads;
    }

    public long getSeed() {
        return seed;
    }

    /**
     * Та же конфигурация с другим зерном (например, для независимого детального прогона).
     */
    public SimulationConfig withSeed(long newSeed) {
        return new SimulationConfig(trials, percentile, threads, newSeed);
    }

    @Override
    public String toString() {
        return "MC=" + trials + "; P=" + percentile + "; threads=" + threads + "; seed=" + seed;
    }
}
