package loadsim.engine;

import loadsim.config.SimulationConstants;

/**
 * Таблица 24 часа x 12 месяцев одной статистики, кВт.
 * Ячейка может быть не определена (коэффициент вариации при нулевом среднем).
 */
public final class StatisticTable {

    private final Statistic statistic;
    private final double[][] values;
    private final boolean[][] defined;

    StatisticTable(Statistic statistic) {
        this.statistic = statistic;
        this.values = new double[SimulationConstants.HOURS_PER_DAY][SimulationConstants.MONTHS_PER_YEAR];
        this.defined = new boolean[SimulationConstants.HOURS_PER_DAY][SimulationConstants.MONTHS_PER_YEAR];
    }

    void set(int hour, int month, double value) {
        values[hour][month] = value;
        defined[hour][month] = true;
    }

    public Statistic getStatistic() {
        return statistic;
    }

    public int getHours() {
        return values.length;
    }

    public int getMonths() {
        return values[0].length;
    }

    public boolean isDefined(int hour, int month) {
        return defined[hour][month];
    }

    /**
     * @throws IllegalStateException если ячейка не определена
     */
    public double get(int hour, int month) {
        if (!defined[hour][month]) {
            throw new IllegalStateException(statistic + " undefined at hour " + hour
                    + ", month " + SimulationConstants.monthName(month));
        }
        return values[hour][month];
    }

    public int undefinedCount() {
        int n = 0;
        for (boolean[] row : defined) {
            for (boolean d : row) {
                if (!d) n++;
            }
        }
        return n;
    }
}
