package loadsim.engine;

import loadsim.config.SimulationConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Результат за год: 12 месячных итогов по порядку месяцев,
 * сведённые в таблицы час x месяц, плюс суточное потребление каждого испытания.
 */
public final class YearlySummary {

    private final double percentile;
    private final int trials;
    private final List<MonthlySummary> months;
    private final double[][] dailyTotalsKwh;
    private final Map<Statistic, StatisticTable> tables = new EnumMap<>(Statistic.class);

    public YearlySummary(double percentile,
                         int trials,
                         List<MonthlySummary> months,
                         double[][] dailyTotalsKwh) {
        if (months.size() != SimulationConstants.MONTHS_PER_YEAR
                || dailyTotalsKwh.length != SimulationConstants.MONTHS_PER_YEAR) {
            throw new IllegalArgumentException("expected " + SimulationConstants.MONTHS_PER_YEAR + " months");
        }
        this.percentile = percentile;
        this.trials = trials;
        this.months = Collections.unmodifiableList(new ArrayList<>(months));
        this.dailyTotalsKwh = new double[dailyTotalsKwh.length][];
        for (int m = 0; m < dailyTotalsKwh.length; m++) {
            this.dailyTotalsKwh[m] = dailyTotalsKwh[m].clone();
        }
        buildTables();
    }

    private void buildTables() {
        for (Statistic s : Statistic.values()) {
            tables.put(s, new StatisticTable(s));
        }
        for (int m = 0; m < months.size(); m++) {
            MonthlySummary ms = months.get(m);
            if (ms.getMonth() != m) {
                throw new IllegalArgumentException("month summaries out of order at " + m);
            }
            for (int h = 0; h < ms.getHours(); h++) {
                tables.get(Statistic.MEAN).set(h, m, ms.getMean(h));
                tables.get(Statistic.STANDARD_DEVIATION).set(h, m, ms.getStdDev(h));
                tables.get(Statistic.PERCENTILE).set(h, m, ms.getPercentile(h));

                OptionalDouble cov = ms.getCoefficientOfVariation(h);
                if (cov.isPresent()) {
                    tables.get(Statistic.PERCENTAGE_VARIABILITY).set(h, m, cov.getAsDouble());
                }
            }
        }
    }

    public StatisticTable getTable(Statistic statistic) {
        return tables.get(statistic);
    }

    public MonthlySummary getMonth(int month) {
        return months.get(month);
    }

    public List<MonthlySummary> getMonths() {
        return months;
    }

    public double getPercentile() {
        return percentile;
    }

    public int getTrials() {
        return trials;
    }

    /** Суточное потребление испытаний месяца, кВт·ч (копия). */
    public double[] getDailyTotalsKwh(int month) {
        return dailyTotalsKwh[month].clone();
    }

    /** Ячейки с неопределённым коэффициентом вариации. */
    public int undefinedCoefficientCount() {
        return tables.get(Statistic.PERCENTAGE_VARIABILITY).undefinedCount();
    }
}
