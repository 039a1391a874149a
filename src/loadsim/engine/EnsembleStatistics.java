package loadsim.engine;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Статистика ансамбля по часам.
 * <ul>
 *     <li>std - генеральное (популяционное) СКО, деление на trials;</li>
 *     <li>перцентиль - линейная интерполяция между порядковыми статистиками (R-7, как numpy);</li>
 *     <li>коэффициент вариации = std / mean, при mean = 0 не определён.</li>
 * </ul>
 */
public final class EnsembleStatistics {

    private EnsembleStatistics() {}

    public static MonthlySummary summarize(MonthEnsemble ensemble, double percentile) {
        int hours = ensemble.getHours();

        double[] mean = new double[hours];
        double[] std = new double[hours];
        double[] cov = new double[hours];
        boolean[] covDefined = new boolean[hours];
        double[] pct = new double[hours];

        for (int h = 0; h < hours; h++) {
            double[] values = ensemble.getHour(h);

            mean[h] = mean(values);
            std[h] = populationStd(values);
            pct[h] = percentile(values, percentile);

            if (mean[h] != 0.0) {
                cov[h] = std[h] / mean[h];
                covDefined[h] = true;
            }
        }

        return new MonthlySummary(ensemble.getMonth(), mean, std, cov, covDefined, pct);
    }

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    public static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * @param p перцентиль в процентах; p <= 0 -> минимум, p >= 100 -> максимум
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            throw new IllegalArgumentException("empty sample");
        }
        if (Double.isNaN(p)) {
            throw new IllegalArgumentException("percentile is NaN");
        }
        if (p <= 0.0) return StatUtils.min(values);
        if (p >= 100.0) return StatUtils.max(values);

        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }
}
