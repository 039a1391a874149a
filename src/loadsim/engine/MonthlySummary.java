package loadsim.engine;

import java.util.OptionalDouble;

/**
 * Итог одного месяца по часам, кВт: mean, std, коэффициент вариации, перцентиль.
 */
public final class MonthlySummary {

    private final int month;
    private final double[] mean;
    private final double[] stdDev;
    private final double[] coefficientOfVariation;
    private final boolean[] coefficientOfVariationDefined;
    private final double[] percentile;

    public MonthlySummary(int month,
                          double[] mean,
                          double[] stdDev,
                          double[] coefficientOfVariation,
                          boolean[] coefficientOfVariationDefined,
                          double[] percentile) {
        this.month = month;
        this.mean = mean.clone();
        this.stdDev = stdDev.clone();
        this.coefficientOfVariation = coefficientOfVariation.clone();
        this.coefficientOfVariationDefined = coefficientOfVariationDefined.clone();
        this.percentile = percentile.clone();
    }

    public int getMonth() {
        return month;
    }

    public double getMean(int hour) {
        return mean[hour];
    }

    public double getStdDev(int hour) {
        return stdDev[hour];
    }

    public double getPercentile(int hour) {
        return percentile[hour];
    }

    public boolean isCoefficientOfVariationDefined(int hour) {
        return coefficientOfVariationDefined[hour];
    }

    /**
     * @return пусто, если mean = 0 в этот час
     */
    public OptionalDouble getCoefficientOfVariation(int hour) {
        return coefficientOfVariationDefined[hour]
                ? OptionalDouble.of(coefficientOfVariation[hour])
                : OptionalDouble.empty();
    }

    public int getHours() {
        return mean.length;
    }

    /** Количество часов с неопределённым коэффициентом вариации. */
    public int undefinedCoefficientCount() {
        int n = 0;
        for (boolean d : coefficientOfVariationDefined) {
            if (!d) n++;
        }
        return n;
    }
}
