package loadsim.model;

import loadsim.config.SimulationConstants;

import java.util.Arrays;

/**
 * Профиль использования устройства: вероятность того, что одно устройство
 * включено в данный час данного месяца. Матрица 24 x 12 (час x месяц).
 */
public final class UtilizationProfile {

    private final double[][] probabilities;

    public UtilizationProfile(double[][] probabilities) {
        this.probabilities = validatedCopy(probabilities);
    }

    public double getProbability(int hour, int month) {
        return probabilities[hour][month];
    }

    /** Столбец месяца, 24 значения. */
    public double[] getMonth(int month) {
        double[] col = new double[SimulationConstants.HOURS_PER_DAY];
        for (int h = 0; h < col.length; h++) {
            col[h] = probabilities[h][month];
        }
        return col;
    }

    /**
     * Профиль с одинаковой вероятностью во все часы и месяцы.
     */
    public static UtilizationProfile constant(double p) {
        double[][] m = new double[SimulationConstants.HOURS_PER_DAY][SimulationConstants.MONTHS_PER_YEAR];
        for (double[] row : m) {
            Arrays.fill(row, p);
        }
        return new UtilizationProfile(m);
    }

    private static double[][] validatedCopy(double[][] src) {
        if (src == null || src.length != SimulationConstants.HOURS_PER_DAY) {
            throw new InputDataException("Utilization profile must have "
                    + SimulationConstants.HOURS_PER_DAY + " hour rows, got "
                    + (src == null ? 0 : src.length));
        }
        double[][] copy = new double[SimulationConstants.HOURS_PER_DAY][];
        for (int h = 0; h < src.length; h++) {
            if (src[h] == null || src[h].length != SimulationConstants.MONTHS_PER_YEAR) {
                throw new InputDataException("Utilization profile hour " + h + " must have "
                        + SimulationConstants.MONTHS_PER_YEAR + " month values");
            }
            for (int m = 0; m < src[h].length; m++) {
                double p = src[h][m];
                // NaN тоже отсекается
                if (!(p >= 0.0 && p <= 1.0)) {
                    throw new InputDataException("Utilization probability out of [0, 1] at hour "
                            + h + ", month " + m + ": " + p);
                }
            }
            copy[h] = src[h].clone();
        }
        return copy;
    }
}
