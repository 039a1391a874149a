package loadsim.engine;

import loadsim.config.SimulationConstants;

/**
 * Ансамбль испытаний одного месяца: матрица 24 x trials, кВт.
 */
public final class MonthEnsemble {

    private final int month;

    /** [hour][trial] */
    private final double[][] loadKw;

    public MonthEnsemble(int month, int trials) {
        if (trials <= 0) {
            throw new IllegalArgumentException("trials must be > 0");
        }
        this.month = month;
        this.loadKw = new double[SimulationConstants.HOURS_PER_DAY][trials];
    }

    /**
     * Кладёт вектор испытания в столбец trial.
     */
    void setTrial(int trial, double[] hourlyKw) {
        if (hourlyKw.length != SimulationConstants.HOURS_PER_DAY) {
            throw new IllegalArgumentException("trial vector must have "
                    + SimulationConstants.HOURS_PER_DAY + " values, got " + hourlyKw.length);
        }
        for (int h = 0; h < hourlyKw.length; h++) {
            loadKw[h][trial] = hourlyKw[h];
        }
    }

    public int getMonth() {
        return month;
    }

    public int getTrials() {
        return loadKw[0].length;
    }

    public int getHours() {
        return loadKw.length;
    }

    public double get(int hour, int trial) {
        return loadKw[hour][trial];
    }

    /** Значения всех испытаний для часа (копия). */
    public double[] getHour(int hour) {
        return loadKw[hour].clone();
    }

    /** Вектор нагрузки одного испытания (копия). */
    public double[] getTrial(int trial) {
        double[] v = new double[loadKw.length];
        for (int h = 0; h < v.length; h++) {
            v[h] = loadKw[h][trial];
        }
        return v;
    }

    /**
     * Суточное потребление каждого испытания, кВт·ч (сумма 24 часовых значений).
     */
    public double[] dailyTotalsKwh() {
        int trials = getTrials();
        double[] totals = new double[trials];
        for (double[] hourRow : loadKw) {
            for (int t = 0; t < trials; t++) {
                totals[t] += hourRow[t];
            }
        }
        return totals;
    }
}
