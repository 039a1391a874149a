package loadsim.io;

import loadsim.config.SimulationConstants;
import loadsim.engine.Statistic;
import loadsim.engine.StatisticTable;
import loadsim.engine.YearlySummary;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Сохранение годовых таблиц (час x месяц) в CSV, по файлу на статистику,
 * и суточного потребления по испытаниям.
 */
public final class ResultsCsvWriter {

    public static final String FILE_SUFFIX = "_system_load_values.csv";
    public static final String DAILY_ENERGY_FILE = "daily_energy_demand.csv";
    public static final String UNDEFINED = "undefined";

    private ResultsCsvWriter() {}

    /**
     * @return пути записанных файлов, в порядке Statistic
     */
    public static List<Path> writeTables(Path outputDir, YearlySummary summary) throws IOException {
        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        for (Statistic s : Statistic.values()) {
            Path path = outputDir.resolve(fileName(s, summary.getPercentile()));
            writeTable(path, summary.getTable(s));
            written.add(path);
        }
        return written;
    }

    public static void writeTable(Path path, StatisticTable table) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            StringBuilder h = new StringBuilder();
            for (int m = 0; m < table.getMonths(); m++) {
                h.append(',').append(SimulationConstants.monthName(m));
            }
            w.write(h.toString());
            w.newLine();

            for (int hour = 0; hour < table.getHours(); hour++) {
                StringBuilder sb = new StringBuilder(128);
                sb.append(hour);
                for (int m = 0; m < table.getMonths(); m++) {
                    sb.append(',');
                    sb.append(table.isDefined(hour, m) ? fmt(table.get(hour, m)) : UNDEFINED);
                }
                w.write(sb.toString());
                w.newLine();
            }
        }
    }

    /**
     * Суточное потребление: Month, Trial, Daily sum (kWh). Данные для boxplot по месяцам.
     */
    public static Path writeDailyEnergy(Path outputDir, YearlySummary summary) throws IOException {
        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(DAILY_ENERGY_FILE);

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            w.write("Month,Trial,Daily sum (kWh)");
            w.newLine();

            for (int m = 0; m < SimulationConstants.MONTHS_PER_YEAR; m++) {
                double[] totals = summary.getDailyTotalsKwh(m);
                for (int t = 0; t < totals.length; t++) {
                    w.write(SimulationConstants.monthName(m) + "," + t + "," + fmt(totals[t]));
                    w.newLine();
                }
            }
        }
        return path;
    }

    public static String fileName(Statistic s, double percentile) {
        String prefix = (s == Statistic.PERCENTILE)
                ? percentileLabel(percentile) + "_" + s.getFileKey()
                : s.getFileKey();
        return prefix + FILE_SUFFIX;
    }

    /** 90.0 -> "90", 97.5 -> "97.5" */
    static String percentileLabel(double percentile) {
        if (percentile == Math.rint(percentile)) {
            return Long.toString((long) percentile);
        }
        return Double.toString(percentile);
    }

    static String fmt(double v) {
        return String.format(Locale.US, "%." + SimulationConstants.OUTPUT_DECIMALS + "f", v);
    }
}
