package loadsim.io;

import loadsim.config.SimulationConfig;
import loadsim.config.SimulationConstants;
import loadsim.engine.Statistic;
import loadsim.engine.StatisticTable;
import loadsim.engine.YearlySummary;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Годовые таблицы в один xlsx: лист на статистику + лист суточного потребления.
 */
public final class ResultsExcelWriter {

    public static final String FILE_NAME = "system_load_values.xlsx";
    public static final String DAILY_SHEET = "Daily energy";

    private ResultsExcelWriter() {}

    public static Path writeXlsx(Path outputDir, SimulationConfig cfg, YearlySummary summary) throws IOException {
        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(FILE_NAME);

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            // numbers: keep numeric cells for charts
            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.000"));

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setAlignment(HorizontalAlignment.CENTER);
            intStyle.setDataFormat(df.getFormat("0"));

            for (Statistic s : Statistic.values()) {
                Sheet sh = wb.createSheet(sheetName(s, summary.getPercentile()));
                writeTableSheet(sh, buildPassport(cfg), summary.getTable(s), headerStyle, numberStyle, intStyle);
            }

            writeDailySheet(wb.createSheet(DAILY_SHEET), buildPassport(cfg), summary, headerStyle, numberStyle, intStyle);

            try (OutputStream out = Files.newOutputStream(path)) {
                wb.write(out);
            }
        }
        return path;
    }

    private static void writeTableSheet(Sheet sh,
                                        String passport,
                                        StatisticTable table,
                                        CellStyle headerStyle,
                                        CellStyle numberStyle,
                                        CellStyle intStyle) {
        int r = 0;
        sh.createRow(r++).createCell(0).setCellValue(passport);

        Row hdr = sh.createRow(r++);
        int c = writeHeader(hdr, 0, "Hour", headerStyle);
        for (int m = 0; m < table.getMonths(); m++) {
            c = writeHeader(hdr, c, SimulationConstants.monthName(m), headerStyle);
        }

        for (int hour = 0; hour < table.getHours(); hour++) {
            Row row = sh.createRow(r++);
            writeInt(row, 0, hour, intStyle);
            for (int m = 0; m < table.getMonths(); m++) {
                if (table.isDefined(hour, m)) {
                    writeNumber(row, 1 + m, round(table.get(hour, m)), numberStyle);
                } else {
                    Cell cell = row.createCell(1 + m, CellType.STRING);
                    cell.setCellValue(ResultsCsvWriter.UNDEFINED);
                    cell.setCellStyle(headerStyle);
                }
            }
        }

        // passport does NOT define width
        sh.setColumnWidth(0, 8 * 256);
        for (int m = 0; m < table.getMonths(); m++) sh.setColumnWidth(1 + m, 11 * 256);
    }

    private static void writeDailySheet(Sheet sh,
                                        String passport,
                                        YearlySummary summary,
                                        CellStyle headerStyle,
                                        CellStyle numberStyle,
                                        CellStyle intStyle) {
        int r = 0;
        sh.createRow(r++).createCell(0).setCellValue(passport);

        // испытания вниз, месяцы вправо: удобно для boxplot
        Row hdr = sh.createRow(r++);
        int c = writeHeader(hdr, 0, "Trial", headerStyle);
        for (int m = 0; m < SimulationConstants.MONTHS_PER_YEAR; m++) {
            c = writeHeader(hdr, c, SimulationConstants.monthName(m), headerStyle);
        }

        double[][] totals = new double[SimulationConstants.MONTHS_PER_YEAR][];
        for (int m = 0; m < totals.length; m++) totals[m] = summary.getDailyTotalsKwh(m);

        for (int t = 0; t < summary.getTrials(); t++) {
            Row row = sh.createRow(r++);
            writeInt(row, 0, t, intStyle);
            for (int m = 0; m < totals.length; m++) {
                writeNumber(row, 1 + m, round(totals[m][t]), numberStyle);
            }
        }

        sh.setColumnWidth(0, 8 * 256);
        for (int m = 0; m < SimulationConstants.MONTHS_PER_YEAR; m++) sh.setColumnWidth(1 + m, 11 * 256);
    }

    static String sheetName(Statistic s, double percentile) {
        switch (s) {
            case MEAN:
                return "Mean";
            case STANDARD_DEVIATION:
                return "Standard deviation";
            case PERCENTAGE_VARIABILITY:
                return "Variability";
            case PERCENTILE:
                return ResultsCsvWriter.percentileLabel(percentile) + " percentile";
            default:
                throw new IllegalArgumentException("Unknown statistic: " + s);
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static void writeInt(Row row, int col, long value, CellStyle intStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(intStyle);
    }

    private static double round(double v) {
        double f = Math.pow(10, SimulationConstants.OUTPUT_DECIMALS);
        return Math.round(v * f) / f;
    }

    private static String buildPassport(SimulationConfig cfg) {
        return String.format(Locale.US,
                "MC=%d; P=%s; threads=%d; seed=%d; units=kW",
                cfg.getTrials(),
                ResultsCsvWriter.percentileLabel(cfg.getPercentile()),
                cfg.getThreads(),
                cfg.getSeed());
    }
}
