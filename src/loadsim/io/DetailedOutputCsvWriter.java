package loadsim.io;

import loadsim.config.SimulationConfig;
import loadsim.config.SimulationConstants;
import loadsim.engine.DetailedOutputGenerator;
import loadsim.engine.DetailedRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Детальный вывод в CSV: Trial, Device, Month, Hour, Load (kWh), Type.
 * Записи пишутся по мере генерации, в памяти не накапливаются.
 */
public final class DetailedOutputCsvWriter {

    public static final String FILE_NAME = "detailed_output.csv";
    public static final String HEADER = "Trial,Device,Month,Hour,Load (kWh),Type";

    private DetailedOutputCsvWriter() {}

    /**
     * @return количество записанных строк (без заголовка)
     */
    public static long write(Path outputDir,
                             DetailedOutputGenerator generator,
                             SimulationConfig config) throws IOException {

        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(FILE_NAME);

        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            w.write(HEADER);
            w.newLine();

            long[] count = {0L};
            try {
                generator.generate(config, r -> {
                    try {
                        w.write(line(r));
                        w.newLine();
                        count[0]++;
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            return count[0];
        }
    }

    static String line(DetailedRecord r) {
        return r.trial() + ","
                + csvCell(r.device()) + ","
                + SimulationConstants.monthName(r.month()) + ","
                + r.hour() + ","
                + String.format(Locale.US, "%." + SimulationConstants.OUTPUT_DECIMALS + "f", r.loadKwh()) + ","
                + csvCell(r.type());
    }

    private static String csvCell(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }
}
