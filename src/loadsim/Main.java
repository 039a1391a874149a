package loadsim;

import loadsim.config.ConfigurationException;
import loadsim.config.SimulationConfig;
import loadsim.config.SimulationConstants;
import loadsim.engine.YearlySummary;
import loadsim.io.DetailedOutputCsvWriter;
import loadsim.io.ResultsCsvWriter;
import loadsim.io.ResultsExcelWriter;
import loadsim.model.DeviceCatalog;
import org.apache.commons.cli.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Monte Carlo симулятор нагрузки сообщества устройств.
 * <p>
 * Режимы:
 * results  - mean / std / коэффициент вариации / перцентиль по часам каждого месяца;
 * daily    - суточное потребление каждого испытания (данные для boxplot);
 * detailed - нагрузка каждого устройства по испытаниям, месяцам и часам;
 * all      - всё сразу.
 */
public class Main {

    public enum RunMode {RESULTS, DAILY, DETAILED, ALL}

    public static void main(String[] args) {
        try {
            CommandLine cmd = parseArgs(args);
            if (cmd == null) {
                return;
            }
            run(cmd);
        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static Options options() {
        Options options = new Options();
        options.addOption("devices", true, "path to device list csv (default: \"Device list.csv\")");
        options.addOption("profiles", true, "folder with <device>_times.csv files (default: \"Utilisation profiles\")");
        options.addOption("output", true, "output folder (default: \"Outputs\")");
        options.addOption("trials", true, "Monte Carlo trials per month (default: " + SimulationConstants.DEFAULT_TRIALS + ")");
        options.addOption("percentile", true, "percentile in (0, 100) (default: " + SimulationConstants.DEFAULT_PERCENTILE + ")");
        options.addOption("threads", true, "worker threads (default: available processors)");
        options.addOption("seed", true, "base random seed (default: random)");
        options.addOption("mode", true, "results/daily/detailed/all (default: results)");
        options.addOption("h", false, "help (show options and exit)");
        return options;
    }

    static CommandLine parseArgs(String[] args) throws ParseException {
        Options options = options();
        CommandLine cmd = new DefaultParser().parse(options, args);
        if (cmd.hasOption('h')) {
            new HelpFormatter().printHelp("load-simulator.jar", options);
            return null;
        }
        return cmd;
    }

    static SimulationConfig buildConfig(CommandLine cmd) {
        int trials = wholeNumber(cmd, "trials", SimulationConstants.DEFAULT_TRIALS);
        double percentile = number(cmd, "percentile", SimulationConstants.DEFAULT_PERCENTILE);
        int threads = wholeNumber(cmd, "threads", Runtime.getRuntime().availableProcessors());
        long seed = cmd.hasOption("seed") ? seed(cmd.getOptionValue("seed")) : System.nanoTime();
        return new SimulationConfig(trials, percentile, threads, seed);
    }

    private static double number(CommandLine cmd, String option, double defaultValue) {
        String v = cmd.getOptionValue(option);
        if (v == null) return defaultValue;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("-" + option + " is not a number: " + v);
        }
    }

    private static int wholeNumber(CommandLine cmd, String option, int defaultValue) {
        double d = number(cmd, option, defaultValue);
        if (d != Math.rint(d)) {
            throw new ConfigurationException("-" + option + " must be a whole number, got " + cmd.getOptionValue(option));
        }
        if (d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw new ConfigurationException("-" + option + " is out of range: " + cmd.getOptionValue(option));
        }
        return (int) d;
    }

    private static long seed(String v) {
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("-seed is not a whole number: " + v);
        }
    }

    static RunMode parseMode(String s) {
        try {
            return RunMode.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown mode: " + s + " (results/daily/detailed/all)");
        }
    }

    static void run(CommandLine cmd) throws Exception {
        Path devicesPath = Paths.get(cmd.getOptionValue("devices", "Device list.csv"));
        Path profilesDir = Paths.get(cmd.getOptionValue("profiles", "Utilisation profiles"));
        Path outputDir = Paths.get(cmd.getOptionValue("output", "Outputs"));
        RunMode mode = parseMode(cmd.getOptionValue("mode", "results"));

        // 1) конфиг - до чтения файлов и до любой выборки
        SimulationConfig cfg = buildConfig(cmd);
        // 2) входные данные
        DeviceCatalog catalog = ScenarioFactory.load(devicesPath, profilesDir);

        System.out.println("Automatically generating results!");
        System.out.println("Devices: " + catalog.size() + "; " + cfg);

        try (ScenarioFactory.EngineContext ctx = ScenarioFactory.buildEngineContext(catalog, cfg)) {

            if (mode != RunMode.DETAILED) {
                long t0 = System.currentTimeMillis();
                YearlySummary summary = ctx.engine().runYear(cfg);
                System.out.println("Monte Carlo done in " + (System.currentTimeMillis() - t0) + " ms");

                int undefined = summary.undefinedCoefficientCount();
                if (undefined > 0) {
                    System.out.println("Coefficient of variation undefined (mean = 0) in "
                            + undefined + " of " + (SimulationConstants.HOURS_PER_DAY * SimulationConstants.MONTHS_PER_YEAR)
                            + " hour/month cells");
                }

                if (mode == RunMode.RESULTS || mode == RunMode.ALL) {
                    for (Path p : ResultsCsvWriter.writeTables(outputDir, summary)) {
                        System.out.println("Saved: " + p);
                    }
                    System.out.println("Saved: " + ResultsExcelWriter.writeXlsx(outputDir, cfg, summary));
                }
                if (mode == RunMode.DAILY || mode == RunMode.ALL) {
                    System.out.println("Saved: " + ResultsCsvWriter.writeDailyEnergy(outputDir, summary));
                }
            }

            if (mode == RunMode.DETAILED || mode == RunMode.ALL) {
                // детальный прогон независим от сводного, если зерно не задано явно
                SimulationConfig detailedCfg = cmd.hasOption("seed") ? cfg : cfg.withSeed(System.nanoTime());
                System.out.println("Generating values of load demand for each device, month and hour.");
                long rows = DetailedOutputCsvWriter.write(outputDir, ctx.detailed(), detailedCfg);
                System.out.println("Saved: " + outputDir.resolve(DetailedOutputCsvWriter.FILE_NAME) + " (" + rows + " rows)");
            }
        }

        System.out.println("Simulation complete! Check the \"" + outputDir + "\" folder for your results.");
    }
}
