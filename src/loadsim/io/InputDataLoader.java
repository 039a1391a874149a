package loadsim.io;

import loadsim.config.SimulationConstants;
import loadsim.model.Device;
import loadsim.model.DeviceCatalog;
import loadsim.model.InputDataException;
import loadsim.model.UtilizationProfile;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Загрузка входных данных: список устройств и профили использования.
 * <p>
 * Список устройств: CSV с заголовком, первый столбец - имя устройства,
 * столбцы "Power (W)", "Number", "Available" (Y/N), "Type" ищутся по заголовку.
 * Профиль: "[устройство]_times.csv" в папке профилей, 24 строки x 12 столбцов, без заголовка.
 */
public class InputDataLoader {

    public static final String POWER_COLUMN = "Power (W)";
    public static final String NUMBER_COLUMN = "Number";
    public static final String AVAILABLE_COLUMN = "Available";
    public static final String TYPE_COLUMN = "Type";

    public static final String PROFILE_SUFFIX = "_times.csv";

    public DeviceCatalog load(Path deviceListPath, Path profilesDir) throws IOException {
        List<Device> devices = loadDevices(deviceListPath);

        DeviceCatalog.Builder b = DeviceCatalog.builder();
        for (Device d : devices) {
            b.addDevice(d, loadProfile(profilesDir, d.getName()));
        }
        return b.build();
    }

    public List<Device> loadDevices(Path deviceListPath) throws IOException {
        List<String[]> rows = readRows(deviceListPath);
        if (rows.isEmpty()) {
            throw new InputDataException("Device list is empty (" + deviceListPath + ")");
        }

        String[] header = rows.get(0);
        int powerCol = column(header, POWER_COLUMN, deviceListPath);
        int numberCol = column(header, NUMBER_COLUMN, deviceListPath);
        int availableCol = column(header, AVAILABLE_COLUMN, deviceListPath);
        int typeCol = column(header, TYPE_COLUMN, deviceListPath);

        List<Device> devices = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            String[] r = rows.get(i);
            int line = i + 1;
            String name = cell(r, 0, line, deviceListPath);

            double power = round(parseNumber(cell(r, powerCol, line, deviceListPath), line, deviceListPath));
            double number = round(parseNumber(cell(r, numberCol, line, deviceListPath), line, deviceListPath));
            if (number != Math.rint(number)) {
                throw new InputDataException("Number of '" + name + "' must be a whole number, got "
                        + number + " (" + deviceListPath + ":" + line + ")");
            }
            if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
                throw new InputDataException("Number of '" + name + "' is out of range: "
                        + cell(r, numberCol, line, deviceListPath) + " (" + deviceListPath + ":" + line + ")");
            }
            boolean available = parseAvailable(cell(r, availableCol, line, deviceListPath), name, line, deviceListPath);
            String type = cell(r, typeCol, line, deviceListPath);

            devices.add(new Device(name, power, (int) number, available, type));
        }
        return devices;
    }

    public UtilizationProfile loadProfile(Path profilesDir, String deviceName) throws IOException {
        Path path = profilesDir.resolve(deviceName + PROFILE_SUFFIX);
        if (!Files.isRegularFile(path)) {
            throw new InputDataException("No utilization profile for device '" + deviceName + "': " + path);
        }

        List<String[]> rows = readRows(path);
        if (rows.size() != SimulationConstants.HOURS_PER_DAY) {
            throw new InputDataException("Ожидалось " + SimulationConstants.HOURS_PER_DAY
                    + " строк, получено " + rows.size() + " (" + path + ")");
        }

        double[][] p = new double[SimulationConstants.HOURS_PER_DAY][];
        for (int h = 0; h < rows.size(); h++) {
            String[] r = rows.get(h);
            if (r.length != SimulationConstants.MONTHS_PER_YEAR) {
                throw new InputDataException("Ожидалось " + SimulationConstants.MONTHS_PER_YEAR
                        + " столбцов, получено " + r.length + " (" + path + ":" + (h + 1) + ")");
            }
            p[h] = new double[r.length];
            for (int m = 0; m < r.length; m++) {
                p[h][m] = parseNumber(r[m], h + 1, path);
            }
        }
        return new UtilizationProfile(p);
    }

    private static List<String[]> readRows(Path path) throws IOException {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = br.readLine()) != null) {
                if (first) {
                    // BOM из Excel
                    if (line.startsWith("\uFEFF")) line = line.substring(1);
                    first = false;
                }
                if (line.trim().isEmpty()) continue;

                rows.add(splitCsv(line));
            }
        }
        return rows;
    }

    private static int column(String[] header, String name, Path path) {
        for (int i = 1; i < header.length; i++) {
            if (header[i].equalsIgnoreCase(name)) return i;
        }
        throw new InputDataException("Column '" + name + "' not found in " + path);
    }

    private static String cell(String[] row, int col, int line, Path path) {
        if (col >= row.length) {
            throw new InputDataException("Missing value in column " + (col + 1) + " (" + path + ":" + line + ")");
        }
        return row[col];
    }

    private static double parseNumber(String s, int line, Path path) {
        double v;
        try {
            v = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new InputDataException("Not a number: '" + s + "' (" + path + ":" + line + ")", e);
        }
        if (!Double.isFinite(v)) {
            throw new InputDataException("Not a finite number: '" + s + "' (" + path + ":" + line + ")");
        }
        return v;
    }

    private static boolean parseAvailable(String s, String device, int line, Path path) {
        switch (s.toUpperCase(Locale.ROOT)) {
            case "Y":
                return true;
            case "N":
                return false;
            default:
                throw new InputDataException("Available of '" + device + "' must be Y or N, got '" + s
                        + "' (" + path + ":" + line + ")");
        }
    }

    /**
     * Разбор строки CSV: запятая - разделитель, значения в кавычках могут содержать запятые.
     */
    static String[] splitCsv(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cur.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cur.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                cells.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(ch);
            }
        }
        cells.add(cur.toString().trim());
        return cells.toArray(new String[0]);
    }

    private static double round(double v) {
        double f = Math.pow(10, SimulationConstants.INPUT_DECIMALS);
        return Math.round(v * f) / f;
    }
}
