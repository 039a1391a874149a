package loadsim.engine;

/**
 * Годовые таблицы результата и имена их выходных файлов.
 */
public enum Statistic {
    MEAN("mean"),
    STANDARD_DEVIATION("standard_deviation"),
    PERCENTAGE_VARIABILITY("percentage_variability"),
    PERCENTILE("percentile");

    private final String fileKey;

    Statistic(String fileKey) {
        this.fileKey = fileKey;
    }

    public String getFileKey() {
        return fileKey;
    }
}
