// File: loadsim/config/SimulationConstants.java
package loadsim.config;

/**
 * Глобальные константы симуляции нагрузки.
 */
public final class SimulationConstants {

    /** Часов в сутках (строки профиля использования). */
    public static final int HOURS_PER_DAY = 24;

    /** Месяцев в году (столбцы профиля использования). */
    public static final int MONTHS_PER_YEAR = 12;

    /** Вт -> кВт */
    public static final double WATTS_PER_KW = 1000.0;

    /** Знаков после запятой при сохранении результатов */
    public static final int OUTPUT_DECIMALS = 3;

    /** Знаков после запятой при чтении списка устройств */
    public static final int INPUT_DECIMALS = 3;

    public static final String[] MONTH_NAMES = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun",
            "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    // =========================================================================
    // ===========================   MONTE CARLO   =============================
    // =========================================================================

    /** Количество испытаний на месяц по умолчанию */
    public static final int DEFAULT_TRIALS = 100;

    /** Перцентиль по умолчанию: 90 значит 90% нагрузок ниже выходного значения */
    public static final double DEFAULT_PERCENTILE = 90.0;

    private SimulationConstants() {}

    public static String monthName(int month) {
        return MONTH_NAMES[month];
    }
}
