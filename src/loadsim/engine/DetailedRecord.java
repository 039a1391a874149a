package loadsim.engine;

/**
 * Одна выборка детального вывода: (испытание, устройство, месяц, час) -> нагрузка, кВт·ч.
 */
public record DetailedRecord(int trial,
                             String device,
                             int month,
                             int hour,
                             double loadKwh,
                             String type) {}
