package loadsim.engine;

import loadsim.config.SimulationConfig;
import loadsim.config.SimulationConstants;
import loadsim.model.Device;
import loadsim.model.DeviceCatalog;
import loadsim.model.UtilizationProfile;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Детальный вывод: одна выборка на каждую четвёрку (испытание, устройство, месяц, час),
 * без агрегации. Порядок записей: испытание -> устройство -> месяц -> час.
 * <p>
 * Нагрузка в тех же единицах, что и в агрегированном пути: active * P / 1000.
 * Генераторы берутся по той же схеме зёрен (месяц, испытание), что и в MonteCarloRunner,
 * и расходуются в том же порядке устройство -> час. При одинаковом зерне сумма записей
 * по устройствам совпадает с ансамблем; при разных зёрнах прогоны независимы.
 */
public final class DetailedOutputGenerator {

    private final DeviceCatalog catalog;
    private final DeviceSampler sampler;

    public DetailedOutputGenerator(DeviceCatalog catalog, DeviceSampler sampler) {
        this.catalog = catalog;
        this.sampler = sampler;
    }

    /** Общее количество записей: trials x устройства x 12 x 24. */
    public long expectedRecordCount(int trials) {
        return (long) trials * catalog.size()
                * SimulationConstants.MONTHS_PER_YEAR
                * SimulationConstants.HOURS_PER_DAY;
    }

    public void generate(SimulationConfig config, Consumer<DetailedRecord> sink) {
        final int months = SimulationConstants.MONTHS_PER_YEAR;
        final int hours = SimulationConstants.HOURS_PER_DAY;
        final List<Device> devices = catalog.getDevices();

        for (int trial = 0; trial < config.getTrials(); trial++) {
            RandomGenerator[] rndByMonth = new RandomGenerator[months];
            for (int m = 0; m < months; m++) {
                rndByMonth[m] = MonteCarloRunner.randomFor(config.getSeed(), m, trial);
            }

            for (Device device : devices) {
                UtilizationProfile profile = catalog.getProfile(device.getName());
                int n = device.getEffectiveCount();

                for (int m = 0; m < months; m++) {
                    for (int h = 0; h < hours; h++) {
                        int active = sampler.sampleActiveUnits(n, profile.getProbability(h, m), rndByMonth[m]);
                        sink.accept(new DetailedRecord(
                                trial,
                                device.getName(),
                                m,
                                h,
                                DeviceSampler.toKw(active, device),
                                device.getType()
                        ));
                    }
                }
            }
        }
    }

    public List<DetailedRecord> generateAll(SimulationConfig config) {
        long expected = expectedRecordCount(config.getTrials());
        if (expected > Integer.MAX_VALUE) {
            throw new IllegalStateException("Too many records to hold in memory: " + expected
                    + ", stream them with generate(config, sink)");
        }
        List<DetailedRecord> out = new ArrayList<>((int) expected);
        generate(config, out::add);
        return out;
    }
}
