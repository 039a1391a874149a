package loadsim.engine;

import loadsim.config.SimulationConstants;
import loadsim.model.Device;
import loadsim.model.DeviceCatalog;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Одно испытание: суммарная нагрузка системы по часам для заданного месяца.
 */
public final class SystemLoadAggregator {

    private final DeviceCatalog catalog;
    private final DeviceSampler sampler;

    public SystemLoadAggregator(DeviceCatalog catalog, DeviceSampler sampler) {
        this.catalog = catalog;
        this.sampler = sampler;
    }

    /**
     * @param month 0..11
     * @param rnd   генератор этого испытания
     * @return нагрузка по часам, кВт (24 значения)
     */
    public double[] aggregate(int month, RandomGenerator rnd) {
        double[] loadKw = new double[SimulationConstants.HOURS_PER_DAY];

        // порядок: устройство -> час (на него опирается DetailedOutputGenerator)
        for (Device device : catalog.getDevices()) {
            double[] p = catalog.getProfile(device.getName()).getMonth(month);
            for (int h = 0; h < SimulationConstants.HOURS_PER_DAY; h++) {
                loadKw[h] += sampler.sampleLoadKw(device, p[h], rnd);
            }
        }
        return loadKw;
    }
}
