package loadsim.engine;

import loadsim.config.SimulationConstants;
import loadsim.model.Device;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Случайное число включённых устройств одного типа в заданный час/месяц.
 * Каждое из n устройств включено независимо с вероятностью p -> Binomial(n, p).
 * <p>
 * Состояния не хранит: весь источник случайности приходит параметром.
 */
public final class DeviceSampler {

    /**
     * @return число включённых устройств, [0; n]
     */
    public int sampleActiveUnits(int n, double p, RandomGenerator rnd) {
        // p = 0, p = 1 и n = 0 идут через тот же вызов: одно случайное число на выборку
        return new BinomialDistribution(rnd, n, p).sample();
    }

    /**
     * Нагрузка устройства, кВт.
     */
    public double sampleLoadKw(Device device, double p, RandomGenerator rnd) {
        int active = sampleActiveUnits(device.getEffectiveCount(), p, rnd);
        return toKw(active, device);
    }

    static double toKw(int activeUnits, Device device) {
        return activeUnits * device.getPowerW() / SimulationConstants.WATTS_PER_KW;
    }
}
