package loadsim;

import loadsim.config.SimulationConfig;
import loadsim.engine.*;
import loadsim.io.InputDataLoader;
import loadsim.model.DeviceCatalog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    public static DeviceCatalog load(Path deviceListPath, Path profilesDir) throws IOException {
        DeviceCatalog catalog = new InputDataLoader().load(deviceListPath, profilesDir);
        if (catalog.size() == 0) {
            throw new IllegalStateException("Список устройств пуст: " + deviceListPath);
        }
        return catalog;
    }

    public static EngineContext buildEngineContext(DeviceCatalog catalog, SimulationConfig cfg) {
        ExecutorService executor = Executors.newFixedThreadPool(cfg.getThreads());

        DeviceSampler sampler = new DeviceSampler();
        SystemLoadAggregator aggregator = new SystemLoadAggregator(catalog, sampler);
        MonteCarloRunner runner = new MonteCarloRunner(executor, aggregator);

        return new EngineContext(
                new SimulationEngine(runner),
                new DetailedOutputGenerator(catalog, sampler),
                executor
        );
    }

    public record EngineContext(SimulationEngine engine,
                                DetailedOutputGenerator detailed,
                                ExecutorService executor) implements AutoCloseable {

        @Override
        public void close() {
            executor.shutdown();
        }
    }
}
