package work.lcod.summation.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.summation.attributes.StaticAttributeProvider;
import work.lcod.summation.runtime.ConfigurationLoader;
import work.lcod.summation.runtime.HistogramManager;
import work.lcod.summation.runtime.Registry;
import work.lcod.summation.runtime.SpecificationException;
import work.lcod.summation.store.InMemoryHistogramStore;

/**
 * Public entry point for running one manager over a sample file: load, book, fill, harvest.
 */
public final class SummationRunner {
    private static final Logger logger = LogManager.getLogger(SummationRunner.class);

    private final Registry registry;

    public SummationRunner() {
        this(new Registry());
    }

    public SummationRunner(Registry registry) {
        this.registry = registry;
    }

    public RunResult run(SummationRunConfiguration configuration) {
        var started = Instant.now();
        var resolved = configuration.workingDirectory().resolve(configuration.configurationFile());
        try {
            var loaded = ConfigurationLoader.loadFromLocalFile(resolved);
            StaticAttributeProvider attributes = loaded.attributes().orElseThrow(
                () -> new IllegalStateException("Configuration " + resolved + " has no 'attributes' section")
            );
            var manager = new HistogramManager(loaded.manager(), attributes, registry);
            var store = new InMemoryHistogramStore();
            manager.book(store, configuration.setup());

            int samples = 0;
            int events = 0;
            if (configuration.samplesFile().isPresent()) {
                var samplesPath = configuration.workingDirectory().resolve(configuration.samplesFile().get());
                List<SampleReader.Sample> records = SampleReader.read(samplesPath);
                Long currentEvent = null;
                for (var sample : records) {
                    if (currentEvent != null && currentEvent != sample.event()) {
                        manager.executePerSampleHarvesting();
                        events++;
                    }
                    currentEvent = sample.event();
                    manager.fill(sample.x(), sample.y(), sample.module(), sample.event(), sample.col(), sample.row());
                    samples++;
                }
                if (currentEvent != null) {
                    manager.executePerSampleHarvesting();
                    events++;
                }
                logger.info("Filled {} samples over {} events", samples, events);
            }
            manager.executeHarvestingOnline(configuration.setup());
            manager.executeHarvestingOffline(store, configuration.setup());

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("configuration", resolved.toString());
            metadata.put("manager", loaded.manager().name());
            metadata.put("specifications", describe(manager, attributes));
            metadata.put("samples", samples);
            metadata.put("events", events);
            metadata.put("histograms", store.snapshot());
            return RunResult.success(metadata, started);
        } catch (SpecificationException ex) {
            logger.error("Run of {} failed: {}", resolved, ex.getMessage());
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("configuration", resolved.toString());
            errorMeta.put("code", ex.code());
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        } catch (RuntimeException ex) {
            logger.error("Run of {} failed", resolved, ex);
            return RunResult.failure(ex.getMessage(), Map.of("configuration", resolved.toString()), started);
        }
    }

    private static List<String> describe(HistogramManager manager, StaticAttributeProvider attributes) {
        var descriptions = new ArrayList<String>();
        for (var spec : manager.specifications()) {
            descriptions.add(spec.describe(attributes));
        }
        return descriptions;
    }
}
