package work.lcod.summation.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.summation.attributes.AttributeProvider;
import work.lcod.summation.attributes.SampleContext;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.store.HistogramStore;
import work.lcod.summation.table.Table;
import work.lcod.summation.table.Values;

/**
 * Owns the specifications of one measured quantity together with their tables, and drives
 * booking, per-sample filling and harvesting.
 *
 * <p>Not thread-safe: a manager is driven by a single thread in sample order. Independent
 * managers may run on different threads as long as the shared attribute provider is loaded
 * first.
 */
public final class HistogramManager {
    private static final Logger logger = LogManager.getLogger(HistogramManager.class);

    private final ManagerConfiguration config;
    private final AttributeProvider provider;
    private final Registry registry;
    private final FolderPaths paths;
    private final List<Slot> slots = new ArrayList<>();
    private final SampleContext lastSample = SampleContext.unset();

    public HistogramManager(ManagerConfiguration config, AttributeProvider provider) {
        this(config, provider, new Registry());
    }

    public HistogramManager(ManagerConfiguration config, AttributeProvider provider, Registry registry) {
        this.config = Objects.requireNonNull(config, "config");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.paths = new FolderPaths(provider, config.topFolderName());
        for (var spec : config.specs()) {
            addSpecification(spec);
        }
    }

    public void addSpecification(SummationSpecification spec) {
        slots.add(new Slot(spec, config));
    }

    public ManagerConfiguration configuration() {
        return config;
    }

    public Registry registry() {
        return registry;
    }

    public List<SummationSpecification> specifications() {
        var list = new ArrayList<SummationSpecification>(slots.size());
        for (var slot : slots) {
            list.add(slot.spec);
        }
        return Collections.unmodifiableList(list);
    }

    public Table table(int index) {
        return slots.get(index).table;
    }

    public String folder(Values key) {
        return paths.folder(key);
    }

    /**
     * Books the histograms of every specification for the whole attribute domain.
     */
    public void book(HistogramStore store, Map<String, Object> setup) {
        if (!config.enabled()) {
            return;
        }
        ensureLoaded(setup);
        var planner = new BookingPlanner(config, provider, paths);
        for (var slot : slots) {
            int booked = planner.book(slot.spec, slot.table, store);
            logger.info("Booked {} histograms for {}", booked, config.name());
        }
    }

    public void fill(double x, double y, long moduleId, long eventId, int col, int row) {
        if (!config.enabled()) {
            return;
        }
        boolean cached = lastSample.sameSample(moduleId, eventId, col, row);
        if (!cached) {
            lastSample.set(moduleId, eventId, col, row);
        }
        for (int i = 0; i < slots.size(); i++) {
            var slot = slots.get(i);
            if (!cached) {
                slot.key.clear();
                provider.extractColumns(slot.spec.keyColumns(), lastSample, slot.key);
                slot.fastPath.invalidate();
            }
            slot.working.copyFrom(slot.key);
            slot.executor.execute(x, y, slot.working, Stage.ONLINE, slot.fastPath);
        }
    }

    public void fill(double x, long moduleId, long eventId, int col, int row) {
        requireDimensions(1);
        fill(x, 0.0, moduleId, eventId, col, row);
    }

    public void fill(long moduleId, long eventId, int col, int row) {
        requireDimensions(0);
        fill(0.0, 0.0, moduleId, eventId, col, row);
    }

    public void fill(double x, double y, SampleContext sample) {
        fill(x, y, sample.moduleId(), sample.eventId(), sample.col(), sample.row());
    }

    /**
     * Runs the per-sample harvesting steps for every counter, turning the counts gathered since
     * the last call into one fill of the coarser histograms. Call once per unit (event).
     */
    public void executePerSampleHarvesting() {
        if (!config.enabled()) {
            return;
        }
        var scratch = new Values();
        var fastPath = new FastPath();
        for (var slot : slots) {
            if (!slot.spec.hasPerSampleHarvesting()) {
                continue;
            }
            slot.table.forEachCounter((key, counter) -> {
                scratch.copyFrom(key);
                fastPath.set(counter);
                slot.executor.execute(0.0, 0.0, scratch, Stage.ONLINE_HARVEST, fastPath);
            });
        }
    }

    public void executeHarvestingOnline(Map<String, Object> setup) {
        if (!config.enabled()) {
            return;
        }
        ensureLoaded(setup);
    }

    /**
     * Reloads every specification's table from {@code store} and runs its offline steps.
     */
    public void executeHarvestingOffline(HistogramStore store, Map<String, Object> setup) {
        if (!config.enabled()) {
            return;
        }
        ensureLoaded(setup);
        for (var slot : slots) {
            logger.info("Specs for {}: {}", config.name(), slot.spec.describe(provider));
        }
        lastSample.reset();
        var reloader = new StoreReloader(config, provider, paths);
        var pipeline = new HarvestPipeline(config, provider, paths, registry);
        for (var slot : slots) {
            slot.fastPath.invalidate();
            slot.table.swap(reloader.reload(slot.spec, store));
            pipeline.run(slot.spec, slot.table, store);
        }
    }

    private void ensureLoaded(Map<String, Object> setup) {
        if (!provider.loaded()) {
            provider.load(setup == null ? Map.of() : setup);
        }
    }

    private void requireDimensions(int expected) {
        if (config.dimensions() != expected) {
            throw new IllegalArgumentException(
                "Manager " + config.name() + " fills " + config.dimensions() + " coordinates, got " + expected
            );
        }
    }

    private static final class Slot {
        final SummationSpecification spec;
        final Table table = new Table();
        final Values key = new Values();
        final Values working = new Values();
        final FastPath fastPath = new FastPath();
        final OnlineExecutor executor;

        Slot(SummationSpecification spec, ManagerConfiguration config) {
            this.spec = Objects.requireNonNull(spec, "spec");
            this.executor = new OnlineExecutor(spec, table, config.dimensions(), config.bookUndefined());
        }
    }
}
