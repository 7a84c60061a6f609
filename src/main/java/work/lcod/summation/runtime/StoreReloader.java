package work.lcod.summation.runtime;

import java.util.EnumSet;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.summation.attributes.AttributeProvider;
import work.lcod.summation.attributes.SampleContext;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.store.HistogramStore;
import work.lcod.summation.table.Cell;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Table;
import work.lcod.summation.table.Values;

/**
 * Rebuilds the online result of a specification from the store by recomputing the key and
 * name booking gave each histogram.
 */
final class StoreReloader implements StepVisitor {
    private static final Logger logger = LogManager.getLogger(StoreReloader.class);
    private static final Set<Stage> ONLINE_STAGES = EnumSet.of(Stage.ONLINE, Stage.ONLINE_HARVEST);

    private final ManagerConfiguration config;
    private final AttributeProvider provider;
    private final FolderPaths paths;

    private Values key;
    private String name;

    StoreReloader(ManagerConfiguration config, AttributeProvider provider, FolderPaths paths) {
        this.config = config;
        this.provider = provider;
        this.paths = paths;
    }

    Table reload(SummationSpecification spec, HistogramStore store) {
        var table = new Table();
        int missing = 0;
        for (SampleContext context : provider.allContexts()) {
            key = provider.extractColumns(spec.keyColumns(), context);
            if (!config.bookUndefined() && key.hasUndefined()) {
                continue;
            }
            name = config.name();
            spec.walk(ONLINE_STAGES, this);
            String path = paths.path(key, name);
            var found = store.get(path);
            if (found.isEmpty()) {
                missing++;
                if (config.bookUndefined()) {
                    logger.error("Histogram {} not found", path);
                }
                continue;
            }
            if (!table.contains(key)) {
                table.put(key, Cell.stored(found.get()));
            }
        }
        logger.debug("Reloaded {} histograms for {} ({} not found)", table.size(), config.name(), missing);
        key = null;
        return table;
    }

    @Override
    public boolean visit(int index, SummationStep step) {
        switch (step.type()) {
            case SAVE:
                return true;
            case COUNT:
                name = "num_" + name;
                return true;
            case EXTEND_X:
            case EXTEND_Y: {
                Column column = step.extendedColumn();
                name = name + "_per_" + provider.prettyName(column);
                key.erase(column);
                return true;
            }
            case GROUPBY:
                key.retainOnly(step.columns());
                return true;
            case REDUCE:
            case CUSTOM:
            case NONE:
            default:
                throw new SpecificationException(
                    SpecificationException.ILLEGAL_STEP,
                    "Illegal step " + step + "; booking should have caught this"
                );
        }
    }
}
