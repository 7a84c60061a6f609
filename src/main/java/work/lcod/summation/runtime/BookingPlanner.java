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
import work.lcod.summation.table.StoredHistogram;
import work.lcod.summation.table.Table;
import work.lcod.summation.table.Values;

/**
 * Registers, for every context of the attribute domain, the histogram the online steps of a
 * specification will fill. Replays the same step walk as {@link OnlineExecutor} but derives
 * names, titles, labels and ranges instead of values.
 */
final class BookingPlanner implements StepVisitor {
    private static final Logger logger = LogManager.getLogger(BookingPlanner.class);
    private static final Set<Stage> ONLINE_STAGES = EnumSet.of(Stage.ONLINE, Stage.ONLINE_HARVEST);

    private final ManagerConfiguration config;
    private final AttributeProvider provider;
    private final FolderPaths paths;

    private SummationSpecification spec;
    private Table table;
    private Values key;
    private int dimensions;
    private boolean xFree;
    private boolean yFree;
    private String name;
    private String title;
    private String xlabel;
    private String ylabel;
    private int xNbins;
    private double xMin;
    private double xMax;
    private int yNbins;
    private double yMin;
    private double yMax;

    BookingPlanner(ManagerConfiguration config, AttributeProvider provider, FolderPaths paths) {
        this.config = config;
        this.provider = provider;
        this.paths = paths;
    }

    /**
     * Books every histogram of {@code spec} into {@code store} and records the handles in
     * {@code table}. Keys that already hold a histogram are left alone.
     *
     * @return number of histograms booked by this call
     */
    int book(SummationSpecification spec, Table table, HistogramStore store) {
        this.spec = spec;
        this.table = table;
        int booked = 0;
        try {
            for (SampleContext context : provider.allContexts()) {
                key = provider.extractColumns(spec.keyColumns(), context);
                if (!config.bookUndefined() && key.hasUndefined()) {
                    logger.debug("Skipping {}: undefined columns", key);
                    continue;
                }
                reset();
                spec.walk(ONLINE_STAGES, this);
                if (register(store)) {
                    booked++;
                }
            }
        } finally {
            this.spec = null;
            this.table = null;
            this.key = null;
        }
        return booked;
    }

    @Override
    public boolean visit(int index, SummationStep step) {
        switch (step.type()) {
            case SAVE:
                return true;
            case COUNT:
                dimensions = 0;
                xFree = true;
                yFree = true;
                title = "Count of " + title;
                name = "num_" + name;
                ylabel = "#" + xlabel;
                xlabel = "";
                xNbins = 1;
                yNbins = 1;
                xMin = 0.0;
                yMin = 0.0;
                xMax = 1.0;
                yMax = 1.0;
                if (spec.isFollowedByHarvest(index)) {
                    createCounter();
                }
                return true;
            case EXTEND_X: {
                if (!xFree) {
                    throw illegal("1D to 1D EXTEND_X is not supported online");
                }
                Column column = step.extendedColumn();
                String columnName = provider.prettyName(column);
                dimensions = dimensions == 0 ? 1 : 2;
                xFree = false;
                title = title + " per " + columnName;
                name = name + "_per_" + columnName;
                xlabel = columnName;
                xMin = provider.minValue(column) - 0.5;
                xMax = provider.maxValue(column) + 0.5;
                xNbins = (int) (xMax - xMin);
                key.erase(column);
                return true;
            }
            case EXTEND_Y: {
                if (!yFree) {
                    throw illegal("2D to 2D EXTEND_Y is not supported online");
                }
                Column column = step.extendedColumn();
                String columnName = provider.prettyName(column);
                dimensions = 2;
                yFree = false;
                title = title + " per " + columnName;
                name = name + "_per_" + columnName;
                ylabel = columnName;
                yMin = provider.minValue(column) - 0.5;
                yMax = provider.maxValue(column) + 0.5;
                yNbins = (int) (yMax - yMin);
                key.erase(column);
                return true;
            }
            case GROUPBY: {
                if (dimensions != 0) {
                    throw illegal("Only COUNT/GROUPBY with per-sample harvesting is allowed online");
                }
                dimensions = 1;
                xFree = false;
                xNbins = config.rangeNbins();
                xMin = config.rangeMin();
                xMax = config.rangeMax();
                xlabel = ylabel + " per Event";
                var extracted = spec.keyColumns();
                if (!extracted.isEmpty()) {
                    xlabel = xlabel + " and " + provider.prettyName(extracted.get(extracted.size() - 1));
                }
                ylabel = "#Entries";
                key.retainOnly(step.columns());
                return true;
            }
            case REDUCE:
            case CUSTOM:
            case NONE:
            default:
                throw illegal("Operation " + step.type() + " not supported online. Try SAVE before to switch to harvesting");
        }
    }

    private void reset() {
        dimensions = config.dimensions();
        xFree = dimensions < 1;
        yFree = dimensions < 2;
        name = config.name();
        title = config.title();
        xlabel = config.xlabel();
        ylabel = config.ylabel();
        xNbins = config.rangeNbins();
        xMin = config.rangeMin();
        xMax = config.rangeMax();
        yNbins = config.rangeYNbins();
        yMin = config.rangeYMin();
        yMax = config.rangeYMax();
    }

    private void createCounter() {
        Cell existing = table.get(key);
        if (existing == null) {
            table.counter(key);
        } else if (existing.hasHistogram()) {
            throw conflict();
        }
    }

    private boolean register(HistogramStore store) {
        Cell existing = table.get(key);
        if (existing != null) {
            if (existing.hasHistogram()) {
                return false;
            }
            throw conflict();
        }
        store.setCurrentFolder(paths.folder(key));
        StoredHistogram handle;
        if (dimensions == 0 || dimensions == 1) {
            handle = store.book1D(name, title + ";" + xlabel + ";" + ylabel, xNbins, xMin, xMax);
        } else {
            handle = store.book2D(
                name,
                title + ";" + xlabel + ";" + ylabel,
                xNbins,
                xMin,
                xMax,
                yNbins,
                yMin,
                yMax
            );
        }
        table.put(key, Cell.stored(handle));
        return true;
    }

    private SpecificationException conflict() {
        return new SpecificationException(
            SpecificationException.COUNTER_CONFLICT,
            "Counter and histogram share the key " + key + "; GROUPBY after COUNT must drop a column"
        );
    }

    private static SpecificationException illegal(String message) {
        return new SpecificationException(SpecificationException.ILLEGAL_STEP, message);
    }
}
