package work.lcod.summation.runtime;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.summation.attributes.AttributeProvider;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.store.HistogramStore;
import work.lcod.summation.table.Axis;
import work.lcod.summation.table.Cell;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Histogram;
import work.lcod.summation.table.StoredHistogram;
import work.lcod.summation.table.Table;
import work.lcod.summation.table.Values;

/**
 * Offline steps. Each step transforms the whole table; the grouping, reducing and extending
 * steps build a new table and swap it in.
 */
final class HarvestPipeline {
    private static final Logger logger = LogManager.getLogger(HarvestPipeline.class);

    private final ManagerConfiguration config;
    private final AttributeProvider provider;
    private final FolderPaths paths;
    private final Registry registry;

    HarvestPipeline(ManagerConfiguration config, AttributeProvider provider, FolderPaths paths, Registry registry) {
        this.config = config;
        this.provider = provider;
        this.paths = paths;
        this.registry = registry;
    }

    void run(SummationSpecification spec, Table table, HistogramStore store) {
        for (var step : spec.steps()) {
            if (step.stage() != Stage.OFFLINE) {
                continue;
            }
            switch (step.type()) {
                case SAVE:
                    executeSave(table, store);
                    break;
                case GROUPBY:
                    executeGroupBy(step, table);
                    break;
                case REDUCE:
                    executeReduce(step, table);
                    break;
                case EXTEND_X:
                    executeExtend(step, table, true);
                    break;
                case EXTEND_Y:
                    executeExtend(step, table, false);
                    break;
                case CUSTOM:
                    executeCustom(step, table);
                    break;
                case COUNT:
                case NONE:
                default:
                    throw new SpecificationException(
                        SpecificationException.ILLEGAL_STEP,
                        "Operation " + step.type() + " not supported in harvesting"
                    );
            }
        }
    }

    /** Books a stored histogram for every in-memory one and copies its content over. */
    void executeSave(Table table, HistogramStore store) {
        for (var entry : table.entries()) {
            Cell cell = entry.getValue();
            if (cell instanceof Cell.Stored) {
                continue;
            }
            if (!cell.hasHistogram()) {
                if (config.bookUndefined()) {
                    throw new SpecificationException(
                        SpecificationException.MISSING_HISTOGRAM,
                        "Missing histogram for " + entry.getKey()
                    );
                }
                continue;
            }
            Histogram source = cell.histogram();
            store.setCurrentFolder(paths.folder(entry.getKey()));
            Axis xAxis = source.xAxis();
            Axis yAxis = source.yAxis();
            StoredHistogram handle;
            if (source.dimension() == 1) {
                handle = store.book1D(source.name(), source.title(), xAxis.nbins(), xAxis.min(), xAxis.max());
            } else {
                handle = store.book2D(
                    source.name(),
                    source.title(),
                    xAxis.nbins(),
                    xAxis.min(),
                    xAxis.max(),
                    yAxis.nbins(),
                    yAxis.min(),
                    yAxis.max()
                );
            }
            handle.setAxisTitle(xAxis.title(), 1);
            handle.setAxisTitle(yAxis.title(), 2);
            handle.histogram().add(source);
            table.put(entry.getKey(), Cell.stored(handle));
        }
    }

    /** Projects keys onto the step's columns and sums the histograms that collide. */
    void executeGroupBy(SummationStep step, Table table) {
        var out = new Table();
        for (var entry : table.entries()) {
            Histogram source = histogramOf(entry.getKey(), entry.getValue());
            Values projected = entry.getKey().projection(step.columns());
            Cell merged = out.get(projected);
            if (merged == null) {
                out.put(projected, Cell.local(source.copy()));
            } else {
                merged.histogram().add(source);
            }
        }
        table.swap(out);
    }

    void executeReduce(SummationStep step, Table table) {
        var reduction = Reduction.find(step.arg());
        if (reduction.isEmpty()) {
            logger.error("Reduction '{}' not yet implemented; {} entries left untransformed", step.arg(), table.size());
            return;
        }
        var out = new Table();
        for (var entry : table.entries()) {
            Histogram source = histogramOf(entry.getKey(), entry.getValue());
            out.put(entry.getKey(), Cell.local(reduction.get().reduce(source)));
        }
        table.swap(out);
    }

    /**
     * Concatenates, along one axis, the histograms that differ only in the step's column.
     * Members are placed in key order, so the column's values come out ascending.
     */
    void executeExtend(SummationStep step, Table table, boolean isX) {
        Column column = step.extendedColumn();
        var entries = table.entries();

        Map<Values, Integer> nbins = new LinkedHashMap<>();
        for (var entry : entries) {
            Values reduced = reducedKey(entry.getKey(), column);
            Histogram source = histogramOf(entry.getKey(), entry.getValue());
            int contributed = isX ? source.xAxis().nbins() : source.yAxis().nbins();
            nbins.merge(reduced, contributed, Integer::sum);
        }

        var out = new Table();
        Map<Values, Integer> fillPointer = new HashMap<>();
        String columnName = provider.prettyName(column);
        for (var entry : entries) {
            Values reduced = reducedKey(entry.getKey(), column);
            Histogram source = histogramOf(entry.getKey(), entry.getValue());
            Cell target = out.get(reduced);
            if (target == null) {
                target = Cell.local(extendedHistogram(source, columnName, nbins.get(reduced), isX));
                out.put(reduced, target);
                fillPointer.put(reduced, 1);
            }
            int pointer = fillPointer.get(reduced);
            Histogram extended = target.histogram();
            int sourceX = source.xAxis().nbins();
            int sourceY = source.yAxis().nbins();
            if (extended.dimension() == 1) {
                for (int i = 1; i <= sourceX; i++) {
                    extended.setBinContent(pointer++, source.getBinContent(i));
                }
            } else if (isX) {
                for (int i = 1; i <= sourceX; i++) {
                    for (int j = 1; j <= sourceY; j++) {
                        extended.setBinContent(pointer, j, source.getBinContent(i, j));
                    }
                    pointer++;
                }
            } else {
                for (int j = 1; j <= sourceY; j++) {
                    for (int i = 1; i <= sourceX; i++) {
                        extended.setBinContent(i, pointer, source.getBinContent(i, j));
                    }
                    pointer++;
                }
            }
            fillPointer.put(reduced, pointer);
        }
        table.swap(out);
    }

    void executeCustom(SummationStep step, Table table) {
        var entry = registry.get(step.arg());
        if (entry == null) {
            logger.debug("No custom step registered for '{}'; skipping", step.arg());
            return;
        }
        entry.function().apply(step, table);
    }

    private static Histogram extendedHistogram(Histogram source, String columnName, int total, boolean isX) {
        String xTitle = source.xAxis().title();
        String yTitle = source.yAxis().title();
        String title = isX
            ? source.title() + " per " + columnName + ";" + columnName + "/" + xTitle + ";" + yTitle
            : source.title() + " per " + columnName + ";" + xTitle + ";" + columnName + "/" + yTitle;
        if (source.dimension() == 1 && isX) {
            return Histogram.create1D(source.name(), title, total, 0.5, total + 0.5);
        }
        int sourceX = source.xAxis().nbins();
        int sourceY = source.yAxis().nbins();
        if (isX) {
            return Histogram.create2D(source.name(), title, total, 0.5, total + 0.5, sourceY, 0.5, sourceY + 0.5);
        }
        return Histogram.create2D(source.name(), title, sourceX, 0.5, sourceX + 0.5, total, 0.5, total + 0.5);
    }

    private static Values reducedKey(Values key, Column column) {
        if (!key.contains(column)) {
            throw new SpecificationException(
                SpecificationException.ILLEGAL_STEP,
                "Cannot EXTEND along " + column + ": key " + key + " does not carry it"
            );
        }
        return key.without(column);
    }

    private static Histogram histogramOf(Values key, Cell cell) {
        if (!cell.hasHistogram()) {
            throw new SpecificationException(
                SpecificationException.MISSING_HISTOGRAM,
                "Invalid histogram: " + key + " holds a " + cell.kind() + " cell"
            );
        }
        return cell.histogram();
    }
}
