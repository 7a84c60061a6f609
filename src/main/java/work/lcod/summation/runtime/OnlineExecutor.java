package work.lcod.summation.runtime;

import java.util.EnumSet;
import java.util.Set;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.table.Cell;
import work.lcod.summation.table.Table;
import work.lcod.summation.table.Values;

/**
 * Fills one sample into the table of a specification. This runs once per sample and
 * specification: it does not allocate when the fast path is valid.
 *
 * <p>Instances keep per-call scratch state and are confined to the manager that owns them.
 */
final class OnlineExecutor implements StepVisitor {
    private static final Set<Stage> ONLINE = EnumSet.of(Stage.ONLINE);
    private static final Set<Stage> ONLINE_HARVEST = EnumSet.of(Stage.ONLINE_HARVEST);

    private final SummationSpecification spec;
    private final Table table;
    private final int defaultDimensions;
    private final boolean bookUndefined;

    private double x;
    private double y;
    private int dimensions;
    private boolean xFree;
    private boolean yFree;
    private boolean finished;
    private Stage stage;
    private Values key;
    private FastPath fastPath;

    OnlineExecutor(SummationSpecification spec, Table table, int defaultDimensions, boolean bookUndefined) {
        this.spec = spec;
        this.table = table;
        this.defaultDimensions = defaultDimensions;
        this.bookUndefined = bookUndefined;
    }

    /**
     * Walks the steps of {@code stage} for the sample {@code (x, y)} whose key is {@code key}.
     * The key is modified in place by EXTEND and GROUPBY.
     */
    void execute(double x, double y, Values key, Stage stage, FastPath fastPath) {
        this.x = x;
        this.y = y;
        this.dimensions = defaultDimensions;
        this.xFree = defaultDimensions < 1;
        this.yFree = defaultDimensions < 2;
        this.finished = false;
        this.stage = stage;
        this.key = key;
        this.fastPath = fastPath;
        try {
            spec.walk(stage == Stage.ONLINE ? ONLINE : ONLINE_HARVEST, this);
            if (!finished) {
                fillCell();
            }
        } finally {
            this.key = null;
            this.fastPath = null;
        }
    }

    @Override
    public boolean visit(int index, SummationStep step) {
        switch (step.type()) {
            case SAVE:
                return true;
            case COUNT:
                x = 0.0;
                y = 0.0;
                dimensions = 0;
                xFree = true;
                yFree = true;
                if (spec.isFollowedByHarvest(index)) {
                    Cell.Counter counter = fastPath.isValid() ? asCounter(fastPath.cell()) : counterAt();
                    fastPath.set(counter);
                    counter.increment();
                    finished = true;
                    return false;
                }
                return true;
            case EXTEND_X: {
                if (!xFree) {
                    throw illegal("Can only EXTEND_X on a COUNT or an empty accumulator");
                }
                var column = step.extendedColumn();
                x = key.get(column);
                key.erase(column);
                xFree = false;
                dimensions = dimensions == 0 ? 1 : 2;
                return true;
            }
            case EXTEND_Y: {
                if (!yFree) {
                    throw illegal("Can only EXTEND_Y on a COUNT or an empty accumulator");
                }
                var column = step.extendedColumn();
                y = key.get(column);
                key.erase(column);
                yFree = false;
                dimensions = 2;
                return true;
            }
            case GROUPBY: {
                if (stage != Stage.ONLINE_HARVEST) {
                    throw illegal("Only COUNT/GROUPBY with per-sample harvesting is allowed online");
                }
                Cell.Counter counter = fastPath.isValid() ? asCounter(fastPath.cell()) : counterAt();
                x = counter.count();
                fastPath.invalidate();
                counter.reset();
                key.retainOnly(step.columns());
                dimensions = 1;
                xFree = false;
                return true;
            }
            case REDUCE:
            case CUSTOM:
            case NONE:
            default:
                throw illegal("Illegal step " + step + " in stage " + stage + "; booking should have caught this");
        }
    }

    private void fillCell() {
        Cell cell = fastPath.cell();
        if (cell == null) {
            cell = table.get(key);
            if (cell == null || !cell.hasHistogram()) {
                if (bookUndefined) {
                    throw new SpecificationException(
                        SpecificationException.BOOKING_MISMATCH,
                        "All histograms were booked but none exists for " + key
                    );
                }
                return;
            }
            fastPath.set(cell);
        }
        if (dimensions == 0) {
            cell.fill();
        } else if (dimensions == 1) {
            cell.fill(x);
        } else {
            cell.fill(x, y);
        }
    }

    private Cell.Counter counterAt() {
        Cell cell = table.get(key);
        if (cell == null) {
            return table.counter(key);
        }
        if (cell instanceof Cell.Counter counter) {
            return counter;
        }
        throw new SpecificationException(
            SpecificationException.COUNTER_CONFLICT,
            "Expected a counter at " + key + " but the table holds a " + cell.kind() + " cell"
        );
    }

    private static Cell.Counter asCounter(Cell cell) {
        if (cell instanceof Cell.Counter counter) {
            return counter;
        }
        throw new SpecificationException(
            SpecificationException.COUNTER_CONFLICT,
            "Expected a counter but the cached cell is " + cell.kind()
        );
    }

    private static SpecificationException illegal(String message) {
        return new SpecificationException(SpecificationException.ILLEGAL_STEP, message);
    }
}
