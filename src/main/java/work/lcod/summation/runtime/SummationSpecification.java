package work.lcod.summation.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import work.lcod.summation.attributes.AttributeProvider;
import work.lcod.summation.runtime.SummationStep.Stage;
import work.lcod.summation.runtime.SummationStep.Type;
import work.lcod.summation.table.Column;

/**
 * Ordered, immutable list of steps defining one derived view.
 *
 * <p>The leading step is an online GROUPBY naming the columns extracted for every sample; the
 * walks used for filling, booking and reloading start after it. Stages never go backwards,
 * and a per-sample harvesting block is always introduced by a COUNT.
 */
public final class SummationSpecification {
    private final List<SummationStep> steps;
    private final List<Column> keyColumns;
    private final boolean perSampleHarvesting;

    public SummationSpecification(List<SummationStep> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps == null ? List.of() : steps));
        validate(this.steps);
        this.keyColumns = this.steps.get(0).columns();
        this.perSampleHarvesting = this.steps.stream().anyMatch(step -> step.stage() == Stage.ONLINE_HARVEST);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SummationStep> steps() {
        return steps;
    }

    public SummationStep step(int index) {
        return steps.get(index);
    }

    /** Columns the attribute provider extracts for each sample. */
    public List<Column> keyColumns() {
        return keyColumns;
    }

    public boolean hasPerSampleHarvesting() {
        return perSampleHarvesting;
    }

    /**
     * True when the step after {@code index} belongs to the per-sample harvesting block.
     */
    public boolean isFollowedByHarvest(int index) {
        return index + 1 < steps.size() && steps.get(index + 1).stage() == Stage.ONLINE_HARVEST;
    }

    /**
     * Visits, in order, every step after the leading GROUPBY whose stage is in {@code stages}.
     */
    public void walk(Set<Stage> stages, StepVisitor visitor) {
        for (int i = 1; i < steps.size(); i++) {
            var step = steps.get(i);
            if (!stages.contains(step.stage())) {
                continue;
            }
            if (!visitor.visit(i, step)) {
                return;
            }
        }
    }

    public String describe(AttributeProvider provider) {
        var joiner = new StringJoiner(" | ");
        for (var step : steps) {
            var text = new StringBuilder(step.stage().name()).append(' ').append(step.type().name());
            if (!step.columns().isEmpty()) {
                text.append(' ').append(step.columns().stream()
                    .map(column -> provider == null ? column.id() : provider.prettyName(column))
                    .collect(Collectors.joining("/")));
            }
            if (!step.arg().isEmpty()) {
                text.append(" (").append(step.arg()).append(')');
            }
            joiner.add(text);
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return "SummationSpecification" + steps;
    }

    private static void validate(List<SummationStep> steps) {
        if (steps.isEmpty()) {
            throw illegal("A specification needs at least one step");
        }
        var first = steps.get(0);
        if (first.stage() != Stage.ONLINE || first.type() != Type.GROUPBY) {
            throw illegal("The first step must be an ONLINE GROUPBY naming the extracted columns, got " + first);
        }
        Stage previous = Stage.ONLINE;
        for (int i = 1; i < steps.size(); i++) {
            var step = steps.get(i);
            if (step.type() == Type.NONE) {
                throw illegal("Step " + i + " has no type");
            }
            if (step.stage().compareTo(previous) < 0) {
                throw illegal("Step " + i + " (" + step + ") goes back to an earlier stage");
            }
            if (step.stage() == Stage.ONLINE_HARVEST && previous != Stage.ONLINE_HARVEST) {
                var before = steps.get(i - 1);
                if (before.type() != Type.COUNT || before.stage() != Stage.ONLINE) {
                    throw illegal("Per-sample harvesting at step " + i + " must follow an ONLINE COUNT");
                }
            }
            if (step.type() == Type.EXTEND_X || step.type() == Type.EXTEND_Y) {
                step.extendedColumn();
            }
            switch (step.stage()) {
                case ONLINE:
                    if (step.type() == Type.GROUPBY) {
                        throw illegal("GROUPBY at step " + i + " needs per-sample harvesting (COUNT first)");
                    }
                    if (step.type() == Type.REDUCE || step.type() == Type.CUSTOM) {
                        throw illegal(step.type() + " is not supported online; SAVE first to switch to harvesting");
                    }
                    break;
                case ONLINE_HARVEST:
                    if (step.type() == Type.REDUCE || step.type() == Type.CUSTOM || step.type() == Type.COUNT) {
                        throw illegal(step.type() + " is not supported in per-sample harvesting");
                    }
                    break;
                case OFFLINE:
                    if (step.type() == Type.COUNT) {
                        throw illegal("COUNT is not supported in offline harvesting");
                    }
                    break;
                default:
                    throw illegal("Unknown stage " + step.stage());
            }
            previous = step.stage();
        }
    }

    private static SpecificationException illegal(String message) {
        return new SpecificationException(SpecificationException.ILLEGAL_STEP, message);
    }

    /**
     * Fluent construction. The builder starts in the online stage; {@link #perSample()} opens the
     * per-sample harvesting block and {@link #save()} closes the online part.
     */
    public static final class Builder {
        private final List<SummationStep> steps = new ArrayList<>();
        private Stage stage = Stage.ONLINE;

        public Builder groupBy(String... columns) {
            return add(Type.GROUPBY, columns, "");
        }

        public Builder count() {
            return add(Type.COUNT, new String[0], "");
        }

        public Builder perSample() {
            stage = Stage.ONLINE_HARVEST;
            return this;
        }

        public Builder extendX(String column) {
            return add(Type.EXTEND_X, new String[] {column}, "");
        }

        public Builder extendY(String column) {
            return add(Type.EXTEND_Y, new String[] {column}, "");
        }

        public Builder reduce(String reduction) {
            return add(Type.REDUCE, new String[0], reduction);
        }

        public Builder custom(String hook) {
            return add(Type.CUSTOM, new String[0], hook);
        }

        /** Appends a SAVE; online, it also moves the builder to the offline stage. */
        public Builder save() {
            add(Type.SAVE, new String[0], "");
            stage = Stage.OFFLINE;
            return this;
        }

        public Builder step(SummationStep step) {
            steps.add(step);
            stage = step.stage();
            return this;
        }

        public SummationSpecification build() {
            return new SummationSpecification(steps);
        }

        private Builder add(Type type, String[] columns, String arg) {
            var list = new ArrayList<Column>(columns.length);
            for (String column : columns) {
                list.add(Column.of(column));
            }
            steps.add(new SummationStep(stage, type, list, arg));
            return this;
        }
    }
}
