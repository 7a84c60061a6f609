package work.lcod.summation.runtime;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.summation.table.Column;

/**
 * One operation of a specification.
 */
public record SummationStep(Stage stage, Type type, List<Column> columns, String arg) {
    public enum Stage {
        /** Executed for every sample. */
        ONLINE,
        /** Executed for every counter at the end of a unit (per-sample harvesting). */
        ONLINE_HARVEST,
        /** Executed once on the reloaded table at harvest time. */
        OFFLINE;

        public static Stage from(String value) {
            return parse(Stage.class, value, "stage");
        }
    }

    public enum Type {
        SAVE,
        COUNT,
        EXTEND_X,
        EXTEND_Y,
        GROUPBY,
        REDUCE,
        CUSTOM,
        NONE;

        public static Type from(String value) {
            return parse(Type.class, value, "step type");
        }
    }

    public SummationStep {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(type, "type");
        columns = columns == null ? List.of() : List.copyOf(columns);
        arg = arg == null ? "" : arg;
    }

    public static SummationStep of(Stage stage, Type type, Column... columns) {
        return new SummationStep(stage, type, List.of(columns), "");
    }

    /** The single column an EXTEND step moves into an axis. */
    public Column extendedColumn() {
        if (columns.size() != 1) {
            throw new SpecificationException(
                SpecificationException.ILLEGAL_STEP,
                type + " needs exactly one column, got " + columns
            );
        }
        return columns.get(0);
    }

    @Override
    public String toString() {
        var builder = new StringBuilder(stage.name()).append(' ').append(type.name());
        if (!columns.isEmpty()) {
            builder.append(' ').append(columns.stream().map(Column::id).collect(Collectors.joining("/")));
        }
        if (!arg.isEmpty()) {
            builder.append(" (").append(arg).append(')');
        }
        return builder.toString();
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + label);
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported " + label + ": " + value);
        }
    }
}
