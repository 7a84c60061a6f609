package work.lcod.summation.table;

import java.util.Objects;

/**
 * Identifier of one categorical dimension. Display name, value range and formatting are
 * answered by the attribute provider that declares the column.
 */
public record Column(String id) {
    public Column {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Column id must not be blank");
        }
    }

    public static Column of(String id) {
        return new Column(id.trim());
    }

    @Override
    public String toString() {
        return id;
    }
}
