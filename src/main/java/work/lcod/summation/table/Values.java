package work.lcod.summation.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Grouping key: an ordered column to value mapping with unique columns.
 *
 * <p>Equality and hashing ignore the column order; iteration keeps insertion order, which is
 * the order used for folder paths. Instances are mutable so the fill path can reuse one
 * scratch key per specification. Keys stored in a {@link Table} are private copies and must
 * not be mutated.
 */
public final class Values implements Comparable<Values> {
    public static final int UNDEFINED = 999_999_999;

    private static final int INITIAL_CAPACITY = 4;

    private Column[] columns;
    private int[] values;
    private int size;
    private int hash;
    private int[] sortedOrder;

    public Values() {
        this(INITIAL_CAPACITY);
    }

    private Values(int capacity) {
        this.columns = new Column[Math.max(capacity, 1)];
        this.values = new int[Math.max(capacity, 1)];
    }

    public static Values of(Object... columnValuePairs) {
        if (columnValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Expected column/value pairs");
        }
        var result = new Values(columnValuePairs.length / 2);
        for (int i = 0; i < columnValuePairs.length; i += 2) {
            Object column = columnValuePairs[i];
            Column col = column instanceof Column c ? c : Column.of(String.valueOf(column));
            result.put(col, ((Number) columnValuePairs[i + 1]).intValue());
        }
        return result;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Column column(int index) {
        checkIndex(index);
        return columns[index];
    }

    public int value(int index) {
        checkIndex(index);
        return values[index];
    }

    public boolean contains(Column column) {
        return indexOf(column) >= 0;
    }

    /**
     * Returns the value of {@code column}, or {@link #UNDEFINED} when the key does not carry it.
     */
    public int get(Column column) {
        int index = indexOf(column);
        return index < 0 ? UNDEFINED : values[index];
    }

    public boolean hasUndefined() {
        for (int i = 0; i < size; i++) {
            if (values[i] == UNDEFINED) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sets {@code column} to {@code value}, appending the column when it is new.
     */
    public Values put(Column column, int value) {
        int index = indexOf(column);
        if (index >= 0) {
            values[index] = value;
        } else {
            ensureCapacity(size + 1);
            columns[size] = column;
            values[size] = value;
            size++;
        }
        touch();
        return this;
    }

    /**
     * Removes {@code column}, keeping the order of the remaining columns.
     */
    public boolean erase(Column column) {
        int index = indexOf(column);
        if (index < 0) {
            return false;
        }
        int tail = size - index - 1;
        if (tail > 0) {
            System.arraycopy(columns, index + 1, columns, index, tail);
            System.arraycopy(values, index + 1, values, index, tail);
        }
        size--;
        columns[size] = null;
        touch();
        return true;
    }

    public void clear() {
        Arrays.fill(columns, 0, size, null);
        size = 0;
        touch();
    }

    /**
     * Replaces the content of this key with {@code other} without allocating when capacity allows.
     */
    public Values copyFrom(Values other) {
        if (other == this) {
            return this;
        }
        ensureCapacity(other.size);
        if (other.size < size) {
            Arrays.fill(columns, other.size, size, null);
        }
        System.arraycopy(other.columns, 0, columns, 0, other.size);
        System.arraycopy(other.values, 0, values, 0, other.size);
        size = other.size;
        touch();
        return this;
    }

    /**
     * Keeps only {@code keep}, in the given order. Columns absent from this key are carried as
     * {@link #UNDEFINED}.
     */
    public Values retainOnly(List<Column> keep) {
        int count = keep.size();
        Column[] newColumns = new Column[Math.max(count, 1)];
        int[] newValues = new int[Math.max(count, 1)];
        for (int i = 0; i < count; i++) {
            newColumns[i] = keep.get(i);
            newValues[i] = get(keep.get(i));
        }
        if (columns.length >= newColumns.length) {
            Arrays.fill(columns, null);
            System.arraycopy(newColumns, 0, columns, 0, count);
            System.arraycopy(newValues, 0, values, 0, count);
        } else {
            columns = newColumns;
            values = newValues;
        }
        size = count;
        touch();
        return this;
    }

    public Values projection(List<Column> keep) {
        return copy().retainOnly(keep);
    }

    public Values without(Column column) {
        var copy = copy();
        copy.erase(column);
        return copy;
    }

    public Values copy() {
        var copy = new Values(size);
        copy.copyFrom(this);
        return copy;
    }

    public List<Column> columns() {
        var list = new ArrayList<Column>(size);
        for (int i = 0; i < size; i++) {
            list.add(columns[i]);
        }
        return list;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Values other) || other.size != size || other.hashCode() != hashCode()) {
            return false;
        }
        for (int i = 0; i < size; i++) {
            int index = other.indexOf(columns[i]);
            if (index < 0 || other.values[index] != values[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            for (int i = 0; i < size; i++) {
                h += mix(columns[i].hashCode() * 31 + values[i]);
            }
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    /**
     * Orders keys by their pairs sorted by column id, so the ordering agrees with
     * {@link #equals(Object)}. Keys differing only in one column sort by that column's value.
     */
    @Override
    public int compareTo(Values other) {
        int[] mine = sortedOrder();
        int[] theirs = other.sortedOrder();
        int common = Math.min(size, other.size);
        for (int i = 0; i < common; i++) {
            int byColumn = columns[mine[i]].id().compareTo(other.columns[theirs[i]].id());
            if (byColumn != 0) {
                return byColumn;
            }
            int byValue = Integer.compare(values[mine[i]], other.values[theirs[i]]);
            if (byValue != 0) {
                return byValue;
            }
        }
        return Integer.compare(size, other.size);
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "{", "}");
        for (int i = 0; i < size; i++) {
            joiner.add(columns[i].id() + "=" + (values[i] == UNDEFINED ? "UNDEFINED" : String.valueOf(values[i])));
        }
        return joiner.toString();
    }

    private int indexOf(Column column) {
        for (int i = 0; i < size; i++) {
            if (columns[i].equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private int[] sortedOrder() {
        int[] order = sortedOrder;
        if (order == null) {
            order = new int[size];
            for (int i = 0; i < size; i++) {
                int j = i;
                while (j > 0 && columns[order[j - 1]].id().compareTo(columns[i].id()) > 0) {
                    order[j] = order[j - 1];
                    j--;
                }
                order[j] = i;
            }
            sortedOrder = order;
        }
        return order;
    }

    private void ensureCapacity(int capacity) {
        if (capacity > columns.length) {
            int grown = Math.max(capacity, columns.length * 2);
            columns = Arrays.copyOf(columns, grown);
            values = Arrays.copyOf(values, grown);
        }
    }

    private void touch() {
        hash = 0;
        sortedOrder = null;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for key of size " + size);
        }
    }

    private static int mix(int h) {
        h ^= h >>> 16;
        h *= 0x7feb352d;
        h ^= h >>> 15;
        return h;
    }
}
