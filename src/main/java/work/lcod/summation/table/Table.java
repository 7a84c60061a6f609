package work.lcod.summation.table;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Key to cell mapping driven by one specification. Lookups hash the key; ordered traversal
 * sorts by {@link Values#compareTo(Values)}.
 */
public final class Table {
    private Map<Values, Cell> cells = new HashMap<>();

    public Cell get(Values key) {
        return cells.get(key);
    }

    /**
     * Returns the counter at {@code key}, creating it on first access.
     *
     * @throws IllegalStateException when the key already holds a histogram
     */
    public Cell.Counter counter(Values key) {
        Cell cell = cells.get(key);
        if (cell == null) {
            Cell.Counter counter = Cell.counter();
            cells.put(key.copy(), counter);
            return counter;
        }
        if (cell instanceof Cell.Counter counter) {
            return counter;
        }
        throw new IllegalStateException("Key " + key + " holds a " + cell.kind() + " cell, not a counter");
    }

    /**
     * Stores {@code cell} under a private copy of {@code key}, replacing any previous cell.
     */
    public void put(Values key, Cell cell) {
        Cell previous = cells.get(key);
        if (previous == null) {
            cells.put(key.copy(), cell);
        } else {
            cells.replace(key, cell);
        }
    }

    public boolean contains(Values key) {
        return cells.containsKey(key);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /** Entries in key order. Keys are the table's own copies and must not be mutated. */
    public List<Map.Entry<Values, Cell>> entries() {
        var list = new ArrayList<>(cells.entrySet());
        list.sort(Map.Entry.comparingByKey());
        return list;
    }

    /**
     * Visits every counter in no particular order. {@code action} must not add or remove cells.
     */
    public void forEachCounter(BiConsumer<Values, Cell.Counter> action) {
        for (var entry : cells.entrySet()) {
            if (entry.getValue() instanceof Cell.Counter counter) {
                action.accept(entry.getKey(), counter);
            }
        }
    }

    /**
     * Takes over the content of {@code other}, which is left empty.
     */
    public void swap(Table other) {
        var mine = cells;
        cells = other.cells;
        other.cells = mine;
        other.cells.clear();
    }

    public void clear() {
        cells.clear();
    }

    @Override
    public String toString() {
        return "Table" + cells;
    }
}
