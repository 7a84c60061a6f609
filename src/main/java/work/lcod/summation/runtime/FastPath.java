package work.lcod.summation.runtime;

import work.lcod.summation.table.Cell;

/**
 * Single-slot memo of the cell the last sample of a specification ended up in. Either empty
 * or holding one cell; every operation that changes the key must call {@link #invalidate()}
 * first.
 */
public final class FastPath {
    private Cell cell;

    public boolean isValid() {
        return cell != null;
    }

    /** The cached cell, or {@code null} when empty. */
    public Cell cell() {
        return cell;
    }

    public void set(Cell cell) {
        this.cell = cell;
    }

    public void invalidate() {
        cell = null;
    }
}
