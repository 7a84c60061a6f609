package work.lcod.summation.attributes;

/**
 * Identifying tuple of a sample: the module it belongs to, the unit (event) it was taken in,
 * and its column/row inside the module.
 *
 * <p>{@link #NO_MODULE} marks samples without a stable module identity; such samples never
 * match a previous tuple, so their key is always extracted again.
 */
public final class SampleContext {
    public static final long NO_MODULE = 0L;

    private long moduleId;
    private long eventId;
    private int col;
    private int row;

    public SampleContext(long moduleId, long eventId, int col, int row) {
        this.moduleId = moduleId;
        this.eventId = eventId;
        this.col = col;
        this.row = row;
    }

    public static SampleContext ofModule(long moduleId) {
        return new SampleContext(moduleId, 0L, 0, 0);
    }

    /** A context that matches no sample, used as the initial state of a cache slot. */
    public static SampleContext unset() {
        return new SampleContext(NO_MODULE, Long.MIN_VALUE, Integer.MIN_VALUE, Integer.MIN_VALUE);
    }

    public long moduleId() {
        return moduleId;
    }

    public long eventId() {
        return eventId;
    }

    public int col() {
        return col;
    }

    public int row() {
        return row;
    }

    public boolean hasStableIdentity() {
        return moduleId != NO_MODULE;
    }

    /**
     * True when the sample identified by the arguments is the one this context last described
     * and that sample has a stable module identity.
     */
    public boolean sameSample(long moduleId, long eventId, int col, int row) {
        return moduleId != NO_MODULE
            && this.moduleId == moduleId
            && this.eventId == eventId
            && this.col == col
            && this.row == row;
    }

    public void set(long moduleId, long eventId, int col, int row) {
        this.moduleId = moduleId;
        this.eventId = eventId;
        this.col = col;
        this.row = row;
    }

    public void reset() {
        set(NO_MODULE, Long.MIN_VALUE, Integer.MIN_VALUE, Integer.MIN_VALUE);
    }

    @Override
    public String toString() {
        return "SampleContext{module=" + moduleId + ", event=" + eventId + ", col=" + col + ", row=" + row + "}";
    }
}
