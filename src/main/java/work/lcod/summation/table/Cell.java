package work.lcod.summation.table;

import java.util.Objects;

/**
 * State of one table bucket: a running counter, an in-memory histogram, or a handle on a
 * stored histogram. A bucket without state is simply absent from its {@link Table}.
 */
public abstract sealed class Cell permits Cell.Counter, Cell.Local, Cell.Stored {
    public enum Kind {
        COUNTER,
        LOCAL,
        STORED
    }

    private Cell() {}

    public abstract Kind kind();

    public boolean hasHistogram() {
        return false;
    }

    /**
     * Histogram carried by this cell.
     *
     * @throws IllegalStateException for counters
     */
    public Histogram histogram() {
        throw new IllegalStateException("Cell of kind " + kind() + " carries no histogram");
    }

    public void fill() {
        histogram().fill(0.0);
    }

    public void fill(double x) {
        histogram().fill(x);
    }

    public void fill(double x, double y) {
        histogram().fill(x, y);
    }

    public static Counter counter() {
        return new Counter();
    }

    public static Local local(Histogram histogram) {
        return new Local(histogram);
    }

    public static Stored stored(StoredHistogram handle) {
        return new Stored(handle);
    }

    public static final class Counter extends Cell {
        private long count;

        private Counter() {}

        @Override
        public Kind kind() {
            return Kind.COUNTER;
        }

        public void increment() {
            count++;
        }

        public long count() {
            return count;
        }

        public void reset() {
            count = 0;
        }

        @Override
        public String toString() {
            return "Counter{" + count + "}";
        }
    }

    public static final class Local extends Cell {
        private final Histogram histogram;

        private Local(Histogram histogram) {
            this.histogram = Objects.requireNonNull(histogram, "histogram");
        }

        @Override
        public Kind kind() {
            return Kind.LOCAL;
        }

        @Override
        public boolean hasHistogram() {
            return true;
        }

        @Override
        public Histogram histogram() {
            return histogram;
        }

        @Override
        public String toString() {
            return "Local{" + histogram.name() + "}";
        }
    }

    public static final class Stored extends Cell {
        private final StoredHistogram handle;

        private Stored(StoredHistogram handle) {
            this.handle = Objects.requireNonNull(handle, "handle");
        }

        @Override
        public Kind kind() {
            return Kind.STORED;
        }

        public StoredHistogram handle() {
            return handle;
        }

        @Override
        public boolean hasHistogram() {
            return true;
        }

        @Override
        public Histogram histogram() {
            return handle.histogram();
        }

        @Override
        public String toString() {
            return "Stored{" + handle.path() + "}";
        }
    }
}
