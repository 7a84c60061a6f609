package work.lcod.summation.table;

import java.util.Objects;

/**
 * Handle on a histogram owned by a histogram store. Filling the handle fills the stored copy.
 */
public final class StoredHistogram {
    private final String path;
    private final Histogram histogram;

    public StoredHistogram(String path, Histogram histogram) {
        this.path = Objects.requireNonNull(path, "path");
        this.histogram = Objects.requireNonNull(histogram, "histogram");
    }

    public String path() {
        return path;
    }

    public Histogram histogram() {
        return histogram;
    }

    public void setAxisTitle(String title, int axis) {
        histogram.setAxisTitle(title, axis);
    }

    @Override
    public String toString() {
        return "StoredHistogram{" + path + "}";
    }
}
