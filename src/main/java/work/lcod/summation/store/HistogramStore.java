package work.lcod.summation.store;

import java.util.Optional;
import work.lcod.summation.table.StoredHistogram;

/**
 * Persistent histogram storage addressed by folder path and histogram name.
 *
 * <p>Booking happens relative to the current folder. Titles use the compound
 * {@code title;xlabel;ylabel} convention.
 */
public interface HistogramStore {
    Optional<StoredHistogram> get(String path);

    void setCurrentFolder(String folder);

    StoredHistogram book1D(String name, String title, int nbins, double min, double max);

    StoredHistogram book2D(
        String name,
        String title,
        int nbinsX,
        double minX,
        double maxX,
        int nbinsY,
        double minY,
        double maxY
    );
}
