package work.lcod.summation.table;

/**
 * Fixed-width binning of one histogram axis. Bins are numbered from 1; bin 0 is the underflow
 * and {@code nbins + 1} the overflow.
 */
public record Axis(int nbins, double min, double max, String title) {
    public Axis {
        if (nbins < 1) {
            throw new IllegalArgumentException("Axis needs at least one bin, got " + nbins);
        }
        if (!(max > min)) {
            throw new IllegalArgumentException("Axis range is empty: [" + min + ", " + max + ")");
        }
        title = title == null ? "" : title;
    }

    /** The single-bin axis a one-dimensional histogram carries as its y axis. */
    public static Axis unit(String title) {
        return new Axis(1, 0.0, 1.0, title);
    }

    public int findBin(double x) {
        if (Double.isNaN(x) || x < min) {
            return 0;
        }
        if (x >= max) {
            return nbins + 1;
        }
        int bin = 1 + (int) (nbins * (x - min) / (max - min));
        return Math.min(bin, nbins);
    }

    public double width() {
        return (max - min) / nbins;
    }

    public double center(int bin) {
        return min + (bin - 0.5) * width();
    }

    public Axis withTitle(String newTitle) {
        return new Axis(nbins, min, max, newTitle);
    }
}
