package work.lcod.summation.table;

import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory one or two dimensional histogram with under- and overflow bins.
 *
 * <p>Titles follow the compound {@code title;xlabel;ylabel} convention: {@link #create1D} and
 * {@link #create2D} split the given title into the histogram title and the axis titles.
 */
public final class Histogram {
    private final String name;
    private String title;
    private final int dimension;
    private Axis xAxis;
    private Axis yAxis;
    private final double[] contents;
    private double entries;

    private Histogram(String name, String title, int dimension, Axis xAxis, Axis yAxis) {
        this.name = Objects.requireNonNull(name, "name");
        this.title = title == null ? "" : title;
        this.dimension = dimension;
        this.xAxis = xAxis;
        this.yAxis = yAxis;
        int rows = dimension == 1 ? 1 : yAxis.nbins() + 2;
        this.contents = new double[(xAxis.nbins() + 2) * rows];
    }

    private Histogram(Histogram source) {
        this.name = source.name;
        this.title = source.title;
        this.dimension = source.dimension;
        this.xAxis = source.xAxis;
        this.yAxis = source.yAxis;
        this.contents = source.contents.clone();
        this.entries = source.entries;
    }

    public static Histogram create1D(String name, String compoundTitle, int nbins, double min, double max) {
        String[] parts = splitTitle(compoundTitle);
        return new Histogram(name, parts[0], 1, new Axis(nbins, min, max, parts[1]), Axis.unit(parts[2]));
    }

    public static Histogram create2D(
        String name,
        String compoundTitle,
        int nbinsX,
        double minX,
        double maxX,
        int nbinsY,
        double minY,
        double maxY
    ) {
        String[] parts = splitTitle(compoundTitle);
        return new Histogram(
            name,
            parts[0],
            2,
            new Axis(nbinsX, minX, maxX, parts[1]),
            new Axis(nbinsY, minY, maxY, parts[2])
        );
    }

    public String name() {
        return name;
    }

    public String title() {
        return title;
    }

    public int dimension() {
        return dimension;
    }

    public Axis xAxis() {
        return xAxis;
    }

    public Axis yAxis() {
        return yAxis;
    }

    public double entries() {
        return entries;
    }

    public void setTitle(String title) {
        this.title = title == null ? "" : title;
    }

    /**
     * Sets the title of axis 1 (x) or 2 (y).
     */
    public void setAxisTitle(String axisTitle, int axis) {
        if (axis == 1) {
            xAxis = xAxis.withTitle(axisTitle);
        } else if (axis == 2) {
            yAxis = yAxis.withTitle(axisTitle);
        } else {
            throw new IllegalArgumentException("Unknown axis " + axis);
        }
    }

    public void fill(double x) {
        if (dimension == 1) {
            contents[xAxis.findBin(x)] += 1.0;
        } else {
            contents[index(xAxis.findBin(x), yAxis.findBin(0.0))] += 1.0;
        }
        entries += 1.0;
    }

    public void fill(double x, double y) {
        if (dimension == 1) {
            fill(x);
            return;
        }
        contents[index(xAxis.findBin(x), yAxis.findBin(y))] += 1.0;
        entries += 1.0;
    }

    public double getBinContent(int binX) {
        return contents[index(binX, 1)];
    }

    /**
     * Content of bin {@code (binX, binY)}; a one-dimensional histogram ignores {@code binY}.
     */
    public double getBinContent(int binX, int binY) {
        return contents[index(binX, binY)];
    }

    public void setBinContent(int binX, double value) {
        setBinContent(binX, 1, value);
    }

    public void setBinContent(int binX, int binY, double value) {
        contents[index(binX, binY)] = value;
        entries += 1.0;
    }

    /**
     * Adds {@code other} bin by bin. Both histograms must share the same binning.
     */
    public void add(Histogram other) {
        if (other.dimension != dimension
            || other.xAxis.nbins() != xAxis.nbins()
            || other.yAxis.nbins() != yAxis.nbins()) {
            throw new IllegalArgumentException(
                "Cannot add histogram '" + other.name + "' to '" + name + "': binning differs"
            );
        }
        for (int i = 0; i < contents.length; i++) {
            contents[i] += other.contents[i];
        }
        entries += other.entries;
    }

    /**
     * Mean along x, weighted by in-range bin contents at the bin centers.
     */
    public double mean() {
        double sumW = 0.0;
        double sumWX = 0.0;
        int rows = dimension == 1 ? 1 : yAxis.nbins();
        for (int i = 1; i <= xAxis.nbins(); i++) {
            double center = xAxis.center(i);
            for (int j = 1; j <= rows; j++) {
                double w = getBinContent(i, j);
                sumW += w;
                sumWX += w * center;
            }
        }
        return sumW == 0.0 ? 0.0 : sumWX / sumW;
    }

    public double integral() {
        double sum = 0.0;
        int rows = dimension == 1 ? 1 : yAxis.nbins();
        for (int i = 1; i <= xAxis.nbins(); i++) {
            for (int j = 1; j <= rows; j++) {
                sum += getBinContent(i, j);
            }
        }
        return sum;
    }

    /** Copy of the in-range bin contents, row-major over y for two dimensional histograms. */
    public double[] binContents() {
        int rows = dimension == 1 ? 1 : yAxis.nbins();
        double[] result = new double[xAxis.nbins() * rows];
        int k = 0;
        for (int j = 1; j <= rows; j++) {
            for (int i = 1; i <= xAxis.nbins(); i++) {
                result[k++] = getBinContent(i, j);
            }
        }
        return result;
    }

    public Histogram copy() {
        return new Histogram(this);
    }

    @Override
    public String toString() {
        return "Histogram{" + name + ", dim=" + dimension + ", x=" + xAxis + ", y=" + yAxis
            + ", entries=" + entries + ", bins=" + Arrays.toString(binContents()) + "}";
    }

    private int index(int binX, int binY) {
        if (binX < 0 || binX > xAxis.nbins() + 1) {
            throw new IndexOutOfBoundsException("x bin " + binX + " outside histogram '" + name + "'");
        }
        if (dimension == 1) {
            return binX;
        }
        if (binY < 0 || binY > yAxis.nbins() + 1) {
            throw new IndexOutOfBoundsException("y bin " + binY + " outside histogram '" + name + "'");
        }
        return binY * (xAxis.nbins() + 2) + binX;
    }

    private static String[] splitTitle(String compoundTitle) {
        String[] result = {"", "", ""};
        if (compoundTitle == null) {
            return result;
        }
        String[] parts = compoundTitle.split(";", -1);
        for (int i = 0; i < Math.min(parts.length, 3); i++) {
            result[i] = parts[i];
        }
        return result;
    }
}
