package work.lcod.summation.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import work.lcod.summation.table.Axis;
import work.lcod.summation.table.Histogram;
import work.lcod.summation.table.StoredHistogram;

/**
 * Histogram store kept in memory, keyed by full path. Booking an existing path returns the
 * histogram already stored there.
 */
public final class InMemoryHistogramStore implements HistogramStore {
    private final Map<String, StoredHistogram> histograms = new TreeMap<>();
    private String currentFolder = "";

    @Override
    public Optional<StoredHistogram> get(String path) {
        return Optional.ofNullable(histograms.get(normalize(path)));
    }

    @Override
    public void setCurrentFolder(String folder) {
        currentFolder = normalizeFolder(folder);
    }

    public String currentFolder() {
        return currentFolder;
    }

    @Override
    public StoredHistogram book1D(String name, String title, int nbins, double min, double max) {
        return book(name, () -> Histogram.create1D(name, title, nbins, min, max));
    }

    @Override
    public StoredHistogram book2D(
        String name,
        String title,
        int nbinsX,
        double minX,
        double maxX,
        int nbinsY,
        double minY,
        double maxY
    ) {
        return book(name, () -> Histogram.create2D(name, title, nbinsX, minX, maxX, nbinsY, minY, maxY));
    }

    public int size() {
        return histograms.size();
    }

    public List<String> paths() {
        return new ArrayList<>(histograms.keySet());
    }

    /**
     * Serialisable view of the store: path to name, title, axes, entries and bin contents.
     */
    public Map<String, Object> snapshot() {
        var result = new LinkedHashMap<String, Object>();
        for (var entry : histograms.entrySet()) {
            Histogram h = entry.getValue().histogram();
            var item = new LinkedHashMap<String, Object>();
            item.put("name", h.name());
            item.put("title", h.title());
            item.put("dimension", h.dimension());
            item.put("x", axisMap(h.xAxis()));
            if (h.dimension() == 2) {
                item.put("y", axisMap(h.yAxis()));
            } else {
                item.put("ylabel", h.yAxis().title());
            }
            item.put("entries", h.entries());
            item.put("bins", toList(h.binContents()));
            result.put(entry.getKey(), item);
        }
        return Collections.unmodifiableMap(result);
    }

    private StoredHistogram book(String name, Supplier<Histogram> factory) {
        String path = currentFolder.isEmpty() ? name : currentFolder + "/" + name;
        return histograms.computeIfAbsent(path, key -> new StoredHistogram(key, factory.get()));
    }

    private static Map<String, Object> axisMap(Axis axis) {
        var map = new LinkedHashMap<String, Object>();
        map.put("title", axis.title());
        map.put("nbins", axis.nbins());
        map.put("min", axis.min());
        map.put("max", axis.max());
        return map;
    }

    private static List<Double> toList(double[] values) {
        var list = new ArrayList<Double>(values.length);
        for (double value : values) {
            list.add(value);
        }
        return list;
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path.trim();
        while (trimmed.contains("//")) {
            trimmed = trimmed.replace("//", "/");
        }
        return trimmed.startsWith("/") ? trimmed.substring(1) : trimmed;
    }

    private static String normalizeFolder(String folder) {
        String normalized = normalize(folder);
        return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }
}
