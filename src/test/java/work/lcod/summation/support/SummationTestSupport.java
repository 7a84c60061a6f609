package work.lcod.summation.support;

import java.util.Map;
import work.lcod.summation.attributes.StaticAttributeProvider;
import work.lcod.summation.attributes.ValueFormat;
import work.lcod.summation.runtime.ManagerConfiguration;
import work.lcod.summation.store.InMemoryHistogramStore;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Histogram;

/**
 * Shared fixtures: a small two-layer detector and manager configurations filling it.
 *
 * <pre>
 * module  Layer  Ladder
 *   101     1      1
 *   102     1      2
 *   103     1      3
 *   201     2      1
 * </pre>
 */
public final class SummationTestSupport {
    public static final long M101 = 101L;
    public static final long M102 = 102L;
    public static final long M103 = 103L;
    public static final long M201 = 201L;
    /** Module without a Ladder attribute. */
    public static final long M301 = 301L;

    public static final Column LAYER = Column.of("Layer");
    public static final Column LADDER = Column.of("Ladder");

    private SummationTestSupport() {}

    public static StaticAttributeProvider detector() {
        return detectorBuilder().build();
    }

    public static StaticAttributeProvider detectorWithIncompleteModule() {
        return detectorBuilder()
            .module(M301, Map.of("Layer", 1))
            .build();
    }

    private static StaticAttributeProvider.Builder detectorBuilder() {
        return StaticAttributeProvider.builder()
            .column("Layer", "Layer", 1, 2)
            .column("Ladder", "Ladder", 1, 3)
            .column(new StaticAttributeProvider.ColumnDefinition(
                Column.of("Side"), "Side", 1, 2, ValueFormat.SIGNED, StaticAttributeProvider.Source.ATTRIBUTE
            ))
            .module(M101, Map.of("Layer", 1, "Ladder", 1, "Side", 1))
            .module(M102, Map.of("Layer", 1, "Ladder", 2, "Side", 2))
            .module(M103, Map.of("Layer", 1, "Ladder", 3, "Side", 1))
            .module(M201, Map.of("Layer", 2, "Ladder", 1, "Side", 2));
    }

    /** One-dimensional "adc" manager: 10 bins over [0, 10) in folder {@code Pixel}. */
    public static ManagerConfiguration.Builder adcManager() {
        return ManagerConfiguration.builder()
            .name("adc")
            .title("ADC")
            .xlabel("adc")
            .ylabel("#entries")
            .topFolderName("Pixel")
            .dimensions(1)
            .range(10, 0.0, 10.0);
    }

    /** Zero-dimensional "hits" manager counting samples: 20 bins over [0, 20). */
    public static ManagerConfiguration.Builder hitsManager() {
        return ManagerConfiguration.builder()
            .name("hits")
            .title("Hits")
            .xlabel("hits")
            .topFolderName("Pixel")
            .dimensions(0)
            .range(20, 0.0, 20.0);
    }

    public static Histogram stored(InMemoryHistogramStore store, String path) {
        return store.get(path)
            .orElseThrow(() -> new AssertionError("No histogram at " + path + "; store has " + store.paths()))
            .histogram();
    }

    public static Histogram histogram1D(String name, int nbins, double min, double max, double... fills) {
        var histogram = Histogram.create1D(name, name + ";x;y", nbins, min, max);
        for (double x : fills) {
            histogram.fill(x);
        }
        return histogram;
    }
}
