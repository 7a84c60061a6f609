package work.lcod.summation.runtime;

import java.util.Locale;
import java.util.Optional;
import work.lcod.summation.table.Histogram;

/**
 * Functions collapsing a histogram into a single number, selected by the argument of a
 * REDUCE step.
 */
public enum Reduction {
    MEAN("mean_") {
        @Override
        public double apply(Histogram histogram) {
            return histogram.mean();
        }

        @Override
        public String label(Histogram histogram) {
            return "mean of " + histogram.xAxis().title();
        }
    },
    COUNT("num_") {
        @Override
        public double apply(Histogram histogram) {
            return histogram.entries();
        }

        @Override
        public String label(Histogram histogram) {
            return "# of " + histogram.xAxis().title() + " entries";
        }
    };

    private final String prefix;

    Reduction(String prefix) {
        this.prefix = prefix;
    }

    public abstract double apply(Histogram histogram);

    public abstract String label(Histogram histogram);

    /** Name of the reduced histogram. */
    public String rename(String name) {
        return prefix + name;
    }

    /**
     * Returns the single-bin histogram holding the reduction of {@code source}.
     */
    public Histogram reduce(Histogram source) {
        var reduced = Histogram.create1D(rename(source.name()), source.title() + ";;" + label(source), 1, 0.0, 1.0);
        reduced.setBinContent(1, apply(source));
        return reduced;
    }

    public static Optional<Reduction> find(String arg) {
        if (arg == null || arg.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Reduction.valueOf(arg.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
