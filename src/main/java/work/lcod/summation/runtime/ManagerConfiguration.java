package work.lcod.summation.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of one {@link HistogramManager}: switches, the defaults copied into
 * every booked histogram, and the enabled specifications.
 */
public record ManagerConfiguration(
    boolean enabled,
    boolean bookUndefined,
    String topFolderName,
    String name,
    String title,
    String xlabel,
    String ylabel,
    int dimensions,
    int rangeNbins,
    double rangeMin,
    double rangeMax,
    int rangeYNbins,
    double rangeYMin,
    double rangeYMax,
    List<SummationSpecification> specs
) {
    public ManagerConfiguration {
        Objects.requireNonNull(topFolderName, "topFolderName");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(xlabel, "xlabel");
        Objects.requireNonNull(ylabel, "ylabel");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Manager name must not be blank");
        }
        if (dimensions < 0 || dimensions > 2) {
            throw new IllegalArgumentException("dimensions must be 0, 1 or 2, got " + dimensions);
        }
        specs = specs == null ? List.of() : List.copyOf(specs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean bookUndefined = true;
        private String topFolderName = "";
        private String name;
        private String title = "";
        private String xlabel = "";
        private String ylabel = "";
        private int dimensions = 1;
        private int rangeNbins = 100;
        private double rangeMin = 0.0;
        private double rangeMax = 100.0;
        private int rangeYNbins = 100;
        private double rangeYMin = 0.0;
        private double rangeYMax = 100.0;
        private final List<SummationSpecification> specs = new ArrayList<>();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder bookUndefined(boolean bookUndefined) {
            this.bookUndefined = bookUndefined;
            return this;
        }

        public Builder topFolderName(String topFolderName) {
            this.topFolderName = topFolderName;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder xlabel(String xlabel) {
            this.xlabel = xlabel;
            return this;
        }

        public Builder ylabel(String ylabel) {
            this.ylabel = ylabel;
            return this;
        }

        public Builder dimensions(int dimensions) {
            this.dimensions = dimensions;
            return this;
        }

        public Builder range(int nbins, double min, double max) {
            this.rangeNbins = nbins;
            this.rangeMin = min;
            this.rangeMax = max;
            return this;
        }

        public Builder rangeY(int nbins, double min, double max) {
            this.rangeYNbins = nbins;
            this.rangeYMin = min;
            this.rangeYMax = max;
            return this;
        }

        public Builder spec(SummationSpecification spec) {
            specs.add(spec);
            return this;
        }

        public ManagerConfiguration build() {
            return new ManagerConfiguration(
                enabled,
                bookUndefined,
                topFolderName,
                name,
                title,
                xlabel,
                ylabel,
                dimensions,
                rangeNbins,
                rangeMin,
                rangeMax,
                rangeYNbins,
                rangeYMin,
                rangeYMax,
                specs
            );
        }
    }
}
