package work.lcod.summation.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one {@link SummationRunner} execution.
 */
public record SummationRunConfiguration(
    Path configurationFile,
    Optional<Path> samplesFile,
    Path workingDirectory,
    Map<String, Object> setup
) {
    public SummationRunConfiguration {
        Objects.requireNonNull(configurationFile, "configurationFile");
        Objects.requireNonNull(samplesFile, "samplesFile");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        setup = setup == null ? Map.of() : Map.copyOf(setup);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path configurationFile;
        private Optional<Path> samplesFile = Optional.empty();
        private Path workingDirectory;
        private Map<String, Object> setup = Map.of();

        public Builder configurationFile(Path configurationFile) {
            this.configurationFile = configurationFile;
            return this;
        }

        public Builder samplesFile(Path samplesFile) {
            this.samplesFile = Optional.ofNullable(samplesFile);
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder setup(Map<String, Object> setup) {
            this.setup = setup;
            return this;
        }

        public SummationRunConfiguration build() {
            Path directory = workingDirectory;
            if (directory == null && configurationFile != null) {
                directory = configurationFile.toAbsolutePath().getParent();
            }
            return new SummationRunConfiguration(configurationFile, samplesFile, directory, setup);
        }
    }
}
