package work.lcod.summation.cli;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.summation.api.RunResult;
import work.lcod.summation.api.SummationRunConfiguration;
import work.lcod.summation.api.SummationRunner;

@CommandLine.Command(
    name = "summation-run",
    description = "Book, fill and harvest the histograms of one manager configuration.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SummationRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        required = true,
        paramLabel = "PATH",
        description = "Manager configuration (.yaml, .yml, .json or .toml)."
    )
    private Path config;

    @CommandLine.Option(
        names = {"-s", "--samples"},
        paramLabel = "PATH",
        description = "CSV samples with header module,event,col,row,x,y.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path samples;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Write the JSON result to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws Exception {
        Path configPath = config.toAbsolutePath().normalize();
        if (!Files.exists(configPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + configPath);
        }
        Path samplesPath = null;
        if (samples != null) {
            samplesPath = samples.toAbsolutePath().normalize();
            if (!Files.exists(samplesPath)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Samples file not found: " + samplesPath);
            }
        }

        SummationRunConfiguration configuration = SummationRunConfiguration.builder()
            .configurationFile(configPath)
            .samplesFile(samplesPath)
            .workingDirectory(Paths.get("").toAbsolutePath())
            .build();
        RunResult result = new SummationRunner().run(configuration);

        String json = result.toPrettyJson();
        if (output != null) {
            Path target = output.toAbsolutePath().normalize();
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json + System.lineSeparator(), StandardCharsets.UTF_8);
        } else {
            spec.commandLine().getOut().println(json);
        }
        if (result.status() == RunResult.Status.FAILURE) {
            spec.commandLine().getErr().println(result.summary());
        }
        return result.status().exitCode();
    }
}
