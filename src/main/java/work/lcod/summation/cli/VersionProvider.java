package work.lcod.summation.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.lcod.summation.runtime.Reduction;
import work.lcod.summation.runtime.SummationStep;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "summation-run (java) " + version,
            "steps: " + names(Arrays.stream(SummationStep.Type.values()).filter(t -> t != SummationStep.Type.NONE).toArray()),
            "reductions: " + names(Reduction.values())
        };
    }

    private static String names(Object[] constants) {
        return Arrays.stream(constants).map(String::valueOf).collect(Collectors.joining(", "));
    }
}
