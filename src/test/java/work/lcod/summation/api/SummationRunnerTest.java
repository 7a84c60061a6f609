package work.lcod.summation.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SummationRunnerTest {
    private static final Path CONFIGS = Path.of("src", "test", "resources", "configs").toAbsolutePath();

    @Test
    void runsOnlineAndOfflineSteps() {
        var config = SummationRunConfiguration.builder()
            .configurationFile(CONFIGS.resolve("adc.yaml"))
            .samplesFile(CONFIGS.resolve("adc-samples.csv"))
            .build();

        var result = new SummationRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        assertEquals(5, result.metadata().get("samples"));
        assertEquals(2, result.metadata().get("events"));
        var histograms = histograms(result);
        assertEquals(List.of(0.0, 2.0, 1.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0), bins(histograms, "Pixel/Layer_1/Module_101/adc"));
        assertEquals(List.of(0.0, 2.0, 2.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0), bins(histograms, "Pixel/Layer_1/adc"));
        assertEquals(1.0, bins(histograms, "Pixel/Layer_2/adc").get(7));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
        assertEquals(histograms.size(), result.histogramCount());
        assertTrue(result.summary().startsWith("success: " + histograms.size() + " histogram(s)"));
    }

    @Test
    void harvestsPerEvent() {
        var config = SummationRunConfiguration.builder()
            .configurationFile(CONFIGS.resolve("hits.toml"))
            .samplesFile(CONFIGS.resolve("hits-samples.csv"))
            .build();

        var result = new SummationRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status(), () -> String.valueOf(result.metadata()));
        var layer1 = bins(histograms(result), "Layer_1/num_hits");
        assertEquals(1.0, layer1.get(0));
        assertEquals(2.0, layer1.get(1));
        assertEquals(1.0, layer1.get(2));
        var layer2 = bins(histograms(result), "Layer_2/num_hits");
        assertEquals(1.0, layer2.get(1));
        assertEquals(1.0, layer2.get(2));
    }

    @Test
    void bookingWithoutSamplesStillHarvests() {
        var config = SummationRunConfiguration.builder()
            .configurationFile(CONFIGS.resolve("adc.yaml"))
            .build();

        var result = new SummationRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(0, result.metadata().get("samples"));
        assertTrue(histograms(result).containsKey("Pixel/Layer_2/adc"));
    }

    @Test
    void reportsFailureWithoutAttributes(@TempDir Path dir) throws Exception {
        var file = dir.resolve("bare.yaml");
        Files.writeString(file, "manager:\n  name: bare\n  specs: []\n");

        var result = new SummationRunner().run(SummationRunConfiguration.builder().configurationFile(file).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(String.valueOf(result.metadata().get("error")).contains("attributes"));
    }

    @Test
    void reportsSpecificationErrorCode(@TempDir Path dir) throws Exception {
        var file = dir.resolve("conflict.yaml");
        Files.writeString(file, String.join("\n",
            "manager:",
            "  name: hits",
            "  dimensions: 0",
            "  specs:",
            "    - steps:",
            "        - { stage: ONLINE, type: GROUPBY, columns: Layer }",
            "        - { stage: ONLINE, type: COUNT }",
            "        - { stage: ONLINE_HARVEST, type: GROUPBY, columns: Layer }",
            "        - { stage: ONLINE_HARVEST, type: SAVE }",
            "attributes:",
            "  columns: [ { id: Layer, min: 1, max: 1 } ]",
            "  modules: [ { id: 1, Layer: 1 } ]",
            ""
        ));

        var result = new SummationRunner().run(SummationRunConfiguration.builder().configurationFile(file).build());

        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals("counter_conflict", result.metadata().get("code"));
        assertEquals(Optional.of("counter_conflict"), result.errorCode());
        assertEquals(0, result.histogramCount());
        assertTrue(result.summary().startsWith("failure [counter_conflict]: "));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> histograms(RunResult result) {
        return (Map<String, Object>) result.metadata().get("histograms");
    }

    @SuppressWarnings("unchecked")
    private static List<Double> bins(Map<String, Object> histograms, String path) {
        var item = (Map<String, Object>) histograms.get(path);
        if (item == null) {
            throw new AssertionError("No histogram " + path + " in " + histograms.keySet());
        }
        return (List<Double>) item.get("bins");
    }
}
