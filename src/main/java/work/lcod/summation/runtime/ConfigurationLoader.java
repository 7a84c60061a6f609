package work.lcod.summation.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.summation.attributes.StaticAttributeProvider;
import work.lcod.summation.attributes.ValueFormat;
import work.lcod.summation.table.Column;

/**
 * Loads a manager configuration (and optionally a static attribute domain) from YAML, JSON or
 * TOML.
 *
 * <pre>
 * manager:
 *   name: adc
 *   specs:
 *     - steps:
 *         - { stage: ONLINE, type: GROUPBY, columns: PXLayer/DetId }
 *         - { stage: ONLINE, type: SAVE }
 * attributes:
 *   columns: [ { id: PXLayer, min: 1, max: 4 } ]
 *   modules: [ { id: 101, PXLayer: 1 } ]
 * </pre>
 */
public final class ConfigurationLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();

    private ConfigurationLoader() {}

    public record LoadedConfiguration(ManagerConfiguration manager, Optional<StaticAttributeProvider> attributes) {}

    public static LoadedConfiguration loadFromLocalFile(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (fileName.endsWith(".toml")) {
                return parseToml(Files.readString(path), path.toString());
            }
            try (var in = Files.newInputStream(path)) {
                return parse(in, path.toString());
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
    }

    public static LoadedConfiguration parse(InputStream in, String origin) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        return fromTree(root, origin);
    }

    public static LoadedConfiguration parseToml(String text, String origin) {
        return fromTree(tomlTree(text, origin), origin);
    }

    private static JsonNode tomlTree(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid TOML in " + origin + ": " + result.errors().get(0));
        }
        return JSON.valueToTree(convertTomlTable(result));
    }

    private static LoadedConfiguration fromTree(JsonNode root, String origin) {
        if (root == null || !root.hasNonNull("manager")) {
            throw new IllegalStateException("Configuration " + origin + " has no 'manager' section");
        }
        var manager = readManager(root.get("manager"), origin);
        Optional<StaticAttributeProvider> attributes = root.hasNonNull("attributes")
            ? Optional.of(readAttributes(root.get("attributes"), origin))
            : Optional.empty();
        return new LoadedConfiguration(manager, attributes);
    }

    private static ManagerConfiguration readManager(JsonNode node, String origin) {
        var builder = ManagerConfiguration.builder()
            .enabled(node.path("enabled").asBoolean(true))
            .bookUndefined(node.path("bookUndefined").asBoolean(true))
            .topFolderName(node.path("topFolderName").asText(""))
            .name(requiredText(node, "name", origin))
            .title(node.path("title").asText(""))
            .xlabel(node.path("xlabel").asText(""))
            .ylabel(node.path("ylabel").asText(""))
            .dimensions(node.path("dimensions").asInt(1))
            .range(
                node.path("range_nbins").asInt(100),
                node.path("range_min").asDouble(0.0),
                node.path("range_max").asDouble(100.0)
            )
            .rangeY(
                node.path("range_y_nbins").asInt(100),
                node.path("range_y_min").asDouble(0.0),
                node.path("range_y_max").asDouble(100.0)
            );
        var specs = node.path("specs");
        if (!specs.isMissingNode() && !specs.isArray()) {
            throw new IllegalStateException("'specs' must be a list in " + origin);
        }
        for (var specNode : specs) {
            if (!specNode.path("enabled").asBoolean(true)) {
                continue;
            }
            builder.spec(readSpecification(specNode, origin));
        }
        return builder.build();
    }

    private static SummationSpecification readSpecification(JsonNode node, String origin) {
        var stepsNode = node.path("steps");
        if (!stepsNode.isArray()) {
            throw new IllegalStateException("Specification without 'steps' list in " + origin);
        }
        var steps = new ArrayList<SummationStep>();
        for (var stepNode : stepsNode) {
            try {
                steps.add(new SummationStep(
                    SummationStep.Stage.from(stepNode.path("stage").asText(null)),
                    SummationStep.Type.from(stepNode.path("type").asText(null)),
                    readColumns(stepNode.path("columns")),
                    stepNode.path("arg").asText("")
                ));
            } catch (IllegalArgumentException ex) {
                throw new IllegalStateException("Invalid step " + stepNode + " in " + origin + ": " + ex.getMessage(), ex);
            }
        }
        return new SummationSpecification(steps);
    }

    private static List<Column> readColumns(JsonNode node) {
        var columns = new ArrayList<Column>();
        if (node.isArray()) {
            for (var item : node) {
                columns.add(Column.of(item.asText()));
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            for (var part : node.asText().split("/")) {
                if (!part.isBlank()) {
                    columns.add(Column.of(part));
                }
            }
        }
        return columns;
    }

    private static StaticAttributeProvider readAttributes(JsonNode node, String origin) {
        var builder = StaticAttributeProvider.builder();
        for (var columnNode : node.path("columns")) {
            var id = requiredText(columnNode, "id", origin);
            builder.column(new StaticAttributeProvider.ColumnDefinition(
                Column.of(id),
                columnNode.path("name").asText(id),
                columnNode.path("min").asDouble(0.0),
                columnNode.path("max").asDouble(0.0),
                ValueFormat.from(columnNode.path("format").asText(null)),
                StaticAttributeProvider.Source.from(columnNode.path("source").asText(null))
            ));
        }
        for (var moduleNode : node.path("modules")) {
            if (!moduleNode.hasNonNull("id")) {
                throw new IllegalStateException("Module without 'id' in " + origin);
            }
            var values = new LinkedHashMap<String, Integer>();
            var fields = moduleNode.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                if ("id".equals(field.getKey())) {
                    continue;
                }
                if (!field.getValue().canConvertToInt()) {
                    throw new IllegalStateException(
                        "Attribute " + field.getKey() + " of module " + moduleNode.get("id") + " is not an integer in " + origin
                    );
                }
                values.put(field.getKey(), field.getValue().asInt());
            }
            builder.module(moduleNode.get("id").asLong(), values);
        }
        return builder.build();
    }

    private static String requiredText(JsonNode node, String field, String origin) {
        var value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new IllegalStateException("Missing '" + field + "' in " + origin);
        }
        return value;
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(key)));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
