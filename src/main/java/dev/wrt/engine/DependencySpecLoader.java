package dev.wrt.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wrt.model.DependencySpec;
import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the workflow run order and dependency graph from a JSON document:
 *
 * <pre>
 * {
 *   "workflow_run_order": ["bamMergePreprocessing", "mutect2", ...],
 *   "dependencies": { "bamMergePreprocessing": ["mutect2", "gridss"], ... }
 * }
 * </pre>
 */
public final class DependencySpecLoader {

    public static final String RUN_ORDER_FIELD = "workflow_run_order";
    public static final String DEPENDENCIES_FIELD = "dependencies";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DependencySpecLoader() {}

    /**
     * Load a dependency spec from a JSON file.
     */
    public static DependencySpec loadFromFile(Path path) throws PipelineException {
        if (!Files.isRegularFile(path)) {
            throw PipelineException.absent(path.toString());
        }
        try {
            return parse(MAPPER.readTree(path.toFile()), path.toString());
        } catch (IOException e) {
            throw PipelineException.malformed(path.toString(), e);
        }
    }

    /**
     * Load a dependency spec from a JSON string.
     */
    public static DependencySpec loadFromString(String json) throws PipelineException {
        try {
            return parse(MAPPER.readTree(json), "dependency config");
        } catch (IOException e) {
            throw PipelineException.malformed("dependency config", e);
        }
    }

    private static DependencySpec parse(JsonNode root, String source) throws PipelineException {
        if (root == null || !root.isObject()) {
            throw malformed(source, "expected a JSON object at the top level");
        }
        List<String> runOrder = parseRunOrder(root.get(RUN_ORDER_FIELD), source);
        Map<String, List<String>> dependencies = parseDependencies(root.get(DEPENDENCIES_FIELD), source);
        return new DependencySpec(runOrder, dependencies);
    }

    private static List<String> parseRunOrder(JsonNode node, String source) throws PipelineException {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw malformed(source, "'%s' must be an array of step names".formatted(RUN_ORDER_FIELD));
        }
        return textValues(node, RUN_ORDER_FIELD, source);
    }

    private static Map<String, List<String>> parseDependencies(JsonNode node, String source)
            throws PipelineException {
        var dependencies = new LinkedHashMap<String, List<String>>();
        if (node == null || node.isNull()) {
            return dependencies;
        }
        if (!node.isObject()) {
            throw malformed(source, "'%s' must be an object of step name to dependents".formatted(DEPENDENCIES_FIELD));
        }
        for (var entry : node.properties()) {
            JsonNode dependents = entry.getValue();
            String field = DEPENDENCIES_FIELD + "." + entry.getKey();
            if (!dependents.isArray()) {
                throw malformed(source, "'%s' must be an array of step names".formatted(field));
            }
            dependencies.put(entry.getKey(), textValues(dependents, field, source));
        }
        return dependencies;
    }

    private static List<String> textValues(JsonNode array, String field, String source) throws PipelineException {
        var values = new ArrayList<String>();
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw malformed(source, "'%s' contains a non-string entry: %s".formatted(field, item));
            }
            values.add(item.asText());
        }
        return values;
    }

    private static PipelineException malformed(String source, String detail) {
        return new PipelineException(ErrorKind.INPUT_MALFORMED, source,
            "Invalid dependency config %s: %s".formatted(source, detail));
    }
}
