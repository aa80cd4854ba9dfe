package dev.wrt.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wrt.model.PipelineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds run identifiers anywhere in a JSON document, regardless of its schema.
 *
 * <p>Every value stored under the identifier key is collected, at any depth,
 * whether the enclosing object sits inside an array or another object. A
 * matched value is taken as-is: if it is itself an object or array it is not
 * scanned again for nested identifiers.
 */
public final class IdentifierExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IdentifierExtractor() {}

    /**
     * Read a JSON document from disk.
     *
     * @throws PipelineException INPUT_ABSENT if the file does not exist,
     *                           INPUT_MALFORMED if it is not valid JSON
     */
    public static JsonNode readDocument(Path path) throws PipelineException {
        if (!Files.isRegularFile(path)) {
            throw PipelineException.absent(path.toString());
        }
        try {
            return MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw PipelineException.malformed(path.toString(), e);
        }
    }

    /**
     * Parse a JSON document from a string.
     */
    public static JsonNode readDocument(String json) throws PipelineException {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw PipelineException.malformed("identifier document", e);
        }
    }

    /**
     * All matched values in document order, duplicates kept.
     */
    public static List<JsonNode> extractValues(JsonNode root, String key) {
        var found = new ArrayList<JsonNode>();
        collect(root, key, found);
        return found;
    }

    /**
     * All identifiers as text in document order, duplicates kept.
     */
    public static List<String> extractAll(JsonNode root, String key) {
        var ids = new ArrayList<String>();
        for (JsonNode value : extractValues(root, key)) {
            ids.add(asIdentifier(value));
        }
        return ids;
    }

    /**
     * Distinct identifiers, in order of first appearance.
     */
    public static Set<String> extractDistinct(JsonNode root, String key) {
        return new LinkedHashSet<>(extractAll(root, key));
    }

    private static void collect(JsonNode node, String key, List<JsonNode> found) {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            for (var entry : node.properties()) {
                if (key.equals(entry.getKey())) {
                    found.add(entry.getValue());
                } else {
                    collect(entry.getValue(), key, found);
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, key, found);
            }
        }
    }

    private static String asIdentifier(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
