package dev.wrt.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.wrt.model.PipelineException;
import dev.wrt.model.RawStepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a metrics-store export (a JSON array of step documents) into raw step records.
 *
 * <p>Field values are read leniently: Mongo extended JSON wrappers such as
 * {@code {"$date": ...}} and {@code {"$numberDouble": "..."}} are unwrapped, an
 * unreadable or non-finite duration becomes null, and entries that are not objects are skipped.
 */
public final class MetricsRecordParser {

    public static final String RUN_ID_FIELD = "workflow_run_id";
    public static final String STEP_NAME_FIELD = "workflow_name";
    public static final String START_TIME_FIELD = "start_time";
    public static final String END_TIME_FIELD = "end_time";
    public static final String DURATION_FIELD = "wallclock_seconds";

    private static final Logger log = LoggerFactory.getLogger(MetricsRecordParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MetricsRecordParser() {}

    /**
     * Parse an export document.
     *
     * @param defaultRunId run id given to records that do not carry one
     * @param source       name used in error messages
     */
    public static List<RawStepRecord> parse(InputStream in, String defaultRunId, String source)
            throws PipelineException {
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw PipelineException.malformed(source, e);
        }
        return parse(root, defaultRunId);
    }

    public static List<RawStepRecord> parse(JsonNode root, String defaultRunId) {
        var records = new ArrayList<RawStepRecord>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return records;
        }
        if (root.isObject()) {
            records.add(toRecord(root, defaultRunId));
            return records;
        }
        for (JsonNode item : root) {
            if (!item.isObject()) {
                log.debug("Skipping non-object metrics entry: {}", item);
                continue;
            }
            records.add(toRecord(item, defaultRunId));
        }
        return records;
    }

    static RawStepRecord toRecord(JsonNode node, String defaultRunId) {
        String runId = text(node.get(RUN_ID_FIELD));
        return new RawStepRecord(
            runId != null ? runId : defaultRunId,
            text(node.get(STEP_NAME_FIELD)),
            timestamp(node.get(START_TIME_FIELD)),
            timestamp(node.get(END_TIME_FIELD)),
            number(node.get(DURATION_FIELD))
        );
    }

    private static String text(JsonNode node) {
        JsonNode value = unwrap(node);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static String timestamp(JsonNode node) {
        if (node != null && node.isObject() && node.has("$date")) {
            JsonNode date = node.get("$date");
            if (date.isNumber()) {
                return Instant.ofEpochMilli(date.asLong()).toString();
            }
            if (date.isObject() && date.has("$numberLong")) {
                String millis = date.get("$numberLong").asText().trim();
                try {
                    return Instant.ofEpochMilli(Long.parseLong(millis)).toString();
                } catch (NumberFormatException e) {
                    return millis;
                }
            }
            return text(date);
        }
        return text(node);
    }

    private static Double number(JsonNode node) {
        JsonNode value = unwrap(node);
        if (value == null || value.isNull()) {
            return null;
        }
        Double parsed = null;
        if (value.isNumber()) {
            parsed = value.asDouble();
        } else if (value.isTextual()) {
            try {
                parsed = Double.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return parsed != null && Double.isFinite(parsed) ? parsed : null;
    }

    /** {"$numberLong": "12"} and friends collapse to their inner value. */
    private static JsonNode unwrap(JsonNode node) {
        if (node != null && node.isObject() && node.size() == 1) {
            var field = node.fieldNames().next();
            if (field.startsWith("$number")) {
                return node.get(field);
            }
        }
        return node;
    }
}
