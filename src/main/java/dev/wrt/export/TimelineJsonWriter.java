package dev.wrt.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.wrt.model.CanonicalRun;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.RunTimeline;
import dev.wrt.model.TemporalEdge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a timeline as a JSON document for an external chart renderer.
 *
 * <p>Rows carry a {@code label} (step name and run id) that edges refer to.
 * {@code byRunOrder} is present only when the timeline has a declared order.
 */
public final class TimelineJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private TimelineJsonWriter() {}

    public static void write(RunTimeline timeline, Path file) throws IOException {
        MAPPER.writeValue(file.toFile(), toJson(timeline));
    }

    public static ObjectNode toJson(RunTimeline timeline) {
        ObjectNode root = MAPPER.createObjectNode();
        root.set("byStartTime", rows(timeline.byStartTime()));
        if (timeline.declaredOrderAvailable()) {
            root.set("byRunOrder", rows(timeline.byRunOrder()));
        }
        ArrayNode edges = root.putArray("edges");
        for (TemporalEdge edge : timeline.edges()) {
            ObjectNode node = edges.addObject();
            node.put("from", edge.from().label());
            node.put("to", edge.to().label());
            node.put("from_time", edge.fromTime());
            node.put("to_time", edge.toTime());
        }
        return root;
    }

    private static ArrayNode rows(List<EnrichedRun> runs) {
        ArrayNode rows = MAPPER.createArrayNode();
        for (EnrichedRun enriched : runs) {
            CanonicalRun run = enriched.run();
            ObjectNode row = rows.addObject();
            row.put("label", enriched.label());
            row.put("workflow_name", run.primaryStepName());
            row.put("workflow_run_id", run.runId());
            row.put("start_time", run.startTime());
            row.put("end_time", run.endTime());
            row.put("wallclock_seconds", run.durationSeconds());
            row.put("max_provisionFileOut_wallclock_seconds", run.auxiliaryMaxDuration());
            row.put("sample_name", enriched.sampleName());
        }
        return rows;
    }
}
