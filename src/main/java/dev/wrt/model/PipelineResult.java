package dev.wrt.model;

import java.util.List;

/**
 * Outcome of one report pipeline invocation.
 */
public sealed interface PipelineResult {

    /** The pipeline produced a timeline. Warnings name degraded optional branches. */
    record Completed(RunTimeline timeline, List<String> warnings) implements PipelineResult {
        public Completed {
            warnings = List.copyOf(warnings);
        }
    }

    /** Nothing to report: no identifiers, no runs. Not a failure. */
    record Empty(String reason) implements PipelineResult {}

    /** A required input was absent or malformed. */
    record Failed(ErrorKind kind, String message) implements PipelineResult {}
}
