package dev.wrt.model;

/**
 * A canonical run joined with the sample it was produced for.
 */
public record EnrichedRun(
    CanonicalRun run,
    String sampleName // nullable — the provenance report had no row for this run
) {

    public static EnrichedRun withoutSample(CanonicalRun run) {
        return new EnrichedRun(run, null);
    }

    public String runId() { return run.runId(); }
    public String stepName() { return run.primaryStepName(); }
    public String startTime() { return run.startTime(); }
    public String endTime() { return run.endTime(); }

    /** Row key used by renderers: step name and run id. */
    public String label() {
        return run.primaryStepName() + "-" + run.runId();
    }
}
