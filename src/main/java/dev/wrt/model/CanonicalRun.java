package dev.wrt.model;

/**
 * One logical workflow run, folded from all step records sharing a run id.
 */
public record CanonicalRun(
    String runId,
    String primaryStepName,
    String startTime,
    String endTime,
    Double durationSeconds, // nullable
    double auxiliaryMaxDuration
) {}
