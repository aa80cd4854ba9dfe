package dev.wrt.model;

/**
 * One execution step as reported by the metrics store.
 * Timestamps are kept as the raw text the store returned; they may not parse.
 */
public record RawStepRecord(
    String runId,
    String stepName,
    String startTime,
    String endTime,
    Double durationSeconds // nullable — absent or unparsable in the source
) {}
