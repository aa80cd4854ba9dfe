package dev.wrt.model;

/**
 * Directed link from an upstream run's end to a downstream run's start.
 * Derived per rendering, never stored.
 */
public record TemporalEdge(
    EnrichedRun from,
    EnrichedRun to
) {

    /** Time the arrow leaves: end of the upstream run. */
    public String fromTime() { return from.endTime(); }

    /** Time the arrow arrives: start of the downstream run. */
    public String toTime() { return to.startTime(); }
}
