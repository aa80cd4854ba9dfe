package dev.wrt.engine;

import dev.wrt.model.DependencySpec;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.RunTimeline;
import dev.wrt.model.TemporalEdge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders runs for rendering and derives the arrows between dependent runs.
 *
 * <ul>
 *   <li>By start time: ascending, ties keep input order, unparsable start times last.</li>
 *   <li>By run order: position of the step name in the declared run order; undeclared
 *       steps after every declared one; ties keep start-time order.</li>
 *   <li>Edges: for each declared (upstream, downstream) pair, every upstream run is linked
 *       to every downstream run. Cycles in the spec are accepted; edges are pairwise and
 *       never followed, so nothing recurses.</li>
 * </ul>
 */
public final class DependencyGrouper {

    /** Position given to steps missing from the declared run order. */
    public static final int UNDECLARED_POSITION = Integer.MAX_VALUE;

    private static final Comparator<EnrichedRun> BY_START_TIME =
        Comparator.comparing(run -> Timestamps.parse(run.startTime()), Timestamps.UNPARSABLE_LAST);

    private DependencyGrouper() {}

    /**
     * @param spec declared order and dependencies, or null for start-time ordering only
     */
    public static RunTimeline group(Collection<EnrichedRun> runs, DependencySpec spec) {
        List<EnrichedRun> byStartTime = sortByStartTime(runs);
        if (spec == null) {
            return new RunTimeline(byStartTime, List.of(), List.of(), false);
        }
        List<EnrichedRun> byRunOrder = sortByRunOrder(byStartTime, spec);
        List<TemporalEdge> edges = edges(byStartTime, spec);
        return new RunTimeline(byStartTime, byRunOrder, edges, true);
    }

    public static List<EnrichedRun> sortByStartTime(Collection<EnrichedRun> runs) {
        var sorted = new ArrayList<>(runs);
        // List.sort is stable
        sorted.sort(BY_START_TIME);
        return sorted;
    }

    /**
     * Expects {@code byStartTime} already in start-time order so that the stable
     * sort leaves same-step runs in that order.
     */
    public static List<EnrichedRun> sortByRunOrder(List<EnrichedRun> byStartTime, DependencySpec spec) {
        var sorted = new ArrayList<>(byStartTime);
        sorted.sort(Comparator.comparingInt(run -> declaredPosition(run, spec)));
        return sorted;
    }

    public static int declaredPosition(EnrichedRun run, DependencySpec spec) {
        int position = spec.positionOf(run.stepName());
        return position < 0 ? UNDECLARED_POSITION : position;
    }

    /**
     * Full cross product of upstream and downstream runs per declared pair.
     * Within a pair, runs appear in the order of {@code runs}.
     */
    public static List<TemporalEdge> edges(List<EnrichedRun> runs, DependencySpec spec) {
        Map<String, List<EnrichedRun>> byStep = new LinkedHashMap<>();
        for (EnrichedRun run : runs) {
            byStep.computeIfAbsent(run.stepName(), name -> new ArrayList<>()).add(run);
        }

        var edges = new ArrayList<TemporalEdge>();
        for (Map.Entry<String, String> pair : spec.edgePairs()) {
            List<EnrichedRun> upstream = byStep.getOrDefault(pair.getKey(), List.of());
            List<EnrichedRun> downstream = byStep.getOrDefault(pair.getValue(), List.of());
            for (EnrichedRun from : upstream) {
                for (EnrichedRun to : downstream) {
                    edges.add(new TemporalEdge(from, to));
                }
            }
        }
        return edges;
    }
}
