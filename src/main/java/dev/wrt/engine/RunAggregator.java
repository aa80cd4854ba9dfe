package dev.wrt.engine;

import dev.wrt.model.CanonicalRun;
import dev.wrt.model.RawStepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds raw step records into one canonical record per run id.
 *
 * <p>Within a run, the primary step is the <em>last</em> record seen whose step
 * name is not the auxiliary step. A run reported with more than one
 * non-auxiliary step is not rejected; the later record replaces the earlier one.
 * The auxiliary step contributes only its duration, folded by maximum.
 * Runs that only ever report the auxiliary step yield nothing.
 */
public final class RunAggregator {

    private static final Logger log = LoggerFactory.getLogger(RunAggregator.class);

    private final String auxiliaryStepName;

    public RunAggregator(String auxiliaryStepName) {
        this.auxiliaryStepName = auxiliaryStepName;
    }

    /**
     * Aggregate records for any number of runs, in any interleaving.
     * Output order is the order in which run ids were first seen.
     */
    public List<CanonicalRun> aggregate(Iterable<RawStepRecord> records) {
        var partitions = new LinkedHashMap<String, Partition>();
        for (RawStepRecord record : records) {
            partitions.computeIfAbsent(record.runId(), id -> new Partition()).accept(record);
        }

        var runs = new ArrayList<CanonicalRun>(partitions.size());
        for (Map.Entry<String, Partition> entry : partitions.entrySet()) {
            Partition partition = entry.getValue();
            if (partition.primary == null) {
                log.debug("Run {} has only {} records, skipping", entry.getKey(), auxiliaryStepName);
                continue;
            }
            if (partition.primaryCandidates > 1) {
                log.debug("Run {} reported {} primary steps, keeping the last ({})",
                    entry.getKey(), partition.primaryCandidates, partition.primary.stepName());
            }
            RawStepRecord primary = partition.primary;
            runs.add(new CanonicalRun(
                entry.getKey(),
                primary.stepName(),
                primary.startTime(),
                primary.endTime(),
                primary.durationSeconds(),
                partition.auxiliaryMax
            ));
        }
        log.debug("Aggregated {} runs from {} run ids", runs.size(), partitions.size());
        return runs;
    }

    private final class Partition {
        private RawStepRecord primary;
        private int primaryCandidates;
        private double auxiliaryMax;

        void accept(RawStepRecord record) {
            if (auxiliaryStepName.equals(record.stepName())) {
                auxiliaryMax = Math.max(auxiliaryMax, durationOrZero(record.durationSeconds()));
            } else {
                primary = record;
                primaryCandidates++;
            }
        }
    }

    static double durationOrZero(Double duration) {
        if (duration == null || !Double.isFinite(duration) || duration < 0) {
            return 0.0;
        }
        return duration;
    }
}
