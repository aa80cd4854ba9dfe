package dev.wrt.source;

import dev.wrt.model.PipelineException;
import dev.wrt.model.RawStepRecord;

import java.util.List;

/**
 * Read access to the workflow metrics store, queried one run id at a time.
 * Retries and timeouts belong to implementations, not to callers.
 */
public interface MetricsStore {

    /**
     * Step records reported for a run. An empty list means the store had no data
     * for that id, which is a valid outcome.
     *
     * @throws PipelineException if the store's answer cannot be read
     */
    List<RawStepRecord> fetch(String runId) throws PipelineException;
}
