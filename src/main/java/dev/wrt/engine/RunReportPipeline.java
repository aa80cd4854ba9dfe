package dev.wrt.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.wrt.model.CanonicalRun;
import dev.wrt.model.DependencySpec;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.PipelineException;
import dev.wrt.model.PipelineResult;
import dev.wrt.model.RawStepRecord;
import dev.wrt.model.ReportSettings;
import dev.wrt.model.RunTimeline;
import dev.wrt.source.MetricsStore;
import dev.wrt.source.ProvenanceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * One-shot batch transform from run identifiers to an ordered, sample-enriched timeline.
 *
 * <p>Identity resolution runs on the supplied executor while step records are fetched
 * and aggregated on the calling thread; the two meet in a join on run id. Identity
 * resolution is optional: if it fails, runs keep a null sample name and the result
 * carries a warning. Failure to read the metrics store aborts the run.
 */
public final class RunReportPipeline {

    private static final Logger log = LoggerFactory.getLogger(RunReportPipeline.class);

    private final ReportSettings settings;
    private final MetricsStore metricsStore;
    private final ProvenanceSource provenance; // nullable — no identity enrichment
    private final DependencySpec dependencySpec; // nullable — start-time ordering only
    private final Executor executor;

    public RunReportPipeline(ReportSettings settings, MetricsStore metricsStore,
                             ProvenanceSource provenance, DependencySpec dependencySpec,
                             Executor executor) {
        this.settings = settings;
        this.metricsStore = metricsStore;
        this.provenance = provenance;
        this.dependencySpec = dependencySpec;
        this.executor = executor;
    }

    /**
     * Run the report for every identifier found in a JSON document.
     */
    public PipelineResult run(JsonNode identifierDocument) {
        List<String> ids = IdentifierExtractor.extractAll(identifierDocument, settings.identifierKey());
        return run(ids);
    }

    /**
     * Run the report for the given identifiers. Duplicates are ignored.
     */
    public PipelineResult run(Collection<String> runIds) {
        Set<String> ids = new LinkedHashSet<>(runIds);
        if (ids.isEmpty()) {
            log.info("No workflow IDs found");
            return new PipelineResult.Empty("No workflow IDs found");
        }
        log.info("Building report for {} workflow runs", ids.size());

        CompletableFuture<Resolution> identities = provenance == null
            ? CompletableFuture.completedFuture(Resolution.skipped())
            : CompletableFuture.supplyAsync(() -> resolveIdentities(ids), executor);

        List<CanonicalRun> runs;
        try {
            runs = aggregate(ids);
        } catch (PipelineException e) {
            log.error("Aborting report: {}", e.getMessage());
            identities.cancel(false);
            return failed(e);
        }
        if (runs.isEmpty()) {
            log.info("No workflow runs found for {} IDs", ids.size());
            identities.cancel(false);
            return new PipelineResult.Empty("No workflow runs found for %d IDs".formatted(ids.size()));
        }

        Resolution resolution = join(identities);
        List<EnrichedRun> enriched = enrich(runs, resolution.samples());
        RunTimeline timeline = DependencyGrouper.group(enriched, dependencySpec);
        log.info("Report ready: {} runs, {} dependency edges", enriched.size(), timeline.edges().size());
        return new PipelineResult.Completed(timeline, resolution.warnings());
    }

    public static PipelineResult.Failed failed(PipelineException e) {
        return new PipelineResult.Failed(e.kind(), e.getMessage());
    }

    private List<CanonicalRun> aggregate(Set<String> ids) throws PipelineException {
        // one owned buffer, folded once
        var records = new ArrayList<RawStepRecord>();
        for (String id : ids) {
            records.addAll(metricsStore.fetch(id));
        }
        log.debug("Fetched {} step records", records.size());
        return new RunAggregator(settings.auxiliaryStepName()).aggregate(records);
    }

    private Resolution resolveIdentities(Set<String> ids) {
        var resolver = new IdentityResolver(settings.sampleColumn(), settings.runIdColumn(),
            settings.provenanceChunkSize());
        try {
            return new Resolution(resolver.resolve(ids, provenance), List.of());
        } catch (PipelineException e) {
            log.warn("Continuing without sample names: {}", e.getMessage());
            return Resolution.degraded("Sample names unavailable: " + e.getMessage());
        }
    }

    private static Resolution join(CompletableFuture<Resolution> identities) {
        try {
            return identities.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Continuing without sample names", cause);
            return Resolution.degraded("Sample names unavailable: " + cause);
        }
    }

    private List<EnrichedRun> enrich(List<CanonicalRun> runs, Map<String, Set<String>> samples) {
        var enriched = new ArrayList<EnrichedRun>(runs.size());
        for (CanonicalRun run : runs) {
            String sample = IdentityResolver.joinSamples(samples.get(run.runId()), settings.sampleSeparator());
            enriched.add(new EnrichedRun(run, sample));
        }
        return enriched;
    }

    private record Resolution(Map<String, Set<String>> samples, List<String> warnings) {
        static Resolution skipped() {
            return new Resolution(Map.of(), List.of());
        }

        static Resolution degraded(String warning) {
            return new Resolution(Map.of(), List.of(warning));
        }
    }
}
