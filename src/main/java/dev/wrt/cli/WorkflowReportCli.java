package dev.wrt.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.JsonNode;
import dev.wrt.engine.DependencyGrouper;
import dev.wrt.engine.DependencySpecLoader;
import dev.wrt.engine.DependencySpecValidator;
import dev.wrt.engine.IdentifierExtractor;
import dev.wrt.engine.RunReportPipeline;
import dev.wrt.export.RunIdListFile;
import dev.wrt.export.RunReportCsvReader;
import dev.wrt.export.RunReportCsvWriter;
import dev.wrt.export.TimelineJsonWriter;
import dev.wrt.model.DependencySpec;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;
import dev.wrt.model.PipelineResult;
import dev.wrt.model.ReportSettings;
import dev.wrt.model.RunTimeline;
import dev.wrt.source.FileProvenanceSource;
import dev.wrt.source.JsonDirectoryMetricsStore;
import dev.wrt.source.MetricsStore;
import dev.wrt.source.ProvenanceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * CLI entry point: builds a workflow runtime report from run ids, metrics exports
 * and an optional provenance report and dependency config, or rebuilds the
 * timeline from a previously written CSV report.
 */
@Command(
    name = "workflow-runtime-report",
    mixinStandardHelpOptions = true,
    description = "Aggregate workflow run metrics into a dependency-ordered runtime report."
)
public class WorkflowReportCli implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_INPUT_ABSENT = 1;
    public static final int EXIT_INPUT_MALFORMED = 2;
    public static final int EXIT_OUTPUT_FAILED = 3;

    private static final Logger log = LoggerFactory.getLogger(WorkflowReportCli.class);

    static class RunInput {
        @Option(names = "--ids-json", description = "JSON document with run ids at any depth")
        Path idsJson;

        @Option(names = "--ids-file", description = "Run id list file (one id per line, 'workflow_run_id' header)")
        Path idsFile;

        @Option(names = "--from-csv", description = "Rebuild the timeline from an existing CSV report (needs --timeline)")
        Path fromCsv;
    }

    @Spec
    private CommandSpec commandSpec;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private RunInput runInput;

    @Option(names = {"-m", "--metrics-dir"},
        description = "Directory of metrics exports, one <run id>.json per run (required unless --from-csv)")
    private Path metricsDir;

    @Option(names = "--provenance", description = "Provenance report (.tsv or .tsv.gz) for sample names")
    private Path provenance;

    @Option(names = "--config", description = "Dependency config with workflow_run_order and dependencies")
    private Path config;

    @Option(names = "--csv", defaultValue = "workflow_report.csv",
        description = "CSV report to create or append to (default: ${DEFAULT-VALUE})")
    private Path csv;

    @Option(names = "--timeline", description = "Write the ordered timeline and dependency edges as JSON")
    private Path timeline;

    @Option(names = "--save-ids", description = "Append the run ids to this list file")
    private Path saveIds;

    @Option(names = "--id-key", defaultValue = ReportSettings.DEFAULT_IDENTIFIER_KEY,
        description = "Key holding run ids in the JSON document (default: ${DEFAULT-VALUE})")
    private String idKey;

    @Option(names = "--auxiliary-step", defaultValue = ReportSettings.DEFAULT_AUXILIARY_STEP,
        description = "Step whose duration is folded into its run by maximum (default: ${DEFAULT-VALUE})")
    private String auxiliaryStep;

    @Option(names = "--verbose", description = "Log per-run aggregation details")
    private boolean verbose;

    private int chunkSize;

    @Option(names = "--chunk-size", defaultValue = "" + ReportSettings.DEFAULT_CHUNK_SIZE,
        description = "Provenance rows scanned per chunk (default: ${DEFAULT-VALUE})")
    void setChunkSize(int value) {
        if (value < 1) {
            throw new ParameterException(commandSpec.commandLine(),
                "Invalid value for option '--chunk-size': must be a positive number, was " + value);
        }
        this.chunkSize = value;
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.wrt")).setLevel(Level.DEBUG);
        }
        if (runInput.fromCsv != null) {
            return rebuildTimeline();
        }
        if (metricsDir == null) {
            throw new ParameterException(commandSpec.commandLine(),
                "Missing required option: '--metrics-dir=<metricsDir>'");
        }

        ReportSettings settings = ReportSettings.defaults()
            .withIdentifierKey(idKey)
            .withAuxiliaryStepName(auxiliaryStep)
            .withProvenanceChunkSize(chunkSize);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            List<String> ids = readIds(settings);
            MetricsStore store = new JsonDirectoryMetricsStore(metricsDir);
            DependencySpec spec = loadDependencySpec();
            ProvenanceSource provenanceSource = provenance == null ? null : new FileProvenanceSource(provenance);

            var pipeline = new RunReportPipeline(settings, store, provenanceSource, spec, executor);
            return report(pipeline.run(ids), ids);
        } catch (PipelineException e) {
            return fail(RunReportPipeline.failed(e));
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Orders the runs of an accumulated CSV report and writes their timeline.
     */
    private int rebuildTimeline() {
        if (timeline == null) {
            throw new ParameterException(commandSpec.commandLine(), "--from-csv requires --timeline");
        }
        try {
            List<EnrichedRun> runs = RunReportCsvReader.read(runInput.fromCsv);
            if (runs.isEmpty()) {
                System.out.println("No workflow runs found in " + runInput.fromCsv);
                return EXIT_OK;
            }
            RunTimeline ordered = DependencyGrouper.group(runs, loadDependencySpec());
            TimelineJsonWriter.write(ordered, timeline);
            System.out.println("Timeline for %d runs written to %s".formatted(runs.size(), timeline));
            return EXIT_OK;
        } catch (PipelineException e) {
            return fail(RunReportPipeline.failed(e));
        } catch (IOException e) {
            System.err.println("Error: could not write timeline: " + e.getMessage());
            return EXIT_OUTPUT_FAILED;
        }
    }

    private List<String> readIds(ReportSettings settings) throws PipelineException {
        if (runInput.idsFile != null) {
            return RunIdListFile.read(runInput.idsFile);
        }
        JsonNode document = IdentifierExtractor.readDocument(runInput.idsJson);
        return IdentifierExtractor.extractAll(document, settings.identifierKey());
    }

    private DependencySpec loadDependencySpec() throws PipelineException {
        if (config == null) {
            return null;
        }
        DependencySpec spec = DependencySpecLoader.loadFromFile(config);
        for (String warning : DependencySpecValidator.validate(spec)) {
            log.warn("{}: {}", config, warning);
        }
        return spec;
    }

    private int report(PipelineResult result, List<String> ids) {
        if (result instanceof PipelineResult.Failed failed) {
            return fail(failed);
        }
        if (result instanceof PipelineResult.Empty empty) {
            System.out.println(empty.reason());
            return EXIT_OK;
        }

        var completed = (PipelineResult.Completed) result;
        completed.warnings().forEach(w -> System.err.println("Warning: " + w));
        try {
            boolean created = RunReportCsvWriter.write(completed.timeline().byStartTime(), csv);
            System.out.println("Workflow run metrics %s %s".formatted(created ? "saved to" : "appended to", csv));
            if (timeline != null) {
                TimelineJsonWriter.write(completed.timeline(), timeline);
                System.out.println("Timeline written to " + timeline);
            }
            if (saveIds != null) {
                RunIdListFile.append(ids, saveIds);
            }
        } catch (IOException e) {
            System.err.println("Error: could not write report: " + e.getMessage());
            return EXIT_OUTPUT_FAILED;
        }
        return EXIT_OK;
    }

    private static int fail(PipelineResult.Failed failed) {
        System.err.println("Error: " + failed.message());
        return failed.kind() == ErrorKind.INPUT_ABSENT ? EXIT_INPUT_ABSENT : EXIT_INPUT_MALFORMED;
    }
}
