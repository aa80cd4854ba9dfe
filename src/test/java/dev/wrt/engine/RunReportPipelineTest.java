package dev.wrt.engine;

import dev.wrt.model.DependencySpec;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;
import dev.wrt.model.PipelineResult;
import dev.wrt.model.RawStepRecord;
import dev.wrt.model.ReportSettings;
import dev.wrt.source.JsonDirectoryMetricsStore;
import dev.wrt.source.MetricsStore;
import dev.wrt.source.ProvenanceSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportPipelineTest {

    private static final String REPORT = "Root Sample Name\tWorkflow Run SWID\n"
        + "PANX_0001\tA1\n"
        + "PANX_0002\tC1\n";

    private static final Map<String, List<RawStepRecord>> METRICS = Map.of(
        "A1", List.of(
            new RawStepRecord("A1", "align", "2024-01-01T00:00:00", "2024-01-01T01:00:00", 3600.0),
            new RawStepRecord("A1", "provisionFileOut", null, null, 50.0),
            new RawStepRecord("A1", "provisionFileOut", null, null, 80.0)),
        "A2", List.of(
            new RawStepRecord("A2", "align", "2024-01-01T00:30:00", "2024-01-01T01:30:00", 3600.0)),
        "C1", List.of(
            new RawStepRecord("C1", "call", "2024-01-01T02:00:00", "2024-01-01T03:00:00", 3600.0))
    );

    private static final MetricsStore STORE = runId -> METRICS.getOrDefault(runId, List.of());

    private static ProvenanceSource report(String body) {
        return new ProvenanceSource() {
            @Override
            public Reader open() {
                return new StringReader(body);
            }

            @Override
            public String name() {
                return "fpr";
            }
        };
    }

    private static final ProvenanceSource MISSING_REPORT = new ProvenanceSource() {
        @Override
        public Reader open() throws IOException {
            throw new NoSuchFileException("fpr.tsv.gz");
        }

        @Override
        public String name() {
            return "fpr.tsv.gz";
        }
    };

    private static List<String> ids(List<EnrichedRun> runs) {
        return runs.stream().map(EnrichedRun::runId).toList();
    }

    @Test
    void buildsEnrichedTimelineFromIdentifierDocument() throws PipelineException {
        var spec = new DependencySpec(List.of("align", "call"), Map.of("align", List.of("call")));
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), STORE, report(REPORT), spec, Runnable::run);

        PipelineResult result = pipeline.run(IdentifierExtractor.readDocument("""
            {"steps": [{"workflow_id": "C1"}, {"workflow_id": "A2"}, {"workflow_id": "A1"}]}
            """));

        assertThat(result).isInstanceOf(PipelineResult.Completed.class);
        var completed = (PipelineResult.Completed) result;
        var timeline = completed.timeline();
        assertThat(completed.warnings()).isEmpty();
        assertThat(ids(timeline.byStartTime())).containsExactly("A1", "A2", "C1");
        assertThat(ids(timeline.byRunOrder())).containsExactly("A1", "A2", "C1");
        assertThat(timeline.edges()).hasSize(2);

        EnrichedRun a1 = timeline.byStartTime().get(0);
        assertThat(a1.stepName()).isEqualTo("align");
        assertThat(a1.run().auxiliaryMaxDuration()).isEqualTo(80.0);
        assertThat(a1.sampleName()).isEqualTo("PANX_0001");
        assertThat(timeline.byStartTime().get(1).sampleName()).isNull();
        assertThat(timeline.byStartTime().get(2).sampleName()).isEqualTo("PANX_0002");
    }

    @Test
    void noIdentifiersIsEmptyNotFailure() {
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), STORE, null, null, Runnable::run);

        assertThat(pipeline.run(List.of())).isInstanceOf(PipelineResult.Empty.class);
    }

    @Test
    void noRunsIsEmptyNotFailure() {
        MetricsStore onlyAux = id -> List.of(new RawStepRecord(id, "provisionFileOut", null, null, 3.0));
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), onlyAux, null, null, Runnable::run);

        PipelineResult result = pipeline.run(List.of("X"));

        assertThat(result).isInstanceOf(PipelineResult.Empty.class);
        assertThat(((PipelineResult.Empty) result).reason()).contains("No workflow runs");
    }

    @Test
    void missingProvenanceDegradesToNullSamples() {
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), STORE, MISSING_REPORT, null, Runnable::run);

        PipelineResult result = pipeline.run(List.of("A1", "C1"));

        assertThat(result).isInstanceOf(PipelineResult.Completed.class);
        var completed = (PipelineResult.Completed) result;
        assertThat(completed.warnings()).singleElement().asString().contains("fpr.tsv.gz");
        assertThat(completed.timeline().byStartTime()).extracting(EnrichedRun::sampleName).containsOnlyNulls();
        assertThat(completed.timeline().declaredOrderAvailable()).isFalse();
    }

    @Test
    void unreadableMetricsAbortsTheRun() {
        MetricsStore broken = id -> {
            throw new PipelineException(ErrorKind.INPUT_MALFORMED, id + ".json", "Could not parse " + id + ".json");
        };
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), broken, report(REPORT), null, Runnable::run);

        PipelineResult result = pipeline.run(List.of("A1"));

        assertThat(result).isEqualTo(new PipelineResult.Failed(ErrorKind.INPUT_MALFORMED, "Could not parse A1.json"));
    }

    @Test
    void duplicateIdentifiersAreFetchedOnce() {
        var fetched = new ArrayList<String>();
        MetricsStore recording = id -> {
            fetched.add(id);
            return STORE.fetch(id);
        };
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), recording, null, null, Runnable::run);

        pipeline.run(List.of("A1", "A1", "A2"));

        assertThat(fetched).containsExactly("A1", "A2");
    }

    @Test
    void customAuxiliaryStepIsHonoured() {
        MetricsStore store = id -> List.of(
            new RawStepRecord(id, "align", "2024-01-01T00:00:00", "2024-01-01T01:00:00", 10.0),
            new RawStepRecord(id, "upload", null, null, 25.0));
        var settings = ReportSettings.defaults().withAuxiliaryStepName("upload");
        var pipeline = new RunReportPipeline(settings, store, null, null, Runnable::run);

        var result = (PipelineResult.Completed) pipeline.run(List.of("Z"));

        assertThat(result.timeline().byStartTime().get(0).run().auxiliaryMaxDuration()).isEqualTo(25.0);
    }

    @Test
    void identifiersThatAreNotRunFileNamesYieldNoRuns(@TempDir Path dir) throws Exception {
        Path metrics = Files.createDirectory(dir.resolve("Extracted_Metrics"));
        Files.writeString(metrics.resolve("A1.json"), """
            [{"workflow_name": "align", "start_time": "2024-01-01T00:00:00", "wallclock_seconds": 10}]
            """);
        Files.writeString(dir.resolve("B1.json"), """
            [{"workflow_name": "call", "start_time": "2024-01-01T00:00:00", "wallclock_seconds": 10}]
            """);
        var store = new JsonDirectoryMetricsStore(metrics);
        var pipeline = new RunReportPipeline(ReportSettings.defaults(), store, null, null, Runnable::run);

        assertThat(pipeline.run(List.of("A1\u0000", "../B1"))).isInstanceOf(PipelineResult.Empty.class);

        var result = (PipelineResult.Completed) pipeline.run(List.of("A1\u0000", "../B1", "A1"));
        assertThat(ids(result.timeline().byStartTime())).containsExactly("A1");
    }
}
