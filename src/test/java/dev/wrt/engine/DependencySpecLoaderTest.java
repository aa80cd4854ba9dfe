package dev.wrt.engine;

import dev.wrt.model.DependencySpec;
import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencySpecLoaderTest {

    @Test
    void loadsRunOrderAndDependencies() throws PipelineException {
        String json = """
            {
              "workflow_run_order": ["bamMergePreprocessing", "mutect2", "gridss", "purple", "hrDetect"],
              "dependencies": {
                "bamMergePreprocessing": ["mutect2", "gridss"],
                "mutect2": ["purple", "hrDetect"],
                "gridss": ["purple", "hrDetect"],
                "purple": ["hrDetect"]
              }
            }
            """;

        DependencySpec spec = DependencySpecLoader.loadFromString(json);

        assertThat(spec.runOrder()).containsExactly("bamMergePreprocessing", "mutect2", "gridss", "purple", "hrDetect");
        assertThat(spec.dependencies()).containsOnlyKeys("bamMergePreprocessing", "mutect2", "gridss", "purple");
        assertThat(spec.dependencies().get("mutect2")).containsExactly("purple", "hrDetect");
        assertThat(spec.positionOf("gridss")).isEqualTo(2);
        assertThat(spec.positionOf("delly")).isEqualTo(-1);
        assertThat(spec.edgePairs()).hasSize(7);
        assertThat(spec.edgePairs().get(0)).isEqualTo(Map.entry("bamMergePreprocessing", "mutect2"));
    }

    @Test
    void missingSectionsDefaultToEmpty() throws PipelineException {
        DependencySpec spec = DependencySpecLoader.loadFromString("{}");

        assertThat(spec.runOrder()).isEmpty();
        assertThat(spec.dependencies()).isEmpty();
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("workflow_config.json");
        Files.writeString(file, """
            {"workflow_run_order": ["align", "call"], "dependencies": {"align": ["call"]}}
            """);

        DependencySpec spec = DependencySpecLoader.loadFromFile(file);

        assertThat(spec.runOrder()).containsExactly("align", "call");
        assertThat(spec.dependencies()).isEqualTo(Map.of("align", List.of("call")));
    }

    @Test
    void rejectsWrongShapes() {
        assertThatThrownBy(() -> DependencySpecLoader.loadFromString("""
            {"workflow_run_order": "align"}
            """))
            .isInstanceOf(PipelineException.class)
            .hasMessageContaining("workflow_run_order");

        assertThatThrownBy(() -> DependencySpecLoader.loadFromString("""
            {"dependencies": {"align": "call"}}
            """))
            .isInstanceOf(PipelineException.class)
            .hasMessageContaining("dependencies.align");

        assertThatThrownBy(() -> DependencySpecLoader.loadFromString("""
            {"workflow_run_order": ["align", 3]}
            """))
            .isInstanceOf(PipelineException.class)
            .hasMessageContaining("non-string");

        assertThatThrownBy(() -> DependencySpecLoader.loadFromString("[]"))
            .isInstanceOf(PipelineException.class);
    }

    @Test
    void invalidJsonIsMalformed() {
        assertThatThrownBy(() -> DependencySpecLoader.loadFromString("{\"workflow_run_order\": ["))
            .isInstanceOf(PipelineException.class)
            .extracting(e -> ((PipelineException) e).kind())
            .isEqualTo(ErrorKind.INPUT_MALFORMED);
    }

    @Test
    void missingFileIsAbsent(@TempDir Path dir) {
        assertThatThrownBy(() -> DependencySpecLoader.loadFromFile(dir.resolve("workflow_config.json")))
            .isInstanceOf(PipelineException.class)
            .extracting(e -> ((PipelineException) e).kind())
            .isEqualTo(ErrorKind.INPUT_ABSENT);
    }
}
