package dev.wrt.source;

import dev.wrt.model.PipelineException;
import dev.wrt.model.RawStepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Metrics store backed by a directory of exports, one {@code <run id>.json}
 * file per run. A missing file means the store returned nothing for that run,
 * and so does a run id that does not name a file directly inside the directory.
 */
public final class JsonDirectoryMetricsStore implements MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(JsonDirectoryMetricsStore.class);

    private final Path directory;

    public JsonDirectoryMetricsStore(Path directory) throws PipelineException {
        if (!Files.isDirectory(directory)) {
            throw PipelineException.absent(directory.toString());
        }
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public List<RawStepRecord> fetch(String runId) throws PipelineException {
        Path file;
        try {
            file = directory.resolve(runId + ".json").normalize();
        } catch (InvalidPathException e) {
            log.warn("Run id is not a valid file name ({}), no metrics read", e.getReason());
            return List.of();
        }
        if (!directory.equals(file.getParent())) {
            log.warn("Run id {} points outside {}, no metrics read", runId, directory);
            return List.of();
        }
        if (!Files.isRegularFile(file)) {
            log.debug("No metrics export for run {}", runId);
            return List.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return MetricsRecordParser.parse(in, runId, file.toString());
        } catch (IOException e) {
            throw PipelineException.malformed(file.toString(), e);
        }
    }
}
