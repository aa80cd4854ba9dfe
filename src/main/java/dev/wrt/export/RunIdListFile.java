package dev.wrt.export;

import dev.wrt.model.PipelineException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Plain-text list of run ids, one per line under a {@code workflow_run_id} header.
 */
public final class RunIdListFile {

    public static final String HEADER = "workflow_run_id";

    private RunIdListFile() {}

    /**
     * Append ids, writing the header first only if the file is new.
     */
    public static void append(Collection<String> runIds, Path file) throws IOException {
        boolean exists = Files.exists(file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                 StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (!exists) {
                writer.write(HEADER);
                writer.newLine();
            }
            for (String runId : runIds) {
                writer.write(runId);
                writer.newLine();
            }
        }
    }

    /**
     * Read ids back in file order. Header lines and blank lines are skipped.
     */
    public static List<String> read(Path file) throws PipelineException {
        if (!Files.isRegularFile(file)) {
            throw PipelineException.absent(file.toString());
        }
        var ids = new ArrayList<String>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                String id = line.trim();
                if (!id.isEmpty() && !HEADER.equals(id)) {
                    ids.add(id);
                }
            }
        } catch (IOException e) {
            throw PipelineException.malformed(file.toString(), e);
        }
        return ids;
    }
}
