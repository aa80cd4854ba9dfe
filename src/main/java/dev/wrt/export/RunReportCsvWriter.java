package dev.wrt.export;

import dev.wrt.model.CanonicalRun;
import dev.wrt.model.EnrichedRun;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Flat CSV projection of enriched runs, one row per run.
 * Appends to an existing report; a new report starts with the header row.
 */
public final class RunReportCsvWriter {

    public static final String STEP_COLUMN = "workflow_name";
    public static final String START_COLUMN = "start_time";
    public static final String END_COLUMN = "end_time";
    public static final String DURATION_COLUMN = "wallclock_seconds";
    public static final String RUN_ID_COLUMN = "workflow_run_id";
    public static final String AUXILIARY_MAX_COLUMN = "max_provisionFileOut_wallclock_seconds";
    public static final String SAMPLE_COLUMN = "sample_name";

    public static final String[] HEADER = {
        STEP_COLUMN,
        START_COLUMN,
        END_COLUMN,
        DURATION_COLUMN,
        RUN_ID_COLUMN,
        AUXILIARY_MAX_COLUMN,
        SAMPLE_COLUMN
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setRecordSeparator('\n')
        .build();

    private RunReportCsvWriter() {}

    /**
     * @return true if the file was created, false if rows were appended to an existing one
     */
    public static boolean write(Collection<EnrichedRun> runs, Path csvFile) throws IOException {
        boolean exists = Files.exists(csvFile);
        CSVFormat format = exists ? FORMAT : FORMAT.builder().setHeader(HEADER).build();

        try (BufferedWriter writer = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8,
                 StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (EnrichedRun run : runs) {
                printer.printRecord(row(run));
            }
        }
        return !exists;
    }

    static List<String> row(EnrichedRun enriched) {
        CanonicalRun run = enriched.run();
        return Arrays.asList(
            nullToEmpty(run.primaryStepName()),
            nullToEmpty(run.startTime()),
            nullToEmpty(run.endTime()),
            run.durationSeconds() == null ? "" : formatSeconds(run.durationSeconds()),
            nullToEmpty(run.runId()),
            formatSeconds(run.auxiliaryMaxDuration()),
            nullToEmpty(enriched.sampleName())
        );
    }

    /** Whole seconds print without a fractional part. */
    static String formatSeconds(double seconds) {
        if (seconds == Math.rint(seconds) && !Double.isInfinite(seconds) && Math.abs(seconds) < 1e15) {
            return Long.toString((long) seconds);
        }
        return Double.toString(seconds);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
