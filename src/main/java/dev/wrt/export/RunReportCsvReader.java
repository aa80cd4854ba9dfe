package dev.wrt.export;

import dev.wrt.model.CanonicalRun;
import dev.wrt.model.EnrichedRun;
import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static dev.wrt.export.RunReportCsvWriter.AUXILIARY_MAX_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.DURATION_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.END_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.RUN_ID_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.SAMPLE_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.START_COLUMN;
import static dev.wrt.export.RunReportCsvWriter.STEP_COLUMN;

/**
 * Reads a run report written by {@link RunReportCsvWriter}, possibly built up over
 * several invocations, back into enriched runs in file order.
 *
 * <p>Empty cells become null. The {@code sample_name} column may be absent; reports
 * without it load with no sample names. Unreadable durations read as absent.
 */
public final class RunReportCsvReader {

    private static final Logger log = LoggerFactory.getLogger(RunReportCsvReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .build();

    private RunReportCsvReader() {}

    public static List<EnrichedRun> read(Path csvFile) throws PipelineException {
        if (!Files.isRegularFile(csvFile)) {
            throw PipelineException.absent(csvFile.toString());
        }
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            requireColumns(parser, csvFile);

            var runs = new ArrayList<EnrichedRun>();
            for (CSVRecord record : parser) {
                runs.add(toRun(record));
            }
            log.info("Read {} runs from {}", runs.size(), csvFile);
            return runs;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw PipelineException.malformed(csvFile.toString(), e);
        }
    }

    static EnrichedRun toRun(CSVRecord record) {
        Double auxiliary = seconds(cell(record, AUXILIARY_MAX_COLUMN));
        var run = new CanonicalRun(
            cell(record, RUN_ID_COLUMN),
            cell(record, STEP_COLUMN),
            cell(record, START_COLUMN),
            cell(record, END_COLUMN),
            seconds(cell(record, DURATION_COLUMN)),
            auxiliary == null ? 0.0 : auxiliary
        );
        return new EnrichedRun(run, cell(record, SAMPLE_COLUMN));
    }

    private static String cell(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            return null;
        }
        String value = record.get(column);
        return value.isEmpty() ? null : value;
    }

    private static Double seconds(String value) {
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void requireColumns(CSVParser parser, Path csvFile) throws PipelineException {
        List<String> header = parser.getHeaderNames();
        var missing = new ArrayList<String>();
        for (String column : RunReportCsvWriter.HEADER) {
            if (!column.equals(SAMPLE_COLUMN) && !header.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new PipelineException(ErrorKind.INPUT_MALFORMED, csvFile.toString(),
                "Run report %s is missing columns %s".formatted(csvFile, missing));
        }
    }
}
