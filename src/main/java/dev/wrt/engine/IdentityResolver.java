package dev.wrt.engine;

import dev.wrt.model.ErrorKind;
import dev.wrt.model.PipelineException;
import dev.wrt.source.ProvenanceSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps run identifiers to sample names by scanning a provenance report.
 *
 * <p>The report is streamed in chunks of complete rows so it is never held in
 * memory. Each chunk yields a partial map that is folded into the result by set
 * union; repeated (sample, run) rows collapse. A requested run with no matching
 * row is simply absent from the result.
 */
public final class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final CSVFormat TSV = CSVFormat.TDF.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setQuote(null)
        .setIgnoreSurroundingSpaces(false)
        .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
        .build();

    private final String sampleColumn;
    private final String runIdColumn;
    private final int chunkSize;

    public IdentityResolver(String sampleColumn, String runIdColumn, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.sampleColumn = sampleColumn;
        this.runIdColumn = runIdColumn;
        this.chunkSize = chunkSize;
    }

    /**
     * Resolve sample names for the given run ids.
     *
     * @return run id to sorted sample names; ids without a match are omitted
     * @throws PipelineException if the report is missing, unreadable or lacks a required column
     */
    public Map<String, Set<String>> resolve(Set<String> runIds, ProvenanceSource source) throws PipelineException {
        var resolved = new LinkedHashMap<String, Set<String>>();
        if (runIds.isEmpty()) {
            return resolved;
        }

        long rows = 0;
        int chunks = 0;
        try (Reader reader = source.open(); CSVParser parser = TSV.parse(reader)) {
            requireColumns(parser, source);

            var chunk = new ArrayList<CSVRecord>(Math.min(chunkSize, 4096));
            for (CSVRecord record : parser) {
                chunk.add(record);
                if (chunk.size() == chunkSize) {
                    merge(resolved, scanChunk(chunk, runIds));
                    rows += chunk.size();
                    chunks++;
                    chunk.clear();
                }
            }
            if (!chunk.isEmpty()) {
                merge(resolved, scanChunk(chunk, runIds));
                rows += chunk.size();
                chunks++;
            }
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw PipelineException.absent(source.name());
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw PipelineException.malformed(source.name(), e);
        }

        log.info("Scanned {} provenance rows in {} chunks; {} of {} runs matched a sample",
            rows, chunks, resolved.size(), runIds.size());
        return resolved;
    }

    /**
     * Matches within one chunk. Rows missing either column are skipped.
     */
    Map<String, Set<String>> scanChunk(Collection<CSVRecord> chunk, Set<String> runIds) {
        var partial = new LinkedHashMap<String, Set<String>>();
        for (CSVRecord record : chunk) {
            if (!record.isSet(runIdColumn) || !record.isSet(sampleColumn)) {
                continue;
            }
            String runId = record.get(runIdColumn).trim();
            if (!runIds.contains(runId)) {
                continue;
            }
            String sample = record.get(sampleColumn).trim();
            if (!sample.isEmpty()) {
                partial.computeIfAbsent(runId, id -> new TreeSet<>()).add(sample);
            }
        }
        return partial;
    }

    /**
     * Union {@code partial} into {@code into}. Associative and commutative, so the
     * order chunks are merged in does not affect the result.
     */
    static void merge(Map<String, Set<String>> into, Map<String, Set<String>> partial) {
        partial.forEach((runId, samples) ->
            into.computeIfAbsent(runId, id -> new TreeSet<>()).addAll(samples));
    }

    /**
     * Single display value for a run's samples, or null when there are none.
     */
    public static String joinSamples(Set<String> samples, String separator) {
        if (samples == null || samples.isEmpty()) {
            return null;
        }
        return String.join(separator, samples);
    }

    private void requireColumns(CSVParser parser, ProvenanceSource source) throws PipelineException {
        List<String> header = parser.getHeaderNames();
        var missing = new ArrayList<String>();
        for (String column : List.of(sampleColumn, runIdColumn)) {
            if (!header.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new PipelineException(ErrorKind.INPUT_MALFORMED, source.name(),
                "Provenance report %s is missing columns %s".formatted(source.name(), missing));
        }
    }
}
