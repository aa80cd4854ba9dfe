package dev.wrt.model;

/**
 * Tunables for a report run. CLI options override individual values.
 */
public record ReportSettings(
    String identifierKey,
    String auxiliaryStepName,
    String sampleColumn,
    String runIdColumn,
    int provenanceChunkSize,
    String sampleSeparator
) {
    public static final String DEFAULT_IDENTIFIER_KEY = "workflow_id";
    public static final String DEFAULT_AUXILIARY_STEP = "provisionFileOut";
    public static final String DEFAULT_SAMPLE_COLUMN = "Root Sample Name";
    public static final String DEFAULT_RUN_ID_COLUMN = "Workflow Run SWID";
    public static final int DEFAULT_CHUNK_SIZE = 10_000;
    public static final String DEFAULT_SAMPLE_SEPARATOR = ";";

    public ReportSettings {
        if (provenanceChunkSize < 1) {
            throw new IllegalArgumentException("provenanceChunkSize must be positive: " + provenanceChunkSize);
        }
    }

    public static ReportSettings defaults() {
        return new ReportSettings(DEFAULT_IDENTIFIER_KEY, DEFAULT_AUXILIARY_STEP, DEFAULT_SAMPLE_COLUMN,
            DEFAULT_RUN_ID_COLUMN, DEFAULT_CHUNK_SIZE, DEFAULT_SAMPLE_SEPARATOR);
    }

    public ReportSettings withIdentifierKey(String key) {
        return new ReportSettings(key, auxiliaryStepName, sampleColumn, runIdColumn,
            provenanceChunkSize, sampleSeparator);
    }

    public ReportSettings withAuxiliaryStepName(String name) {
        return new ReportSettings(identifierKey, name, sampleColumn, runIdColumn,
            provenanceChunkSize, sampleSeparator);
    }

    public ReportSettings withProvenanceChunkSize(int chunkSize) {
        return new ReportSettings(identifierKey, auxiliaryStepName, sampleColumn, runIdColumn,
            chunkSize, sampleSeparator);
    }
}
