package dev.wrt.source;

import java.io.IOException;
import java.io.Reader;

/**
 * Access to a tab-separated provenance report. Each call to {@link #open()}
 * starts a fresh read from the first line; the caller closes the reader.
 */
public interface ProvenanceSource {

    /**
     * Open the decompressed report text.
     *
     * @throws java.nio.file.NoSuchFileException if the report does not exist
     * @throws IOException if the report cannot be opened or decompressed
     */
    Reader open() throws IOException;

    /** Name used in error messages. */
    String name();
}
