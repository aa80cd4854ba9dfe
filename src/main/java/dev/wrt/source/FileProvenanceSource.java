package dev.wrt.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Provenance report on local disk. Files ending in {@code .gz} are gunzipped
 * while reading; anything else is read as plain text.
 */
public final class FileProvenanceSource implements ProvenanceSource {

    private static final int BUFFER_SIZE = 1 << 16;

    private final Path path;

    public FileProvenanceSource(Path path) {
        this.path = path;
    }

    @Override
    public Reader open() throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        InputStream in = Files.newInputStream(path);
        try {
            if (path.getFileName().toString().endsWith(".gz")) {
                in = new GZIPInputStream(in, BUFFER_SIZE);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }

    @Override
    public String name() {
        return path.toString();
    }
}
