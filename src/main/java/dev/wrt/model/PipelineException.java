package dev.wrt.model;

/**
 * An input problem that stops one branch of the report pipeline.
 */
public class PipelineException extends Exception {

    private final ErrorKind kind;
    private final String source;

    public PipelineException(ErrorKind kind, String source, String message) {
        super(message);
        this.kind = kind;
        this.source = source;
    }

    public PipelineException(ErrorKind kind, String source, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.source = source;
    }

    public static PipelineException absent(String source) {
        return new PipelineException(ErrorKind.INPUT_ABSENT, source, "Input not found: " + source);
    }

    public static PipelineException malformed(String source, Throwable cause) {
        return new PipelineException(ErrorKind.INPUT_MALFORMED, source,
            "Could not parse %s: %s".formatted(source, cause.getMessage()), cause);
    }

    public ErrorKind kind() { return kind; }
    public String source() { return source; }
}
