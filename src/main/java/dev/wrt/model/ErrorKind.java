package dev.wrt.model;

/**
 * Failure categories surfaced to callers.
 */
public enum ErrorKind {
    /** A required input could not be located. */
    INPUT_ABSENT,
    /** An input was found but could not be parsed. */
    INPUT_MALFORMED
}
