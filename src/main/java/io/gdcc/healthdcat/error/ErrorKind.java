package io.gdcc.healthdcat.error;

/** Kinds of terminal conversion failures, as reported in a conversion result. */
public enum ErrorKind {
    SOURCE_READ,
    VALIDATION_FAILED,
    UNKNOWN_PLUGIN,
    DUPLICATE_NAME,
    UNSUPPORTED_FORMAT,
    MISSING_CONFIGURATION,
    STAGE
}
