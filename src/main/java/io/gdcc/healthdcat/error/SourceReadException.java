package io.gdcc.healthdcat.error;

/** The record source could not be opened or did not contain well-formed tabular data. */
public class SourceReadException extends StageException {

    public SourceReadException(String stage, String message) {
        super(stage, message);
    }

    public SourceReadException(String stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SOURCE_READ;
    }
}
