package io.gdcc.healthdcat.error;

/**
 * Failure of a single pipeline stage. Always carries the name of the stage that failed so the
 * failure can be attributed once it reaches the caller.
 */
public class StageException extends Exception {
    private final String stage;

    public StageException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public StageException(String stage, Throwable cause) {
        this(stage, describe(cause), cause);
    }

    public String getStage() {
        return stage;
    }

    public ErrorKind kind() {
        return ErrorKind.STAGE;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "stage failed";
        }
        String message = cause.getMessage();
        return (message == null || message.isBlank())
                ? cause.getClass().getSimpleName()
                : message;
    }
}
