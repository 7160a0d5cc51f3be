package io.gdcc.healthdcat.error;

/** A stage option without a usable default was absent or unusable. */
public class MissingConfigurationException extends StageException {
    private final String option;

    public MissingConfigurationException(String stage, String option, String message) {
        super(stage, message);
        this.option = option;
    }

    public String getOption() {
        return option;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_CONFIGURATION;
    }
}
