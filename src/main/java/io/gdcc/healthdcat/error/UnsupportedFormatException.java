package io.gdcc.healthdcat.error;

import java.util.Collection;
import java.util.List;

/** The requested serialization format is not one the generator can write. */
public class UnsupportedFormatException extends StageException {
    private final String format;
    private final List<String> supported;

    public UnsupportedFormatException(String stage, String format, Collection<String> supported) {
        super(
                stage,
                "Unsupported format '" + format + "'; supported formats are " + supported);
        this.format = format;
        this.supported = List.copyOf(supported);
    }

    public String getFormat() {
        return format;
    }

    public List<String> getSupported() {
        return supported;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNSUPPORTED_FORMAT;
    }
}
