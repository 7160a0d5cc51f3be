package io.gdcc.healthdcat.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A re-openable source of tabular bytes. Readers acquire the stream with {@link #open()} inside
 * try-with-resources so it is released however the conversion fails.
 */
@FunctionalInterface
public interface RecordSource {

    InputStream open() throws IOException;

    /** Short label used in log and error messages. */
    default String describe() {
        return getClass().getSimpleName();
    }

    static RecordSource of(Path path) {
        Objects.requireNonNull(path, "path");
        return new RecordSource() {
            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(path);
            }

            @Override
            public String describe() {
                return path.toString();
            }
        };
    }

    static RecordSource of(byte[] bytes) {
        byte[] copy = bytes.clone();
        return new RecordSource() {
            @Override
            public InputStream open() {
                return new ByteArrayInputStream(copy);
            }

            @Override
            public String describe() {
                return "<" + copy.length + " bytes>";
            }
        };
    }

    static RecordSource ofString(String text) {
        return of(Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
    }
}
