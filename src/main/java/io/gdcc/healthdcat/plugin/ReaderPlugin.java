package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.reader.RecordSource;

/**
 * Reader boundary: turns a byte source into an ordered {@link RecordSet}. Implementations open the
 * source with {@link RecordSource#open()} and must close it before returning, on success and on
 * failure. Unreadable or malformed input is reported as a {@link
 * io.gdcc.healthdcat.error.SourceReadException}.
 */
public interface ReaderPlugin extends Plugin<RecordSource, RecordSet> {

    @Override
    default StageKind kind() {
        return StageKind.READER;
    }
}
