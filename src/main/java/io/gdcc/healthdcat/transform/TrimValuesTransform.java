package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import java.util.List;

/**
 * Strips leading and trailing whitespace from string values. Option {@code fields} limits the
 * columns touched (default: all); {@code emptyToNull} turns values that end up empty into null.
 */
public class TrimValuesTransform implements TransformPlugin {
    public static final String NAME = "trim_values";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options) {
        List<String> fields = options.getStringList("fields");
        boolean emptyToNull = options.getBoolean("emptyToNull", false);
        return input.map(
                record -> {
                    Record out = record;
                    for (String column : record.columns()) {
                        if (!fields.isEmpty() && !fields.contains(column)) {
                            continue;
                        }
                        Object value = record.get(column);
                        if (value instanceof String) {
                            String trimmed = ((String) value).strip();
                            Object replacement =
                                    (emptyToNull && trimmed.isEmpty()) ? null : trimmed;
                            if (!value.equals(replacement)) {
                                out = out.with(column, replacement);
                            }
                        }
                    }
                    return out;
                });
    }
}
