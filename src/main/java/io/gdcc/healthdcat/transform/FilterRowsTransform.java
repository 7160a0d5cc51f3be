package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.error.MissingConfigurationException;
import io.gdcc.healthdcat.error.StageException;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps only rows matching a condition on one column. Options: {@code field} (required) and one
 * of {@code equals} (string comparison), {@code matches} (regular expression) or {@code notBlank}
 * (default when neither of the others is given). {@code invert=true} drops matching rows instead.
 * Surviving rows keep their relative order.
 */
public class FilterRowsTransform implements TransformPlugin {
    public static final String NAME = "filter_rows";

    private static final Logger log = LoggerFactory.getLogger(FilterRowsTransform.class);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options) throws StageException {
        String field = options.getString("field");
        if (field == null || field.isBlank()) {
            throw new MissingConfigurationException(NAME, "field", "Option 'field' is required");
        }
        Predicate<Record> condition = condition(field, options);
        if (options.getBoolean("invert", false)) {
            condition = condition.negate();
        }
        RecordSet out = input.filter(condition);
        log.debug("Kept {} of {} rows on field '{}'", out.size(), input.size(), field);
        return out;
    }

    private Predicate<Record> condition(String field, StageOptions options) throws StageException {
        if (options.has("equals")) {
            String expected = options.getString("equals");
            return record -> Objects.equals(expected, record.getString(field));
        }
        if (options.has("matches")) {
            Pattern pattern;
            try {
                pattern = Pattern.compile(options.getString("matches"));
            } catch (PatternSyntaxException e) {
                throw new StageException(NAME, "Invalid 'matches' expression", e);
            }
            return record -> {
                String value = record.getString(field);
                return value != null && pattern.matcher(value).matches();
            };
        }
        return record -> !record.isBlank(field);
    }
}
