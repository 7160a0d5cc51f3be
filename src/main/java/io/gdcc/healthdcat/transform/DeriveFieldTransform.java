package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.error.MissingConfigurationException;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes a column from a template over other columns of the same row, e.g. {@code
 * template="${title} (${year})"}. Missing or empty placeholders render as empty strings. Options:
 * {@code target}, {@code template} (both required) and {@code overwrite} (default false: rows that
 * already hold a non-blank target value are left alone).
 */
public class DeriveFieldTransform implements TransformPlugin {
    public static final String NAME = "derive_field";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options)
            throws MissingConfigurationException {
        String target = options.getString("target");
        String template = options.getString("template");
        if (target == null || target.isBlank()) {
            throw new MissingConfigurationException(NAME, "target", "Option 'target' is required");
        }
        if (template == null) {
            throw new MissingConfigurationException(
                    NAME, "template", "Option 'template' is required");
        }
        boolean overwrite = options.getBoolean("overwrite", false);
        return input.map(
                record -> {
                    if (!overwrite && !record.isBlank(target)) {
                        return record;
                    }
                    return record.with(target, render(template, record));
                });
    }

    static String render(String template, Record record) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = record.getString(matcher.group(1).trim());
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
