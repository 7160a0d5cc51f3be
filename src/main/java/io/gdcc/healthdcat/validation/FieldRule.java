package io.gdcc.healthdcat.validation;

import java.util.regex.Pattern;

/**
 * All checks declared for one column.
 *
 * @param field column name
 * @param required whether every row must provide a non-blank value
 * @param type expected value format; {@link FieldType#STRING} accepts anything
 * @param pattern optional regular expression the whole value must match
 */
public record FieldRule(String field, boolean required, FieldType type, Pattern pattern) {

    public FieldRule {
        type = type == null ? FieldType.STRING : type;
    }

    public static FieldRule required(String field) {
        return new FieldRule(field, true, FieldType.STRING, null);
    }

    public FieldRule withRequired() {
        return new FieldRule(field, true, type, pattern);
    }

    public FieldRule withType(FieldType newType) {
        return new FieldRule(field, required, newType, pattern);
    }

    public FieldRule withPattern(Pattern newPattern) {
        return new FieldRule(field, required, type, newPattern);
    }
}
