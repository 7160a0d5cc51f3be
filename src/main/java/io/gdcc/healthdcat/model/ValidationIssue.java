package io.gdcc.healthdcat.model;

/**
 * One validation finding.
 *
 * @param row zero-based index of the offending row
 * @param field column the rule was declared on
 * @param rule rule identifier, e.g. {@code required} or {@code integer}
 * @param message human readable description
 */
public record ValidationIssue(int row, String field, String rule, String message) {

    public static ValidationIssue required(int row, String field) {
        return new ValidationIssue(
                row, field, "required", "Row " + row + " missing required field: " + field);
    }

    public static ValidationIssue malformed(int row, String field, String rule, Object value) {
        return new ValidationIssue(
                row,
                field,
                rule,
                "Row " + row + " field '" + field + "' is not a valid " + rule + ": '" + value
                        + "'");
    }
}
