package io.gdcc.healthdcat.model;

import java.util.List;

/**
 * Output of a validator stage.
 *
 * @param validRecords records that may continue down the pipeline
 * @param issues findings in row order, then rule declaration order
 */
public record ValidationReport(RecordSet validRecords, List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
