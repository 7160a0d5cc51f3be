package io.gdcc.healthdcat.error;

import io.gdcc.healthdcat.model.ValidationIssue;
import java.util.List;

/** Raised by a validator in strict mode when at least one issue was found. */
public class ValidationFailedException extends StageException {
    private final transient List<ValidationIssue> issues;

    public ValidationFailedException(String stage, List<ValidationIssue> issues) {
        super(stage, summarize(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_FAILED;
    }

    private static String summarize(List<ValidationIssue> issues) {
        StringBuilder sb = new StringBuilder("Validation failed with ")
                .append(issues.size())
                .append(issues.size() == 1 ? " issue" : " issues");
        for (ValidationIssue issue : issues) {
            sb.append(System.lineSeparator()).append("  - ").append(issue.message());
        }
        return sb.toString();
    }
}
