package io.gdcc.healthdcat.pipeline;

import io.gdcc.healthdcat.model.ValidationIssue;
import java.util.List;

/**
 * Outcome of one conversion.
 *
 * <p>{@code success=true} means the run completed; {@code issues} may still hold lenient
 * validation warnings. {@code success=false} means the run aborted: {@code error} identifies the
 * failure and {@code text} is null, never a partial serialization.
 *
 * @param text serialized graph, or null when the run failed
 * @param issues validation issues collected before completion or failure
 * @param success whether the run reached {@link PipelineState#DONE}
 * @param error the terminal failure, or null on success
 * @param stages names of the stages that ran to completion, in order
 */
public record ConversionResult(
        String text,
        List<ValidationIssue> issues,
        boolean success,
        ConversionError error,
        List<String> stages) {

    public ConversionResult {
        issues = List.copyOf(issues);
        stages = List.copyOf(stages);
    }

    static ConversionResult completed(
            String text, List<ValidationIssue> issues, List<String> stages) {
        return new ConversionResult(text, issues, true, null, stages);
    }

    static ConversionResult failed(
            ConversionError error, List<ValidationIssue> issues, List<String> stages) {
        return new ConversionResult(null, issues, false, error, stages);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
