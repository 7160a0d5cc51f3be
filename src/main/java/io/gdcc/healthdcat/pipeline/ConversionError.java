package io.gdcc.healthdcat.pipeline;

import io.gdcc.healthdcat.error.ErrorKind;

/**
 * The terminal failure of a conversion run.
 *
 * @param kind failure category
 * @param stage name of the stage (or unresolved plugin) that failed
 * @param message description of the failure
 * @param state pipeline state the run was in when it failed
 * @param cause underlying exception, for diagnostics
 */
public record ConversionError(
        ErrorKind kind, String stage, String message, PipelineState state, Throwable cause) {}
