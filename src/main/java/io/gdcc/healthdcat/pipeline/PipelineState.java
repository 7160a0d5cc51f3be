package io.gdcc.healthdcat.pipeline;

/**
 * States of one conversion run. Runs move strictly forward through {@code INIT, READ, VALIDATE,
 * TRANSFORM*, GENERATE, DONE}; {@code ERROR} is absorbing and reachable from any state.
 */
public enum PipelineState {
    INIT,
    READ,
    VALIDATE,
    TRANSFORM,
    GENERATE,
    DONE,
    ERROR
}
