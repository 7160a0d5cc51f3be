package io.gdcc.healthdcat.plugin;

/** The role a plugin plays in the conversion pipeline. */
public enum StageKind {
    READER,
    VALIDATOR,
    TRANSFORM,
    GENERATOR
}
