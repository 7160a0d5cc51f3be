package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.model.RecordSet;

/** Produces the serialized metadata graph for a record set. Must not perform I/O. */
public interface GeneratorPlugin extends Plugin<RecordSet, String> {

    @Override
    default StageKind kind() {
        return StageKind.GENERATOR;
    }
}
