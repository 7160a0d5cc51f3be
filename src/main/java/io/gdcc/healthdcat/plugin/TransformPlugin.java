package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.model.RecordSet;

/**
 * Reshapes a record set: renames or derives fields, filters or reorders rows. A transform may
 * shrink the set but never duplicates a row.
 */
public interface TransformPlugin extends Plugin<RecordSet, RecordSet> {

    @Override
    default StageKind kind() {
        return StageKind.TRANSFORM;
    }
}
