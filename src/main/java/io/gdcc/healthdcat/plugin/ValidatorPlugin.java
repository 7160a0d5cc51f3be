package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.model.ValidationReport;

/** Checks a record set and reports the valid subset plus any issues found. */
public interface ValidatorPlugin extends Plugin<RecordSet, ValidationReport> {

    @Override
    default StageKind kind() {
        return StageKind.VALIDATOR;
    }
}
