package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;

/**
 * Sample third-party style transform: marks every row with {@code _transformed=true} and {@code
 * _plugin=<name>}. Useful for checking that a transform chain ran.
 */
public class CustomTransformPlugin implements TransformPlugin {
    public static final String NAME = "custom_transform";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options) {
        return input.map(record -> record.with("_transformed", Boolean.TRUE).with("_plugin", NAME));
    }
}
