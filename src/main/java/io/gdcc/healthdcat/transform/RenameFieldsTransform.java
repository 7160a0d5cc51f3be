package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.error.MissingConfigurationException;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import java.util.Map;

/**
 * Renames columns, e.g. to align source headers with profile field names. Option {@code mapping}:
 * old column name to new column name. Columns keep their position; renames apply
 * simultaneously, so a mapping may swap two columns.
 */
public class RenameFieldsTransform implements TransformPlugin {
    public static final String NAME = "rename_fields";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options)
            throws MissingConfigurationException {
        Map<String, String> mapping = options.getStringMap("mapping");
        if (mapping.isEmpty()) {
            throw new MissingConfigurationException(
                    NAME, "mapping", "Option 'mapping' (old name -> new name) is required");
        }
        return input.map(record -> record.renamed(mapping));
    }
}
