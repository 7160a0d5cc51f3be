package io.gdcc.healthdcat.transform;

import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops rows whose key repeats an earlier row's key; the first occurrence wins. Option {@code key}
 * lists the key columns (default: all columns, i.e. exact duplicates). This is the one sanctioned
 * way for rows to collapse onto the same generated identifier.
 */
public class DeduplicateTransform implements TransformPlugin {
    public static final String NAME = "deduplicate";

    private static final Logger log = LoggerFactory.getLogger(DeduplicateTransform.class);

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordSet execute(RecordSet input, StageOptions options) {
        List<String> key = options.getStringList("key");
        Set<List<Object>> seen = new HashSet<>();
        RecordSet out = input.filter(record -> seen.add(keyOf(record, key)));
        if (out.size() != input.size()) {
            log.info("Removed {} duplicate rows", input.size() - out.size());
        }
        return out;
    }

    private static List<Object> keyOf(Record record, List<String> key) {
        if (key.isEmpty()) {
            return List.of(record.asMap());
        }
        List<Object> values = new ArrayList<>(key.size());
        for (String column : key) {
            values.add(record.getString(column));
        }
        return values;
    }
}
