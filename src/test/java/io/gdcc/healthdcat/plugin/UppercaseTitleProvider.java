package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.model.RecordSet;
import java.util.Locale;

/** Test provider registered through META-INF/services. */
public class UppercaseTitleProvider implements PluginProvider {
    public static final String NAME = "uppercase_title";

    @Override
    public Plugin<?, ?> getPlugin() {
        return new TransformPlugin() {
            @Override
            public String getName() {
                return NAME;
            }

            @Override
            public RecordSet execute(RecordSet input, StageOptions options) {
                return input.map(
                        r ->
                                r.isBlank("title")
                                        ? r
                                        : r.with(
                                                "title",
                                                r.getString("title").toUpperCase(Locale.ROOT)));
            }
        };
    }
}
