package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.validation.RuleValidator;

/** Test provider that reuses a built-in name; listed only under {@code clashing/}. */
public class ClashingProvider implements PluginProvider {

    @Override
    public Plugin<?, ?> getPlugin() {
        return new RuleValidator();
    }
}
