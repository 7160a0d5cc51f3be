package io.gdcc.healthdcat.plugin;

/**
 * SPI for third-party stages. Implementations are listed in {@code
 * META-INF/services/io.gdcc.healthdcat.plugin.PluginProvider} and registered by {@link
 * PluginBootstrap#registerDiscovered(PluginRegistry, ClassLoader)}; no converter code changes are
 * needed for a new stage.
 */
public interface PluginProvider {

    /** The stage to register. Called once per bootstrap. */
    Plugin<?, ?> getPlugin();

    /** Registration name. Defaults to the plugin's own name. */
    default String getPluginName() {
        return getPlugin().getName();
    }

    /** Whether this provider should be registered, e.g. false when required settings are absent. */
    default boolean isEnabled() {
        return true;
    }
}
