package io.gdcc.healthdcat.error;

/** Base type for registry lookups and registrations that cannot be honoured. */
public abstract class PluginRegistryException extends RuntimeException {
    private final String pluginName;

    protected PluginRegistryException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }

    public abstract ErrorKind kind();
}
