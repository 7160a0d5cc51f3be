package io.gdcc.healthdcat.error;

/** No plugin (of the requested kind) is registered under the given name. */
public class UnknownPluginException extends PluginRegistryException {

    public UnknownPluginException(String pluginName) {
        super(pluginName, "No plugin registered under name: " + pluginName);
    }

    public UnknownPluginException(String pluginName, String message) {
        super(pluginName, message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UNKNOWN_PLUGIN;
    }
}
