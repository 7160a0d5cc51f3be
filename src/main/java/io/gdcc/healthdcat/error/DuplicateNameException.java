package io.gdcc.healthdcat.error;

/** A plugin was registered under a name that is already bound. */
public class DuplicateNameException extends PluginRegistryException {

    public DuplicateNameException(String pluginName) {
        super(pluginName, "Plugin already registered: " + pluginName);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_NAME;
    }
}
