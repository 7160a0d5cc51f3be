package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.error.DuplicateNameException;
import io.gdcc.healthdcat.error.UnknownPluginException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of pipeline stages by name.
 *
 * <p>The process-wide instance ({@link #getInstance()}) is populated once by a bootstrap routine
 * (see {@link PluginBootstrap}) and is read-only afterwards; conversions only look plugins up.
 * Registration is append-only: there is no removal, and registering a name twice is rejected
 * with {@link DuplicateNameException}. Lookups are lock-free and may run concurrently with each
 * other; registration is serialized.
 *
 * <p>Independent registries can be created with the public constructor, e.g. for tests or for an
 * application embedding several differently configured pipelines.
 */
public final class PluginRegistry {

    private static final PluginRegistry INSTANCE = new PluginRegistry();

    private final Map<String, Plugin<?, ?>> pluginsByName = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

    public static PluginRegistry getInstance() {
        return INSTANCE;
    }

    public PluginRegistry() {}

    /**
     * Registers a plugin under the given name.
     *
     * @param name plugin name; trimmed, must be non-blank
     * @param plugin implementation
     * @throws IllegalArgumentException if name is blank
     * @throws DuplicateNameException if a plugin is already registered under the name
     */
    public synchronized void register(String name, Plugin<?, ?> plugin) {
        Objects.requireNonNull(plugin, "plugin");
        String key = Objects.requireNonNull(name, "name").trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Plugin name must be non-blank");
        }
        if (pluginsByName.putIfAbsent(key, plugin) != null) {
            throw new DuplicateNameException(key);
        }
        registrationOrder.add(key);
    }

    /**
     * Registers a batch of plugins all-or-nothing: if any name is blank or already taken, nothing
     * is registered.
     *
     * @param plugins plugins by name, in registration order
     * @throws DuplicateNameException if a name is already registered
     */
    public synchronized void registerAll(Map<String, Plugin<?, ?>> plugins) {
        Map<String, Plugin<?, ?>> batch = new LinkedHashMap<>();
        plugins.forEach(
                (name, plugin) -> {
                    String key = Objects.requireNonNull(name, "name").trim();
                    if (key.isEmpty()) {
                        throw new IllegalArgumentException("Plugin name must be non-blank");
                    }
                    if (pluginsByName.containsKey(key) || batch.containsKey(key)) {
                        throw new DuplicateNameException(key);
                    }
                    batch.put(key, Objects.requireNonNull(plugin, "plugin"));
                });
        pluginsByName.putAll(batch);
        registrationOrder.addAll(batch.keySet());
    }

    /** Registers a plugin under its own {@link Plugin#getName()}. */
    public void register(Plugin<?, ?> plugin) {
        register(Objects.requireNonNull(plugin, "plugin").getName(), plugin);
    }

    /**
     * Returns the plugin registered under {@code name}.
     *
     * @throws UnknownPluginException if nothing is registered under the name
     */
    public Plugin<?, ?> get(String name) {
        Plugin<?, ?> plugin = name == null ? null : pluginsByName.get(name.trim());
        if (plugin == null) {
            throw new UnknownPluginException(name);
        }
        return plugin;
    }

    public boolean contains(String name) {
        return name != null && pluginsByName.containsKey(name.trim());
    }

    /** Names in registration order. For discovery and diagnostics only. */
    public List<String> list() {
        return List.copyOf(registrationOrder);
    }

    /** Names of the plugins of one kind, in registration order. */
    public List<String> list(StageKind kind) {
        return registrationOrder.stream()
                .filter(name -> pluginsByName.get(name).kind() == kind)
                .toList();
    }

    public ReaderPlugin getReader(String name) {
        return typed(name, StageKind.READER, ReaderPlugin.class);
    }

    public ValidatorPlugin getValidator(String name) {
        return typed(name, StageKind.VALIDATOR, ValidatorPlugin.class);
    }

    public TransformPlugin getTransform(String name) {
        return typed(name, StageKind.TRANSFORM, TransformPlugin.class);
    }

    public GeneratorPlugin getGenerator(String name) {
        return typed(name, StageKind.GENERATOR, GeneratorPlugin.class);
    }

    private <T> T typed(String name, StageKind kind, Class<T> type) {
        Plugin<?, ?> plugin = get(name);
        if (plugin.kind() != kind || !type.isInstance(plugin)) {
            throw new UnknownPluginException(
                    name,
                    "Plugin '"
                            + name
                            + "' is a "
                            + plugin.kind()
                            + " stage, expected "
                            + kind);
        }
        return type.cast(plugin);
    }
}
