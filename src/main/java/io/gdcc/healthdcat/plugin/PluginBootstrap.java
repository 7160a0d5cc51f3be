package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.error.DuplicateNameException;
import io.gdcc.healthdcat.mapping.RdfGeneratorPlugin;
import io.gdcc.healthdcat.reader.CsvReaderPlugin;
import io.gdcc.healthdcat.transform.CustomTransformPlugin;
import io.gdcc.healthdcat.transform.DeduplicateTransform;
import io.gdcc.healthdcat.transform.DeriveFieldTransform;
import io.gdcc.healthdcat.transform.FilterRowsTransform;
import io.gdcc.healthdcat.transform.RenameFieldsTransform;
import io.gdcc.healthdcat.transform.TrimValuesTransform;
import io.gdcc.healthdcat.validation.RuleValidator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trusted start-up routine that fills a {@link PluginRegistry}: first the built-in stages, then
 * any {@link PluginProvider} found on the class path. Conversions never register plugins
 * themselves.
 */
public final class PluginBootstrap {
    private static final Logger log = LoggerFactory.getLogger(PluginBootstrap.class);

    private static volatile boolean defaultRegistryReady;

    private PluginBootstrap() {}

    /**
     * Returns the process-wide registry, populating it on first use with built-ins and discovered
     * providers. A failed bootstrap registers nothing, so a later call can retry.
     */
    public static PluginRegistry defaultRegistry() {
        if (!defaultRegistryReady) {
            synchronized (PluginBootstrap.class) {
                if (!defaultRegistryReady) {
                    populate(
                            PluginRegistry.getInstance(),
                            Thread.currentThread().getContextClassLoader());
                    defaultRegistryReady = true;
                }
            }
        }
        return PluginRegistry.getInstance();
    }

    /**
     * Registers the built-ins and every enabled provider visible to {@code classLoader} as one
     * batch.
     *
     * @throws DuplicateNameException if any name is taken twice; the registry is left unchanged
     */
    static void populate(PluginRegistry registry, ClassLoader classLoader) {
        Map<String, Plugin<?, ?>> plugins = new LinkedHashMap<>();
        for (Plugin<?, ?> plugin : builtins()) {
            add(plugins, plugin.getName(), plugin);
        }
        discover(plugins, classLoader);
        registry.registerAll(plugins);
        log.debug("Registered {} plugins", plugins.size());
    }

    /** The stages shipped with the converter, in registration order. */
    public static List<Plugin<?, ?>> builtins() {
        return List.of(
                new CsvReaderPlugin(),
                new RuleValidator(),
                new RenameFieldsTransform(),
                new TrimValuesTransform(),
                new FilterRowsTransform(),
                new DeriveFieldTransform(),
                new DeduplicateTransform(),
                new CustomTransformPlugin(),
                new RdfGeneratorPlugin());
    }

    public static void registerBuiltins(PluginRegistry registry) {
        Map<String, Plugin<?, ?>> plugins = new LinkedHashMap<>();
        for (Plugin<?, ?> plugin : builtins()) {
            add(plugins, plugin.getName(), plugin);
        }
        registry.registerAll(plugins);
        log.debug("Registered {} built-in plugins", plugins.size());
    }

    /**
     * Registers every enabled {@link PluginProvider} visible to {@code classLoader}.
     *
     * @return number of plugins registered
     * @throws DuplicateNameException if a provider reuses a taken name
     */
    public static int registerDiscovered(PluginRegistry registry, ClassLoader classLoader) {
        Map<String, Plugin<?, ?>> plugins = new LinkedHashMap<>();
        discover(plugins, classLoader);
        registry.registerAll(plugins);
        return plugins.size();
    }

    private static void discover(Map<String, Plugin<?, ?>> plugins, ClassLoader classLoader) {
        for (PluginProvider provider : ServiceLoader.load(PluginProvider.class, classLoader)) {
            if (!provider.isEnabled()) {
                log.info("Skipping disabled plugin provider {}", provider.getClass().getName());
                continue;
            }
            String name = provider.getPluginName();
            add(plugins, name, provider.getPlugin());
            log.info("Found plugin '{}' in provider {}", name, provider.getClass().getName());
        }
    }

    private static void add(Map<String, Plugin<?, ?>> plugins, String name, Plugin<?, ?> plugin) {
        if (plugins.putIfAbsent(name.trim(), plugin) != null) {
            throw new DuplicateNameException(name.trim());
        }
    }
}
