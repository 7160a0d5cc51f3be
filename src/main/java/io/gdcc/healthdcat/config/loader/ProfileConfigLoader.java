package io.gdcc.healthdcat.config.loader;

import io.gdcc.healthdcat.config.model.EntityType;
import io.gdcc.healthdcat.config.model.FieldMapping;
import io.gdcc.healthdcat.config.model.ProfileConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProfileConfigLoader {
    public static final String SYS_PROP = "healthdcat.profile.config";
    public static final String DEFAULT_RESOURCE = "healthdcat-profile.properties";

    private static final Logger log = LoggerFactory.getLogger(ProfileConfigLoader.class);

    private static final Pattern FIELD_PREDICATE_PATTERN =
            Pattern.compile("^field\\.([^.]+)\\.predicate$");
    private static final Pattern TYPE_RULE_PATTERN =
            Pattern.compile("^validation\\.type\\.([^.]+)$");

    private static volatile ProfileConfig defaultConfig;

    private ProfileConfigLoader() {}

    /**
     * The default profile: the file named by the {@value #SYS_PROP} system property when set,
     * otherwise the {@value #DEFAULT_RESOURCE} bundled on the class path. Loaded once.
     */
    public static ProfileConfig loadDefault() {
        ProfileConfig config = defaultConfig;
        if (config == null) {
            synchronized (ProfileConfigLoader.class) {
                config = defaultConfig;
                if (config == null) {
                    try {
                        config = load();
                    } catch (IOException e) {
                        throw new UncheckedIOException("Could not load HealthDCAT profile", e);
                    }
                    defaultConfig = config;
                }
            }
        }
        return config;
    }

    /**
     * Load the profile from the location in the system property, falling back to the class path
     * resource.
     *
     * @return ProfileConfig
     * @throws IOException when loading fails
     */
    public static ProfileConfig load() throws IOException {
        String location = System.getProperty(SYS_PROP);
        if (location != null && !location.isBlank()) {
            Path path = Path.of(location.trim());
            log.info("Loading HealthDCAT profile from {}", path);
            try (InputStream closeMe = Files.newInputStream(path)) {
                return load(closeMe);
            }
        }
        try (InputStream closeMe =
                ProfileConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (closeMe == null) {
                throw new IOException(
                        "System property '"
                                + SYS_PROP
                                + "' not set and "
                                + DEFAULT_RESOURCE
                                + " not found on the class path");
            }
            return load(closeMe);
        }
    }

    public static ProfileConfig load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return parse(properties);
    }

    static ProfileConfig parse(Properties properties) {
        // prefix.*
        Map<String, String> prefixes = new LinkedHashMap<>();
        for (String k : sortedKeys(properties)) {
            if (k.startsWith("prefix.")) {
                prefixes.put(k.substring("prefix.".length()), properties.getProperty(k).trim());
            }
        }

        // fields: field.<column>.{predicate,target,as,datatype,lang,split,format,map.*}
        // Optional field.<column>.order keeps the emitted property order stable.
        Map<String, Integer> order = new TreeMap<>();
        List<String> columns = new ArrayList<>();
        for (String key : sortedKeys(properties)) {
            Matcher matcher = FIELD_PREDICATE_PATTERN.matcher(key);
            if (!matcher.matches()) {
                continue;
            }
            String column = matcher.group(1);
            columns.add(column);
            String rawOrder = properties.getProperty("field." + column + ".order");
            order.put(column, rawOrder == null ? Integer.MAX_VALUE : parseOrder(column, rawOrder));
        }
        columns.sort((a, b) -> Integer.compare(order.get(a), order.get(b)));

        Map<String, FieldMapping> fields = new LinkedHashMap<>();
        for (String column : columns) {
            fields.put(column, parseField(properties, column));
        }

        // validation.required=a,b and validation.type.<column>=<type>
        List<String> required = splitList(properties.getProperty("validation.required"));
        Map<String, String> types = new LinkedHashMap<>();
        for (String key : sortedKeys(properties)) {
            Matcher matcher = TYPE_RULE_PATTERN.matcher(key);
            if (matcher.matches()) {
                types.put(matcher.group(1), properties.getProperty(key).trim());
            }
        }

        String agentKey = properties.getProperty("agent.key", "publisher").trim();
        return new ProfileConfig(
                Collections.unmodifiableMap(prefixes),
                Collections.unmodifiableMap(fields),
                List.copyOf(required),
                Collections.unmodifiableMap(types),
                agentKey);
    }

    private static FieldMapping parseField(Properties properties, String column) {
        String base = "field." + column;
        Map<String, String> map = new LinkedHashMap<>();
        String mapPrefix = base + ".map.";
        for (String key : sortedKeys(properties)) {
            if (key.startsWith(mapPrefix)) {
                map.put(key.substring(mapPrefix.length()), properties.getProperty(key).trim());
            }
        }
        return new FieldMapping(
                column,
                EntityType.fromToken(properties.getProperty(base + ".target")),
                properties.getProperty(base + ".predicate").trim(),
                trimToNull(properties.getProperty(base + ".as")),
                trimToNull(properties.getProperty(base + ".datatype")),
                trimToNull(properties.getProperty(base + ".lang")),
                properties.getProperty(base + ".split"),
                trimToNull(properties.getProperty(base + ".format")),
                map);
    }

    private static int parseOrder(String column, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "field." + column + ".order must be an integer, got '" + raw + "'", e);
        }
    }

    private static List<String> sortedKeys(Properties properties) {
        List<String> keys = new ArrayList<>(properties.stringPropertyNames());
        Collections.sort(keys);
        return keys;
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }

    private static String trimToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
