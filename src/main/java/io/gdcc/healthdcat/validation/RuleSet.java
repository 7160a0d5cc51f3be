package io.gdcc.healthdcat.validation;

import io.gdcc.healthdcat.config.model.ProfileConfig;
import io.gdcc.healthdcat.plugin.StageOptions;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered set of {@link FieldRule}s. Fields keep the position of their first declaration, which
 * fixes the order of issues reported for a row.
 */
public final class RuleSet {
    private static final String PATTERN_PREFIX = "pattern:";

    private final Map<String, FieldRule> rules;

    private RuleSet(Map<String, FieldRule> rules) {
        this.rules = rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rules from the profile defaults (unless {@code useProfileRules=false}) followed by the
     * {@code requiredFields} and {@code fieldTypes} options.
     */
    public static RuleSet from(ProfileConfig profile, StageOptions options) {
        Builder builder = builder();
        boolean useProfile = options.getBoolean("useProfileRules", true);
        if (useProfile && profile != null) {
            builder.required(profile.requiredFields());
        }
        builder.required(options.getStringList("requiredFields"));
        if (useProfile && profile != null) {
            profile.fieldTypes().forEach(builder::type);
        }
        options.getStringMap("fieldTypes").forEach(builder::type);
        return builder.build();
    }

    public List<FieldRule> rules() {
        return List.copyOf(rules.values());
    }

    public FieldRule rule(String field) {
        return rules.get(field);
    }

    public static final class Builder {
        private final Map<String, FieldRule> rules = new LinkedHashMap<>();

        private Builder() {}

        public Builder required(String field) {
            rules.merge(field, FieldRule.required(field), (old, ignored) -> old.withRequired());
            return this;
        }

        public Builder required(Collection<String> fields) {
            fields.forEach(this::required);
            return this;
        }

        public Builder type(String field, FieldType type) {
            rules.put(field, current(field).withType(type));
            return this;
        }

        /**
         * Declares a type by rule id: {@code integer}, {@code decimal}, {@code boolean}, {@code
         * date}, {@code uri}, {@code string}, or {@code pattern:<regex>}.
         */
        public Builder type(String field, String ruleId) {
            if (ruleId.startsWith(PATTERN_PREFIX)) {
                return pattern(field, ruleId.substring(PATTERN_PREFIX.length()));
            }
            return type(field, FieldType.fromRuleId(ruleId));
        }

        public Builder pattern(String field, String regex) {
            Pattern compiled;
            try {
                compiled = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "Invalid pattern for field '" + field + "': " + regex, e);
            }
            rules.put(field, current(field).withPattern(compiled));
            return this;
        }

        private FieldRule current(String field) {
            return rules.computeIfAbsent(
                    field, f -> new FieldRule(f, false, FieldType.STRING, null));
        }

        public RuleSet build() {
            return new RuleSet(Collections.unmodifiableMap(new LinkedHashMap<>(rules)));
        }
    }
}
