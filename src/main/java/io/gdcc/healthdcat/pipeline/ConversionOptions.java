package io.gdcc.healthdcat.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gdcc.healthdcat.mapping.RdfGeneratorPlugin;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.reader.CsvReaderPlugin;
import io.gdcc.healthdcat.validation.RuleValidator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options of one conversion call. Absent values take their defaults: {@code format=turtle},
 * {@code validate=true}, lenient validation, no transforms, and the built-in reader, validator and
 * generator.
 *
 * <p>Can be bound from a plain map (e.g. parsed JSON or YAML) with {@link #fromMap(Map)}; unknown
 * keys are rejected.
 *
 * @param format serialization format identifier
 * @param datasetUri base IRI of generated identifiers
 * @param validate whether the validate stage runs
 * @param strict abort on the first validation issue instead of collecting issues
 * @param allowEmpty blank values satisfy {@code required}
 * @param dropInvalidRows in lenient mode, drop rows that have issues
 * @param requiredFields columns every row must fill
 * @param fieldTypes column to type rule (integer, decimal, boolean, date, uri, pattern:regex)
 * @param transforms transform plugin names, in execution order
 * @param transformOptions per transform name, that transform's options
 * @param propertyMapping column to predicate, overriding the profile mapping
 * @param naturalKey column used instead of the row index to identify datasets
 * @param reader name of the reader plugin
 * @param validator name of the validator plugin
 * @param generator name of the generator plugin
 * @param readerOptions options passed to the reader
 * @param generatorOptions further generator options (e.g. includeTableSchema, catalogTitle)
 */
public record ConversionOptions(
        String format,
        String datasetUri,
        Boolean validate,
        Boolean strict,
        Boolean allowEmpty,
        Boolean dropInvalidRows,
        List<String> requiredFields,
        Map<String, String> fieldTypes,
        List<String> transforms,
        Map<String, Map<String, Object>> transformOptions,
        Map<String, String> propertyMapping,
        String naturalKey,
        String reader,
        String validator,
        String generator,
        Map<String, Object> readerOptions,
        Map<String, Object> generatorOptions) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ConversionOptions {
        format = (format == null || format.isBlank()) ? RdfGeneratorPlugin.DEFAULT_FORMAT : format;
        validate = validate == null ? Boolean.TRUE : validate;
        strict = strict == null ? Boolean.FALSE : strict;
        allowEmpty = allowEmpty == null ? Boolean.FALSE : allowEmpty;
        dropInvalidRows = dropInvalidRows == null ? Boolean.FALSE : dropInvalidRows;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        fieldTypes = fieldTypes == null ? Map.of() : orderedCopy(fieldTypes);
        transforms = transforms == null ? List.of() : List.copyOf(transforms);
        transformOptions = transformOptions == null ? Map.of() : orderedCopy(transformOptions);
        propertyMapping = propertyMapping == null ? Map.of() : orderedCopy(propertyMapping);
        reader = (reader == null || reader.isBlank()) ? CsvReaderPlugin.NAME : reader;
        validator = (validator == null || validator.isBlank()) ? RuleValidator.NAME : validator;
        generator =
                (generator == null || generator.isBlank()) ? RdfGeneratorPlugin.NAME : generator;
        readerOptions = readerOptions == null ? Map.of() : orderedCopy(readerOptions);
        generatorOptions = generatorOptions == null ? Map.of() : orderedCopy(generatorOptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds options from a map keyed by component name.
     *
     * @throws IllegalArgumentException on unknown keys or values of the wrong shape
     */
    public static ConversionOptions fromMap(Map<String, ?> values) {
        return MAPPER.convertValue(values, ConversionOptions.class);
    }

    public StageOptions readerStageOptions() {
        return StageOptions.of(readerOptions);
    }

    public StageOptions validatorStageOptions() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("strict", strict);
        map.put("allowEmpty", allowEmpty);
        map.put("dropInvalidRows", dropInvalidRows);
        map.put("requiredFields", requiredFields);
        map.put("fieldTypes", fieldTypes);
        return StageOptions.of(map);
    }

    /** Explicit options ({@code format}, {@code datasetUri}, ...) win over generatorOptions. */
    public StageOptions generatorStageOptions() {
        Map<String, Object> map = new LinkedHashMap<>(generatorOptions);
        map.put("format", format);
        if (datasetUri != null) {
            map.put("datasetUri", datasetUri);
        }
        if (!propertyMapping.isEmpty()) {
            map.put("propertyMapping", propertyMapping);
        }
        if (naturalKey != null) {
            map.put("naturalKey", naturalKey);
        }
        return StageOptions.of(map);
    }

    public StageOptions transformStageOptions(String transformName) {
        return StageOptions.of(transformOptions.get(transformName));
    }

    private static <V> Map<String, V> orderedCopy(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public static final class Builder {
        private String format;
        private String datasetUri;
        private Boolean validate;
        private Boolean strict;
        private Boolean allowEmpty;
        private Boolean dropInvalidRows;
        private final List<String> requiredFields = new ArrayList<>();
        private final Map<String, String> fieldTypes = new LinkedHashMap<>();
        private final List<String> transforms = new ArrayList<>();
        private final Map<String, Map<String, Object>> transformOptions = new LinkedHashMap<>();
        private final Map<String, String> propertyMapping = new LinkedHashMap<>();
        private String naturalKey;
        private String reader;
        private String validator;
        private String generator;
        private final Map<String, Object> readerOptions = new LinkedHashMap<>();
        private final Map<String, Object> generatorOptions = new LinkedHashMap<>();

        private Builder() {}

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder datasetUri(String datasetUri) {
            this.datasetUri = datasetUri;
            return this;
        }

        public Builder validate(boolean validate) {
            this.validate = validate;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder allowEmpty(boolean allowEmpty) {
            this.allowEmpty = allowEmpty;
            return this;
        }

        public Builder dropInvalidRows(boolean dropInvalidRows) {
            this.dropInvalidRows = dropInvalidRows;
            return this;
        }

        public Builder requiredFields(String... fields) {
            this.requiredFields.addAll(List.of(fields));
            return this;
        }

        public Builder fieldType(String field, String type) {
            this.fieldTypes.put(field, type);
            return this;
        }

        public Builder transform(String name) {
            this.transforms.add(name);
            return this;
        }

        public Builder transform(String name, Map<String, ?> options) {
            this.transforms.add(name);
            this.transformOptions.put(name, new LinkedHashMap<>(options));
            return this;
        }

        public Builder propertyMapping(String column, String predicate) {
            this.propertyMapping.put(column, predicate);
            return this;
        }

        public Builder naturalKey(String naturalKey) {
            this.naturalKey = naturalKey;
            return this;
        }

        public Builder reader(String reader) {
            this.reader = reader;
            return this;
        }

        public Builder validator(String validator) {
            this.validator = validator;
            return this;
        }

        public Builder generator(String generator) {
            this.generator = generator;
            return this;
        }

        public Builder readerOption(String key, Object value) {
            this.readerOptions.put(key, value);
            return this;
        }

        public Builder generatorOption(String key, Object value) {
            this.generatorOptions.put(key, value);
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(
                    format,
                    datasetUri,
                    validate,
                    strict,
                    allowEmpty,
                    dropInvalidRows,
                    requiredFields,
                    fieldTypes,
                    transforms,
                    transformOptions,
                    propertyMapping,
                    naturalKey,
                    reader,
                    validator,
                    generator,
                    readerOptions,
                    generatorOptions);
        }
    }
}
