package io.gdcc.healthdcat.mapping;

import io.gdcc.healthdcat.config.model.EntityType;
import io.gdcc.healthdcat.config.model.FieldMapping;
import io.gdcc.healthdcat.model.Record;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.jena.vocabulary.DCAT;
import org.apache.jena.vocabulary.DCTerms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps one record onto profile entities: the row's dataset plus, when the row has columns for
 * them, a distribution, a publisher agent and a contact point linked from the dataset.
 */
public class EntityMapper {
    private static final Logger log = LoggerFactory.getLogger(EntityMapper.class);

    private final Map<String, FieldMapping> fields;
    private final Prefixes prefixes;
    private final String agentKey;
    private final boolean includeUnmapped;

    /**
     * @param fields column mappings in emission order
     * @param prefixes used to expand predicate and datatype CURIEs
     * @param agentKey column whose value names the publisher agent
     * @param includeUnmapped emit columns without a mapping as literals below the dataset base
     * @throws IllegalArgumentException if a mapping targets an entity rows cannot create or uses a
     *     predicate that does not expand
     */
    public EntityMapper(
            Map<String, FieldMapping> fields,
            Prefixes prefixes,
            String agentKey,
            boolean includeUnmapped) {
        for (FieldMapping mapping : fields.values()) {
            if (prefixes.expand(mapping.predicate()) == null) {
                throw new IllegalArgumentException(
                        "Cannot resolve predicate '"
                                + mapping.predicate()
                                + "' of column '"
                                + mapping.column()
                                + "'");
            }
            if (mapping.target() == EntityType.TABLE_SCHEMA
                    || mapping.target() == EntityType.COLUMN) {
                throw new IllegalArgumentException(
                        "Column '" + mapping.column() + "' cannot target " + mapping.target());
            }
        }
        this.fields = fields;
        this.prefixes = prefixes;
        this.agentKey = agentKey;
        this.includeUnmapped = includeUnmapped;
    }

    /**
     * Adds the entities of one row to {@code graph}.
     *
     * @param key disambiguating key of the row (row index or natural key value)
     * @return the row's dataset entity
     */
    public Entity map(EntityGraph graph, IdentifierFactory ids, Record record, String key) {
        Entity dataset = graph.entity(ids.dataset(key), EntityType.DATASET.typeIri());
        for (FieldMapping mapping : fields.values()) {
            if (record.isBlank(mapping.column())) {
                continue;
            }
            Entity subject = subjectFor(graph, ids, record, key, dataset, mapping.target());
            if (subject == null) {
                continue;
            }
            String predicate = prefixes.expand(mapping.predicate());
            for (Value value : resolveValues(record.getString(mapping.column()), mapping)) {
                subject.add(predicate, value);
            }
        }
        if (includeUnmapped) {
            for (String column : record.columns()) {
                if (fields.containsKey(column)
                        || column.startsWith("_")
                        || record.isBlank(column)) {
                    continue;
                }
                dataset.add(
                        ids.fieldProperty(column), Value.literal(record.getString(column).trim()));
            }
        }
        return dataset;
    }

    private Entity subjectFor(
            EntityGraph graph,
            IdentifierFactory ids,
            Record record,
            String key,
            Entity dataset,
            EntityType target) {
        return switch (target) {
            case DATASET -> dataset;
            case CATALOG -> graph.entity(ids.catalog(), EntityType.CATALOG.typeIri());
            case DISTRIBUTION -> {
                Entity distribution =
                        graph.entity(ids.distribution(key), EntityType.DISTRIBUTION.typeIri());
                dataset.addReference(DCAT.distribution.getURI(), distribution);
                yield distribution;
            }
            case CONTACT -> {
                Entity contact = graph.entity(ids.contact(key), EntityType.CONTACT.typeIri());
                dataset.addReference(DCAT.contactPoint.getURI(), contact);
                yield contact;
            }
            case AGENT -> {
                if (agentKey == null || record.isBlank(agentKey)) {
                    yield null; // no publisher name, nothing to attach agent details to
                }
                Entity agent =
                        graph.entity(
                                ids.agent(record.getString(agentKey)),
                                EntityType.AGENT.typeIri());
                dataset.addReference(DCTerms.publisher.getURI(), agent);
                yield agent;
            }
            default -> throw new IllegalStateException("Unsupported target " + target);
        };
    }

    List<Value> resolveValues(String cell, FieldMapping mapping) {
        List<String> raw = splitCell(cell, mapping);
        List<Value> out = new ArrayList<>(raw.size());
        for (String s : raw) {
            if (mapping.isIri()) {
                String iri = toIri(s, mapping);
                if (looksLikeIri(iri)) {
                    out.add(Value.ref(iri));
                } else {
                    log.warn(
                            "Dropping value '{}' of column '{}': not a valid IRI",
                            s,
                            mapping.column());
                }
            } else {
                out.add(literal(applyMapIfAny(s, mapping), mapping));
            }
        }
        return out;
    }

    private static List<String> splitCell(String cell, FieldMapping mapping) {
        if (!mapping.multi()) {
            return Collections.singletonList(cell.trim());
        }
        List<String> values = new ArrayList<>();
        for (String part : cell.split(java.util.regex.Pattern.quote(mapping.separator()))) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }

    /** map lookup, then absolute IRIs as-is, then the format template. */
    private String toIri(String value, FieldMapping mapping) {
        String mapped = lookup(value, mapping);
        if (mapped != null) {
            String expanded = prefixes.expand(mapped);
            return expanded != null ? expanded : mapped;
        }
        if (looksLikeIri(value)) {
            return value;
        }
        if (mapping.format() != null && !mapping.format().isBlank()) {
            String filled =
                    isOpaqueTemplate(mapping.format())
                            ? value.trim()
                            : normalizeTemplateValue(value);
            return mapping.format().replace("${value}", filled);
        }
        return value;
    }

    private static String applyMapIfAny(String value, FieldMapping mapping) {
        String mapped = lookup(value, mapping);
        return mapped != null ? mapped : value;
    }

    private static String lookup(String value, FieldMapping mapping) {
        if (mapping.map().isEmpty()) {
            return null;
        }
        // Try normalized key first, then the original
        String key = stripParameters(value).toLowerCase(Locale.ROOT);
        return mapping.map().getOrDefault(key, mapping.map().get(value));
    }

    private Value literal(String value, FieldMapping mapping) {
        String datatypeIri = prefixes.expand(mapping.datatype());
        if (datatypeIri != null) {
            return Value.typed(value, datatypeIri);
        }
        if (mapping.lang() != null && !mapping.lang().isBlank()) {
            return Value.langString(value, mapping.lang());
        }
        return Value.literal(value);
    }

    /**
     * Media types are reduced to "type/subtype" (e.g. "text/plain; charset=US-ASCII" becomes
     * "text/plain"); other values are percent-encoded so they form a single IRI segment.
     */
    static String normalizeTemplateValue(String value) {
        String contentType = stripParameters(value).trim().toLowerCase(Locale.ROOT);
        String[] parts = contentType.split("/");
        if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
            return parts[0].trim() + "/" + parts[1].trim();
        }
        return IdentifierFactory.encode(value.trim());
    }

    /**
     * Templates such as {@code mailto:${value}} put the value straight after the scheme, where it
     * is the whole scheme-specific part and must not be percent-encoded as a path segment.
     */
    static boolean isOpaqueTemplate(String format) {
        int placeholder = format.indexOf("${value}");
        return placeholder > 0
                && format.substring(0, placeholder).matches("[a-zA-Z][a-zA-Z0-9+.-]*:");
    }

    /**
     * Strip parameters from a content-type-like value (e.g., "text/plain; charset=US-ASCII" ->
     * "text/plain").
     */
    private static String stripParameters(String s) {
        String t = s.trim();
        int i = t.indexOf(';');
        return (i >= 0) ? t.substring(0, i).trim() : t;
    }

    static boolean looksLikeIri(String s) {
        return Prefixes.isAbsoluteIri(s) && !s.matches(".*[\\s<>\"{}|\\\\^`].*");
    }
}
