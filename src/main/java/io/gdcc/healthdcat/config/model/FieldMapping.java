package io.gdcc.healthdcat.config.model;

import java.util.Map;

/**
 * How one input column becomes property values on a profile entity.
 *
 * @param column input column name
 * @param target entity the values are attached to
 * @param predicate CURIE or IRI of the property
 * @param as literal | iri
 * @param datatype CURIE or IRI of the literal datatype, or null
 * @param lang language tag for plain literals, or null
 * @param separator splits one cell into several values; null for single-valued columns
 * @param format IRI template with a {@code ${value}} placeholder, applied to iri values
 * @param map value to IRI (or replacement literal) lookup, applied before format
 */
public record FieldMapping(
        String column,
        EntityType target,
        String predicate,
        String as,
        String datatype,
        String lang,
        String separator,
        String format,
        Map<String, String> map) {

    public FieldMapping {
        as = (as == null || as.isBlank()) ? "literal" : as.trim();
        map = map == null ? Map.of() : Map.copyOf(map);
    }

    public static FieldMapping literal(String column, String predicate) {
        return new FieldMapping(
                column, EntityType.DATASET, predicate, "literal", null, null, null, null, null);
    }

    public boolean isIri() {
        return "iri".equals(as);
    }

    public boolean multi() {
        return separator != null && !separator.isEmpty();
    }

    public FieldMapping withPredicate(String newPredicate) {
        return new FieldMapping(
                column, target, newPredicate, as, datatype, lang, separator, format, map);
    }
}
