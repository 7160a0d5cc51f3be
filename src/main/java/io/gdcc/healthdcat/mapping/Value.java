package io.gdcc.healthdcat.mapping;

/**
 * Object of a property: either a literal (lexical form with optional datatype or language tag) or
 * a reference to another entity or external resource by IRI.
 */
public record Value(String lexical, String datatype, String lang, String reference) {

    public static Value literal(String lexical) {
        return new Value(lexical, null, null, null);
    }

    public static Value typed(String lexical, String datatypeIri) {
        return new Value(lexical, datatypeIri, null, null);
    }

    public static Value langString(String lexical, String lang) {
        return new Value(lexical, null, lang, null);
    }

    public static Value ref(String iri) {
        return new Value(null, null, null, iri);
    }

    public boolean isReference() {
        return reference != null;
    }
}
