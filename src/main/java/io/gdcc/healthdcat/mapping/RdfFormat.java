package io.gdcc.healthdcat.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFFormat;

/** Serialization formats the generator writes, keyed by case-sensitive identifiers. */
public enum RdfFormat {
    TURTLE("turtle", RDFFormat.TURTLE_PRETTY),
    // Turtle is a subset of N3, so the Turtle writer produces valid N3
    N3("n3", RDFFormat.TURTLE_PRETTY),
    NTRIPLES("nt", RDFFormat.NTRIPLES_UTF8),
    RDF_XML("xml", RDFFormat.RDFXML_PRETTY),
    JSON_LD("json-ld", RDFFormat.JSONLD);

    private final String id;
    private final RDFFormat jenaFormat;

    RdfFormat(String id, RDFFormat jenaFormat) {
        this.id = id;
        this.jenaFormat = jenaFormat;
    }

    public String id() {
        return id;
    }

    public RDFFormat jenaFormat() {
        return jenaFormat;
    }

    /** Language for reading the serialized text back. */
    public Lang lang() {
        return jenaFormat.getLang();
    }

    public static Optional<RdfFormat> fromId(String id) {
        for (RdfFormat format : values()) {
            if (format.id.equals(id)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static List<String> ids() {
        List<String> ids = new ArrayList<>();
        for (RdfFormat format : values()) {
            ids.add(format.id);
        }
        return ids;
    }
}
