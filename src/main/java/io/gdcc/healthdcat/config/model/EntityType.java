package io.gdcc.healthdcat.config.model;

import java.util.Locale;

/** Profile entity kinds a column can be mapped onto, with their class IRI. */
public enum EntityType {
    CATALOG("http://www.w3.org/ns/dcat#Catalog"),
    DATASET("http://www.w3.org/ns/dcat#Dataset"),
    DISTRIBUTION("http://www.w3.org/ns/dcat#Distribution"),
    AGENT("http://xmlns.com/foaf/0.1/Agent"),
    CONTACT("http://www.w3.org/2006/vcard/ns#Kind"),
    TABLE_SCHEMA("http://www.w3.org/ns/csvw#TableSchema"),
    COLUMN("http://www.w3.org/ns/csvw#Column");

    private final String typeIri;

    EntityType(String typeIri) {
        this.typeIri = typeIri;
    }

    public String typeIri() {
        return typeIri;
    }

    /** Parses the lower-case config token, e.g. {@code distribution}; blank means dataset. */
    public static EntityType fromToken(String token) {
        if (token == null || token.isBlank()) {
            return DATASET;
        }
        String normalized = token.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity target '" + token + "'", e);
        }
    }
}
