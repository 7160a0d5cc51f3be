package io.gdcc.healthdcat.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Namespace prefixes of a profile; expands CURIEs such as {@code dct:title} to full IRIs. */
public final class Prefixes {
    private final Map<String, String> namespaces;

    public Prefixes(Map<String, String> namespaces) {
        this.namespaces = Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
    }

    /**
     * Expands a CURIE with a known prefix; returns absolute IRIs unchanged.
     *
     * @return the IRI, or null when the value is blank or uses an unknown prefix
     */
    public String expand(String curieOrIri) {
        if (curieOrIri == null || curieOrIri.isBlank()) {
            return null;
        }
        String value = curieOrIri.trim();
        int colon = value.indexOf(':');
        if (colon > 0) {
            String namespace = namespaces.get(value.substring(0, colon));
            if (namespace != null) {
                return namespace + value.substring(colon + 1);
            }
        }
        return isAbsoluteIri(value) ? value : null;
    }

    public Map<String, String> jena() {
        return namespaces;
    }

    /** Absolute IRI with a scheme that is not a declared prefix, e.g. {@code http://...}. */
    static boolean isAbsoluteIri(String s) {
        if (s == null || !s.matches("^[a-zA-Z][a-zA-Z0-9+.-]*:.+")) {
            return false;
        }
        return s.contains("://") || s.startsWith("urn:") || s.startsWith("mailto:");
    }
}
