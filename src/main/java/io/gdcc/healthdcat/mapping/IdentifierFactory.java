package io.gdcc.healthdcat.mapping;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Deterministic identifiers below a dataset base URI. Every identifier is a pure function of the
 * base URI, the entity kind and a key, so the same input always yields the same IRI:
 *
 * <pre>
 * {base}                              catalog
 * {base}/dataset/{key}                dataset of one row
 * {base}/dataset/{key}/distribution   its distribution
 * {base}/dataset/{key}/contact        its contact point
 * {base}/agent/{name}                 publisher, shared by name
 * {base}/schema                       table schema
 * {base}/schema/column/{index}        column description
 * </pre>
 *
 * Keys are percent-encoded, so any row index or natural-key value gives a valid IRI segment.
 */
public final class IdentifierFactory {
    private final String base;
    private final String prefix;

    /** @param baseUri absolute IRI; a trailing {@code /} or {@code #} is kept as the separator */
    public IdentifierFactory(String baseUri) {
        String trimmed = Objects.requireNonNull(baseUri, "baseUri").trim();
        if (!isAbsolute(trimmed)) {
            throw new IllegalArgumentException("Base URI must be an absolute IRI: " + baseUri);
        }
        this.base = trimmed;
        this.prefix = (trimmed.endsWith("/") || trimmed.endsWith("#")) ? trimmed : trimmed + "/";
    }

    public String catalog() {
        return base;
    }

    public String dataset(String key) {
        return prefix + "dataset/" + encode(key);
    }

    public String dataset(int row) {
        return dataset(Integer.toString(row));
    }

    public String distribution(String datasetKey) {
        return dataset(datasetKey) + "/distribution";
    }

    public String contact(String datasetKey) {
        return dataset(datasetKey) + "/contact";
    }

    public String agent(String name) {
        return prefix + "agent/" + encode(name.trim());
    }

    public String tableSchema() {
        return prefix + "schema";
    }

    public String column(int index) {
        return tableSchema() + "/column/" + index;
    }

    /** Property IRI for a column the profile does not map. */
    public String fieldProperty(String column) {
        return prefix + "field/" + encode(column);
    }

    /** True for any URI with a scheme, including opaque ones such as {@code tag:...}. */
    static boolean isAbsolute(String uri) {
        try {
            return new URI(uri).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    static String encode(String segment) {
        return URLEncoder.encode(Objects.requireNonNull(segment, "key"), StandardCharsets.UTF_8)
                .replace("+", "%20");
    }
}
