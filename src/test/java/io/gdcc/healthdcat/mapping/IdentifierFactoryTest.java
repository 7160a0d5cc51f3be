package io.gdcc.healthdcat.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdentifierFactoryTest {

    private final IdentifierFactory ids = new IdentifierFactory("http://example.org/ds");

    @Test
    @DisplayName("identifiers follow the documented layout below the base URI")
    void layout() {
        assertThat(ids.catalog()).isEqualTo("http://example.org/ds");
        assertThat(ids.dataset(0)).isEqualTo("http://example.org/ds/dataset/0");
        assertThat(ids.distribution("0")).isEqualTo("http://example.org/ds/dataset/0/distribution");
        assertThat(ids.contact("0")).isEqualTo("http://example.org/ds/dataset/0/contact");
        assertThat(ids.agent("Agency")).isEqualTo("http://example.org/ds/agent/Agency");
        assertThat(ids.tableSchema()).isEqualTo("http://example.org/ds/schema");
        assertThat(ids.column(2)).isEqualTo("http://example.org/ds/schema/column/2");
    }

    @Test
    @DisplayName("the same inputs always give the same identifier")
    void idempotent() {
        IdentifierFactory other = new IdentifierFactory("http://example.org/ds");

        assertThat(other.dataset("A-1")).isEqualTo(ids.dataset("A-1"));
        assertThat(other.agent(" Agency ")).isEqualTo(ids.agent("Agency"));
    }

    @Test
    @DisplayName("distinct keys never share an identifier")
    void distinct_keys() {
        List<String> keys = List.of("0", "1", "a b", "a+b", "a/b", "a%20b");

        assertThat(keys.stream().map(ids::dataset).distinct()).hasSize(keys.size());
    }

    @Test
    @DisplayName("keys are percent-encoded into a single path segment")
    void encodes_keys() {
        assertThat(ids.dataset("a b/c")).isEqualTo("http://example.org/ds/dataset/a%20b%2Fc");
        assertThat(ids.agent("Santé Publique"))
                .isEqualTo("http://example.org/ds/agent/Sant%C3%A9%20Publique");
    }

    @Test
    @DisplayName("a trailing slash or hash on the base is kept as separator")
    void trailing_separator() {
        assertThat(new IdentifierFactory("http://example.org/ds/").dataset(1))
                .isEqualTo("http://example.org/ds/dataset/1");
        assertThat(new IdentifierFactory("http://example.org/ds#").dataset(1))
                .isEqualTo("http://example.org/ds#dataset/1");
    }

    @Test
    @DisplayName("relative bases are rejected")
    void rejects_relative_base() {
        assertThatThrownBy(() -> new IdentifierFactory("ds/catalog"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("any absolute URI scheme is accepted as base")
    void accepts_other_schemes() {
        assertThat(new IdentifierFactory("tag:example.org,2024:ds").dataset(0))
                .isEqualTo("tag:example.org,2024:ds/dataset/0");
        assertThat(new IdentifierFactory("urn:example:ds").catalog()).isEqualTo("urn:example:ds");
        assertThatThrownBy(() -> new IdentifierFactory("http://example.org/a b"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
