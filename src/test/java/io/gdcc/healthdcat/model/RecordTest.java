package io.gdcc.healthdcat.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RecordTest {

    @Test
    @DisplayName("derived records leave the original untouched")
    void derivations_do_not_mutate() {
        Record original = Record.of("title", "Cohort", "publisher", "Agency");

        Record changed = original.with("title", "Other").without("publisher");

        assertThat(original.getString("title")).isEqualTo("Cohort");
        assertThat(original.has("publisher")).isTrue();
        assertThat(changed.columnList()).containsExactly("title");
        assertThatThrownBy(() -> original.asMap().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("renamed() keeps the column position")
    void rename_keeps_position() {
        Record record = Record.of("a", "1", "b", "2", "c", "3");

        assertThat(record.renamed(Map.of("b", "beta")).columnList())
                .containsExactly("a", "beta", "c");
        assertThat(record.renamed(Map.of("missing", "x"))).isSameAs(record);
    }

    @Test
    @DisplayName("renamed() applies all renames to the original columns at once")
    void rename_swaps_columns() {
        Record record = Record.of("a", "1", "b", "2", "c", "3");

        Record swapped = record.renamed(Map.of("a", "b", "b", "a"));

        assertThat(swapped.columnList()).containsExactly("b", "a", "c");
        assertThat(swapped.getString("a")).isEqualTo("2");
        assertThat(swapped.getString("b")).isEqualTo("1");
    }

    @Test
    @DisplayName("renaming onto an existing column replaces it")
    void rename_onto_existing_column() {
        Record record = Record.of("a", "1", "b", "2", "c", "3");

        Record out = record.renamed(Map.of("c", "a"));

        assertThat(out.columnList()).containsExactly("b", "a");
        assertThat(out.getString("a")).isEqualTo("3");
    }

    @Test
    @DisplayName("only scalar values are accepted")
    void rejects_non_scalars() {
        assertThatThrownBy(() -> Record.of("tags", List.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tags");
        assertThat(Record.of("n", 3, "flag", true, "empty", null).size()).isEqualTo(3);
    }

    @Test
    @DisplayName("isBlank() covers absent, null and whitespace-only values")
    void blank_values() {
        Record record = Record.of("empty", "", "space", "  ", "nil", null, "value", "x");

        assertThat(record.isBlank("empty")).isTrue();
        assertThat(record.isBlank("space")).isTrue();
        assertThat(record.isBlank("nil")).isTrue();
        assertThat(record.isBlank("absent")).isTrue();
        assertThat(record.isBlank("value")).isFalse();
    }

    @Test
    @DisplayName("RecordSet.columns() is the union of columns in first-appearance order")
    void record_set_columns() {
        RecordSet set =
                RecordSet.of(Record.of("b", "1", "a", "2"), Record.of("a", "3", "c", "4"));

        assertThat(set.columns()).containsExactly("b", "a", "c");
        assertThat(set.filter(r -> r.has("c")).size()).isEqualTo(1);
    }
}
