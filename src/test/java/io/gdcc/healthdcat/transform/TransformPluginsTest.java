package io.gdcc.healthdcat.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.gdcc.healthdcat.error.ErrorKind;
import io.gdcc.healthdcat.error.MissingConfigurationException;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.plugin.StageOptions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TransformPluginsTest {

    private static final RecordSet INPUT =
            RecordSet.of(
                    Record.of("Title", " Cohort A ", "year", "2020", "publisher", "Agency"),
                    Record.of("Title", "Cohort B", "year", "2021", "publisher", ""),
                    Record.of("Title", " Cohort A ", "year", "2020", "publisher", "Agency"));

    @Test
    @DisplayName("rename_fields renames columns in place")
    void rename_fields() throws Exception {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("Title", "title");
        RecordSet out =
                new RenameFieldsTransform().execute(INPUT, StageOptions.of("mapping", mapping));

        assertThat(out.get(0).columnList()).containsExactly("title", "year", "publisher");
        assertThat(INPUT.get(0).has("Title")).isTrue();
    }

    @Test
    @DisplayName("rename_fields can swap two columns")
    void rename_fields_swap() throws Exception {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("Title", "publisher");
        mapping.put("publisher", "Title");
        RecordSet out =
                new RenameFieldsTransform().execute(INPUT, StageOptions.of("mapping", mapping));

        assertThat(out.get(0).columnList()).containsExactly("publisher", "year", "Title");
        assertThat(out.get(0).getString("publisher"))
                .isEqualTo(INPUT.get(0).getString("Title"));
        assertThat(out.get(0).getString("Title"))
                .isEqualTo(INPUT.get(0).getString("publisher"));
    }

    @Test
    @DisplayName("rename_fields without a mapping is a configuration error")
    void rename_fields_requires_mapping() {
        assertThatThrownBy(() -> new RenameFieldsTransform().execute(INPUT, StageOptions.empty()))
                .isInstanceOf(MissingConfigurationException.class)
                .satisfies(
                        e ->
                                assertThat(((MissingConfigurationException) e).kind())
                                        .isEqualTo(ErrorKind.MISSING_CONFIGURATION));
    }

    @Test
    @DisplayName("trim_values strips whitespace and optionally nulls empty values")
    void trim_values() {
        RecordSet out =
                new TrimValuesTransform()
                        .execute(
                                RecordSet.of(Record.of("a", "  x ", "b", "   ", "n", 3)),
                                StageOptions.of("emptyToNull", true));

        assertThat(out.get(0).get("a")).isEqualTo("x");
        assertThat(out.get(0).has("b")).isTrue();
        assertThat(out.get(0).get("b")).isNull();
        assertThat(out.get(0).get("n")).isEqualTo(3);
    }

    @Test
    @DisplayName("trim_values limited to some fields leaves the others alone")
    void trim_selected_fields() {
        RecordSet out =
                new TrimValuesTransform()
                        .execute(
                                RecordSet.of(Record.of("a", " x ", "b", " y ")),
                                StageOptions.of("fields", List.of("b")));

        assertThat(out.get(0).get("a")).isEqualTo(" x ");
        assertThat(out.get(0).get("b")).isEqualTo("y");
    }

    @Test
    @DisplayName("filter_rows keeps matching rows in order")
    void filter_rows() throws Exception {
        FilterRowsTransform filter = new FilterRowsTransform();

        assertThat(filter.execute(INPUT, StageOptions.of("field", "publisher")).size())
                .isEqualTo(2);
        assertThat(
                        filter.execute(
                                        INPUT,
                                        StageOptions.of("field", "year").with("equals", "2021"))
                                .records())
                .containsExactly(INPUT.get(1));
        assertThat(
                        filter.execute(
                                        INPUT,
                                        StageOptions.of("field", "year")
                                                .with("matches", "202[01]")
                                                .with("invert", true))
                                .isEmpty())
                .isTrue();
        assertThatThrownBy(() -> filter.execute(INPUT, StageOptions.empty()))
                .isInstanceOf(MissingConfigurationException.class);
    }

    @Test
    @DisplayName("derive_field renders templates and respects existing values")
    void derive_field() throws Exception {
        RecordSet rows =
                RecordSet.of(
                        Record.of("title", "Cohort", "year", "2020"),
                        Record.of("title", "Cohort", "year", "2021", "label", "kept"));
        StageOptions options =
                StageOptions.of("target", "label").with("template", "${title} (${year})${missing}");

        RecordSet out = new DeriveFieldTransform().execute(rows, options);
        RecordSet overwritten =
                new DeriveFieldTransform().execute(rows, options.with("overwrite", true));

        assertThat(out.get(0).getString("label")).isEqualTo("Cohort (2020)");
        assertThat(out.get(1).getString("label")).isEqualTo("kept");
        assertThat(overwritten.get(1).getString("label")).isEqualTo("Cohort (2021)");
    }

    @Test
    @DisplayName("deduplicate keeps the first occurrence of each key")
    void deduplicate() {
        DeduplicateTransform dedupe = new DeduplicateTransform();

        assertThat(dedupe.execute(INPUT, StageOptions.empty()).records())
                .containsExactly(INPUT.get(0), INPUT.get(1));
        assertThat(dedupe.execute(INPUT, StageOptions.of("key", "year,publisher")).size())
                .isEqualTo(2);
        assertThat(dedupe.execute(INPUT, StageOptions.of("key", List.of("Title"))).size())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("custom_transform marks every row")
    void custom_transform() {
        RecordSet out = new CustomTransformPlugin().execute(INPUT, StageOptions.empty());

        assertThat(out)
                .allSatisfy(
                        r -> {
                            assertThat(r.get("_transformed")).isEqualTo(Boolean.TRUE);
                            assertThat(r.get("_plugin")).isEqualTo("custom_transform");
                        });
        assertThat(INPUT.get(0).has("_transformed")).isFalse();
    }
}
