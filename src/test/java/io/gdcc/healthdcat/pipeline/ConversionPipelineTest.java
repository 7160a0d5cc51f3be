package io.gdcc.healthdcat.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.gdcc.healthdcat.error.ErrorKind;
import io.gdcc.healthdcat.model.Record;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.model.ValidationIssue;
import io.gdcc.healthdcat.plugin.GeneratorPlugin;
import io.gdcc.healthdcat.plugin.PluginBootstrap;
import io.gdcc.healthdcat.plugin.PluginRegistry;
import io.gdcc.healthdcat.plugin.StageKind;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import io.gdcc.healthdcat.reader.RecordSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConversionPipelineTest {

    private static final String CSV = "title,publisher\nCancer registry,\n";
    private static final String BASE = "http://example.org/ds";

    private PluginRegistry registry;
    private ConversionPipeline pipeline;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
        PluginBootstrap.registerBuiltins(registry);
        pipeline = new ConversionPipeline(registry);
    }

    private static RecordSource csv(String text) {
        return RecordSource.ofString(text);
    }

    @Test
    @DisplayName("strict mode aborts in validation with the missing publisher reported")
    void strict_missing_publisher() {
        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder()
                                .datasetUri(BASE)
                                .strict(true)
                                .requiredFields("publisher")
                                .build());

        assertThat(result.success()).isFalse();
        assertThat(result.text()).isNull();
        assertThat(result.issues()).containsExactly(ValidationIssue.required(0, "publisher"));
        assertThat(result.error().kind()).isEqualTo(ErrorKind.VALIDATION_FAILED);
        assertThat(result.error().stage()).isEqualTo("validator");
        assertThat(result.error().state()).isEqualTo(PipelineState.VALIDATE);
        assertThat(result.stages()).containsExactly("csv_reader");
    }

    @Test
    @DisplayName("lenient mode completes with the issue recorded and the dataset generated")
    void lenient_missing_publisher() {
        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder()
                                .format("turtle")
                                .datasetUri(BASE)
                                .requiredFields("publisher")
                                .build());

        assertThat(result.success()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.issues()).hasSize(1);
        assertThat(result.text()).contains(BASE + "/dataset/0").contains("Cancer registry");
        assertThat(result.stages()).containsExactly("csv_reader", "validator", "rdf_generator");
    }

    @Test
    @DisplayName("an unsupported format fails the run without output")
    void unsupported_format() {
        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder().format("csv").datasetUri(BASE).build());

        assertThat(result.success()).isFalse();
        assertThat(result.text()).isNull();
        assertThat(result.error().kind()).isEqualTo(ErrorKind.UNSUPPORTED_FORMAT);
        assertThat(result.error().state()).isEqualTo(PipelineState.GENERATE);
    }

    @Test
    @DisplayName("an unknown transform fails before the source is opened")
    void unknown_transform_fails_first() {
        AtomicBoolean opened = new AtomicBoolean();
        RecordSource source =
                () -> {
                    opened.set(true);
                    return new ByteArrayInputStream(CSV.getBytes(StandardCharsets.UTF_8));
                };

        ConversionResult result =
                pipeline.convert(
                        source,
                        ConversionOptions.builder().datasetUri(BASE).transform("nope").build());

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(ErrorKind.UNKNOWN_PLUGIN);
        assertThat(result.error().stage()).isEqualTo("nope");
        assertThat(result.error().state()).isEqualTo(PipelineState.INIT);
        assertThat(opened).isFalse();
    }

    @Test
    @DisplayName("validate=false skips the validator entirely")
    void validation_disabled() {
        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder()
                                .datasetUri(BASE)
                                .validate(false)
                                .strict(true)
                                .requiredFields("publisher")
                                .build());

        assertThat(result.success()).isTrue();
        assertThat(result.issues()).isEmpty();
        assertThat(result.stages()).containsExactly("csv_reader", "rdf_generator");
    }

    @Test
    @DisplayName("transforms run in the requested order with their own options")
    void transform_chain() {
        RecordSet records = RecordSet.of(Record.of("Name", "Cohort", "publisher", "Agency"));

        ConversionResult result =
                pipeline.convert(
                        records,
                        ConversionOptions.builder()
                                .datasetUri(BASE)
                                .transform(
                                        "rename_fields",
                                        Map.of("mapping", Map.of("Name", "title")))
                                .transform("custom_transform")
                                .requiredFields("title")
                                .build());

        assertThat(result.success()).isTrue();
        assertThat(result.issues()).extracting(ValidationIssue::field).containsExactly("title");
        assertThat(result.stages())
                .containsExactly("validator", "rename_fields", "custom_transform", "rdf_generator");
        assertThat(result.text()).contains("Cohort");
    }

    @Test
    @DisplayName("an exception escaping a stage is reported against that stage and stops the run")
    void stage_failure_is_wrapped() throws Exception {
        TransformPlugin exploding = mock(TransformPlugin.class);
        when(exploding.getName()).thenReturn("exploding");
        when(exploding.kind()).thenReturn(StageKind.TRANSFORM);
        when(exploding.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
        GeneratorPlugin generator = mock(GeneratorPlugin.class);
        when(generator.getName()).thenReturn("watching_generator");
        when(generator.kind()).thenReturn(StageKind.GENERATOR);
        registry.register(exploding);
        registry.register(generator);

        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder()
                                .datasetUri(BASE)
                                .transform("exploding")
                                .generator("watching_generator")
                                .build());

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(ErrorKind.STAGE);
        assertThat(result.error().stage()).isEqualTo("exploding");
        assertThat(result.error().message()).contains("boom");
        assertThat(result.error().state()).isEqualTo(PipelineState.TRANSFORM);
        assertThat(result.stages()).containsExactly("csv_reader", "validator");
        verify(generator, never()).execute(any(), any());
    }

    @Test
    @DisplayName("a stage returning nothing is a stage failure")
    void null_output() throws Exception {
        TransformPlugin silent = mock(TransformPlugin.class);
        when(silent.getName()).thenReturn("silent");
        when(silent.kind()).thenReturn(StageKind.TRANSFORM);
        registry.register(silent);

        ConversionResult result =
                pipeline.convert(
                        csv(CSV),
                        ConversionOptions.builder().datasetUri(BASE).transform("silent").build());

        assertThat(result.success()).isFalse();
        assertThat(result.error().stage()).isEqualTo("silent");
    }

    @Test
    @DisplayName("an unreadable source fails in the read stage")
    void unreadable_source() {
        RecordSource broken =
                () -> {
                    throw new IOException("disk gone");
                };

        ConversionResult result =
                pipeline.convert(broken, ConversionOptions.builder().datasetUri(BASE).build());

        assertThat(result.error().kind()).isEqualTo(ErrorKind.SOURCE_READ);
        assertThat(result.error().state()).isEqualTo(PipelineState.READ);
        assertThat(result.stages()).isEmpty();
    }

    @Test
    @DisplayName("a missing datasetUri fails generation with a configuration error")
    void missing_dataset_uri() {
        ConversionResult result = pipeline.convert(csv(CSV), ConversionOptions.builder().build());

        assertThat(result.error().kind()).isEqualTo(ErrorKind.MISSING_CONFIGURATION);
        assertThat(result.error().stage()).isEqualTo("rdf_generator");
    }

    @Test
    @DisplayName("an empty dataset converts to a catalog without datasets")
    void empty_dataset() {
        ConversionResult result =
                pipeline.convert(
                        csv("title,publisher\n"),
                        ConversionOptions.builder().datasetUri(BASE).build());

        assertThat(result.success()).isTrue();
        assertThat(result.text()).doesNotContain("/dataset/");
    }

    @Test
    @DisplayName("the default pipeline lists the built-in plugins")
    void default_pipeline() {
        assertThat(new ConversionPipeline().listPlugins())
                .contains("csv_reader", "validator", "custom_transform", "rdf_generator");
    }
}
