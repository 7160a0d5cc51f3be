package io.gdcc.healthdcat.pipeline;

import io.gdcc.healthdcat.error.PluginRegistryException;
import io.gdcc.healthdcat.error.StageException;
import io.gdcc.healthdcat.error.ValidationFailedException;
import io.gdcc.healthdcat.model.RecordSet;
import io.gdcc.healthdcat.model.ValidationIssue;
import io.gdcc.healthdcat.model.ValidationReport;
import io.gdcc.healthdcat.plugin.GeneratorPlugin;
import io.gdcc.healthdcat.plugin.Plugin;
import io.gdcc.healthdcat.plugin.PluginBootstrap;
import io.gdcc.healthdcat.plugin.PluginRegistry;
import io.gdcc.healthdcat.plugin.ReaderPlugin;
import io.gdcc.healthdcat.plugin.StageOptions;
import io.gdcc.healthdcat.plugin.TransformPlugin;
import io.gdcc.healthdcat.plugin.ValidatorPlugin;
import io.gdcc.healthdcat.reader.RecordSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one conversion: read, validate, zero or more transforms, generate. Stages run strictly in
 * sequence; the first failure ends the run and is reported in the {@link ConversionResult}, no
 * later stage is invoked.
 *
 * <p>All plugins a run needs are resolved from the registry before the source is opened, so a
 * misspelled transform name fails without reading any input. Instances hold no per-run state and
 * may be shared between threads.
 */
public class ConversionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    private final PluginRegistry registry;

    /** Pipeline over the process-wide registry, bootstrapped on first use. */
    public ConversionPipeline() {
        this(PluginBootstrap.defaultRegistry());
    }

    public ConversionPipeline(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public PluginRegistry registry() {
        return registry;
    }

    /** Names of all registered plugins, in registration order. */
    public List<String> listPlugins() {
        return registry.list();
    }

    /** Full run starting from a byte source. */
    public ConversionResult convert(RecordSource source, ConversionOptions options) {
        Objects.requireNonNull(source, "source");
        return run(source, null, options);
    }

    /** Run over records that are already in memory; the read stage is skipped. */
    public ConversionResult convert(RecordSet records, ConversionOptions options) {
        Objects.requireNonNull(records, "records");
        return run(null, records, options);
    }

    private ConversionResult run(RecordSource source, RecordSet input, ConversionOptions options) {
        Objects.requireNonNull(options, "options");
        Run run = new Run();
        try {
            ReaderPlugin reader = source != null ? registry.getReader(options.reader()) : null;
            ValidatorPlugin validator =
                    options.validate() ? registry.getValidator(options.validator()) : null;
            List<TransformPlugin> transforms = new ArrayList<>();
            for (String name : options.transforms()) {
                transforms.add(registry.getTransform(name));
            }
            GeneratorPlugin generator = registry.getGenerator(options.generator());

            RecordSet records = input;
            if (reader != null) {
                run.enter(PipelineState.READ, reader);
                records = invoke(reader, source, options.readerStageOptions());
                run.completed(reader);
            }

            if (validator != null) {
                run.enter(PipelineState.VALIDATE, validator);
                ValidationReport report =
                        invoke(validator, records, options.validatorStageOptions());
                run.issues.addAll(report.issues());
                records = report.validRecords();
                run.completed(validator);
            } else {
                log.debug("Validation disabled, passing {} records through", records.size());
            }

            for (TransformPlugin transform : transforms) {
                run.enter(PipelineState.TRANSFORM, transform);
                records =
                        invoke(
                                transform,
                                records,
                                options.transformStageOptions(transform.getName()));
                run.completed(transform);
            }

            run.enter(PipelineState.GENERATE, generator);
            String text = invoke(generator, records, options.generatorStageOptions());
            run.completed(generator);

            run.state = PipelineState.DONE;
            log.info(
                    "Conversion finished: {} records, {} validation issues",
                    records.size(),
                    run.issues.size());
            return ConversionResult.completed(text, run.issues, run.stages);
        } catch (ValidationFailedException e) {
            run.issues.addAll(e.getIssues());
            return run.fail(
                    new ConversionError(e.kind(), e.getStage(), e.getMessage(), run.state, e));
        } catch (StageException e) {
            return run.fail(
                    new ConversionError(e.kind(), e.getStage(), e.getMessage(), run.state, e));
        } catch (PluginRegistryException e) {
            return run.fail(
                    new ConversionError(
                            e.kind(), e.getPluginName(), e.getMessage(), run.state, e));
        }
    }

    /**
     * Executes a stage and labels anything that escapes it, so no unattributed failure crosses
     * the stage boundary.
     */
    private static <I, O> O invoke(Plugin<I, O> plugin, I input, StageOptions options)
            throws StageException {
        O output;
        try {
            output = plugin.execute(input, options);
        } catch (StageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StageException(plugin.getName(), e);
        }
        if (output == null) {
            throw new StageException(plugin.getName(), "Stage returned no output");
        }
        return output;
    }

    /** Mutable bookkeeping of a single run; never shared between runs. */
    private static final class Run {
        private PipelineState state = PipelineState.INIT;
        private final List<ValidationIssue> issues = new ArrayList<>();
        private final List<String> stages = new ArrayList<>();

        void enter(PipelineState next, Plugin<?, ?> plugin) {
            log.debug("{} -> {} ({})", state, next, plugin.getName());
            state = next;
        }

        void completed(Plugin<?, ?> plugin) {
            stages.add(plugin.getName());
        }

        ConversionResult fail(ConversionError error) {
            log.warn(
                    "Conversion aborted in {} stage '{}': {}",
                    state,
                    error.stage(),
                    error.message());
            state = PipelineState.ERROR;
            return ConversionResult.failed(error, issues, stages);
        }
    }
}
