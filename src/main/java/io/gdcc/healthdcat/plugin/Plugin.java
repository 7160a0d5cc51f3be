package io.gdcc.healthdcat.plugin;

import io.gdcc.healthdcat.error.StageException;

/**
 * Base contract for every pipeline stage: a stable name, the role it plays, and a single {@code
 * execute} operation from input to output.
 *
 * <p>Implementations must not mutate {@code input}; they return a new value. Failures are
 * reported as {@link StageException}s carrying {@link #getName()}. Plugins are registered once and
 * shared by concurrent conversions, so they must not hold per-call state.
 *
 * @param <I> input type
 * @param <O> output type
 */
public interface Plugin<I, O> {

    /** Name under which the plugin is registered and referenced by pipeline configuration. */
    String getName();

    StageKind kind();

    /**
     * Runs the stage.
     *
     * @param input stage input; never null
     * @param options stage options; never null, possibly empty
     * @return stage output; never null
     * @throws StageException when the stage cannot produce an output
     */
    O execute(I input, StageOptions options) throws StageException;
}
