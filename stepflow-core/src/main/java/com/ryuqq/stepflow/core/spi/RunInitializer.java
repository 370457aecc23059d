package com.ryuqq.stepflow.core.spi;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;

/**
 * Run-level initialization hook, executed once before the start step.
 *
 * <p>The returned artifacts seed the start step's inherited artifacts
 * (for example the experiment tracker's parent run ID). Any exception fails
 * the run with a {@link com.ryuqq.stepflow.core.error.RunInitializationException}
 * before a single step executes.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunInitializer {

    /**
     * Initializes the run.
     *
     * @param runId the run ID
     * @param parameters run parameters
     * @return seed artifacts (never null)
     * @throws Exception if initialization fails
     */
    Artifacts initialize(RunId runId, RunParameters parameters) throws Exception;

    static RunInitializer none() {
        return (runId, parameters) -> Artifacts.empty();
    }
}
