package com.ryuqq.stepflow.pipeline.training.spi;

import java.util.Map;

/**
 * Experiment tracking server client.
 *
 * <p>Used for observability only; the pipeline never branches on what the tracker returns.
 * The one exception is {@link #startRun(String)} during run initialization: if the
 * server cannot be reached there, the run fails before any step executes.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface ExperimentTracker {

    /**
     * Starts a top-level tracking run.
     *
     * @param name run name (the engine run ID)
     * @return tracking run ID
     */
    String startRun(String name);

    /**
     * Starts a tracking run nested under a parent run.
     *
     * @param parentRunId parent tracking run ID
     * @param name nested run name
     * @return nested tracking run ID
     */
    String startNestedRun(String parentRunId, String name);

    void logMetrics(Map<String, Double> metrics, String runId);

    void logParams(Map<String, Object> params, String runId);
}
