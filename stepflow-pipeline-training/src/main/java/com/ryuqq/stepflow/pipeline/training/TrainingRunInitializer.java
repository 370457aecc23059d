package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.error.RunInitializationException;
import com.ryuqq.stepflow.core.model.RunId;
import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.spi.RunInitializer;
import com.ryuqq.stepflow.pipeline.training.spi.ExperimentTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run 시작 전에 Experiment Tracker에 상위 run을 여는 초기화.
 *
 * <p>tracker에 연결할 수 없으면 어떤 step도 실행되지 않고 Run이
 * {@link RunInitializationException}으로 실패합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class TrainingRunInitializer implements RunInitializer {

    private static final Logger log = LoggerFactory.getLogger(TrainingRunInitializer.class);

    private final ExperimentTracker tracker;

    public TrainingRunInitializer(ExperimentTracker tracker) {
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        this.tracker = tracker;
    }

    @Override
    public Artifacts initialize(RunId runId, RunParameters parameters) {
        TrainingParameters training = TrainingParameters.from(parameters);
        String trackingRunId;
        try {
            trackingRunId = tracker.startRun(runId.getValue());
        } catch (RuntimeException e) {
            throw new RunInitializationException(
                "Failed to connect to tracking server " + training.trackingUri(), e);
        }
        if (trackingRunId == null || trackingRunId.isBlank()) {
            throw new RunInitializationException(
                "Tracking server " + training.trackingUri() + " returned no run ID");
        }
        log.info("Run {} tracked as {} on {}", runId.getValue(), trackingRunId, training.trackingUri());
        return Artifacts.of(TrainingArtifacts.TRACKING_RUN_ID.name(), trackingRunId);
    }
}
