package com.ryuqq.stepflow.core.outcome;

import com.ryuqq.stepflow.core.artifact.Artifacts;
import com.ryuqq.stepflow.core.model.RunId;

/**
 * 성공한 Run.
 *
 * @param runId Run ID
 * @param artifacts 끝 step까지 도달한 최상위 Artifact
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record Succeeded(
    RunId runId,
    Artifacts artifacts
) implements RunOutcome {

    public Succeeded {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (artifacts == null) {
            throw new IllegalArgumentException("artifacts cannot be null");
        }
    }
}
