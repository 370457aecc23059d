package com.ryuqq.stepflow.core.outcome;

import com.ryuqq.stepflow.core.model.RunId;

/**
 * Run 실행 결과.
 *
 * <ul>
 *   <li>{@link Succeeded}: 끝 step까지 도달</li>
 *   <li>{@link Failed}: 초기화 또는 step 실패 (원인 kind, step, branch 경로 포함)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RunOutcome outcome = runner.run(flow, parameters);
 * if (outcome instanceof Failed failed) {
 *     log.error("Run failed at {} {}", failed.stepName(), failed.branchPath());
 * }
 * </pre>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public sealed interface RunOutcome permits Succeeded, Failed {

    RunId runId();

    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }
}
