package com.ryuqq.stepflow.application.flow;

import com.ryuqq.stepflow.core.model.RunParameters;
import com.ryuqq.stepflow.core.outcome.RunOutcome;

/**
 * Flow 실행기.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunHandle handle = runner.submit(flow, parameters);
 * RunOutcome outcome = handle.await();
 *
 * // 또는 동기 실행
 * RunOutcome outcome = runner.run(flow, parameters);
 * </pre>
 *
 * <p>step 실패는 예외로 던지지 않고 {@link com.ryuqq.stepflow.core.outcome.Failed}로 보고합니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface FlowRunner {

    /**
     * Run을 시작하고 즉시 반환.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>RunId 생성 (UUID 기반), RunStore에 PENDING으로 등록</li>
     *   <li>RUNNING 전이 후 RunInitializer 실행</li>
     *   <li>start step부터 그래프를 따라 실행 (branch는 병렬)</li>
     *   <li>끝 step 도달 시 SUCCEEDED, 실패 시 FAILED</li>
     * </ol>
     *
     * @param flow 실행할 Flow
     * @param parameters Run 파라미터 (Run 동안 불변)
     * @return Run 핸들
     * @throws IllegalArgumentException flow 또는 parameters가 null인 경우
     * @throws IllegalStateException 실행기가 종료된 경우
     */
    RunHandle submit(Flow flow, RunParameters parameters);

    /**
     * Run을 실행하고 완료까지 대기.
     *
     * @param flow 실행할 Flow
     * @param parameters Run 파라미터
     * @return Run 결과
     */
    default RunOutcome run(Flow flow, RunParameters parameters) {
        return submit(flow, parameters).await();
    }
}
