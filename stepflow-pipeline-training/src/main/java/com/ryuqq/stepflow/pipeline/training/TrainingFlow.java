package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.application.flow.Flow;
import com.ryuqq.stepflow.core.graph.StepGraph;
import com.ryuqq.stepflow.core.model.StepResources;

import java.util.Map;

/**
 * 교차 검증 학습 Flow 정의.
 *
 * <pre>
 *                 ┌─ cross_validation ─(foreach fold)─ transform_fold → train_fold → evaluate_fold ─┐
 * start ─(split)─┤                                                                   average_scores ─┤
 *                 └─ transform → train_model ─────────────────────────────────────────────────────────┴─ register_model → end
 * </pre>
 *
 * <ul>
 *   <li>start: 실행 모드 결정, 데이터셋 로드</li>
 *   <li>cross_validation: K-fold 분할, fold마다 branch 하나</li>
 *   <li>average_scores: fold 지표 평균/표준편차, 상위 tracking run에 기록</li>
 *   <li>transform / train_model: 전체 데이터로 최종 모델 학습</li>
 *   <li>register_model: 교차 검증 정확도가 임계값 이상이면 모델 등록</li>
 * </ul>
 *
 * <p>모델 학습 step은 4096MB 메모리를, 모델을 다루는 step은 {@code KERAS_BACKEND} 환경 변수를
 * {@link StepResources}로 선언합니다. 해석은 {@code StepInvoker}의 몫입니다.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public final class TrainingFlow {

    public static final String NAME = "training";

    public static final String KERAS_BACKEND_ENV = "KERAS_BACKEND";
    public static final String DEFAULT_KERAS_BACKEND = "jax";

    static final int TRAINING_MEMORY_MB = 4096;

    private TrainingFlow() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 학습 Flow 생성.
     *
     * @param collaborators 외부 협력 객체
     * @param environment step에 전달할 환경 변수 출처 (보통 {@code System.getenv()})
     * @return 검증된 Flow
     */
    public static Flow create(TrainingCollaborators collaborators, Map<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        TrainingSteps steps = new TrainingSteps(collaborators);

        String backend = environment.getOrDefault(KERAS_BACKEND_ENV, DEFAULT_KERAS_BACKEND);
        StepResources kerasOnly = StepResources.none().withEnvironment(KERAS_BACKEND_ENV, backend);
        StepResources training = StepResources.memory(TRAINING_MEMORY_MB)
            .withEnvironment(KERAS_BACKEND_ENV, backend);

        StepGraph graph = StepGraph.builder()
            .split("start", steps::start, "cross_validation", "transform")
            .foreach("cross_validation", steps::crossValidation, "transform_fold")
            .linear("transform_fold", steps::transformFold, "train_fold")
            .linear("train_fold", steps::trainFold, "evaluate_fold")
            .withResources(training)
            .linear("evaluate_fold", steps::evaluateFold, "average_scores")
            .withResources(kerasOnly)
            .join("average_scores", steps::averageScores, 1, "register_model")
            .linear("transform", steps::transform, "train_model")
            .linear("train_model", steps::trainModel, "register_model")
            .withResources(training)
            .join("register_model", steps::registerModel, 2, "end")
            .withResources(kerasOnly)
            .linear("end", steps::end)
            .build();

        return new Flow(NAME, graph, new TrainingRunInitializer(collaborators.tracker()));
    }
}
