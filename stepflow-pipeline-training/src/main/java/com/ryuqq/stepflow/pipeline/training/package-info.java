/**
 * 교차 검증 학습 파이프라인.
 *
 * <p>{@link com.ryuqq.stepflow.pipeline.training.TrainingFlow}가 Flow를 조립하고,
 * 실제 계산은 {@code spi} 패키지의 인터페이스 구현체에 위임합니다.</p>
 *
 * @since 1.0.0
 * @author Stepflow Team
 */
package com.ryuqq.stepflow.pipeline.training;
