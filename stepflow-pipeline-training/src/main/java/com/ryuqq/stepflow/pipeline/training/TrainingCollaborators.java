package com.ryuqq.stepflow.pipeline.training;

import com.ryuqq.stepflow.pipeline.training.spi.DatasetLoader;
import com.ryuqq.stepflow.pipeline.training.spi.ExperimentTracker;
import com.ryuqq.stepflow.pipeline.training.spi.ModelFactory;
import com.ryuqq.stepflow.pipeline.training.spi.ModelRegistry;
import com.ryuqq.stepflow.pipeline.training.spi.TransformerFactory;

/**
 * 학습 파이프라인이 사용하는 외부 협력 객체 묶음.
 *
 * @param datasetLoader 데이터셋 로더
 * @param transformerFactory 전처리 transformer 생성기
 * @param modelFactory 모델 생성기
 * @param tracker Experiment Tracker
 * @param registry 모델 레지스트리
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record TrainingCollaborators(
    DatasetLoader datasetLoader,
    TransformerFactory transformerFactory,
    ModelFactory modelFactory,
    ExperimentTracker tracker,
    ModelRegistry registry
) {

    public TrainingCollaborators {
        if (datasetLoader == null) {
            throw new IllegalArgumentException("datasetLoader cannot be null");
        }
        if (transformerFactory == null) {
            throw new IllegalArgumentException("transformerFactory cannot be null");
        }
        if (modelFactory == null) {
            throw new IllegalArgumentException("modelFactory cannot be null");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
    }
}
