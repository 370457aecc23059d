package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Predictive model trained by the pipeline.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface Model {

    /**
     * Fits the model.
     *
     * @param x transformed features
     * @param y transformed target
     * @param epochs training epochs
     * @param batchSize training batch size
     * @return per-epoch history
     */
    TrainingHistory fit(Matrix x, Matrix y, int epochs, int batchSize);

    Evaluation evaluate(Matrix x, Matrix y);
}
