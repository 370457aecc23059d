package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Model registry publisher.
 *
 * <p>Called only when the accuracy gate is open. A failure here fails the run.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelRegistry {

    /**
     * Registers a new version of the packaged model.
     *
     * @param modelPackage model, transformers, signature and requirements
     */
    void publish(ModelPackage modelPackage);
}
