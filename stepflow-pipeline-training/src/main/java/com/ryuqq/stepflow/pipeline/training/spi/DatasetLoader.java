package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Loads the training dataset. Called once per run, by the start step.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DatasetLoader {

    Dataset load();
}
