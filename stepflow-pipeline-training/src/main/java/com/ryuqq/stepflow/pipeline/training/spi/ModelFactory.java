package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Builds an untrained model for a given input width.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelFactory {

    Model build(int inputWidth);
}
