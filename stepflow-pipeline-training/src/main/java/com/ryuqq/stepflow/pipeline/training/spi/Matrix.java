package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Numeric matrix produced by a {@link Transformer}.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface Matrix {

    int rows();

    /**
     * @return number of columns, used as the model input width
     */
    int columns();
}
