package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Feature or target preprocessing pipeline.
 *
 * <p>{@link #fitTransform(Dataset)} learns its state from the given rows;
 * {@link #transform(Dataset)} reuses that state, so fold test rows never leak
 * into the fitted state.</p>
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface Transformer {

    Matrix fitTransform(Dataset dataset);

    /**
     * Transforms rows with the state learned by {@link #fitTransform(Dataset)}.
     *
     * @param dataset rows to transform
     * @return transformed rows
     * @throws IllegalStateException if the transformer was never fitted
     */
    Matrix transform(Dataset dataset);
}
