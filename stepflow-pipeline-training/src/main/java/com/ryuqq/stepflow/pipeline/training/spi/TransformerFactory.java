package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Builds fresh, unfitted transformers.
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public interface TransformerFactory {

    Transformer buildFeaturesTransformer();

    Transformer buildTargetTransformer();
}
