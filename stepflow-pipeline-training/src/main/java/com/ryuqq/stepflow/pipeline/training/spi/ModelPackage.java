package com.ryuqq.stepflow.pipeline.training.spi;

import java.util.List;

/**
 * Everything the registry needs to serve the model: the trained model, the fitted
 * transformers that preprocess raw requests, the signature and the runtime requirements.
 *
 * @param registeredModelName registry name (a new version is created per publish)
 * @param trackingRunId tracking run the model is logged under
 * @param model model trained on the full dataset
 * @param featuresTransformer fitted features transformer
 * @param targetTransformer fitted target transformer
 * @param signature input/output format
 * @param pipRequirements pinned runtime packages ({@code name==version})
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record ModelPackage(
    String registeredModelName,
    String trackingRunId,
    Model model,
    Transformer featuresTransformer,
    Transformer targetTransformer,
    ModelSignature signature,
    List<String> pipRequirements
) {

    /**
     * Runtime packages the model needs to serve predictions.
     */
    public static final List<String> DEFAULT_PIP_REQUIREMENTS = List.of(
        "scikit-learn==1.5.1",
        "pandas==2.2.2",
        "numpy==1.26.4",
        "keras==3.4.1",
        "jax[cpu]==0.4.31"
    );

    public ModelPackage {
        if (registeredModelName == null || registeredModelName.isBlank()) {
            throw new IllegalArgumentException("registeredModelName cannot be null or blank");
        }
        if (trackingRunId == null || trackingRunId.isBlank()) {
            throw new IllegalArgumentException("trackingRunId cannot be null or blank");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        if (featuresTransformer == null || targetTransformer == null) {
            throw new IllegalArgumentException("transformers cannot be null");
        }
        if (signature == null) {
            throw new IllegalArgumentException("signature cannot be null");
        }
        if (pipRequirements == null) {
            throw new IllegalArgumentException("pipRequirements cannot be null");
        }
        pipRequirements = List.copyOf(pipRequirements);
    }
}
