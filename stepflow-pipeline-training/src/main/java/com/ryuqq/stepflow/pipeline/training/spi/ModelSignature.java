package com.ryuqq.stepflow.pipeline.training.spi;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expected model input/output format, given by example.
 *
 * @param inputExample example request
 * @param outputExample example response
 * @param params inference parameters and their defaults
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record ModelSignature(
    Map<String, Object> inputExample,
    Map<String, Object> outputExample,
    Map<String, Object> params
) {

    public ModelSignature {
        if (inputExample == null || outputExample == null || params == null) {
            throw new IllegalArgumentException("signature examples cannot be null");
        }
        inputExample = Map.copyOf(inputExample);
        outputExample = Map.copyOf(outputExample);
        params = Map.copyOf(params);
    }

    /**
     * Penguin species classifier signature: one raw observation in,
     * predicted species and confidence out.
     *
     * @return signature
     */
    public static ModelSignature penguins() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("island", "Biscoe");
        input.put("culmen_length_mm", 48.6);
        input.put("culmen_depth_mm", 16.0);
        input.put("flipper_length_mm", 230.0);
        input.put("body_mass_g", 5800.0);
        input.put("sex", "MALE");
        return new ModelSignature(
            input,
            Map.of("prediction", "Adelie", "confidence", 0.90),
            Map.of("data_capture", false)
        );
    }
}
