package com.ryuqq.stepflow.pipeline.training.spi;

import java.util.List;

/**
 * Per-epoch training metrics.
 *
 * @param loss loss after each epoch
 * @param accuracy accuracy after each epoch
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record TrainingHistory(List<Double> loss, List<Double> accuracy) {

    public TrainingHistory {
        if (loss == null || accuracy == null) {
            throw new IllegalArgumentException("loss and accuracy cannot be null");
        }
        loss = List.copyOf(loss);
        accuracy = List.copyOf(accuracy);
    }

    public double finalLoss() {
        return last(loss);
    }

    public double finalAccuracy() {
        return last(accuracy);
    }

    private static double last(List<Double> values) {
        return values.isEmpty() ? Double.NaN : values.get(values.size() - 1);
    }
}
