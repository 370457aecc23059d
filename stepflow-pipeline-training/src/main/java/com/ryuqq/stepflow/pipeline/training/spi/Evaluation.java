package com.ryuqq.stepflow.pipeline.training.spi;

/**
 * Model evaluation on held-out rows.
 *
 * @param loss test loss
 * @param accuracy test accuracy
 *
 * @author Stepflow Team
 * @since 1.0.0
 */
public record Evaluation(double loss, double accuracy) {
}
